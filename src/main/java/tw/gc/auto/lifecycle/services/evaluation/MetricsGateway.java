package tw.gc.auto.lifecycle.services.evaluation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.auto.lifecycle.entities.PerformanceObservation;
import tw.gc.auto.lifecycle.repositories.PerformanceObservationRepository;
import tw.gc.auto.lifecycle.services.Scores;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-only access to live performance observations.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MetricsGateway {

    private final PerformanceObservationRepository repository;

    /**
     * Observations of the family at or after {@code since}, oldest first.
     */
    public List<PerformanceObservation> getObservations(String familyId, LocalDateTime since) {
        return repository.findByFamilyIdAndObservedAtGreaterThanEqualOrderByObservedAtAsc(familyId, since);
    }

    /**
     * Count and mean score of the observations at or after {@code since}, without loading them.
     */
    public ObservationSummary summarize(String familyId, LocalDateTime since) {
        PerformanceObservationRepository.WindowSummary summary = repository.summarizeWindow(familyId, since);
        long count = summary != null && summary.getSampleCount() != null ? summary.getSampleCount() : 0L;
        Double mean = count > 0 && summary.getMeanScore() != null ? Scores.round(summary.getMeanScore()) : null;
        return new ObservationSummary(count, mean);
    }

    public long countObservations(String familyId, LocalDateTime since) {
        return repository.countByFamilyIdAndObservedAtGreaterThanEqual(familyId, since);
    }
}
