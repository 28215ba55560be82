package tw.gc.auto.lifecycle.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.auto.lifecycle.entities.PerformanceObservation;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface PerformanceObservationRepository extends JpaRepository<PerformanceObservation, Long> {

    List<PerformanceObservation> findByFamilyIdAndObservedAtGreaterThanEqualOrderByObservedAtAsc(
            String familyId, LocalDateTime since);

    long countByFamilyIdAndObservedAtGreaterThanEqual(String familyId, LocalDateTime since);

    /**
     * Sample count and mean score of the window, computed in the database.
     */
    @Query("SELECT COUNT(o) AS sampleCount, AVG(o.score) AS meanScore FROM PerformanceObservation o " +
           "WHERE o.familyId = :familyId AND o.observedAt >= :since")
    WindowSummary summarizeWindow(@Param("familyId") String familyId, @Param("since") LocalDateTime since);

    interface WindowSummary {
        Long getSampleCount();

        /** Null when the window is empty */
        Double getMeanScore();
    }
}
