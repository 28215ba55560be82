package tw.gc.auto.lifecycle.services.evaluation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.auto.lifecycle.entities.ModelFamily;
import tw.gc.auto.lifecycle.entities.ModelVersion;
import tw.gc.auto.lifecycle.services.FamilyThresholds;
import tw.gc.auto.lifecycle.services.ModelFamilyService;
import tw.gc.auto.lifecycle.services.Scores;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Decides whether a family's live performance has degraded enough to retrain.
 *
 * <p>Fails open: without enough observations, or without a champion baseline, the verdict is
 * always {@code retrain=false}. An improvement (negative delta) never triggers retraining.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DriftEvaluator {

    private final MetricsGateway metricsGateway;
    private final ModelFamilyService familyService;

    public DriftVerdict evaluate(ModelFamily family, FamilyThresholds thresholds, LocalDateTime now) {
        String familyId = family.getFamilyId();
        double threshold = thresholds.driftThreshold();

        ObservationSummary window = metricsGateway.summarize(familyId, now.minus(thresholds.lookbackWindow()));
        long count = window.count();

        if (count < thresholds.minTrainingSamples() || window.meanScore() == null) {
            return new DriftVerdict(familyId, false, null, null, null, threshold, count,
                DriftVerdict.Reason.INSUFFICIENT_DATA,
                "insufficient_data: %d of %d required observations".formatted(count, thresholds.minTrainingSamples()));
        }

        double currentScore = window.meanScore();

        Optional<ModelVersion> champion = familyService.findChampion(family);
        if (champion.isEmpty() || champion.get().getValidationScore() == null) {
            return new DriftVerdict(familyId, false, currentScore, null, null, threshold, count,
                DriftVerdict.Reason.NO_BASELINE, "no champion baseline to compare against");
        }

        double baselineScore = champion.get().getValidationScore();
        double delta = Scores.delta(baselineScore, currentScore);
        boolean retrain = delta >= threshold;

        log.debug("📉 Drift {} current={} baseline={} delta={} threshold={}",
            familyId, currentScore, baselineScore, delta, threshold);

        return new DriftVerdict(familyId, retrain, currentScore, baselineScore, delta, threshold, count,
            retrain ? DriftVerdict.Reason.DRIFT_DETECTED : DriftVerdict.Reason.WITHIN_THRESHOLD,
            "baseline %.4f, current %.4f, delta %.4f vs threshold %.4f"
                .formatted(baselineScore, currentScore, delta, threshold));
    }
}
