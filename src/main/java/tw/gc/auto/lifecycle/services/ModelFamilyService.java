package tw.gc.auto.lifecycle.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.auto.lifecycle.AppConstants;
import tw.gc.auto.lifecycle.config.LifecycleProperties;
import tw.gc.auto.lifecycle.config.LifecycleProperties.Defaults;
import tw.gc.auto.lifecycle.config.LifecycleProperties.FamilyConfig;
import tw.gc.auto.lifecycle.entities.ModelFamily;
import tw.gc.auto.lifecycle.entities.ModelVersion;
import tw.gc.auto.lifecycle.enums.AuditAction;
import tw.gc.auto.lifecycle.enums.ModelVersionStatus;
import tw.gc.auto.lifecycle.exceptions.UnknownEntityException;
import tw.gc.auto.lifecycle.repositories.ModelFamilyRepository;
import tw.gc.auto.lifecycle.repositories.ModelVersionRepository;
import tw.gc.auto.lifecycle.services.audit.AuditLogService;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Model family registry: configured families, their effective thresholds and their champion.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ModelFamilyService {

    private final ModelFamilyRepository familyRepository;
    private final ModelVersionRepository versionRepository;
    private final LifecycleProperties properties;
    private final AuditLogService auditLogService;
    private final Clock clock;

    /**
     * Creates configured families that are missing from the store and installs their seed champion.
     * Existing families keep their stored overrides.
     */
    @Transactional
    public void registerConfiguredFamilies() {
        for (Map.Entry<String, FamilyConfig> entry : properties.getFamilies().entrySet()) {
            String familyId = entry.getKey();
            FamilyConfig config = entry.getValue();

            // Fail fast on malformed configuration before anything is stored
            resolveThresholds(toEntity(familyId, config));

            if (familyRepository.findById(familyId).isEmpty()) {
                familyRepository.save(toEntity(familyId, config));
                log.info("🧬 Registered model family {}", familyId);
            }

            if (config.getChampionArtifact() != null && config.getChampionScore() != null) {
                seedChampion(familyId, config.getChampionArtifact(), config.getChampionScore());
            }
        }
    }

    public ModelFamily getFamily(String familyId) {
        return familyRepository.findById(familyId)
            .orElseThrow(() -> new UnknownEntityException("model family", familyId));
    }

    public List<String> listFamilyIds() {
        return familyRepository.findAll().stream()
            .map(ModelFamily::getFamilyId)
            .sorted()
            .toList();
    }

    public FamilyThresholds resolveThresholds(ModelFamily family) {
        Defaults defaults = properties.getDefaults();
        return new FamilyThresholds(
            orDefault(family.getDriftThreshold(), defaults.getDriftThreshold()),
            orDefault(family.getAutoDeployThreshold(), defaults.getAutoDeployThreshold()),
            family.getScheduleIntervalSeconds() != null
                ? Duration.ofSeconds(family.getScheduleIntervalSeconds()) : defaults.getScheduleInterval(),
            orDefault(family.getMinTrainingSamples(), defaults.getMinTrainingSamples()),
            orDefault(family.getMaxRetries(), defaults.getMaxRetries()),
            orDefault(family.getRegressionTolerance(), defaults.getRegressionTolerance()),
            orDefault(family.getQualityFloor(), defaults.getQualityFloor()),
            family.getLookbackWindowSeconds() != null
                ? Duration.ofSeconds(family.getLookbackWindowSeconds()) : defaults.getLookbackWindow()
        );
    }

    public Optional<ModelVersion> findChampion(ModelFamily family) {
        if (family.getChampionVersionId() == null) {
            return Optional.empty();
        }
        return versionRepository.findById(family.getChampionVersionId());
    }

    /**
     * Installs an initial champion for a family that has none. A family that already has a
     * champion is left untouched and its current champion returned.
     */
    @Transactional
    public ModelVersion seedChampion(String familyId, String artifactRef, double score) {
        ModelFamily family = getFamily(familyId);
        Optional<ModelVersion> existing = findChampion(family);
        if (existing.isPresent()) {
            log.debug("Family {} already has champion {}, seed ignored", familyId, existing.get().getVersionId());
            return existing.get();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        ModelVersion seed = versionRepository.save(ModelVersion.builder()
            .versionId(UUID.randomUUID().toString())
            .familyId(familyId)
            .artifactRef(artifactRef)
            .validationScore(score)
            .metricsJson("{}")
            .status(ModelVersionStatus.DEPLOYED)
            .statusReason("Seeded from configuration")
            .createdAt(now)
            .deployedAt(now)
            .build());

        if (familyRepository.installFirstChampion(familyId, seed.getVersionId(), now) == 0) {
            // Another instance seeded first; drop ours with the transaction
            throw new IllegalStateException("Champion of " + familyId + " was installed concurrently");
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("artifactRef", artifactRef);
        detail.put("championScore", score);
        auditLogService.record(AppConstants.ACTOR_FAMILY_REGISTRY, familyId, seed.getVersionId(), null,
            AuditAction.CHAMPION_SEEDED, ModelVersionStatus.DEPLOYED.name(), detail);

        log.info("👑 Seeded champion {} for {} (score={})", seed.getVersionId(), familyId, score);
        return seed;
    }

    private static ModelFamily toEntity(String familyId, FamilyConfig config) {
        return ModelFamily.builder()
            .familyId(familyId)
            .description(config.getDescription())
            .driftThreshold(config.getDriftThreshold())
            .autoDeployThreshold(config.getAutoDeployThreshold())
            .regressionTolerance(config.getRegressionTolerance())
            .qualityFloor(config.getQualityFloor())
            .minTrainingSamples(config.getMinTrainingSamples())
            .maxRetries(config.getMaxRetries())
            .scheduleIntervalSeconds(config.getScheduleInterval() != null ? config.getScheduleInterval().getSeconds() : null)
            .lookbackWindowSeconds(config.getLookbackWindow() != null ? config.getLookbackWindow().getSeconds() : null)
            .build();
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
