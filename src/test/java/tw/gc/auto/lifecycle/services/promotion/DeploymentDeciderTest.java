package tw.gc.auto.lifecycle.services.promotion;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tw.gc.auto.lifecycle.entities.ModelVersion;
import tw.gc.auto.lifecycle.entities.TrainingJob;
import tw.gc.auto.lifecycle.entities.ValidationResult;
import tw.gc.auto.lifecycle.enums.AuditAction;
import tw.gc.auto.lifecycle.enums.ModelVersionStatus;
import tw.gc.auto.lifecycle.enums.NotificationType;
import tw.gc.auto.lifecycle.exceptions.DeploymentConflictException;
import tw.gc.auto.lifecycle.repositories.ModelFamilyRepository;
import tw.gc.auto.lifecycle.repositories.ModelVersionRepository;
import tw.gc.auto.lifecycle.repositories.TrainingJobRepository;
import tw.gc.auto.lifecycle.services.FamilyThresholds;
import tw.gc.auto.lifecycle.services.ModelFamilyService;
import tw.gc.auto.lifecycle.services.Scores;
import tw.gc.auto.lifecycle.services.TriggerClaimService;
import tw.gc.auto.lifecycle.services.audit.AuditLogService;
import tw.gc.auto.lifecycle.services.notification.NotificationService;
import tw.gc.auto.lifecycle.testutil.LifecycleTestFactory;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static tw.gc.auto.lifecycle.testutil.LifecycleTestFactory.FAMILY;
import static tw.gc.auto.lifecycle.testutil.LifecycleTestFactory.NOW;

@ExtendWith(MockitoExtension.class)
class DeploymentDeciderTest {

    @Mock
    private ModelFamilyRepository familyRepository;

    @Mock
    private ModelVersionRepository versionRepository;

    @Mock
    private TrainingJobRepository jobRepository;

    @Mock
    private ModelFamilyService familyService;

    @Mock
    private TriggerClaimService claimService;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private NotificationService notificationService;

    private DeploymentDecider decider;
    private final FamilyThresholds thresholds = LifecycleTestFactory.defaultThresholds();

    @BeforeEach
    void setUp() {
        decider = new DeploymentDecider(familyRepository, versionRepository, jobRepository, familyService, claimService,
            auditLogService, notificationService, LifecycleTestFactory.clockAtNow());
        lenient().when(versionRepository.save(any(ModelVersion.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(versionRepository.findFamilyIdByVersionId(anyString())).thenReturn(Optional.of(FAMILY));
    }

    private ModelVersion givenValidatedCandidate(String versionId, double score) {
        ModelVersion candidate = LifecycleTestFactory.candidate(versionId, score);
        candidate.setStatus(ModelVersionStatus.VALIDATED);
        lenient().when(versionRepository.findById(versionId)).thenReturn(Optional.of(candidate));
        return candidate;
    }

    @Nested
    @DisplayName("decide")
    class Decide {

        @ParameterizedTest(name = "candidate {0} vs champion 0.80 -> {1}")
        @CsvSource({
            "0.83, DEPLOY",
            "0.82, DEPLOY",
            "0.819999, HOLD_FOR_APPROVAL",
            "0.805, HOLD_FOR_APPROVAL",
            "0.795, HOLD_FOR_APPROVAL"
        })
        void deploysIffDeltaReachesThreshold(double candidateScore, DeploymentDecision.Outcome expected) {
            double delta = Scores.delta(candidateScore, 0.80);
            ValidationResult result = LifecycleTestFactory.passedResult("cand-1", "champion-1", candidateScore, 0.80, delta);

            DeploymentDecision decision = decider.decide(result, thresholds);

            assertThat(decision.outcome()).isEqualTo(expected);
        }

        @Test
        @DisplayName("delta == threshold deploys")
        void boundaryIsInclusive() {
            ValidationResult result = LifecycleTestFactory.passedResult("cand-1", "champion-1", 0.82, 0.80, 0.02);

            DeploymentDecision decision = decider.decide(result, thresholds);

            assertThat(decision.deploy()).isTrue();
            assertThat(decision.reason()).isEqualTo(DeploymentDecision.Reason.THRESHOLD_MET);
        }

        @Test
        void firstChampionDeploys() {
            ValidationResult result = LifecycleTestFactory.passedResult("cand-1", null, 0.75, null, null);

            DeploymentDecision decision = decider.decide(result, thresholds);

            assertThat(decision.deploy()).isTrue();
            assertThat(decision.reason()).isEqualTo(DeploymentDecision.Reason.FIRST_CHAMPION);
        }

        @Test
        void championWithoutScoreHolds() {
            ValidationResult result = LifecycleTestFactory.passedResult("cand-1", "champion-1", 0.90, null, null);

            DeploymentDecision decision = decider.decide(result, thresholds);

            assertThat(decision.outcome()).isEqualTo(DeploymentDecision.Outcome.HOLD_FOR_APPROVAL);
            assertThat(decision.reason()).isEqualTo(DeploymentDecision.Reason.NO_COMPARABLE_BASELINE);
        }

        @Test
        void failedValidationIsNotDecided() {
            ValidationResult failed = ValidationResult.builder()
                .familyId(FAMILY)
                .candidateVersionId("cand-1")
                .verdict(ValidationResult.Verdict.FAIL)
                .build();

            assertThatThrownBy(() -> decider.decide(failed, thresholds)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Candidate 0.83 over champion 0.80 is promoted and the old champion retired")
    void autoDeployPromotesCandidate() {
        ModelVersion candidate = givenValidatedCandidate("cand-1", 0.83);
        when(familyRepository.swapChampion(FAMILY, "champion-1", "cand-1", NOW)).thenReturn(1);
        when(versionRepository.retireDeployedExcept(eq(FAMILY), eq("cand-1"), eq(NOW), anyString())).thenReturn(1);

        DeploymentDecision decision = decider.decideAndApply(
            LifecycleTestFactory.passedResult("cand-1", "champion-1", 0.83, 0.80, 0.03), thresholds);

        assertThat(decision.deploy()).isTrue();
        assertThat(candidate.getStatus()).isEqualTo(ModelVersionStatus.DEPLOYED);
        assertThat(candidate.getDeployedAt()).isEqualTo(NOW);
        verify(auditLogService).record(anyString(), eq(FAMILY), eq("cand-1"), any(),
            eq(AuditAction.DEPLOYMENT_DECIDED), eq("DEPLOY"), anyMap());
        verify(auditLogService).record(anyString(), eq(FAMILY), eq("cand-1"), any(),
            eq(AuditAction.CHAMPION_PROMOTED), eq("DEPLOYED"), anyMap());
        verify(notificationService).notify(eq(NotificationType.MODEL_DEPLOYED), eq(FAMILY), anyString());
    }

    @Test
    @DisplayName("Candidate 0.805 over champion 0.80 is held for approval")
    void smallImprovementIsHeld() {
        ModelVersion candidate = givenValidatedCandidate("cand-1", 0.805);

        DeploymentDecision decision = decider.decideAndApply(
            LifecycleTestFactory.passedResult("cand-1", "champion-1", 0.805, 0.80, 0.005), thresholds);

        assertThat(decision.outcome()).isEqualTo(DeploymentDecision.Outcome.HOLD_FOR_APPROVAL);
        assertThat(candidate.getStatus()).isEqualTo(ModelVersionStatus.VALIDATED);
        verify(familyRepository, never()).swapChampion(anyString(), anyString(), anyString(), any());
        verify(notificationService).notify(eq(NotificationType.APPROVAL_REQUIRED), eq(FAMILY), anyString());
    }

    @Test
    void firstChampionIsInstalled() {
        ModelVersion candidate = givenValidatedCandidate("cand-1", 0.75);
        when(familyRepository.installFirstChampion(FAMILY, "cand-1", NOW)).thenReturn(1);

        decider.decideAndApply(LifecycleTestFactory.passedResult("cand-1", null, 0.75, null, null), thresholds);

        assertThat(candidate.getStatus()).isEqualTo(ModelVersionStatus.DEPLOYED);
        verify(familyRepository, never()).swapChampion(anyString(), anyString(), anyString(), any());
    }

    @Test
    @DisplayName("Champion moved once: re-read and swapped against the new champion")
    void conflictIsRetriedOnce() {
        ModelVersion candidate = givenValidatedCandidate("cand-1", 0.83);
        when(familyRepository.swapChampion(FAMILY, "champion-1", "cand-1", NOW)).thenReturn(0);
        when(familyService.getFamily(FAMILY)).thenReturn(LifecycleTestFactory.family("champion-2"));
        when(versionRepository.findById("champion-2"))
            .thenReturn(Optional.of(LifecycleTestFactory.champion("champion-2", 0.80)));
        when(familyRepository.swapChampion(FAMILY, "champion-2", "cand-1", NOW)).thenReturn(1);

        decider.decideAndApply(LifecycleTestFactory.passedResult("cand-1", "champion-1", 0.83, 0.80, 0.03), thresholds);

        assertThat(candidate.getStatus()).isEqualTo(ModelVersionStatus.DEPLOYED);
    }

    @Test
    @DisplayName("Champion moved twice: DeploymentConflictException")
    void persistentConflictIsSurfaced() {
        givenValidatedCandidate("cand-1", 0.83);
        when(familyRepository.swapChampion(eq(FAMILY), anyString(), eq("cand-1"), eq(NOW))).thenReturn(0);
        when(familyService.getFamily(FAMILY)).thenReturn(
            LifecycleTestFactory.family("champion-2"), LifecycleTestFactory.family("champion-3"));
        when(versionRepository.findById("champion-2"))
            .thenReturn(Optional.of(LifecycleTestFactory.champion("champion-2", 0.80)));

        assertThatThrownBy(() -> decider.decideAndApply(
                LifecycleTestFactory.passedResult("cand-1", "champion-1", 0.83, 0.80, 0.03), thresholds))
            .isInstanceOf(DeploymentConflictException.class)
            .hasMessageContaining("champion-3");
        verify(familyRepository, times(2)).swapChampion(eq(FAMILY), anyString(), eq("cand-1"), eq(NOW));
        verify(notificationService, never()).notify(eq(NotificationType.MODEL_DEPLOYED), anyString(), anyString());
    }

    @Test
    @DisplayName("New champion is too strong: no second swap")
    void conflictAgainstStrongerChampionIsNotForced() {
        givenValidatedCandidate("cand-1", 0.83);
        when(familyRepository.swapChampion(FAMILY, "champion-1", "cand-1", NOW)).thenReturn(0);
        when(familyService.getFamily(FAMILY)).thenReturn(LifecycleTestFactory.family("champion-2"));
        when(versionRepository.findById("champion-2"))
            .thenReturn(Optional.of(LifecycleTestFactory.champion("champion-2", 0.82)));

        assertThatThrownBy(() -> decider.decideAndApply(
                LifecycleTestFactory.passedResult("cand-1", "champion-1", 0.83, 0.80, 0.03), thresholds))
            .isInstanceOf(DeploymentConflictException.class);
        verify(familyRepository, times(1)).swapChampion(anyString(), anyString(), anyString(), any());
    }

    @Test
    void approveHeldCandidate() {
        ModelVersion candidate = givenValidatedCandidate("cand-1", 0.805);
        when(familyService.getFamily(FAMILY)).thenReturn(LifecycleTestFactory.family("champion-1"));
        when(familyRepository.swapChampion(FAMILY, "champion-1", "cand-1", NOW)).thenReturn(1);

        ModelVersion promoted = decider.approveCandidate("cand-1", "alice");

        assertThat(promoted.getStatus()).isEqualTo(ModelVersionStatus.DEPLOYED);
        assertThat(candidate.getStatusReason()).isEqualTo("Promoted by alice");
        verify(auditLogService).record(eq("alice"), eq(FAMILY), eq("cand-1"), any(),
            eq(AuditAction.DEPLOYMENT_DECIDED), eq("APPROVED"), anyMap());
        verify(auditLogService).record(eq("alice"), eq(FAMILY), eq("cand-1"), any(),
            eq(AuditAction.CHAMPION_PROMOTED), eq("DEPLOYED"), anyMap());
    }

    @Test
    void onlyValidatedCandidatesCanBeApproved() {
        ModelVersion rejected = LifecycleTestFactory.candidate("cand-1", 0.6);
        rejected.setStatus(ModelVersionStatus.REJECTED);
        when(versionRepository.findById("cand-1")).thenReturn(Optional.of(rejected));

        assertThatThrownBy(() -> decider.approveCandidate("cand-1", "alice"))
            .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(familyRepository);
    }

    @Test
    void rejectHeldCandidateKeepsChampion() {
        ModelVersion candidate = givenValidatedCandidate("cand-1", 0.805);

        decider.rejectCandidate("cand-1", "bob", "not worth the churn");

        assertThat(candidate.getStatus()).isEqualTo(ModelVersionStatus.REJECTED);
        assertThat(candidate.getStatusReason()).contains("bob").contains("not worth the churn");
        verify(familyRepository).lockByFamilyId(FAMILY);
        verify(familyRepository, never()).swapChampion(anyString(), anyString(), anyString(), any());
        verify(familyRepository, never()).installFirstChampion(anyString(), anyString(), any());
        verify(auditLogService).record(eq("bob"), eq(FAMILY), eq("cand-1"), any(),
            eq(AuditAction.CANDIDATE_REJECTED), eq("REJECTED"), anyMap());
    }

    @Test
    @DisplayName("Rejecting a candidate before validation resolves the trigger that produced it")
    void rejectUnvalidatedCandidateReleasesTrigger() {
        ModelVersion candidate = LifecycleTestFactory.candidate("cand-1", 0.90);
        when(versionRepository.findById("cand-1")).thenReturn(Optional.of(candidate));
        TrainingJob job = LifecycleTestFactory.pendingJob("job-cand-1", "trigger-1", 3);
        when(jobRepository.findById("job-cand-1")).thenReturn(Optional.of(job));

        decider.rejectCandidate("cand-1", "bob", null);

        assertThat(candidate.getStatus()).isEqualTo(ModelVersionStatus.REJECTED);
        verify(claimService).release("trigger-1", "CANDIDATE_REJECTED");
    }

    @Test
    void deployedVersionCannotBeRejected() {
        when(versionRepository.findById("champion-1"))
            .thenReturn(Optional.of(LifecycleTestFactory.champion("champion-1", 0.80)));

        assertThatThrownBy(() -> decider.rejectCandidate("champion-1", "bob", null))
            .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(claimService);
    }

    @Test
    @DisplayName("A manually rejected candidate is never swapped in, even with a passed result")
    void rejectedCandidateIsNeverPromoted() {
        ModelVersion candidate = LifecycleTestFactory.candidate("cand-1", 0.90);
        candidate.setStatus(ModelVersionStatus.REJECTED);
        when(versionRepository.findById("cand-1")).thenReturn(Optional.of(candidate));

        assertThatThrownBy(() -> decider.decideAndApply(
                LifecycleTestFactory.passedResult("cand-1", "champion-1", 0.90, 0.80, 0.10), thresholds))
            .isInstanceOf(IllegalStateException.class);
        verify(familyRepository, never()).swapChampion(anyString(), anyString(), anyString(), any());
        verify(versionRepository, never()).retireDeployedExcept(anyString(), anyString(), any(), anyString());
        assertThat(candidate.getStatus()).isEqualTo(ModelVersionStatus.REJECTED);
    }
}
