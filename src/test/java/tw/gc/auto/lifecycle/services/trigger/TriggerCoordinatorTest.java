package tw.gc.auto.lifecycle.services.trigger;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tw.gc.auto.lifecycle.entities.ModelFamily;
import tw.gc.auto.lifecycle.entities.RetrainTrigger;
import tw.gc.auto.lifecycle.entities.TrainingJob;
import tw.gc.auto.lifecycle.enums.AuditAction;
import tw.gc.auto.lifecycle.enums.NotificationType;
import tw.gc.auto.lifecycle.enums.TriggerCause;
import tw.gc.auto.lifecycle.repositories.ModelFamilyRepository;
import tw.gc.auto.lifecycle.repositories.RetrainTriggerRepository;
import tw.gc.auto.lifecycle.services.FamilyThresholds;
import tw.gc.auto.lifecycle.services.ModelFamilyService;
import tw.gc.auto.lifecycle.services.TriggerClaimService;
import tw.gc.auto.lifecycle.services.audit.AuditLogService;
import tw.gc.auto.lifecycle.services.evaluation.DriftEvaluator;
import tw.gc.auto.lifecycle.services.evaluation.DriftVerdict;
import tw.gc.auto.lifecycle.services.evaluation.MetricsGateway;
import tw.gc.auto.lifecycle.services.evaluation.ScheduleEvaluator;
import tw.gc.auto.lifecycle.services.notification.NotificationService;
import tw.gc.auto.lifecycle.services.training.TrainingJobManager;
import tw.gc.auto.lifecycle.testutil.LifecycleTestFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static tw.gc.auto.lifecycle.testutil.LifecycleTestFactory.FAMILY;

@ExtendWith(MockitoExtension.class)
@DisplayName("TriggerCoordinator")
class TriggerCoordinatorTest {

    @Mock
    private ModelFamilyRepository familyRepository;

    @Mock
    private RetrainTriggerRepository triggerRepository;

    @Mock
    private ModelFamilyService familyService;

    @Mock
    private TriggerClaimService claimService;

    @Mock
    private TrainingJobManager jobManager;

    @Mock
    private MetricsGateway metricsGateway;

    @Mock
    private DriftEvaluator driftEvaluator;

    @Mock
    private ScheduleEvaluator scheduleEvaluator;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private NotificationService notificationService;

    private TriggerCoordinator coordinator;
    private final ModelFamily family = LifecycleTestFactory.family("champion-1");
    private final FamilyThresholds thresholds = LifecycleTestFactory.defaultThresholds();

    // Stand-in for the family row's active_trigger_id column
    private final AtomicReference<String> activeTrigger = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        coordinator = new TriggerCoordinator(familyRepository, triggerRepository, familyService, claimService,
            jobManager, metricsGateway, driftEvaluator, scheduleEvaluator, auditLogService, notificationService,
            new ObjectMapper(), LifecycleTestFactory.clockAtNow());

        lenient().when(familyRepository.findById(FAMILY)).thenReturn(Optional.of(family));
        lenient().when(familyService.getFamily(FAMILY)).thenReturn(family);
        lenient().when(familyService.resolveThresholds(any())).thenReturn(thresholds);
        lenient().when(jobManager.findActiveJob(FAMILY)).thenReturn(Optional.empty());
        lenient().when(claimService.claim(eq(FAMILY), anyString()))
            .thenAnswer(inv -> activeTrigger.compareAndSet(null, inv.getArgument(1)));
        lenient().when(triggerRepository.save(any(RetrainTrigger.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(jobManager.createJob(any(RetrainTrigger.class), any(FamilyThresholds.class)))
            .thenAnswer(inv -> {
                RetrainTrigger trigger = inv.getArgument(0);
                return LifecycleTestFactory.pendingJob("job-" + trigger.getTriggerId(), trigger.getTriggerId(), 3);
            });
    }

    @Test
    @DisplayName("Accepted trigger is persisted, gets a PENDING job and is audited")
    void acceptsFirstTrigger() {
        TriggerResult result = coordinator.submit(
            new RetrainRequest(FAMILY, TriggerCause.PERFORMANCE_DRIFT, List.of("engagement"), false, "DriftEvaluator", "drift"));

        assertThat(result.accepted()).isTrue();
        assertThat(result.jobId()).isEqualTo("job-" + result.triggerId());

        ArgumentCaptor<RetrainTrigger> saved = ArgumentCaptor.forClass(RetrainTrigger.class);
        verify(triggerRepository, times(2)).save(saved.capture());
        assertThat(saved.getValue().getScopeJson()).isEqualTo("[\"engagement\"]");
        assertThat(saved.getValue().getJobId()).isEqualTo(result.jobId());
        verify(auditLogService).record(anyString(), eq(FAMILY), eq(result.triggerId()), eq(result.jobId()),
            eq(AuditAction.TRIGGER_ACCEPTED), eq("ACCEPTED"), anyMap());
        verify(notificationService).notify(eq(NotificationType.RETRAIN_TRIGGERED), eq(FAMILY), anyString());
    }

    @Test
    @DisplayName("Second submit while a trigger is active is rejected with ALREADY_ACTIVE")
    void rejectsWhileTriggerActive() {
        TriggerResult first = coordinator.submit(RetrainRequest.manual(FAMILY, true, "alice"));
        TriggerResult second = coordinator.submit(
            new RetrainRequest(FAMILY, TriggerCause.PERFORMANCE_DRIFT, null, false, "DriftEvaluator", "drift"));

        assertThat(first.accepted()).isTrue();
        assertThat(second.accepted()).isFalse();
        assertThat(second.rejection()).isEqualTo(TriggerResult.Rejection.ALREADY_ACTIVE);
        verify(jobManager, times(1)).createJob(any(), any());
        verify(auditLogService).record(anyString(), eq(FAMILY), eq(FAMILY), isNull(),
            eq(AuditAction.TRIGGER_REJECTED), eq("ALREADY_ACTIVE"), anyMap());
    }

    @Test
    void rejectsWhenFamilyHasActiveJob() {
        when(jobManager.findActiveJob(FAMILY)).thenReturn(Optional.of(new TrainingJob()));

        TriggerResult result = coordinator.submit(RetrainRequest.manual(FAMILY, true, "alice"));

        assertThat(result.rejection()).isEqualTo(TriggerResult.Rejection.ALREADY_ACTIVE);
        verify(claimService, never()).claim(anyString(), anyString());
    }

    @Test
    @DisplayName("Concurrent submissions: exactly one is accepted")
    void concurrentSubmissionsAcceptExactlyOne() throws Exception {
        int submitters = 8;
        ExecutorService pool = Executors.newFixedThreadPool(submitters);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<TriggerResult>> futures = new ArrayList<>();
            for (int i = 0; i < submitters; i++) {
                String requester = "user-" + i;
                Callable<TriggerResult> submit = () -> {
                    start.await();
                    return coordinator.submit(RetrainRequest.manual(FAMILY, true, requester));
                };
                futures.add(pool.submit(submit));
            }
            start.countDown();

            List<TriggerResult> results = new ArrayList<>();
            for (Future<TriggerResult> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }

            assertThat(results).filteredOn(TriggerResult::accepted).hasSize(1);
            assertThat(results).filteredOn(r -> !r.accepted())
                .allMatch(r -> r.rejection() == TriggerResult.Rejection.ALREADY_ACTIVE);
            verify(jobManager, times(1)).createJob(any(), any());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Unforced manual request needs min_training_samples observations")
    void manualRequestWithoutDataIsRejected() {
        when(metricsGateway.countObservations(eq(FAMILY), any())).thenReturn(120L);

        TriggerResult result = coordinator.submit(RetrainRequest.manual(FAMILY, false, "alice"));

        assertThat(result.rejection()).isEqualTo(TriggerResult.Rejection.INSUFFICIENT_DATA);
        assertThat(result.detail()).contains("120 of 500");
        verify(claimService, never()).claim(anyString(), anyString());
    }

    @Test
    @DisplayName("Forced manual request skips the sample check")
    void forcedManualRequestSkipsSampleCheck() {
        TriggerResult result = coordinator.submit(RetrainRequest.manual(FAMILY, true, "alice"));

        assertThat(result.accepted()).isTrue();
        verifyNoInteractions(metricsGateway);
    }

    @Test
    void unknownFamilyIsRejected() {
        when(familyRepository.findById("ghost")).thenReturn(Optional.empty());

        TriggerResult result = coordinator.submit(RetrainRequest.manual("ghost", true, "alice"));

        assertThat(result.rejection()).isEqualTo(TriggerResult.Rejection.UNKNOWN_FAMILY);
        verifyNoInteractions(auditLogService);
    }

    @Test
    @DisplayName("Drift and schedule firing together submit one PERFORMANCE_DRIFT trigger")
    void driftOutranksSchedule() {
        family.setActiveTriggerId(null);
        when(driftEvaluator.evaluate(eq(family), any(), any())).thenReturn(driftVerdict(true));
        when(scheduleEvaluator.dueForForcedRetrain(eq(family), any(), any())).thenReturn(true);

        EvaluationOutcome outcome = coordinator.evaluateFamily(FAMILY, null, null);

        assertThat(outcome.triggered()).isTrue();
        assertThat(outcome.trigger().cause()).isEqualTo(TriggerCause.PERFORMANCE_DRIFT);
        assertThat(outcome.scheduleDue()).isTrue();
        verify(jobManager, times(1)).createJob(any(), any());
        verify(auditLogService).record(anyString(), eq(FAMILY), eq(FAMILY), isNull(),
            eq(AuditAction.DRIFT_EVALUATED), eq("DRIFT_DETECTED"), anyMap());
        verify(auditLogService).record(anyString(), eq(FAMILY), eq(FAMILY), isNull(),
            eq(AuditAction.SCHEDULE_EVALUATED), eq("DUE"), anyMap());
    }

    @Test
    void scheduleAloneSubmitsScheduleTrigger() {
        when(driftEvaluator.evaluate(eq(family), any(), any())).thenReturn(driftVerdict(false));
        when(scheduleEvaluator.dueForForcedRetrain(eq(family), any(), any())).thenReturn(true);

        EvaluationOutcome outcome = coordinator.evaluateFamily(FAMILY, null, null);

        assertThat(outcome.trigger().cause()).isEqualTo(TriggerCause.SCHEDULE);
        assertThat(outcome.trigger().accepted()).isTrue();
    }

    @Test
    void nothingFiresNothingSubmitted() {
        when(driftEvaluator.evaluate(eq(family), any(), any())).thenReturn(driftVerdict(false));
        when(scheduleEvaluator.dueForForcedRetrain(eq(family), any(), any())).thenReturn(false);

        EvaluationOutcome outcome = coordinator.evaluateFamily(FAMILY, null, null);

        assertThat(outcome.trigger()).isNull();
        verify(claimService, never()).claim(anyString(), anyString());
    }

    @Test
    void activeTriggerSuppressesSubmission() {
        family.setActiveTriggerId("trigger-0");
        when(driftEvaluator.evaluate(eq(family), any(), any())).thenReturn(driftVerdict(true));

        EvaluationOutcome outcome = coordinator.evaluateFamily(FAMILY, null, null);

        assertThat(outcome.trigger()).isNull();
        verify(claimService, never()).claim(anyString(), anyString());
    }

    @Test
    @DisplayName("Threshold and window overrides apply to this evaluation only")
    void overridesReachTheEvaluator() {
        ArgumentCaptor<FamilyThresholds> used = ArgumentCaptor.forClass(FamilyThresholds.class);
        when(driftEvaluator.evaluate(eq(family), used.capture(), any())).thenReturn(driftVerdict(false));

        coordinator.evaluateFamily(FAMILY, 0.05, Duration.ofDays(2));

        assertThat(used.getValue().driftThreshold()).isEqualTo(0.05);
        assertThat(used.getValue().lookbackWindow()).isEqualTo(Duration.ofDays(2));
        assertThat(used.getValue().autoDeployThreshold()).isEqualTo(thresholds.autoDeployThreshold());
    }

    private static DriftVerdict driftVerdict(boolean retrain) {
        return new DriftVerdict(FAMILY, retrain, 0.76, 0.80, 0.04, 0.03, 600,
            retrain ? DriftVerdict.Reason.DRIFT_DETECTED : DriftVerdict.Reason.WITHIN_THRESHOLD, "test");
    }
}
