package tw.gc.auto.lifecycle.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tw.gc.auto.lifecycle.entities.RetrainTrigger;
import tw.gc.auto.lifecycle.enums.AuditAction;
import tw.gc.auto.lifecycle.enums.TriggerCause;
import tw.gc.auto.lifecycle.enums.TriggerStatus;
import tw.gc.auto.lifecycle.repositories.ModelFamilyRepository;
import tw.gc.auto.lifecycle.repositories.RetrainTriggerRepository;
import tw.gc.auto.lifecycle.services.audit.AuditLogService;
import tw.gc.auto.lifecycle.testutil.LifecycleTestFactory;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static tw.gc.auto.lifecycle.testutil.LifecycleTestFactory.FAMILY;
import static tw.gc.auto.lifecycle.testutil.LifecycleTestFactory.NOW;

@ExtendWith(MockitoExtension.class)
class TriggerClaimServiceTest {

    @Mock
    private ModelFamilyRepository familyRepository;

    @Mock
    private RetrainTriggerRepository triggerRepository;

    @Mock
    private AuditLogService auditLogService;

    private TriggerClaimService claimService;

    @BeforeEach
    void setUp() {
        claimService = new TriggerClaimService(familyRepository, triggerRepository, auditLogService,
            LifecycleTestFactory.clockAtNow());
    }

    @Test
    void claimSucceedsOnlyWhenRowChanged() {
        when(familyRepository.claimActiveTrigger(FAMILY, "t-1")).thenReturn(1);
        when(familyRepository.claimActiveTrigger(FAMILY, "t-2")).thenReturn(0);

        assertThat(claimService.claim(FAMILY, "t-1")).isTrue();
        assertThat(claimService.claim(FAMILY, "t-2")).isFalse();
    }

    @Test
    void releaseResolvesTriggerAndAudits() {
        RetrainTrigger trigger = LifecycleTestFactory.trigger("t-1", TriggerCause.MANUAL);
        when(triggerRepository.findById("t-1")).thenReturn(Optional.of(trigger));
        when(familyRepository.releaseActiveTrigger(FAMILY, "t-1")).thenReturn(1);

        claimService.release("t-1", "DEPLOYED");

        assertThat(trigger.getStatus()).isEqualTo(TriggerStatus.RESOLVED);
        assertThat(trigger.getResolution()).isEqualTo("DEPLOYED");
        assertThat(trigger.getResolvedAt()).isEqualTo(NOW);
        verify(triggerRepository).save(trigger);
        verify(auditLogService).record(anyString(), eq(FAMILY), eq("t-1"), any(),
            eq(AuditAction.TRIGGER_RESOLVED), eq("DEPLOYED"), anyMap());
    }

    @Test
    void releasingResolvedTriggerIsNoOp() {
        RetrainTrigger trigger = LifecycleTestFactory.trigger("t-1", TriggerCause.MANUAL);
        trigger.setStatus(TriggerStatus.RESOLVED);
        when(triggerRepository.findById("t-1")).thenReturn(Optional.of(trigger));

        claimService.release("t-1", "CANCELLED");

        verify(familyRepository, never()).releaseActiveTrigger(anyString(), anyString());
        verifyNoInteractions(auditLogService);
    }
}
