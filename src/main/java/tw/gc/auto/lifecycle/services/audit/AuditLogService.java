package tw.gc.auto.lifecycle.services.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.auto.lifecycle.entities.AuditEntry;
import tw.gc.auto.lifecycle.enums.AuditAction;
import tw.gc.auto.lifecycle.enums.TrainingJobState;
import tw.gc.auto.lifecycle.exceptions.UnknownEntityException;
import tw.gc.auto.lifecycle.repositories.AuditEntryRepository;
import tw.gc.auto.lifecycle.repositories.ModelFamilyRepository;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only audit trail of every decision and state transition.
 *
 * <p>Appends join the caller's transaction, so an entry is committed together with the state
 * change it describes or not at all. Entries of a family are chained by SHA-256; the family row
 * is locked while appending so the chain stays linear under concurrent writers.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuditLogService {

    static final int MAX_PAGE_SIZE = 500;

    private final AuditEntryRepository repository;
    private final ModelFamilyRepository familyRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public AuditEntry record(String actor, String familyId, String subject, String jobId,
                             AuditAction action, String outcome, Map<String, Object> detail) {
        familyRepository.lockByFamilyId(familyId)
            .orElseThrow(() -> new UnknownEntityException("model family", familyId));

        String previousHash = repository.findFirstByFamilyIdOrderByIdDesc(familyId)
            .map(AuditEntry::getEntryHash)
            .orElse(null);

        LocalDateTime timestamp = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        String detailJson = toJson(detail);

        AuditEntry entry = AuditEntry.builder()
            .timestamp(timestamp)
            .actor(actor)
            .familyId(familyId)
            .subject(subject)
            .jobId(jobId)
            .action(action)
            .outcome(outcome)
            .detail(detailJson)
            .previousHash(previousHash)
            .entryHash(hash(previousHash, timestamp, actor, familyId, subject, jobId, action, outcome, detailJson))
            .build();

        AuditEntry saved = repository.save(entry);
        log.debug("📝 AUDIT family={} subject={} action={} outcome={}", familyId, subject, action, outcome);
        return saved;
    }

    /**
     * Entries of a family, newest first. {@code cursor} is the {@code nextCursor} of the previous page.
     */
    @Transactional(readOnly = true)
    public HistoryPage listHistory(String familyId, int limit, Long cursor) {
        int pageSize = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        PageRequest page = PageRequest.of(0, pageSize);

        List<AuditEntry> entries = cursor == null
            ? repository.findByFamilyIdOrderByIdDesc(familyId, page)
            : repository.findByFamilyIdAndIdLessThanOrderByIdDesc(familyId, cursor, page);

        Long nextCursor = entries.size() == pageSize ? entries.get(entries.size() - 1).getId() : null;
        return new HistoryPage(familyId, entries, nextCursor);
    }

    @Transactional(readOnly = true)
    public Optional<AuditEntry> lastDecision(String familyId) {
        List<AuditAction> decisions = Arrays.stream(AuditAction.values())
            .filter(AuditAction::isDecision)
            .toList();
        return repository.findFirstByFamilyIdAndActionInOrderByIdDesc(familyId, decisions);
    }

    @Transactional(readOnly = true)
    public List<AuditEntry> jobHistory(String jobId) {
        return repository.findByJobIdOrderByIdAsc(jobId);
    }

    /**
     * Rebuilds a job's state from its JOB_STATE_CHANGED entries alone. Every step must be a legal
     * transition of the state machine, starting from PENDING.
     */
    @Transactional(readOnly = true)
    public JobReplay replayJobState(String jobId) {
        List<AuditEntry> transitions = repository.findByJobIdAndActionOrderByIdAsc(jobId, AuditAction.JOB_STATE_CHANGED);
        if (transitions.isEmpty()) {
            throw new UnknownEntityException("training job audit trail", jobId);
        }

        TrainingJobState state = null;
        int runningAttempts = 0;
        List<TrainingJobState> path = new ArrayList<>();
        for (AuditEntry entry : transitions) {
            TrainingJobState next = TrainingJobState.valueOf(entry.getOutcome());
            boolean legal = state == null ? next == TrainingJobState.PENDING : state.canTransitionTo(next);
            if (!legal) {
                throw new IllegalStateException("Illegal transition %s → %s in audit entry %d of job %s"
                    .formatted(state, next, entry.getId(), jobId));
            }
            if (next == TrainingJobState.RUNNING) {
                runningAttempts++;
            }
            path.add(next);
            state = next;
        }
        return new JobReplay(jobId, state, runningAttempts, path);
    }

    /**
     * Recomputes the family's hash chain and reports the first entry that does not match.
     */
    @Transactional(readOnly = true)
    public ChainVerification verifyChain(String familyId) {
        List<AuditEntry> entries = repository.findByFamilyIdOrderByIdAsc(familyId);
        String expectedPrevious = null;
        for (AuditEntry entry : entries) {
            String recomputed = hash(entry.getPreviousHash(), entry.getTimestamp(), entry.getActor(),
                entry.getFamilyId(), entry.getSubject(), entry.getJobId(), entry.getAction(),
                entry.getOutcome(), entry.getDetail());
            if (!Objects.equals(expectedPrevious, entry.getPreviousHash()) || !recomputed.equals(entry.getEntryHash())) {
                log.warn("🚨 Audit chain broken for {} at entry {}", familyId, entry.getId());
                return ChainVerification.broken(familyId, entries.size(), entry.getId());
            }
            expectedPrevious = entry.getEntryHash();
        }
        return ChainVerification.intact(familyId, entries.size());
    }

    private String toJson(Map<String, Object> detail) {
        if (detail == null || detail.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(detail);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit detail", e);
            return "{\"serializationError\":\"" + e.getOriginalMessage() + "\"}";
        }
    }

    static String hash(String previousHash, LocalDateTime timestamp, String actor, String familyId,
                       String subject, String jobId, AuditAction action, String outcome, String detail) {
        String canonical = String.join("|",
            String.valueOf(previousHash),
            String.valueOf(timestamp),
            actor,
            familyId,
            subject,
            String.valueOf(jobId),
            action.name(),
            outcome,
            String.valueOf(detail));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
