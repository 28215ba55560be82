package tw.gc.auto.lifecycle.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;
import tw.gc.auto.lifecycle.enums.AuditAction;

import java.time.LocalDateTime;

/**
 * Append-only record of a decision or state transition.
 *
 * <p>Entries of one family form a hash chain: {@code entryHash} covers the entry's content and
 * {@code previousHash}, the hash of the family's preceding entry.</p>
 */
@Entity
@Immutable
@Table(name = "audit_entries", indexes = {
        @Index(name = "idx_audit_family_id", columnList = "family_id, id"),
        @Index(name = "idx_audit_job_id", columnList = "job_id, id")
})
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "actor", length = 50, nullable = false)
    private String actor;

    @Column(name = "family_id", length = 100, nullable = false)
    private String familyId;

    @Column(name = "subject", length = 100, nullable = false)
    private String subject;

    @Column(name = "job_id", length = 64)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", length = 32, nullable = false)
    private AuditAction action;

    @Column(name = "outcome", length = 64, nullable = false)
    private String outcome;

    @Column(name = "detail", columnDefinition = "TEXT")
    private String detail;

    @Column(name = "previous_hash", length = 64)
    private String previousHash;

    @Column(name = "entry_hash", length = 64, nullable = false)
    private String entryHash;
}
