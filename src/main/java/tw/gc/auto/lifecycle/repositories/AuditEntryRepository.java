package tw.gc.auto.lifecycle.repositories;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.lifecycle.entities.AuditEntry;
import tw.gc.auto.lifecycle.enums.AuditAction;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Append-only: callers only {@code save} new entries and read.
 */
@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntry, Long> {

    Optional<AuditEntry> findFirstByFamilyIdOrderByIdDesc(String familyId);

    Optional<AuditEntry> findFirstByFamilyIdAndActionInOrderByIdDesc(String familyId, Collection<AuditAction> actions);

    List<AuditEntry> findByFamilyIdOrderByIdDesc(String familyId, Pageable pageable);

    List<AuditEntry> findByFamilyIdAndIdLessThanOrderByIdDesc(String familyId, Long cursor, Pageable pageable);

    List<AuditEntry> findByFamilyIdOrderByIdAsc(String familyId);

    List<AuditEntry> findByJobIdOrderByIdAsc(String jobId);

    List<AuditEntry> findByJobIdAndActionOrderByIdAsc(String jobId, AuditAction action);
}
