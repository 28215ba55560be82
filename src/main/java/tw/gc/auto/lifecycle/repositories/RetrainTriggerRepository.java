package tw.gc.auto.lifecycle.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.lifecycle.entities.RetrainTrigger;
import tw.gc.auto.lifecycle.enums.TriggerCause;
import tw.gc.auto.lifecycle.enums.TriggerStatus;

import java.util.List;
import java.util.Optional;

@Repository
public interface RetrainTriggerRepository extends JpaRepository<RetrainTrigger, String> {

    Optional<RetrainTrigger> findFirstByFamilyIdAndStatus(String familyId, TriggerStatus status);

    List<RetrainTrigger> findByStatus(TriggerStatus status);

    long countByFamilyIdAndStatus(String familyId, TriggerStatus status);

    Optional<RetrainTrigger> findFirstByFamilyIdAndCauseOrderByCreatedAtDesc(String familyId, TriggerCause cause);
}
