package tw.gc.auto.lifecycle.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.auto.lifecycle.entities.ModelVersion;
import tw.gc.auto.lifecycle.enums.ModelVersionStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ModelVersionRepository extends JpaRepository<ModelVersion, String> {

    List<ModelVersion> findByFamilyIdAndStatus(String familyId, ModelVersionStatus status);

    long countByFamilyIdAndStatus(String familyId, ModelVersionStatus status);

    @Query("SELECT v.familyId FROM ModelVersion v WHERE v.versionId = :versionId")
    Optional<String> findFamilyIdByVersionId(@Param("versionId") String versionId);

    /**
     * Retires every deployed version of the family except the new champion.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ModelVersion v SET v.status = tw.gc.auto.lifecycle.enums.ModelVersionStatus.RETIRED, " +
           "v.retiredAt = :retiredAt, v.statusReason = :reason " +
           "WHERE v.familyId = :familyId " +
           "AND v.status = tw.gc.auto.lifecycle.enums.ModelVersionStatus.DEPLOYED " +
           "AND v.versionId <> :keepVersionId")
    int retireDeployedExcept(@Param("familyId") String familyId,
                             @Param("keepVersionId") String keepVersionId,
                             @Param("retiredAt") LocalDateTime retiredAt,
                             @Param("reason") String reason);
}
