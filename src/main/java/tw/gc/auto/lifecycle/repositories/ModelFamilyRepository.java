package tw.gc.auto.lifecycle.repositories;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.auto.lifecycle.entities.ModelFamily;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Model family store. The active-trigger claim and the champion pointer are changed only
 * through the compare-and-set updates below; each returns the number of rows changed
 * (1 = swapped, 0 = expectation did not hold).
 */
@Repository
public interface ModelFamilyRepository extends JpaRepository<ModelFamily, String> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ModelFamily f SET f.activeTriggerId = :triggerId " +
           "WHERE f.familyId = :familyId AND f.activeTriggerId IS NULL")
    int claimActiveTrigger(@Param("familyId") String familyId, @Param("triggerId") String triggerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ModelFamily f SET f.activeTriggerId = NULL " +
           "WHERE f.familyId = :familyId AND f.activeTriggerId = :triggerId")
    int releaseActiveTrigger(@Param("familyId") String familyId, @Param("triggerId") String triggerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ModelFamily f SET f.championVersionId = :next, f.lastDeployedAt = :deployedAt " +
           "WHERE f.familyId = :familyId AND f.championVersionId = :expected")
    int swapChampion(@Param("familyId") String familyId,
                     @Param("expected") String expected,
                     @Param("next") String next,
                     @Param("deployedAt") LocalDateTime deployedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ModelFamily f SET f.championVersionId = :next, f.lastDeployedAt = :deployedAt " +
           "WHERE f.familyId = :familyId AND f.championVersionId IS NULL")
    int installFirstChampion(@Param("familyId") String familyId,
                             @Param("next") String next,
                             @Param("deployedAt") LocalDateTime deployedAt);

    /**
     * Row lock used to serialize audit appends of one family.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM ModelFamily f WHERE f.familyId = :familyId")
    Optional<ModelFamily> lockByFamilyId(@Param("familyId") String familyId);
}
