package tw.gc.auto.lifecycle.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.lifecycle.entities.TrainingJob;
import tw.gc.auto.lifecycle.enums.TrainingJobState;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TrainingJobRepository extends JpaRepository<TrainingJob, String> {

    boolean existsByFamilyIdAndStateIn(String familyId, Collection<TrainingJobState> states);

    Optional<TrainingJob> findFirstByFamilyIdAndStateIn(String familyId, Collection<TrainingJobState> states);

    List<TrainingJob> findByStateIn(Collection<TrainingJobState> states);

    Optional<TrainingJob> findByExternalHandle(String externalHandle);

    long countByFamilyIdAndStateIn(String familyId, Collection<TrainingJobState> states);
}
