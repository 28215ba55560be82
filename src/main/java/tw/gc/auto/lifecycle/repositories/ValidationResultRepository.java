package tw.gc.auto.lifecycle.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.auto.lifecycle.entities.ValidationResult;

import java.util.Optional;

@Repository
public interface ValidationResultRepository extends JpaRepository<ValidationResult, Long> {

    Optional<ValidationResult> findByCandidateVersionId(String candidateVersionId);
}
