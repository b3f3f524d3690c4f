package my.projectalpha.app.repository;

import my.projectalpha.app.domain.ExtractionFieldResult;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ExtractionFieldResultRepository extends JpaRepository<ExtractionFieldResult, Long> {
	List<ExtractionFieldResult> findByDocumentIdOrderByIdAsc(Long documentId);

	Optional<ExtractionFieldResult> findByDocumentIdAndTargetModelAndTargetField(Long documentId,
																				 String targetModel,
																				 String targetField);
}
