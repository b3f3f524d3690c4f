package my.projectalpha.app.repository;

import my.projectalpha.app.domain.ExtractionLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ExtractionLogEntryRepository extends JpaRepository<ExtractionLogEntry, Long> {
	List<ExtractionLogEntry> findByDocumentIdOrderByIdAsc(Long documentId);
}
