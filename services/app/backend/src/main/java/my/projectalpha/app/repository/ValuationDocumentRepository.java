package my.projectalpha.app.repository;

import my.projectalpha.app.domain.ValuationDocument;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ValuationDocumentRepository extends JpaRepository<ValuationDocument, Long> {
	List<ValuationDocument> findByAssetHubIdOrderByUploadedAtDescDocumentIdDesc(Long assetHubId);
}
