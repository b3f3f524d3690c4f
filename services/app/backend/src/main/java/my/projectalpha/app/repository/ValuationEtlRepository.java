package my.projectalpha.app.repository;

import my.projectalpha.app.domain.ValuationEtl;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ValuationEtlRepository extends JpaRepository<ValuationEtl, Long> {
	Optional<ValuationEtl> findFirstByDocumentId(Long documentId);
}
