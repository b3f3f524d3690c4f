package my.projectalpha.app.repository;

import my.projectalpha.app.domain.OutcomeAuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OutcomeAuditEntryRepository extends JpaRepository<OutcomeAuditEntry, Long> {
	List<OutcomeAuditEntry> findByAssetHubIdOrderByEditedAtDescIdDesc(Long assetHubId);
}
