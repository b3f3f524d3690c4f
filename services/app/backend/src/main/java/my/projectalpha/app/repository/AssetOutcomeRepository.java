package my.projectalpha.app.repository;

import my.projectalpha.app.domain.AssetOutcome;
import my.projectalpha.app.domain.OutcomeType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface AssetOutcomeRepository extends JpaRepository<AssetOutcome, Long> {
	List<AssetOutcome> findByAssetHubIdOrderByOutcomeIdAsc(Long assetHubId);

	Optional<AssetOutcome> findByAssetHubIdAndOutcomeType(Long assetHubId, OutcomeType outcomeType);
}
