package my.projectalpha.app.repository;

import my.projectalpha.app.domain.Valuation;
import my.projectalpha.app.domain.ValuationSource;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ValuationRepository extends JpaRepository<Valuation, Long> {
	List<Valuation> findByAssetHubIdOrderByValueDateDescCreatedAtDesc(Long assetHubId);

	Optional<Valuation> findByAssetHubIdAndSourceAndValueDate(Long assetHubId, ValuationSource source, LocalDate valueDate);
}
