package my.projectalpha.app.repository;

import my.projectalpha.app.domain.AssetIdHub;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface AssetIdHubRepository extends JpaRepository<AssetIdHub, Long> {
	Optional<AssetIdHub> findFirstByServicerIdOrderByAssetHubIdAsc(String servicerId);
}
