package my.projectalpha.app.service;

import my.projectalpha.app.domain.AssetIdHub;
import my.projectalpha.app.domain.AssetStatus;
import my.projectalpha.app.dto.AssetHubDto;
import my.projectalpha.app.dto.TapeRowDto;
import my.projectalpha.app.repository.AssetIdHubRepository;
import my.projectalpha.app.repository.SellerRawDataRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Service
public class AssetService {
	private final AssetIdHubRepository hubRepository;
	private final SellerRawDataRepository rawDataRepository;

	public AssetService(AssetIdHubRepository hubRepository, SellerRawDataRepository rawDataRepository) {
		this.hubRepository = hubRepository;
		this.rawDataRepository = rawDataRepository;
	}

	public AssetHubDto get(Long id) {
		AssetIdHub hub = require(id);
		TapeRowDto latest = rawDataRepository.findFirstByAssetHubIdOrderByUpdatedAtDesc(hub.getAssetHubId())
				.map(TapeRowDto::from)
				.orElse(null);
		return new AssetHubDto(hub.getAssetHubId(), hub.getSellertapeId(), hub.getServicerId(),
				hub.getAssetStatus().name(), hub.getCreatedAt(), hub.getUpdatedAt(), latest);
	}

	/**
	 * Creates the identity row every new tape row hangs off.
	 */
	@Transactional
	public AssetIdHub createHub(String sellertapeId) {
		LocalDateTime now = LocalDateTime.now();
		AssetIdHub hub = new AssetIdHub();
		hub.setSellertapeId(sellertapeId);
		hub.setAssetStatus(AssetStatus.ACTIVE);
		hub.setCreatedAt(now);
		hub.setUpdatedAt(now);
		return hubRepository.save(hub);
	}

	public AssetIdHub require(Long id) {
		if (id == null) {
			throw new IllegalArgumentException("assetHubId is required");
		}
		return hubRepository.findById(id).orElseThrow(() -> NotFoundException.of("Asset", id));
	}
}
