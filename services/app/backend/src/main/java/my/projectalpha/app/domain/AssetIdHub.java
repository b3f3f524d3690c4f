package my.projectalpha.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "asset_id_hub")
public class AssetIdHub {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "asset_hub_id")
	private Long assetHubId;

	@Column(name = "sellertape_id", length = 100)
	private String sellertapeId;

	@Column(name = "servicer_id", length = 100)
	private String servicerId;

	@Enumerated(EnumType.STRING)
	@Column(name = "asset_status", nullable = false, length = 20)
	private AssetStatus assetStatus;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public Long getAssetHubId() {
		return assetHubId;
	}

	public void setAssetHubId(Long assetHubId) {
		this.assetHubId = assetHubId;
	}

	public String getSellertapeId() {
		return sellertapeId;
	}

	public void setSellertapeId(String sellertapeId) {
		this.sellertapeId = sellertapeId;
	}

	public String getServicerId() {
		return servicerId;
	}

	public void setServicerId(String servicerId) {
		this.servicerId = servicerId;
	}

	public AssetStatus getAssetStatus() {
		return assetStatus;
	}

	public void setAssetStatus(AssetStatus assetStatus) {
		this.assetStatus = assetStatus;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}
}
