package my.projectalpha.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "valuations", uniqueConstraints = @UniqueConstraint(columnNames = {"asset_hub_id", "source", "value_date"}))
public class Valuation {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "valuation_id")
	private Long valuationId;

	@Column(name = "asset_hub_id", nullable = false)
	private Long assetHubId;

	@Column(name = "source", nullable = false, length = 20)
	private ValuationSource source;

	@Column(name = "asis_value", precision = 18, scale = 2)
	private BigDecimal asisValue;

	@Column(name = "arv_value", precision = 18, scale = 2)
	private BigDecimal arvValue;

	@Column(name = "value_date", nullable = false)
	private LocalDate valueDate;

	@Column(name = "rehab_est_total", precision = 18, scale = 2)
	private BigDecimal rehabEstTotal;

	@Column(name = "recommend_rehab")
	private Boolean recommendRehab;

	@Column(name = "notes")
	private String notes;

	@Column(name = "links", length = 500)
	private String links;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public Long getValuationId() {
		return valuationId;
	}

	public void setValuationId(Long valuationId) {
		this.valuationId = valuationId;
	}

	public Long getAssetHubId() {
		return assetHubId;
	}

	public void setAssetHubId(Long assetHubId) {
		this.assetHubId = assetHubId;
	}

	public ValuationSource getSource() {
		return source;
	}

	public void setSource(ValuationSource source) {
		this.source = source;
	}

	public BigDecimal getAsisValue() {
		return asisValue;
	}

	public void setAsisValue(BigDecimal asisValue) {
		this.asisValue = asisValue;
	}

	public BigDecimal getArvValue() {
		return arvValue;
	}

	public void setArvValue(BigDecimal arvValue) {
		this.arvValue = arvValue;
	}

	public LocalDate getValueDate() {
		return valueDate;
	}

	public void setValueDate(LocalDate valueDate) {
		this.valueDate = valueDate;
	}

	public BigDecimal getRehabEstTotal() {
		return rehabEstTotal;
	}

	public void setRehabEstTotal(BigDecimal rehabEstTotal) {
		this.rehabEstTotal = rehabEstTotal;
	}

	public Boolean getRecommendRehab() {
		return recommendRehab;
	}

	public void setRecommendRehab(Boolean recommendRehab) {
		this.recommendRehab = recommendRehab;
	}

	public String getNotes() {
		return notes;
	}

	public void setNotes(String notes) {
		this.notes = notes;
	}

	public String getLinks() {
		return links;
	}

	public void setLinks(String links) {
		this.links = links;
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
