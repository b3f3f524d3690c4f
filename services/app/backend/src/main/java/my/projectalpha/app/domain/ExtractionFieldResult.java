package my.projectalpha.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "extraction_field_results", uniqueConstraints = @UniqueConstraint(columnNames = {"document_id", "target_model", "target_field"}))
public class ExtractionFieldResult {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "id")
	private Long id;

	@Column(name = "document_id", nullable = false)
	private Long documentId;

	@Column(name = "target_model", nullable = false, length = 30)
	private String targetModel;

	@Column(name = "target_field", nullable = false, length = 100)
	private String targetField;

	@Column(name = "value_text")
	private String valueText;

	@Column(name = "value_json")
	private String valueJson;

	@Column(name = "confidence", precision = 5, scale = 4)
	private BigDecimal confidence;

	@Column(name = "extraction_method", nullable = false, length = 10)
	private String extractionMethod;

	@Column(name = "requires_review", nullable = false)
	private boolean requiresReview;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public Long getDocumentId() {
		return documentId;
	}

	public void setDocumentId(Long documentId) {
		this.documentId = documentId;
	}

	public String getTargetModel() {
		return targetModel;
	}

	public void setTargetModel(String targetModel) {
		this.targetModel = targetModel;
	}

	public String getTargetField() {
		return targetField;
	}

	public void setTargetField(String targetField) {
		this.targetField = targetField;
	}

	public String getValueText() {
		return valueText;
	}

	public void setValueText(String valueText) {
		this.valueText = valueText;
	}

	public String getValueJson() {
		return valueJson;
	}

	public void setValueJson(String valueJson) {
		this.valueJson = valueJson;
	}

	public BigDecimal getConfidence() {
		return confidence;
	}

	public void setConfidence(BigDecimal confidence) {
		this.confidence = confidence;
	}

	public String getExtractionMethod() {
		return extractionMethod;
	}

	public void setExtractionMethod(String extractionMethod) {
		this.extractionMethod = extractionMethod;
	}

	public boolean isRequiresReview() {
		return requiresReview;
	}

	public void setRequiresReview(boolean requiresReview) {
		this.requiresReview = requiresReview;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}
}
