package my.projectalpha.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "outcome_audit_log")
public class OutcomeAuditEntry {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "id")
	private Long id;

	@Column(name = "asset_hub_id", nullable = false)
	private Long assetHubId;

	@Column(name = "outcome_type", nullable = false, length = 20)
	private String outcomeType;

	@Column(name = "field", nullable = false, length = 100)
	private String field;

	@Column(name = "old_value", length = 1000)
	private String oldValue;

	@Column(name = "new_value", length = 1000)
	private String newValue;

	@Column(name = "edited_by", nullable = false, length = 100)
	private String editedBy;

	@Column(name = "edited_at", nullable = false)
	private LocalDateTime editedAt;

	@Column(name = "source", nullable = false, length = 20)
	private String source;

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public Long getAssetHubId() {
		return assetHubId;
	}

	public void setAssetHubId(Long assetHubId) {
		this.assetHubId = assetHubId;
	}

	public String getOutcomeType() {
		return outcomeType;
	}

	public void setOutcomeType(String outcomeType) {
		this.outcomeType = outcomeType;
	}

	public String getField() {
		return field;
	}

	public void setField(String field) {
		this.field = field;
	}

	public String getOldValue() {
		return oldValue;
	}

	public void setOldValue(String oldValue) {
		this.oldValue = oldValue;
	}

	public String getNewValue() {
		return newValue;
	}

	public void setNewValue(String newValue) {
		this.newValue = newValue;
	}

	public String getEditedBy() {
		return editedBy;
	}

	public void setEditedBy(String editedBy) {
		this.editedBy = editedBy;
	}

	public LocalDateTime getEditedAt() {
		return editedAt;
	}

	public void setEditedAt(LocalDateTime editedAt) {
		this.editedAt = editedAt;
	}

	public String getSource() {
		return source;
	}

	public void setSource(String source) {
		this.source = source;
	}
}
