package my.projectalpha.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "outcome_tasks", uniqueConstraints = @UniqueConstraint(columnNames = {"outcome_id", "task_type"}))
public class OutcomeTask {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "task_id")
	private Long taskId;

	@Column(name = "outcome_id", nullable = false)
	private Long outcomeId;

	@Column(name = "asset_hub_id", nullable = false)
	private Long assetHubId;

	@Column(name = "task_type", nullable = false, length = 40)
	private String taskType;

	@Column(name = "task_started", nullable = false)
	private LocalDate taskStarted;

	@Column(name = "notes")
	private String notes;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	public Long getTaskId() {
		return taskId;
	}

	public void setTaskId(Long taskId) {
		this.taskId = taskId;
	}

	public Long getOutcomeId() {
		return outcomeId;
	}

	public void setOutcomeId(Long outcomeId) {
		this.outcomeId = outcomeId;
	}

	public Long getAssetHubId() {
		return assetHubId;
	}

	public void setAssetHubId(Long assetHubId) {
		this.assetHubId = assetHubId;
	}

	public String getTaskType() {
		return taskType;
	}

	public void setTaskType(String taskType) {
		this.taskType = taskType;
	}

	public LocalDate getTaskStarted() {
		return taskStarted;
	}

	public void setTaskStarted(LocalDate taskStarted) {
		this.taskStarted = taskStarted;
	}

	public String getNotes() {
		return notes;
	}

	public void setNotes(String notes) {
		this.notes = notes;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}
}
