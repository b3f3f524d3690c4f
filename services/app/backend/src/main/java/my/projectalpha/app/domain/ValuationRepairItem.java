package my.projectalpha.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;

@Entity
@Table(name = "valuation_repair_items")
public class ValuationRepairItem {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "repair_item_id")
	private Long repairItemId;

	@Column(name = "valuation_etl_id", nullable = false)
	private Long valuationEtlId;

	@Column(name = "repair_number")
	private Integer repairNumber;

	@Column(name = "repair_type", nullable = false, length = 10)
	private String repairType;

	@Column(name = "category", nullable = false, length = 30)
	private String category;

	@Column(name = "description")
	private String description;

	@Column(name = "estimated_cost", nullable = false, precision = 18, scale = 2)
	private BigDecimal estimatedCost;

	@Column(name = "priority", nullable = false)
	private Integer priority;

	@Column(name = "is_required", nullable = false)
	private boolean required;

	@Column(name = "repair_recommended")
	private Boolean repairRecommended;

	public Long getRepairItemId() {
		return repairItemId;
	}

	public void setRepairItemId(Long repairItemId) {
		this.repairItemId = repairItemId;
	}

	public Long getValuationEtlId() {
		return valuationEtlId;
	}

	public void setValuationEtlId(Long valuationEtlId) {
		this.valuationEtlId = valuationEtlId;
	}

	public Integer getRepairNumber() {
		return repairNumber;
	}

	public void setRepairNumber(Integer repairNumber) {
		this.repairNumber = repairNumber;
	}

	public String getRepairType() {
		return repairType;
	}

	public void setRepairType(String repairType) {
		this.repairType = repairType;
	}

	public String getCategory() {
		return category;
	}

	public void setCategory(String category) {
		this.category = category;
	}

	public String getDescription() {
		return description;
	}

	public void setDescription(String description) {
		this.description = description;
	}

	public BigDecimal getEstimatedCost() {
		return estimatedCost;
	}

	public void setEstimatedCost(BigDecimal estimatedCost) {
		this.estimatedCost = estimatedCost;
	}

	public Integer getPriority() {
		return priority;
	}

	public void setPriority(Integer priority) {
		this.priority = priority;
	}

	public boolean isRequired() {
		return required;
	}

	public void setRequired(boolean required) {
		this.required = required;
	}

	public Boolean getRepairRecommended() {
		return repairRecommended;
	}

	public void setRepairRecommended(Boolean repairRecommended) {
		this.repairRecommended = repairRecommended;
	}
}
