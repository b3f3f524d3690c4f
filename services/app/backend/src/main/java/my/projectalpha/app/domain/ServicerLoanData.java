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

/**
 * Monthly servicing snapshot of a loan. Rows are unique per servicer loan number and reporting month;
 * {@code assetHubId} stays empty until a hub carries the matching servicer id.
 */
@Entity
@Table(name = "servicer_loan_data",
		uniqueConstraints = @UniqueConstraint(columnNames = {"servicer_id", "reporting_year", "reporting_month"}))
public class ServicerLoanData {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "servicer_loan_data_id")
	private Long servicerLoanDataId;

	@Column(name = "asset_hub_id")
	private Long assetHubId;

	@Column(name = "import_file_id")
	private Long importFileId;

	@Column(name = "servicer_id", nullable = false, length = 64)
	private String servicerId;

	@Column(name = "investor_id", length = 64)
	private String investorId;

	@Column(name = "reporting_year", nullable = false)
	private Integer reportingYear;

	@Column(name = "reporting_month", nullable = false)
	private Integer reportingMonth;

	@Column(name = "reporting_day")
	private Integer reportingDay;

	@Column(name = "as_of_date", nullable = false)
	private LocalDate asOfDate;

	@Column(name = "address", length = 255)
	private String address;

	@Column(name = "city", length = 100)
	private String city;

	@Column(name = "state", length = 50)
	private String state;

	@Column(name = "zip_code", length = 20)
	private String zipCode;

	@Column(name = "occupancy", length = 50)
	private String occupancy;

	@Column(name = "property_type", length = 100)
	private String propertyType;

	@Column(name = "borrower_last_name", length = 100)
	private String borrowerLastName;

	@Column(name = "current_fico")
	private Integer currentFico;

	@Column(name = "current_balance", precision = 18, scale = 2)
	private BigDecimal currentBalance;

	@Column(name = "deferred_balance", precision = 18, scale = 2)
	private BigDecimal deferredBalance;

	@Column(name = "interest_rate", precision = 9, scale = 6)
	private BigDecimal interestRate;

	@Column(name = "next_due_date")
	private LocalDate nextDueDate;

	@Column(name = "last_paid_date")
	private LocalDate lastPaidDate;

	@Column(name = "escrow_balance", precision = 18, scale = 2)
	private BigDecimal escrowBalance;

	@Column(name = "escrow_advance_balance", precision = 18, scale = 2)
	private BigDecimal escrowAdvanceBalance;

	@Column(name = "third_party_recov_balance", precision = 18, scale = 2)
	private BigDecimal thirdPartyRecovBalance;

	@Column(name = "suspense_balance", precision = 18, scale = 2)
	private BigDecimal suspenseBalance;

	@Column(name = "servicer_late_fees", precision = 18, scale = 2)
	private BigDecimal servicerLateFees;

	@Column(name = "other_charges", precision = 18, scale = 2)
	private BigDecimal otherCharges;

	@Column(name = "interest_arrears", precision = 18, scale = 2)
	private BigDecimal interestArrears;

	@Column(name = "total_debt", precision = 18, scale = 2)
	private BigDecimal totalDebt;

	@Column(name = "lien_pos")
	private Integer lienPos;

	@Column(name = "maturity_date")
	private LocalDate maturityDate;

	@Column(name = "avm_value", precision = 18, scale = 2)
	private BigDecimal avmValue;

	@Column(name = "bpo_asis_value", precision = 18, scale = 2)
	private BigDecimal bpoAsisValue;

	@Column(name = "bpo_arv_value", precision = 18, scale = 2)
	private BigDecimal bpoArvValue;

	@Column(name = "fc_flag")
	private Boolean fcFlag;

	@Column(name = "fc_status", length = 100)
	private String fcStatus;

	@Column(name = "bk_flag")
	private Boolean bkFlag;

	@Column(name = "prim_stat", length = 100)
	private String primStat;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public Long getServicerLoanDataId() {
		return servicerLoanDataId;
	}

	public void setServicerLoanDataId(Long servicerLoanDataId) {
		this.servicerLoanDataId = servicerLoanDataId;
	}

	public Long getAssetHubId() {
		return assetHubId;
	}

	public void setAssetHubId(Long assetHubId) {
		this.assetHubId = assetHubId;
	}

	public Long getImportFileId() {
		return importFileId;
	}

	public void setImportFileId(Long importFileId) {
		this.importFileId = importFileId;
	}

	public String getServicerId() {
		return servicerId;
	}

	public void setServicerId(String servicerId) {
		this.servicerId = servicerId;
	}

	public String getInvestorId() {
		return investorId;
	}

	public void setInvestorId(String investorId) {
		this.investorId = investorId;
	}

	public Integer getReportingYear() {
		return reportingYear;
	}

	public void setReportingYear(Integer reportingYear) {
		this.reportingYear = reportingYear;
	}

	public Integer getReportingMonth() {
		return reportingMonth;
	}

	public void setReportingMonth(Integer reportingMonth) {
		this.reportingMonth = reportingMonth;
	}

	public Integer getReportingDay() {
		return reportingDay;
	}

	public void setReportingDay(Integer reportingDay) {
		this.reportingDay = reportingDay;
	}

	public LocalDate getAsOfDate() {
		return asOfDate;
	}

	public void setAsOfDate(LocalDate asOfDate) {
		this.asOfDate = asOfDate;
	}

	public String getAddress() {
		return address;
	}

	public void setAddress(String address) {
		this.address = address;
	}

	public String getCity() {
		return city;
	}

	public void setCity(String city) {
		this.city = city;
	}

	public String getState() {
		return state;
	}

	public void setState(String state) {
		this.state = state;
	}

	public String getZipCode() {
		return zipCode;
	}

	public void setZipCode(String zipCode) {
		this.zipCode = zipCode;
	}

	public String getOccupancy() {
		return occupancy;
	}

	public void setOccupancy(String occupancy) {
		this.occupancy = occupancy;
	}

	public String getPropertyType() {
		return propertyType;
	}

	public void setPropertyType(String propertyType) {
		this.propertyType = propertyType;
	}

	public String getBorrowerLastName() {
		return borrowerLastName;
	}

	public void setBorrowerLastName(String borrowerLastName) {
		this.borrowerLastName = borrowerLastName;
	}

	public Integer getCurrentFico() {
		return currentFico;
	}

	public void setCurrentFico(Integer currentFico) {
		this.currentFico = currentFico;
	}

	public BigDecimal getCurrentBalance() {
		return currentBalance;
	}

	public void setCurrentBalance(BigDecimal currentBalance) {
		this.currentBalance = currentBalance;
	}

	public BigDecimal getDeferredBalance() {
		return deferredBalance;
	}

	public void setDeferredBalance(BigDecimal deferredBalance) {
		this.deferredBalance = deferredBalance;
	}

	public BigDecimal getInterestRate() {
		return interestRate;
	}

	public void setInterestRate(BigDecimal interestRate) {
		this.interestRate = interestRate;
	}

	public LocalDate getNextDueDate() {
		return nextDueDate;
	}

	public void setNextDueDate(LocalDate nextDueDate) {
		this.nextDueDate = nextDueDate;
	}

	public LocalDate getLastPaidDate() {
		return lastPaidDate;
	}

	public void setLastPaidDate(LocalDate lastPaidDate) {
		this.lastPaidDate = lastPaidDate;
	}

	public BigDecimal getEscrowBalance() {
		return escrowBalance;
	}

	public void setEscrowBalance(BigDecimal escrowBalance) {
		this.escrowBalance = escrowBalance;
	}

	public BigDecimal getEscrowAdvanceBalance() {
		return escrowAdvanceBalance;
	}

	public void setEscrowAdvanceBalance(BigDecimal escrowAdvanceBalance) {
		this.escrowAdvanceBalance = escrowAdvanceBalance;
	}

	public BigDecimal getThirdPartyRecovBalance() {
		return thirdPartyRecovBalance;
	}

	public void setThirdPartyRecovBalance(BigDecimal thirdPartyRecovBalance) {
		this.thirdPartyRecovBalance = thirdPartyRecovBalance;
	}

	public BigDecimal getSuspenseBalance() {
		return suspenseBalance;
	}

	public void setSuspenseBalance(BigDecimal suspenseBalance) {
		this.suspenseBalance = suspenseBalance;
	}

	public BigDecimal getServicerLateFees() {
		return servicerLateFees;
	}

	public void setServicerLateFees(BigDecimal servicerLateFees) {
		this.servicerLateFees = servicerLateFees;
	}

	public BigDecimal getOtherCharges() {
		return otherCharges;
	}

	public void setOtherCharges(BigDecimal otherCharges) {
		this.otherCharges = otherCharges;
	}

	public BigDecimal getInterestArrears() {
		return interestArrears;
	}

	public void setInterestArrears(BigDecimal interestArrears) {
		this.interestArrears = interestArrears;
	}

	public BigDecimal getTotalDebt() {
		return totalDebt;
	}

	public void setTotalDebt(BigDecimal totalDebt) {
		this.totalDebt = totalDebt;
	}

	public Integer getLienPos() {
		return lienPos;
	}

	public void setLienPos(Integer lienPos) {
		this.lienPos = lienPos;
	}

	public LocalDate getMaturityDate() {
		return maturityDate;
	}

	public void setMaturityDate(LocalDate maturityDate) {
		this.maturityDate = maturityDate;
	}

	public BigDecimal getAvmValue() {
		return avmValue;
	}

	public void setAvmValue(BigDecimal avmValue) {
		this.avmValue = avmValue;
	}

	public BigDecimal getBpoAsisValue() {
		return bpoAsisValue;
	}

	public void setBpoAsisValue(BigDecimal bpoAsisValue) {
		this.bpoAsisValue = bpoAsisValue;
	}

	public BigDecimal getBpoArvValue() {
		return bpoArvValue;
	}

	public void setBpoArvValue(BigDecimal bpoArvValue) {
		this.bpoArvValue = bpoArvValue;
	}

	public Boolean getFcFlag() {
		return fcFlag;
	}

	public void setFcFlag(Boolean fcFlag) {
		this.fcFlag = fcFlag;
	}

	public String getFcStatus() {
		return fcStatus;
	}

	public void setFcStatus(String fcStatus) {
		this.fcStatus = fcStatus;
	}

	public Boolean getBkFlag() {
		return bkFlag;
	}

	public void setBkFlag(Boolean bkFlag) {
		this.bkFlag = bkFlag;
	}

	public String getPrimStat() {
		return primStat;
	}

	public void setPrimStat(String primStat) {
		this.primStat = primStat;
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
