package my.projectalpha.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "seller_raw_data", uniqueConstraints = @UniqueConstraint(columnNames = {"trade_id", "sellertape_id"}))
public class SellerRawData {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "seller_raw_data_id")
	private Long sellerRawDataId;

	@Column(name = "seller_id")
	private Long sellerId;

	@Column(name = "trade_id", nullable = false)
	private Long tradeId;

	@Column(name = "asset_hub_id", nullable = false)
	private Long assetHubId;

	@Column(name = "sellertape_id", nullable = false, length = 100)
	private String sellertapeId;

	@Enumerated(EnumType.STRING)
	@Column(name = "acq_status", nullable = false, length = 10)
	private AcqStatus acqStatus;

	@Enumerated(EnumType.STRING)
	@Column(name = "asset_class", length = 20)
	private AssetClass assetClass;

	@Column(name = "as_of_date")
	private LocalDate asOfDate;

	@Column(name = "street_address", length = 255)
	private String streetAddress;

	@Column(name = "city", length = 100)
	private String city;

	@Column(name = "state", length = 2)
	private String state;

	@Column(name = "zip", length = 10)
	private String zip;

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

	@Column(name = "first_payment_date")
	private LocalDate firstPaymentDate;

	@Column(name = "origination_date")
	private LocalDate originationDate;

	@Column(name = "original_balance", precision = 18, scale = 2)
	private BigDecimal originalBalance;

	@Column(name = "original_term")
	private Integer originalTerm;

	@Column(name = "original_rate", precision = 9, scale = 6)
	private BigDecimal originalRate;

	@Column(name = "maturity_date")
	private LocalDate maturityDate;

	@Column(name = "default_rate", precision = 9, scale = 6)
	private BigDecimal defaultRate;

	@Column(name = "months_dlq")
	private Integer monthsDlq;

	@Column(name = "accrued_note_interest", precision = 18, scale = 2)
	private BigDecimal accruedNoteInterest;

	@Column(name = "accrued_default_interest", precision = 18, scale = 2)
	private BigDecimal accruedDefaultInterest;

	@Column(name = "escrow_balance", precision = 18, scale = 2)
	private BigDecimal escrowBalance;

	@Column(name = "escrow_advance", precision = 18, scale = 2)
	private BigDecimal escrowAdvance;

	@Column(name = "recoverable_corp_advance", precision = 18, scale = 2)
	private BigDecimal recoverableCorpAdvance;

	@Column(name = "late_fees", precision = 18, scale = 2)
	private BigDecimal lateFees;

	@Column(name = "other_fees", precision = 18, scale = 2)
	private BigDecimal otherFees;

	@Column(name = "suspense_balance", precision = 18, scale = 2)
	private BigDecimal suspenseBalance;

	@Column(name = "total_debt", precision = 18, scale = 2)
	private BigDecimal totalDebt;

	@Column(name = "origination_value", precision = 18, scale = 2)
	private BigDecimal originationValue;

	@Column(name = "origination_arv", precision = 18, scale = 2)
	private BigDecimal originationArv;

	@Column(name = "seller_asis_value", precision = 18, scale = 2)
	private BigDecimal sellerAsisValue;

	@Column(name = "seller_arv_value", precision = 18, scale = 2)
	private BigDecimal sellerArvValue;

	@Column(name = "additional_asis_value", precision = 18, scale = 2)
	private BigDecimal additionalAsisValue;

	@Column(name = "additional_arv_value", precision = 18, scale = 2)
	private BigDecimal additionalArvValue;

	@Column(name = "fc_flag")
	private Boolean fcFlag;

	@Column(name = "fc_first_legal_date")
	private LocalDate fcFirstLegalDate;

	@Column(name = "fc_referred_date")
	private LocalDate fcReferredDate;

	@Column(name = "fc_judgement_date")
	private LocalDate fcJudgementDate;

	@Column(name = "fc_scheduled_sale_date")
	private LocalDate fcScheduledSaleDate;

	@Column(name = "bk_flag")
	private Boolean bkFlag;

	@Column(name = "bk_chapter", length = 10)
	private String bkChapter;

	@Column(name = "mod_flag")
	private Boolean modFlag;

	@Column(name = "mod_date")
	private LocalDate modDate;

	@Column(name = "mod_upb", precision = 18, scale = 2)
	private BigDecimal modUpb;

	@Column(name = "mod_rate", precision = 9, scale = 6)
	private BigDecimal modRate;

	@Column(name = "mod_term")
	private Integer modTerm;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public Long getSellerRawDataId() {
		return sellerRawDataId;
	}

	public void setSellerRawDataId(Long sellerRawDataId) {
		this.sellerRawDataId = sellerRawDataId;
	}

	public Long getSellerId() {
		return sellerId;
	}

	public void setSellerId(Long sellerId) {
		this.sellerId = sellerId;
	}

	public Long getTradeId() {
		return tradeId;
	}

	public void setTradeId(Long tradeId) {
		this.tradeId = tradeId;
	}

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

	public AcqStatus getAcqStatus() {
		return acqStatus;
	}

	public void setAcqStatus(AcqStatus acqStatus) {
		this.acqStatus = acqStatus;
	}

	public AssetClass getAssetClass() {
		return assetClass;
	}

	public void setAssetClass(AssetClass assetClass) {
		this.assetClass = assetClass;
	}

	public LocalDate getAsOfDate() {
		return asOfDate;
	}

	public void setAsOfDate(LocalDate asOfDate) {
		this.asOfDate = asOfDate;
	}

	public String getStreetAddress() {
		return streetAddress;
	}

	public void setStreetAddress(String streetAddress) {
		this.streetAddress = streetAddress;
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

	public String getZip() {
		return zip;
	}

	public void setZip(String zip) {
		this.zip = zip;
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

	public LocalDate getFirstPaymentDate() {
		return firstPaymentDate;
	}

	public void setFirstPaymentDate(LocalDate firstPaymentDate) {
		this.firstPaymentDate = firstPaymentDate;
	}

	public LocalDate getOriginationDate() {
		return originationDate;
	}

	public void setOriginationDate(LocalDate originationDate) {
		this.originationDate = originationDate;
	}

	public BigDecimal getOriginalBalance() {
		return originalBalance;
	}

	public void setOriginalBalance(BigDecimal originalBalance) {
		this.originalBalance = originalBalance;
	}

	public Integer getOriginalTerm() {
		return originalTerm;
	}

	public void setOriginalTerm(Integer originalTerm) {
		this.originalTerm = originalTerm;
	}

	public BigDecimal getOriginalRate() {
		return originalRate;
	}

	public void setOriginalRate(BigDecimal originalRate) {
		this.originalRate = originalRate;
	}

	public LocalDate getMaturityDate() {
		return maturityDate;
	}

	public void setMaturityDate(LocalDate maturityDate) {
		this.maturityDate = maturityDate;
	}

	public BigDecimal getDefaultRate() {
		return defaultRate;
	}

	public void setDefaultRate(BigDecimal defaultRate) {
		this.defaultRate = defaultRate;
	}

	public Integer getMonthsDlq() {
		return monthsDlq;
	}

	public void setMonthsDlq(Integer monthsDlq) {
		this.monthsDlq = monthsDlq;
	}

	public BigDecimal getAccruedNoteInterest() {
		return accruedNoteInterest;
	}

	public void setAccruedNoteInterest(BigDecimal accruedNoteInterest) {
		this.accruedNoteInterest = accruedNoteInterest;
	}

	public BigDecimal getAccruedDefaultInterest() {
		return accruedDefaultInterest;
	}

	public void setAccruedDefaultInterest(BigDecimal accruedDefaultInterest) {
		this.accruedDefaultInterest = accruedDefaultInterest;
	}

	public BigDecimal getEscrowBalance() {
		return escrowBalance;
	}

	public void setEscrowBalance(BigDecimal escrowBalance) {
		this.escrowBalance = escrowBalance;
	}

	public BigDecimal getEscrowAdvance() {
		return escrowAdvance;
	}

	public void setEscrowAdvance(BigDecimal escrowAdvance) {
		this.escrowAdvance = escrowAdvance;
	}

	public BigDecimal getRecoverableCorpAdvance() {
		return recoverableCorpAdvance;
	}

	public void setRecoverableCorpAdvance(BigDecimal recoverableCorpAdvance) {
		this.recoverableCorpAdvance = recoverableCorpAdvance;
	}

	public BigDecimal getLateFees() {
		return lateFees;
	}

	public void setLateFees(BigDecimal lateFees) {
		this.lateFees = lateFees;
	}

	public BigDecimal getOtherFees() {
		return otherFees;
	}

	public void setOtherFees(BigDecimal otherFees) {
		this.otherFees = otherFees;
	}

	public BigDecimal getSuspenseBalance() {
		return suspenseBalance;
	}

	public void setSuspenseBalance(BigDecimal suspenseBalance) {
		this.suspenseBalance = suspenseBalance;
	}

	public BigDecimal getTotalDebt() {
		return totalDebt;
	}

	public void setTotalDebt(BigDecimal totalDebt) {
		this.totalDebt = totalDebt;
	}

	public BigDecimal getOriginationValue() {
		return originationValue;
	}

	public void setOriginationValue(BigDecimal originationValue) {
		this.originationValue = originationValue;
	}

	public BigDecimal getOriginationArv() {
		return originationArv;
	}

	public void setOriginationArv(BigDecimal originationArv) {
		this.originationArv = originationArv;
	}

	public BigDecimal getSellerAsisValue() {
		return sellerAsisValue;
	}

	public void setSellerAsisValue(BigDecimal sellerAsisValue) {
		this.sellerAsisValue = sellerAsisValue;
	}

	public BigDecimal getSellerArvValue() {
		return sellerArvValue;
	}

	public void setSellerArvValue(BigDecimal sellerArvValue) {
		this.sellerArvValue = sellerArvValue;
	}

	public BigDecimal getAdditionalAsisValue() {
		return additionalAsisValue;
	}

	public void setAdditionalAsisValue(BigDecimal additionalAsisValue) {
		this.additionalAsisValue = additionalAsisValue;
	}

	public BigDecimal getAdditionalArvValue() {
		return additionalArvValue;
	}

	public void setAdditionalArvValue(BigDecimal additionalArvValue) {
		this.additionalArvValue = additionalArvValue;
	}

	public Boolean getFcFlag() {
		return fcFlag;
	}

	public void setFcFlag(Boolean fcFlag) {
		this.fcFlag = fcFlag;
	}

	public LocalDate getFcFirstLegalDate() {
		return fcFirstLegalDate;
	}

	public void setFcFirstLegalDate(LocalDate fcFirstLegalDate) {
		this.fcFirstLegalDate = fcFirstLegalDate;
	}

	public LocalDate getFcReferredDate() {
		return fcReferredDate;
	}

	public void setFcReferredDate(LocalDate fcReferredDate) {
		this.fcReferredDate = fcReferredDate;
	}

	public LocalDate getFcJudgementDate() {
		return fcJudgementDate;
	}

	public void setFcJudgementDate(LocalDate fcJudgementDate) {
		this.fcJudgementDate = fcJudgementDate;
	}

	public LocalDate getFcScheduledSaleDate() {
		return fcScheduledSaleDate;
	}

	public void setFcScheduledSaleDate(LocalDate fcScheduledSaleDate) {
		this.fcScheduledSaleDate = fcScheduledSaleDate;
	}

	public Boolean getBkFlag() {
		return bkFlag;
	}

	public void setBkFlag(Boolean bkFlag) {
		this.bkFlag = bkFlag;
	}

	public String getBkChapter() {
		return bkChapter;
	}

	public void setBkChapter(String bkChapter) {
		this.bkChapter = bkChapter;
	}

	public Boolean getModFlag() {
		return modFlag;
	}

	public void setModFlag(Boolean modFlag) {
		this.modFlag = modFlag;
	}

	public LocalDate getModDate() {
		return modDate;
	}

	public void setModDate(LocalDate modDate) {
		this.modDate = modDate;
	}

	public BigDecimal getModUpb() {
		return modUpb;
	}

	public void setModUpb(BigDecimal modUpb) {
		this.modUpb = modUpb;
	}

	public BigDecimal getModRate() {
		return modRate;
	}

	public void setModRate(BigDecimal modRate) {
		this.modRate = modRate;
	}

	public Integer getModTerm() {
		return modTerm;
	}

	public void setModTerm(Integer modTerm) {
		this.modTerm = modTerm;
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
