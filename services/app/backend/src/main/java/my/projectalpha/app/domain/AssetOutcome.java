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
@Table(name = "asset_outcomes", uniqueConstraints = @UniqueConstraint(columnNames = {"asset_hub_id", "outcome_type"}))
public class AssetOutcome {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "outcome_id")
	private Long outcomeId;

	@Column(name = "asset_hub_id", nullable = false)
	private Long assetHubId;

	@Enumerated(EnumType.STRING)
	@Column(name = "outcome_type", nullable = false, length = 20)
	private OutcomeType outcomeType;

	@Column(name = "list_price", precision = 18, scale = 2)
	private BigDecimal listPrice;

	@Column(name = "list_date")
	private LocalDate listDate;

	@Column(name = "under_contract_flag")
	private Boolean underContractFlag;

	@Column(name = "under_contract_date")
	private LocalDate underContractDate;

	@Column(name = "contract_price", precision = 18, scale = 2)
	private BigDecimal contractPrice;

	@Column(name = "estimated_close_date")
	private LocalDate estimatedCloseDate;

	@Column(name = "actual_close_date")
	private LocalDate actualCloseDate;

	@Column(name = "seller_credit_amount", precision = 18, scale = 2)
	private BigDecimal sellerCreditAmount;

	@Column(name = "purchase_type", length = 20)
	private String purchaseType;

	@Column(name = "gross_purchase_price", precision = 18, scale = 2)
	private BigDecimal grossPurchasePrice;

	@Column(name = "nod_noi_sent_date")
	private LocalDate nodNoiSentDate;

	@Column(name = "nod_noi_expire_date")
	private LocalDate nodNoiExpireDate;

	@Column(name = "fc_sale_scheduled_date")
	private LocalDate fcSaleScheduledDate;

	@Column(name = "fc_sale_actual_date")
	private LocalDate fcSaleActualDate;

	@Column(name = "fc_bid_price", precision = 18, scale = 2)
	private BigDecimal fcBidPrice;

	@Column(name = "fc_sale_price", precision = 18, scale = 2)
	private BigDecimal fcSalePrice;

	@Column(name = "dil_completion_date")
	private LocalDate dilCompletionDate;

	@Column(name = "dil_cost", precision = 18, scale = 2)
	private BigDecimal dilCost;

	@Column(name = "cfk_cost", precision = 18, scale = 2)
	private BigDecimal cfkCost;

	@Column(name = "acceptable_min_offer", precision = 18, scale = 2)
	private BigDecimal acceptableMinOffer;

	@Column(name = "short_sale_date")
	private LocalDate shortSaleDate;

	@Column(name = "gross_proceeds", precision = 18, scale = 2)
	private BigDecimal grossProceeds;

	@Column(name = "modification_date")
	private LocalDate modificationDate;

	@Column(name = "modification_cost", precision = 18, scale = 2)
	private BigDecimal modificationCost;

	@Column(name = "modification_payment_type", length = 10)
	private String modificationPaymentType;

	@Column(name = "sold_date")
	private LocalDate soldDate;

	@Column(name = "proceeds", precision = 18, scale = 2)
	private BigDecimal proceeds;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

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

	public OutcomeType getOutcomeType() {
		return outcomeType;
	}

	public void setOutcomeType(OutcomeType outcomeType) {
		this.outcomeType = outcomeType;
	}

	public BigDecimal getListPrice() {
		return listPrice;
	}

	public void setListPrice(BigDecimal listPrice) {
		this.listPrice = listPrice;
	}

	public LocalDate getListDate() {
		return listDate;
	}

	public void setListDate(LocalDate listDate) {
		this.listDate = listDate;
	}

	public Boolean getUnderContractFlag() {
		return underContractFlag;
	}

	public void setUnderContractFlag(Boolean underContractFlag) {
		this.underContractFlag = underContractFlag;
	}

	public LocalDate getUnderContractDate() {
		return underContractDate;
	}

	public void setUnderContractDate(LocalDate underContractDate) {
		this.underContractDate = underContractDate;
	}

	public BigDecimal getContractPrice() {
		return contractPrice;
	}

	public void setContractPrice(BigDecimal contractPrice) {
		this.contractPrice = contractPrice;
	}

	public LocalDate getEstimatedCloseDate() {
		return estimatedCloseDate;
	}

	public void setEstimatedCloseDate(LocalDate estimatedCloseDate) {
		this.estimatedCloseDate = estimatedCloseDate;
	}

	public LocalDate getActualCloseDate() {
		return actualCloseDate;
	}

	public void setActualCloseDate(LocalDate actualCloseDate) {
		this.actualCloseDate = actualCloseDate;
	}

	public BigDecimal getSellerCreditAmount() {
		return sellerCreditAmount;
	}

	public void setSellerCreditAmount(BigDecimal sellerCreditAmount) {
		this.sellerCreditAmount = sellerCreditAmount;
	}

	public String getPurchaseType() {
		return purchaseType;
	}

	public void setPurchaseType(String purchaseType) {
		this.purchaseType = purchaseType;
	}

	public BigDecimal getGrossPurchasePrice() {
		return grossPurchasePrice;
	}

	public void setGrossPurchasePrice(BigDecimal grossPurchasePrice) {
		this.grossPurchasePrice = grossPurchasePrice;
	}

	public LocalDate getNodNoiSentDate() {
		return nodNoiSentDate;
	}

	public void setNodNoiSentDate(LocalDate nodNoiSentDate) {
		this.nodNoiSentDate = nodNoiSentDate;
	}

	public LocalDate getNodNoiExpireDate() {
		return nodNoiExpireDate;
	}

	public void setNodNoiExpireDate(LocalDate nodNoiExpireDate) {
		this.nodNoiExpireDate = nodNoiExpireDate;
	}

	public LocalDate getFcSaleScheduledDate() {
		return fcSaleScheduledDate;
	}

	public void setFcSaleScheduledDate(LocalDate fcSaleScheduledDate) {
		this.fcSaleScheduledDate = fcSaleScheduledDate;
	}

	public LocalDate getFcSaleActualDate() {
		return fcSaleActualDate;
	}

	public void setFcSaleActualDate(LocalDate fcSaleActualDate) {
		this.fcSaleActualDate = fcSaleActualDate;
	}

	public BigDecimal getFcBidPrice() {
		return fcBidPrice;
	}

	public void setFcBidPrice(BigDecimal fcBidPrice) {
		this.fcBidPrice = fcBidPrice;
	}

	public BigDecimal getFcSalePrice() {
		return fcSalePrice;
	}

	public void setFcSalePrice(BigDecimal fcSalePrice) {
		this.fcSalePrice = fcSalePrice;
	}

	public LocalDate getDilCompletionDate() {
		return dilCompletionDate;
	}

	public void setDilCompletionDate(LocalDate dilCompletionDate) {
		this.dilCompletionDate = dilCompletionDate;
	}

	public BigDecimal getDilCost() {
		return dilCost;
	}

	public void setDilCost(BigDecimal dilCost) {
		this.dilCost = dilCost;
	}

	public BigDecimal getCfkCost() {
		return cfkCost;
	}

	public void setCfkCost(BigDecimal cfkCost) {
		this.cfkCost = cfkCost;
	}

	public BigDecimal getAcceptableMinOffer() {
		return acceptableMinOffer;
	}

	public void setAcceptableMinOffer(BigDecimal acceptableMinOffer) {
		this.acceptableMinOffer = acceptableMinOffer;
	}

	public LocalDate getShortSaleDate() {
		return shortSaleDate;
	}

	public void setShortSaleDate(LocalDate shortSaleDate) {
		this.shortSaleDate = shortSaleDate;
	}

	public BigDecimal getGrossProceeds() {
		return grossProceeds;
	}

	public void setGrossProceeds(BigDecimal grossProceeds) {
		this.grossProceeds = grossProceeds;
	}

	public LocalDate getModificationDate() {
		return modificationDate;
	}

	public void setModificationDate(LocalDate modificationDate) {
		this.modificationDate = modificationDate;
	}

	public BigDecimal getModificationCost() {
		return modificationCost;
	}

	public void setModificationCost(BigDecimal modificationCost) {
		this.modificationCost = modificationCost;
	}

	public String getModificationPaymentType() {
		return modificationPaymentType;
	}

	public void setModificationPaymentType(String modificationPaymentType) {
		this.modificationPaymentType = modificationPaymentType;
	}

	public LocalDate getSoldDate() {
		return soldDate;
	}

	public void setSoldDate(LocalDate soldDate) {
		this.soldDate = soldDate;
	}

	public BigDecimal getProceeds() {
		return proceeds;
	}

	public void setProceeds(BigDecimal proceeds) {
		this.proceeds = proceeds;
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
