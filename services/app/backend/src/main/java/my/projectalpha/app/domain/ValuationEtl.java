package my.projectalpha.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "valuation_etl")
public class ValuationEtl {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "valuation_etl_id")
	private Long valuationEtlId;

	@Column(name = "asset_hub_id", nullable = false)
	private Long assetHubId;

	@Column(name = "document_id")
	private Long documentId;

	@Column(name = "source", length = 20)
	private String source;

	@Column(name = "valuation_type", length = 20)
	private String valuationType;

	@Column(name = "bpo_type", length = 20)
	private String bpoType;

	@Column(name = "property_address", nullable = false, length = 255)
	private String propertyAddress;

	@Column(name = "city", length = 100)
	private String city;

	@Column(name = "state", length = 2)
	private String state;

	@Column(name = "zip_code", length = 10)
	private String zipCode;

	@Column(name = "parcel_number", length = 100)
	private String parcelNumber;

	@Column(name = "loan_number", nullable = false, length = 50)
	private String loanNumber;

	@Column(name = "deal_name", length = 100)
	private String dealName;

	@Column(name = "inspection_date", nullable = false)
	private LocalDate inspectionDate;

	@Column(name = "effective_date")
	private LocalDate effectiveDate;

	@Column(name = "report_date")
	private LocalDate reportDate;

	@Column(name = "occupancy_status", length = 20)
	private String occupancyStatus;

	@Column(name = "property_appears_secure")
	private Boolean propertyAppearsSecure;

	@Column(name = "living_area")
	private Integer livingArea;

	@Column(name = "bedrooms")
	private Integer bedrooms;

	@Column(name = "bathrooms", precision = 3, scale = 1)
	private BigDecimal bathrooms;

	@Column(name = "year_built")
	private Integer yearBuilt;

	@Column(name = "lot_size_acres", precision = 10, scale = 4)
	private BigDecimal lotSizeAcres;

	@Column(name = "property_type", length = 20)
	private String propertyType;

	@Column(name = "property_condition", length = 20)
	private String propertyCondition;

	@Column(name = "as_is_value", precision = 18, scale = 2)
	private BigDecimal asIsValue;

	@Column(name = "as_repaired_value", precision = 18, scale = 2)
	private BigDecimal asRepairedValue;

	@Column(name = "quick_sale_value", precision = 18, scale = 2)
	private BigDecimal quickSaleValue;

	@Column(name = "land_value", precision = 18, scale = 2)
	private BigDecimal landValue;

	@Column(name = "recommended_list_price", precision = 18, scale = 2)
	private BigDecimal recommendedListPrice;

	@Column(name = "estimated_repair_cost", precision = 18, scale = 2)
	private BigDecimal estimatedRepairCost;

	@Column(name = "general_comments")
	private String generalComments;

	@Column(name = "payload_json")
	private String payloadJson;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "created_by", length = 100)
	private String createdBy;

	public Long getValuationEtlId() {
		return valuationEtlId;
	}

	public void setValuationEtlId(Long valuationEtlId) {
		this.valuationEtlId = valuationEtlId;
	}

	public Long getAssetHubId() {
		return assetHubId;
	}

	public void setAssetHubId(Long assetHubId) {
		this.assetHubId = assetHubId;
	}

	public Long getDocumentId() {
		return documentId;
	}

	public void setDocumentId(Long documentId) {
		this.documentId = documentId;
	}

	public String getSource() {
		return source;
	}

	public void setSource(String source) {
		this.source = source;
	}

	public String getValuationType() {
		return valuationType;
	}

	public void setValuationType(String valuationType) {
		this.valuationType = valuationType;
	}

	public String getBpoType() {
		return bpoType;
	}

	public void setBpoType(String bpoType) {
		this.bpoType = bpoType;
	}

	public String getPropertyAddress() {
		return propertyAddress;
	}

	public void setPropertyAddress(String propertyAddress) {
		this.propertyAddress = propertyAddress;
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

	public String getParcelNumber() {
		return parcelNumber;
	}

	public void setParcelNumber(String parcelNumber) {
		this.parcelNumber = parcelNumber;
	}

	public String getLoanNumber() {
		return loanNumber;
	}

	public void setLoanNumber(String loanNumber) {
		this.loanNumber = loanNumber;
	}

	public String getDealName() {
		return dealName;
	}

	public void setDealName(String dealName) {
		this.dealName = dealName;
	}

	public LocalDate getInspectionDate() {
		return inspectionDate;
	}

	public void setInspectionDate(LocalDate inspectionDate) {
		this.inspectionDate = inspectionDate;
	}

	public LocalDate getEffectiveDate() {
		return effectiveDate;
	}

	public void setEffectiveDate(LocalDate effectiveDate) {
		this.effectiveDate = effectiveDate;
	}

	public LocalDate getReportDate() {
		return reportDate;
	}

	public void setReportDate(LocalDate reportDate) {
		this.reportDate = reportDate;
	}

	public String getOccupancyStatus() {
		return occupancyStatus;
	}

	public void setOccupancyStatus(String occupancyStatus) {
		this.occupancyStatus = occupancyStatus;
	}

	public Boolean getPropertyAppearsSecure() {
		return propertyAppearsSecure;
	}

	public void setPropertyAppearsSecure(Boolean propertyAppearsSecure) {
		this.propertyAppearsSecure = propertyAppearsSecure;
	}

	public Integer getLivingArea() {
		return livingArea;
	}

	public void setLivingArea(Integer livingArea) {
		this.livingArea = livingArea;
	}

	public Integer getBedrooms() {
		return bedrooms;
	}

	public void setBedrooms(Integer bedrooms) {
		this.bedrooms = bedrooms;
	}

	public BigDecimal getBathrooms() {
		return bathrooms;
	}

	public void setBathrooms(BigDecimal bathrooms) {
		this.bathrooms = bathrooms;
	}

	public Integer getYearBuilt() {
		return yearBuilt;
	}

	public void setYearBuilt(Integer yearBuilt) {
		this.yearBuilt = yearBuilt;
	}

	public BigDecimal getLotSizeAcres() {
		return lotSizeAcres;
	}

	public void setLotSizeAcres(BigDecimal lotSizeAcres) {
		this.lotSizeAcres = lotSizeAcres;
	}

	public String getPropertyType() {
		return propertyType;
	}

	public void setPropertyType(String propertyType) {
		this.propertyType = propertyType;
	}

	public String getPropertyCondition() {
		return propertyCondition;
	}

	public void setPropertyCondition(String propertyCondition) {
		this.propertyCondition = propertyCondition;
	}

	public BigDecimal getAsIsValue() {
		return asIsValue;
	}

	public void setAsIsValue(BigDecimal asIsValue) {
		this.asIsValue = asIsValue;
	}

	public BigDecimal getAsRepairedValue() {
		return asRepairedValue;
	}

	public void setAsRepairedValue(BigDecimal asRepairedValue) {
		this.asRepairedValue = asRepairedValue;
	}

	public BigDecimal getQuickSaleValue() {
		return quickSaleValue;
	}

	public void setQuickSaleValue(BigDecimal quickSaleValue) {
		this.quickSaleValue = quickSaleValue;
	}

	public BigDecimal getLandValue() {
		return landValue;
	}

	public void setLandValue(BigDecimal landValue) {
		this.landValue = landValue;
	}

	public BigDecimal getRecommendedListPrice() {
		return recommendedListPrice;
	}

	public void setRecommendedListPrice(BigDecimal recommendedListPrice) {
		this.recommendedListPrice = recommendedListPrice;
	}

	public BigDecimal getEstimatedRepairCost() {
		return estimatedRepairCost;
	}

	public void setEstimatedRepairCost(BigDecimal estimatedRepairCost) {
		this.estimatedRepairCost = estimatedRepairCost;
	}

	public String getGeneralComments() {
		return generalComments;
	}

	public void setGeneralComments(String generalComments) {
		this.generalComments = generalComments;
	}

	public String getPayloadJson() {
		return payloadJson;
	}

	public void setPayloadJson(String payloadJson) {
		this.payloadJson = payloadJson;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public String getCreatedBy() {
		return createdBy;
	}

	public void setCreatedBy(String createdBy) {
		this.createdBy = createdBy;
	}
}
