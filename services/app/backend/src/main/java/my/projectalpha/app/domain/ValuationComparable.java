package my.projectalpha.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = "valuation_comparables")
public class ValuationComparable {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "comparable_id")
	private Long comparableId;

	@Column(name = "valuation_etl_id", nullable = false)
	private Long valuationEtlId;

	@Column(name = "comp_type", nullable = false, length = 20)
	private String compType;

	@Column(name = "comp_number")
	private Integer compNumber;

	@Column(name = "address", nullable = false, length = 255)
	private String address;

	@Column(name = "city", length = 100)
	private String city;

	@Column(name = "state", length = 2)
	private String state;

	@Column(name = "zip_code", length = 10)
	private String zipCode;

	@Column(name = "proximity_miles", precision = 5, scale = 2)
	private BigDecimal proximityMiles;

	@Column(name = "sale_price", nullable = false, precision = 18, scale = 2)
	private BigDecimal salePrice;

	@Column(name = "sale_date")
	private LocalDate saleDate;

	@Column(name = "living_area")
	private Integer livingArea;

	@Column(name = "bedrooms")
	private Integer bedrooms;

	@Column(name = "bathrooms", precision = 3, scale = 1)
	private BigDecimal bathrooms;

	@Column(name = "year_built")
	private Integer yearBuilt;

	@Column(name = "adjusted_sale_price", precision = 18, scale = 2)
	private BigDecimal adjustedSalePrice;

	@Column(name = "general_comments")
	private String generalComments;

	@Column(name = "payload_json")
	private String payloadJson;

	public Long getComparableId() {
		return comparableId;
	}

	public void setComparableId(Long comparableId) {
		this.comparableId = comparableId;
	}

	public Long getValuationEtlId() {
		return valuationEtlId;
	}

	public void setValuationEtlId(Long valuationEtlId) {
		this.valuationEtlId = valuationEtlId;
	}

	public String getCompType() {
		return compType;
	}

	public void setCompType(String compType) {
		this.compType = compType;
	}

	public Integer getCompNumber() {
		return compNumber;
	}

	public void setCompNumber(Integer compNumber) {
		this.compNumber = compNumber;
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

	public BigDecimal getProximityMiles() {
		return proximityMiles;
	}

	public void setProximityMiles(BigDecimal proximityMiles) {
		this.proximityMiles = proximityMiles;
	}

	public BigDecimal getSalePrice() {
		return salePrice;
	}

	public void setSalePrice(BigDecimal salePrice) {
		this.salePrice = salePrice;
	}

	public LocalDate getSaleDate() {
		return saleDate;
	}

	public void setSaleDate(LocalDate saleDate) {
		this.saleDate = saleDate;
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

	public BigDecimal getAdjustedSalePrice() {
		return adjustedSalePrice;
	}

	public void setAdjustedSalePrice(BigDecimal adjustedSalePrice) {
		this.adjustedSalePrice = adjustedSalePrice;
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
}
