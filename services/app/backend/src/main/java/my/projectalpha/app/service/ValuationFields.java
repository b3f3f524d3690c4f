package my.projectalpha.app.service;

import my.projectalpha.app.domain.ValuationComparable;
import my.projectalpha.app.domain.ValuationEtl;
import my.projectalpha.app.domain.ValuationRepairItem;
import my.projectalpha.app.util.FieldType;
import my.projectalpha.app.util.TypedField;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extraction keys of the valuation tables. Keys not listed here are kept only in the row's payload JSON.
 */
final class ValuationFields {
	static final Map<String, TypedField<ValuationEtl>> VALUATION = new LinkedHashMap<>();
	static final Map<String, TypedField<ValuationComparable>> COMPARABLE = new LinkedHashMap<>();
	static final Map<String, TypedField<ValuationRepairItem>> REPAIR = new LinkedHashMap<>();

	static {
		valuation(TypedField.string("valuation_type", 20, ValuationEtl::getValuationType, (v, x) -> v.setValuationType((String) x)));
		valuation(TypedField.string("bpo_type", 20, ValuationEtl::getBpoType, (v, x) -> v.setBpoType((String) x)));
		valuation(TypedField.string("property_address", 255, ValuationEtl::getPropertyAddress, (v, x) -> v.setPropertyAddress((String) x)));
		valuation(TypedField.string("city", 100, ValuationEtl::getCity, (v, x) -> v.setCity((String) x)));
		valuation(TypedField.string("state", 2, ValuationEtl::getState, (v, x) -> v.setState((String) x)));
		valuation(TypedField.string("zip_code", 10, ValuationEtl::getZipCode, (v, x) -> v.setZipCode((String) x)));
		valuation(TypedField.string("parcel_number", 100, ValuationEtl::getParcelNumber, (v, x) -> v.setParcelNumber((String) x)));
		valuation(TypedField.string("loan_number", 50, ValuationEtl::getLoanNumber, (v, x) -> v.setLoanNumber((String) x)));
		valuation(TypedField.string("deal_name", 100, ValuationEtl::getDealName, (v, x) -> v.setDealName((String) x)));
		valuation(TypedField.of("inspection_date", FieldType.DATE, ValuationEtl::getInspectionDate, (v, x) -> v.setInspectionDate((LocalDate) x)));
		valuation(TypedField.of("effective_date", FieldType.DATE, ValuationEtl::getEffectiveDate, (v, x) -> v.setEffectiveDate((LocalDate) x)));
		valuation(TypedField.of("report_date", FieldType.DATE, ValuationEtl::getReportDate, (v, x) -> v.setReportDate((LocalDate) x)));
		valuation(TypedField.string("occupancy_status", 20, ValuationEtl::getOccupancyStatus, (v, x) -> v.setOccupancyStatus((String) x)));
		valuation(TypedField.of("property_appears_secure", FieldType.BOOLEAN, ValuationEtl::getPropertyAppearsSecure, (v, x) -> v.setPropertyAppearsSecure((Boolean) x)));
		valuation(TypedField.of("living_area", FieldType.INTEGER, ValuationEtl::getLivingArea, (v, x) -> v.setLivingArea((Integer) x)));
		valuation(TypedField.of("bedrooms", FieldType.INTEGER, ValuationEtl::getBedrooms, (v, x) -> v.setBedrooms((Integer) x)));
		valuation(TypedField.of("bathrooms", FieldType.DECIMAL, ValuationEtl::getBathrooms, (v, x) -> v.setBathrooms((BigDecimal) x)));
		valuation(TypedField.of("year_built", FieldType.INTEGER, ValuationEtl::getYearBuilt, (v, x) -> v.setYearBuilt((Integer) x)));
		valuation(TypedField.of("lot_size_acres", FieldType.DECIMAL, ValuationEtl::getLotSizeAcres, (v, x) -> v.setLotSizeAcres((BigDecimal) x)));
		valuation(TypedField.string("property_type", 20, ValuationEtl::getPropertyType, (v, x) -> v.setPropertyType((String) x)));
		valuation(TypedField.string("condition", 20, ValuationEtl::getPropertyCondition, (v, x) -> v.setPropertyCondition((String) x)));
		valuation(TypedField.of("as_is_value", FieldType.DECIMAL, ValuationEtl::getAsIsValue, (v, x) -> v.setAsIsValue((BigDecimal) x)));
		valuation(TypedField.of("as_repaired_value", FieldType.DECIMAL, ValuationEtl::getAsRepairedValue, (v, x) -> v.setAsRepairedValue((BigDecimal) x)));
		valuation(TypedField.of("quick_sale_value", FieldType.DECIMAL, ValuationEtl::getQuickSaleValue, (v, x) -> v.setQuickSaleValue((BigDecimal) x)));
		valuation(TypedField.of("land_value", FieldType.DECIMAL, ValuationEtl::getLandValue, (v, x) -> v.setLandValue((BigDecimal) x)));
		valuation(TypedField.of("recommended_list_price", FieldType.DECIMAL, ValuationEtl::getRecommendedListPrice, (v, x) -> v.setRecommendedListPrice((BigDecimal) x)));
		valuation(TypedField.of("estimated_repair_cost", FieldType.DECIMAL, ValuationEtl::getEstimatedRepairCost, (v, x) -> v.setEstimatedRepairCost((BigDecimal) x)));
		valuation(TypedField.of("general_comments", FieldType.TEXT, ValuationEtl::getGeneralComments, (v, x) -> v.setGeneralComments((String) x)));

		comparable(TypedField.string("comp_type", 20, ValuationComparable::getCompType, (c, x) -> c.setCompType((String) x)));
		comparable(TypedField.of("comp_number", FieldType.INTEGER, ValuationComparable::getCompNumber, (c, x) -> c.setCompNumber((Integer) x)));
		comparable(TypedField.string("address", 255, ValuationComparable::getAddress, (c, x) -> c.setAddress((String) x)));
		comparable(TypedField.string("city", 100, ValuationComparable::getCity, (c, x) -> c.setCity((String) x)));
		comparable(TypedField.string("state", 2, ValuationComparable::getState, (c, x) -> c.setState((String) x)));
		comparable(TypedField.string("zip_code", 10, ValuationComparable::getZipCode, (c, x) -> c.setZipCode((String) x)));
		comparable(TypedField.of("proximity_miles", FieldType.DECIMAL, ValuationComparable::getProximityMiles, (c, x) -> c.setProximityMiles((BigDecimal) x)));
		comparable(TypedField.of("sale_price", FieldType.DECIMAL, ValuationComparable::getSalePrice, (c, x) -> c.setSalePrice((BigDecimal) x)));
		comparable(TypedField.of("sale_date", FieldType.DATE, ValuationComparable::getSaleDate, (c, x) -> c.setSaleDate((LocalDate) x)));
		comparable(TypedField.of("living_area", FieldType.INTEGER, ValuationComparable::getLivingArea, (c, x) -> c.setLivingArea((Integer) x)));
		comparable(TypedField.of("bedrooms", FieldType.INTEGER, ValuationComparable::getBedrooms, (c, x) -> c.setBedrooms((Integer) x)));
		comparable(TypedField.of("bathrooms", FieldType.DECIMAL, ValuationComparable::getBathrooms, (c, x) -> c.setBathrooms((BigDecimal) x)));
		comparable(TypedField.of("year_built", FieldType.INTEGER, ValuationComparable::getYearBuilt, (c, x) -> c.setYearBuilt((Integer) x)));
		comparable(TypedField.of("adjusted_sale_price", FieldType.DECIMAL, ValuationComparable::getAdjustedSalePrice, (c, x) -> c.setAdjustedSalePrice((BigDecimal) x)));
		comparable(TypedField.of("general_comments", FieldType.TEXT, ValuationComparable::getGeneralComments, (c, x) -> c.setGeneralComments((String) x)));

		repair(TypedField.of("repair_number", FieldType.INTEGER, ValuationRepairItem::getRepairNumber, (r, x) -> r.setRepairNumber((Integer) x)));
		repair(TypedField.string("repair_type", 10, ValuationRepairItem::getRepairType, (r, x) -> r.setRepairType((String) x)));
		repair(TypedField.string("category", 30, ValuationRepairItem::getCategory, (r, x) -> r.setCategory((String) x)));
		repair(TypedField.of("description", FieldType.TEXT, ValuationRepairItem::getDescription, (r, x) -> r.setDescription((String) x)));
		repair(TypedField.of("estimated_cost", FieldType.DECIMAL, ValuationRepairItem::getEstimatedCost, (r, x) -> r.setEstimatedCost((BigDecimal) x)));
		repair(TypedField.of("priority", FieldType.INTEGER, ValuationRepairItem::getPriority, (r, x) -> r.setPriority((Integer) x)));
		repair(TypedField.of("is_required", FieldType.BOOLEAN, ValuationRepairItem::isRequired, (r, x) -> r.setRequired(Boolean.TRUE.equals(x))));
		repair(TypedField.of("repair_recommended", FieldType.BOOLEAN, ValuationRepairItem::getRepairRecommended, (r, x) -> r.setRepairRecommended((Boolean) x)));
	}

	private ValuationFields() {
	}

	private static void valuation(TypedField<ValuationEtl> field) {
		VALUATION.put(field.name(), field);
	}

	private static void comparable(TypedField<ValuationComparable> field) {
		COMPARABLE.put(field.name(), field);
	}

	private static void repair(TypedField<ValuationRepairItem> field) {
		REPAIR.put(field.name(), field);
	}
}
