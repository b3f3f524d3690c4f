package my.projectalpha.app.service;

import my.projectalpha.app.domain.AssetOutcome;
import my.projectalpha.app.util.FieldType;
import my.projectalpha.app.util.TypedField;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Editable outcome columns keyed by their API name. Which of them apply to an outcome is decided by
 * {@link my.projectalpha.app.domain.OutcomeType#getFieldNames()}.
 */
final class OutcomeFields {
	static final Map<String, Set<String>> CHOICES = Map.of(
			"purchase_type", Set.of("cash", "financing", "seller_financing"),
			"modification_payment_type", Set.of("pi", "io", "other")
	);
	private static final Map<String, TypedField<AssetOutcome>> FIELDS = new HashMap<>();

	static {
		add(TypedField.of("list_price", FieldType.DECIMAL, AssetOutcome::getListPrice, (outcome, value) -> outcome.setListPrice((BigDecimal) value)));
		add(TypedField.of("list_date", FieldType.DATE, AssetOutcome::getListDate, (outcome, value) -> outcome.setListDate((LocalDate) value)));
		add(TypedField.of("under_contract_flag", FieldType.BOOLEAN, AssetOutcome::getUnderContractFlag, (outcome, value) -> outcome.setUnderContractFlag((Boolean) value)));
		add(TypedField.of("under_contract_date", FieldType.DATE, AssetOutcome::getUnderContractDate, (outcome, value) -> outcome.setUnderContractDate((LocalDate) value)));
		add(TypedField.of("contract_price", FieldType.DECIMAL, AssetOutcome::getContractPrice, (outcome, value) -> outcome.setContractPrice((BigDecimal) value)));
		add(TypedField.of("estimated_close_date", FieldType.DATE, AssetOutcome::getEstimatedCloseDate, (outcome, value) -> outcome.setEstimatedCloseDate((LocalDate) value)));
		add(TypedField.of("actual_close_date", FieldType.DATE, AssetOutcome::getActualCloseDate, (outcome, value) -> outcome.setActualCloseDate((LocalDate) value)));
		add(TypedField.of("seller_credit_amount", FieldType.DECIMAL, AssetOutcome::getSellerCreditAmount, (outcome, value) -> outcome.setSellerCreditAmount((BigDecimal) value)));
		add(TypedField.string("purchase_type", 20, AssetOutcome::getPurchaseType, (outcome, value) -> outcome.setPurchaseType((String) value)));
		add(TypedField.of("gross_purchase_price", FieldType.DECIMAL, AssetOutcome::getGrossPurchasePrice, (outcome, value) -> outcome.setGrossPurchasePrice((BigDecimal) value)));
		add(TypedField.of("nod_noi_sent_date", FieldType.DATE, AssetOutcome::getNodNoiSentDate, (outcome, value) -> outcome.setNodNoiSentDate((LocalDate) value)));
		add(TypedField.of("nod_noi_expire_date", FieldType.DATE, AssetOutcome::getNodNoiExpireDate, (outcome, value) -> outcome.setNodNoiExpireDate((LocalDate) value)));
		add(TypedField.of("fc_sale_scheduled_date", FieldType.DATE, AssetOutcome::getFcSaleScheduledDate, (outcome, value) -> outcome.setFcSaleScheduledDate((LocalDate) value)));
		add(TypedField.of("fc_sale_actual_date", FieldType.DATE, AssetOutcome::getFcSaleActualDate, (outcome, value) -> outcome.setFcSaleActualDate((LocalDate) value)));
		add(TypedField.of("fc_bid_price", FieldType.DECIMAL, AssetOutcome::getFcBidPrice, (outcome, value) -> outcome.setFcBidPrice((BigDecimal) value)));
		add(TypedField.of("fc_sale_price", FieldType.DECIMAL, AssetOutcome::getFcSalePrice, (outcome, value) -> outcome.setFcSalePrice((BigDecimal) value)));
		add(TypedField.of("dil_completion_date", FieldType.DATE, AssetOutcome::getDilCompletionDate, (outcome, value) -> outcome.setDilCompletionDate((LocalDate) value)));
		add(TypedField.of("dil_cost", FieldType.DECIMAL, AssetOutcome::getDilCost, (outcome, value) -> outcome.setDilCost((BigDecimal) value)));
		add(TypedField.of("cfk_cost", FieldType.DECIMAL, AssetOutcome::getCfkCost, (outcome, value) -> outcome.setCfkCost((BigDecimal) value)));
		add(TypedField.of("acceptable_min_offer", FieldType.DECIMAL, AssetOutcome::getAcceptableMinOffer, (outcome, value) -> outcome.setAcceptableMinOffer((BigDecimal) value)));
		add(TypedField.of("short_sale_date", FieldType.DATE, AssetOutcome::getShortSaleDate, (outcome, value) -> outcome.setShortSaleDate((LocalDate) value)));
		add(TypedField.of("gross_proceeds", FieldType.DECIMAL, AssetOutcome::getGrossProceeds, (outcome, value) -> outcome.setGrossProceeds((BigDecimal) value)));
		add(TypedField.of("modification_date", FieldType.DATE, AssetOutcome::getModificationDate, (outcome, value) -> outcome.setModificationDate((LocalDate) value)));
		add(TypedField.of("modification_cost", FieldType.DECIMAL, AssetOutcome::getModificationCost, (outcome, value) -> outcome.setModificationCost((BigDecimal) value)));
		add(TypedField.string("modification_payment_type", 10, AssetOutcome::getModificationPaymentType, (outcome, value) -> outcome.setModificationPaymentType((String) value)));
		add(TypedField.of("sold_date", FieldType.DATE, AssetOutcome::getSoldDate, (outcome, value) -> outcome.setSoldDate((LocalDate) value)));
		add(TypedField.of("proceeds", FieldType.DECIMAL, AssetOutcome::getProceeds, (outcome, value) -> outcome.setProceeds((BigDecimal) value)));
	}

	private OutcomeFields() {
	}

	private static void add(TypedField<AssetOutcome> field) {
		FIELDS.put(field.name(), field);
	}

	static Optional<TypedField<AssetOutcome>> lookup(String name) {
		return Optional.ofNullable(FIELDS.get(name));
	}
}
