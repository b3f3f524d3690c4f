package my.projectalpha.app.importer;

import my.projectalpha.app.domain.AssetClass;
import my.projectalpha.app.domain.SellerRawData;
import my.projectalpha.app.util.FieldType;
import my.projectalpha.app.util.TypedField;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Columns a seller tape may carry, keyed by their normalized header name.
 */
public final class SellerTapeFields {
	public static final String SELLERTAPE_ID = "sellertape_id";
	private static final Map<String, TypedField<SellerRawData>> FIELDS = new LinkedHashMap<>();

	static {
		add(TypedField.string(SELLERTAPE_ID, 100, SellerRawData::getSellertapeId, (row, value) -> row.setSellertapeId((String) value)));
		add(TypedField.string("asset_class", 20, SellerRawData::getAssetClass,
				(row, value) -> row.setAssetClass(AssetClass.parse((String) value))));
		add(TypedField.of("as_of_date", FieldType.DATE, SellerRawData::getAsOfDate, (row, value) -> row.setAsOfDate((LocalDate) value)));
		add(TypedField.string("street_address", 255, SellerRawData::getStreetAddress, (row, value) -> row.setStreetAddress((String) value)));
		add(TypedField.string("city", 100, SellerRawData::getCity, (row, value) -> row.setCity((String) value)));
		add(TypedField.string("state", 2, SellerRawData::getState, (row, value) -> row.setState((String) value)));
		add(TypedField.string("zip", 10, SellerRawData::getZip, (row, value) -> row.setZip((String) value)));
		add(TypedField.of("current_balance", FieldType.DECIMAL, SellerRawData::getCurrentBalance, (row, value) -> row.setCurrentBalance((BigDecimal) value)));
		add(TypedField.of("deferred_balance", FieldType.DECIMAL, SellerRawData::getDeferredBalance, (row, value) -> row.setDeferredBalance((BigDecimal) value)));
		add(TypedField.of("interest_rate", FieldType.RATE, SellerRawData::getInterestRate, (row, value) -> row.setInterestRate((BigDecimal) value)));
		add(TypedField.of("next_due_date", FieldType.DATE, SellerRawData::getNextDueDate, (row, value) -> row.setNextDueDate((LocalDate) value)));
		add(TypedField.of("last_paid_date", FieldType.DATE, SellerRawData::getLastPaidDate, (row, value) -> row.setLastPaidDate((LocalDate) value)));
		add(TypedField.of("first_payment_date", FieldType.DATE, SellerRawData::getFirstPaymentDate, (row, value) -> row.setFirstPaymentDate((LocalDate) value)));
		add(TypedField.of("origination_date", FieldType.DATE, SellerRawData::getOriginationDate, (row, value) -> row.setOriginationDate((LocalDate) value)));
		add(TypedField.of("original_balance", FieldType.DECIMAL, SellerRawData::getOriginalBalance, (row, value) -> row.setOriginalBalance((BigDecimal) value)));
		add(TypedField.of("original_term", FieldType.INTEGER, SellerRawData::getOriginalTerm, (row, value) -> row.setOriginalTerm((Integer) value)));
		add(TypedField.of("original_rate", FieldType.RATE, SellerRawData::getOriginalRate, (row, value) -> row.setOriginalRate((BigDecimal) value)));
		add(TypedField.of("maturity_date", FieldType.DATE, SellerRawData::getMaturityDate, (row, value) -> row.setMaturityDate((LocalDate) value)));
		add(TypedField.of("default_rate", FieldType.RATE, SellerRawData::getDefaultRate, (row, value) -> row.setDefaultRate((BigDecimal) value)));
		add(TypedField.of("months_dlq", FieldType.INTEGER, SellerRawData::getMonthsDlq, (row, value) -> row.setMonthsDlq((Integer) value)));
		add(TypedField.of("accrued_note_interest", FieldType.DECIMAL, SellerRawData::getAccruedNoteInterest, (row, value) -> row.setAccruedNoteInterest((BigDecimal) value)));
		add(TypedField.of("accrued_default_interest", FieldType.DECIMAL, SellerRawData::getAccruedDefaultInterest, (row, value) -> row.setAccruedDefaultInterest((BigDecimal) value)));
		add(TypedField.of("escrow_balance", FieldType.DECIMAL, SellerRawData::getEscrowBalance, (row, value) -> row.setEscrowBalance((BigDecimal) value)));
		add(TypedField.of("escrow_advance", FieldType.DECIMAL, SellerRawData::getEscrowAdvance, (row, value) -> row.setEscrowAdvance((BigDecimal) value)));
		add(TypedField.of("recoverable_corp_advance", FieldType.DECIMAL, SellerRawData::getRecoverableCorpAdvance, (row, value) -> row.setRecoverableCorpAdvance((BigDecimal) value)));
		add(TypedField.of("late_fees", FieldType.DECIMAL, SellerRawData::getLateFees, (row, value) -> row.setLateFees((BigDecimal) value)));
		add(TypedField.of("other_fees", FieldType.DECIMAL, SellerRawData::getOtherFees, (row, value) -> row.setOtherFees((BigDecimal) value)));
		add(TypedField.of("suspense_balance", FieldType.DECIMAL, SellerRawData::getSuspenseBalance, (row, value) -> row.setSuspenseBalance((BigDecimal) value)));
		add(TypedField.of("total_debt", FieldType.DECIMAL, SellerRawData::getTotalDebt, (row, value) -> row.setTotalDebt((BigDecimal) value)));
		add(TypedField.of("origination_value", FieldType.DECIMAL, SellerRawData::getOriginationValue, (row, value) -> row.setOriginationValue((BigDecimal) value)));
		add(TypedField.of("origination_arv", FieldType.DECIMAL, SellerRawData::getOriginationArv, (row, value) -> row.setOriginationArv((BigDecimal) value)));
		add(TypedField.of("seller_asis_value", FieldType.DECIMAL, SellerRawData::getSellerAsisValue, (row, value) -> row.setSellerAsisValue((BigDecimal) value)));
		add(TypedField.of("seller_arv_value", FieldType.DECIMAL, SellerRawData::getSellerArvValue, (row, value) -> row.setSellerArvValue((BigDecimal) value)));
		add(TypedField.of("additional_asis_value", FieldType.DECIMAL, SellerRawData::getAdditionalAsisValue, (row, value) -> row.setAdditionalAsisValue((BigDecimal) value)));
		add(TypedField.of("additional_arv_value", FieldType.DECIMAL, SellerRawData::getAdditionalArvValue, (row, value) -> row.setAdditionalArvValue((BigDecimal) value)));
		add(TypedField.of("fc_flag", FieldType.BOOLEAN, SellerRawData::getFcFlag, (row, value) -> row.setFcFlag((Boolean) value)));
		add(TypedField.of("fc_first_legal_date", FieldType.DATE, SellerRawData::getFcFirstLegalDate, (row, value) -> row.setFcFirstLegalDate((LocalDate) value)));
		add(TypedField.of("fc_referred_date", FieldType.DATE, SellerRawData::getFcReferredDate, (row, value) -> row.setFcReferredDate((LocalDate) value)));
		add(TypedField.of("fc_judgement_date", FieldType.DATE, SellerRawData::getFcJudgementDate, (row, value) -> row.setFcJudgementDate((LocalDate) value)));
		add(TypedField.of("fc_scheduled_sale_date", FieldType.DATE, SellerRawData::getFcScheduledSaleDate, (row, value) -> row.setFcScheduledSaleDate((LocalDate) value)));
		add(TypedField.of("bk_flag", FieldType.BOOLEAN, SellerRawData::getBkFlag, (row, value) -> row.setBkFlag((Boolean) value)));
		add(TypedField.string("bk_chapter", 10, SellerRawData::getBkChapter, (row, value) -> row.setBkChapter((String) value)));
		add(TypedField.of("mod_flag", FieldType.BOOLEAN, SellerRawData::getModFlag, (row, value) -> row.setModFlag((Boolean) value)));
		add(TypedField.of("mod_date", FieldType.DATE, SellerRawData::getModDate, (row, value) -> row.setModDate((LocalDate) value)));
		add(TypedField.of("mod_upb", FieldType.DECIMAL, SellerRawData::getModUpb, (row, value) -> row.setModUpb((BigDecimal) value)));
		add(TypedField.of("mod_rate", FieldType.RATE, SellerRawData::getModRate, (row, value) -> row.setModRate((BigDecimal) value)));
		add(TypedField.of("mod_term", FieldType.INTEGER, SellerRawData::getModTerm, (row, value) -> row.setModTerm((Integer) value)));
	}

	private SellerTapeFields() {
	}

	private static void add(TypedField<SellerRawData> field) {
		FIELDS.put(field.name(), field);
	}

	public static Optional<TypedField<SellerRawData>> lookup(String normalizedHeader) {
		return Optional.ofNullable(FIELDS.get(normalizedHeader));
	}

	public static Collection<TypedField<SellerRawData>> all() {
		return Collections.unmodifiableCollection(FIELDS.values());
	}
}
