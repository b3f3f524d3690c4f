package my.projectalpha.app.importer;

import my.projectalpha.app.domain.ServicerLoanData;
import my.projectalpha.app.util.FieldType;
import my.projectalpha.app.util.TypedField;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Columns a servicer extract may carry. Servicer exports name a few columns differently, those
 * headers resolve through {@code ALIASES}.
 */
public final class ServicerExtractFields {
	public static final String SERVICER_ID = "servicer_id";
	public static final String AS_OF_DATE = "as_of_date";
	private static final Map<String, TypedField<ServicerLoanData>> FIELDS = new LinkedHashMap<>();
	private static final Map<String, String> ALIASES = Map.of(
			"loan_number", SERVICER_ID,
			"servicer_loan_number", SERVICER_ID,
			"date", AS_OF_DATE,
			"zip", "zip_code",
			"occupnacy", "occupancy",
			"upb", "current_balance"
	);

	static {
		add(TypedField.string(SERVICER_ID, 64, ServicerLoanData::getServicerId, (row, value) -> row.setServicerId((String) value)));
		add(TypedField.string("investor_id", 64, ServicerLoanData::getInvestorId, (row, value) -> row.setInvestorId((String) value)));
		add(TypedField.of(AS_OF_DATE, FieldType.DATE, ServicerLoanData::getAsOfDate, (row, value) -> row.setAsOfDate((LocalDate) value)));
		add(TypedField.string("address", 255, ServicerLoanData::getAddress, (row, value) -> row.setAddress((String) value)));
		add(TypedField.string("city", 100, ServicerLoanData::getCity, (row, value) -> row.setCity((String) value)));
		add(TypedField.string("state", 50, ServicerLoanData::getState, (row, value) -> row.setState((String) value)));
		add(TypedField.string("zip_code", 20, ServicerLoanData::getZipCode, (row, value) -> row.setZipCode((String) value)));
		add(TypedField.string("occupancy", 50, ServicerLoanData::getOccupancy, (row, value) -> row.setOccupancy((String) value)));
		add(TypedField.string("property_type", 100, ServicerLoanData::getPropertyType, (row, value) -> row.setPropertyType((String) value)));
		add(TypedField.string("borrower_last_name", 100, ServicerLoanData::getBorrowerLastName, (row, value) -> row.setBorrowerLastName((String) value)));
		add(TypedField.of("current_fico", FieldType.INTEGER, ServicerLoanData::getCurrentFico, (row, value) -> row.setCurrentFico((Integer) value)));
		add(TypedField.of("current_balance", FieldType.DECIMAL, ServicerLoanData::getCurrentBalance, (row, value) -> row.setCurrentBalance((BigDecimal) value)));
		add(TypedField.of("deferred_balance", FieldType.DECIMAL, ServicerLoanData::getDeferredBalance, (row, value) -> row.setDeferredBalance((BigDecimal) value)));
		add(TypedField.of("interest_rate", FieldType.RATE, ServicerLoanData::getInterestRate, (row, value) -> row.setInterestRate((BigDecimal) value)));
		add(TypedField.of("next_due_date", FieldType.DATE, ServicerLoanData::getNextDueDate, (row, value) -> row.setNextDueDate((LocalDate) value)));
		add(TypedField.of("last_paid_date", FieldType.DATE, ServicerLoanData::getLastPaidDate, (row, value) -> row.setLastPaidDate((LocalDate) value)));
		add(TypedField.of("escrow_balance", FieldType.DECIMAL, ServicerLoanData::getEscrowBalance, (row, value) -> row.setEscrowBalance((BigDecimal) value)));
		add(TypedField.of("escrow_advance_balance", FieldType.DECIMAL, ServicerLoanData::getEscrowAdvanceBalance, (row, value) -> row.setEscrowAdvanceBalance((BigDecimal) value)));
		add(TypedField.of("third_party_recov_balance", FieldType.DECIMAL, ServicerLoanData::getThirdPartyRecovBalance, (row, value) -> row.setThirdPartyRecovBalance((BigDecimal) value)));
		add(TypedField.of("suspense_balance", FieldType.DECIMAL, ServicerLoanData::getSuspenseBalance, (row, value) -> row.setSuspenseBalance((BigDecimal) value)));
		add(TypedField.of("servicer_late_fees", FieldType.DECIMAL, ServicerLoanData::getServicerLateFees, (row, value) -> row.setServicerLateFees((BigDecimal) value)));
		add(TypedField.of("other_charges", FieldType.DECIMAL, ServicerLoanData::getOtherCharges, (row, value) -> row.setOtherCharges((BigDecimal) value)));
		add(TypedField.of("interest_arrears", FieldType.DECIMAL, ServicerLoanData::getInterestArrears, (row, value) -> row.setInterestArrears((BigDecimal) value)));
		add(TypedField.of("total_debt", FieldType.DECIMAL, ServicerLoanData::getTotalDebt, (row, value) -> row.setTotalDebt((BigDecimal) value)));
		add(TypedField.of("lien_pos", FieldType.INTEGER, ServicerLoanData::getLienPos, (row, value) -> row.setLienPos((Integer) value)));
		add(TypedField.of("maturity_date", FieldType.DATE, ServicerLoanData::getMaturityDate, (row, value) -> row.setMaturityDate((LocalDate) value)));
		add(TypedField.of("avm_value", FieldType.DECIMAL, ServicerLoanData::getAvmValue, (row, value) -> row.setAvmValue((BigDecimal) value)));
		add(TypedField.of("bpo_asis_value", FieldType.DECIMAL, ServicerLoanData::getBpoAsisValue, (row, value) -> row.setBpoAsisValue((BigDecimal) value)));
		add(TypedField.of("bpo_arv_value", FieldType.DECIMAL, ServicerLoanData::getBpoArvValue, (row, value) -> row.setBpoArvValue((BigDecimal) value)));
		add(TypedField.of("fc_flag", FieldType.BOOLEAN, ServicerLoanData::getFcFlag, (row, value) -> row.setFcFlag((Boolean) value)));
		add(TypedField.string("fc_status", 100, ServicerLoanData::getFcStatus, (row, value) -> row.setFcStatus((String) value)));
		add(TypedField.of("bk_flag", FieldType.BOOLEAN, ServicerLoanData::getBkFlag, (row, value) -> row.setBkFlag((Boolean) value)));
		add(TypedField.string("prim_stat", 100, ServicerLoanData::getPrimStat, (row, value) -> row.setPrimStat((String) value)));
	}

	private ServicerExtractFields() {
	}

	private static void add(TypedField<ServicerLoanData> field) {
		FIELDS.put(field.name(), field);
	}

	public static Optional<TypedField<ServicerLoanData>> lookup(String normalizedHeader) {
		String name = ALIASES.getOrDefault(normalizedHeader, normalizedHeader);
		return Optional.ofNullable(FIELDS.get(name));
	}
}
