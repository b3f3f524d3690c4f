package my.projectalpha.app.importer;

import my.projectalpha.app.domain.ServicerLoanData;
import my.projectalpha.app.util.TypedField;

import java.time.LocalDate;
import java.util.Map;

/**
 * One converted extract row. {@code servicerId} is already normalized.
 */
public record ServicerExtractRow(int rowNumber,
								 String servicerId,
								 LocalDate asOfDate,
								 Map<TypedField<ServicerLoanData>, Object> values) {

	public void applyTo(ServicerLoanData target) {
		for (Map.Entry<TypedField<ServicerLoanData>, Object> entry : values.entrySet()) {
			entry.getKey().write(target, entry.getValue());
		}
		target.setServicerId(servicerId);
		target.setAsOfDate(asOfDate);
		target.setReportingYear(asOfDate.getYear());
		target.setReportingMonth(asOfDate.getMonthValue());
		target.setReportingDay(asOfDate.getDayOfMonth());
	}
}
