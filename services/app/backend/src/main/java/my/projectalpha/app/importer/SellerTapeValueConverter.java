package my.projectalpha.app.importer;

import my.projectalpha.app.util.FieldType;
import my.projectalpha.app.util.TypedField;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Converts raw tape cells. Unlike the lenient coercion used for model output, an unreadable cell
 * raises {@link IllegalArgumentException} so the importer can report it.
 */
public final class SellerTapeValueConverter {
	private static final Set<String> TRUE_VALUES = Set.of("true", "t", "yes", "y", "1");
	private static final Set<String> FALSE_VALUES = Set.of("false", "f", "no", "n", "0");
	// two-digit years resolve into the window ending twenty years from now
	private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
			DateTimeFormatter.ISO_LOCAL_DATE,
			DateTimeFormatter.ofPattern("M/d/yyyy"),
			new DateTimeFormatterBuilder()
					.appendPattern("M/d/")
					.appendValueReduced(ChronoField.YEAR, 2, 2, LocalDate.now().minusYears(80))
					.toFormatter()
	);

	private SellerTapeValueConverter() {
	}

	/**
	 * Returns the typed value for a cell, or {@code null} when the cell is blank.
	 */
	public static Object convert(String raw, TypedField<?> field) {
		if (raw == null) {
			return null;
		}
		String value = raw.trim();
		if (value.isEmpty()) {
			return null;
		}
		FieldType type = field.type();
		switch (type) {
			case DECIMAL:
				return parseDecimal(value, field.name());
			case RATE:
				BigDecimal rate = parseDecimal(value, field.name());
				return rate.compareTo(BigDecimal.ONE) > 0 ? rate.divide(BigDecimal.valueOf(100), 6, RoundingMode.HALF_UP) : rate;
			case INTEGER:
				return parseInteger(value, field.name());
			case BOOLEAN:
				return parseBoolean(value, field.name());
			case DATE:
				return parseDate(value, field.name());
			default:
				if (field.maxLength() != null && value.length() > field.maxLength()) {
					return value.substring(0, field.maxLength());
				}
				return value;
		}
	}

	static BigDecimal parseDecimal(String value, String fieldName) {
		String cleaned = value.replace("$", "").replace(",", "").replace("%", "").trim();
		try {
			return new BigDecimal(cleaned);
		} catch (NumberFormatException ex) {
			throw new IllegalArgumentException("Invalid number for " + fieldName + ": " + value, ex);
		}
	}

	static Integer parseInteger(String value, String fieldName) {
		try {
			return parseDecimal(value, fieldName).setScale(0, RoundingMode.DOWN).intValueExact();
		} catch (ArithmeticException ex) {
			throw new IllegalArgumentException("Number out of range for " + fieldName + ": " + value, ex);
		}
	}

	static Boolean parseBoolean(String value, String fieldName) {
		String lowered = value.toLowerCase(Locale.ROOT);
		if (TRUE_VALUES.contains(lowered)) {
			return Boolean.TRUE;
		}
		if (FALSE_VALUES.contains(lowered)) {
			return Boolean.FALSE;
		}
		throw new IllegalArgumentException("Invalid boolean for " + fieldName + ": " + value);
	}

	static LocalDate parseDate(String value, String fieldName) {
		for (DateTimeFormatter format : DATE_FORMATS) {
			try {
				return LocalDate.parse(value, format);
			} catch (DateTimeParseException ignored) {
				// next format
			}
		}
		throw new IllegalArgumentException("Invalid date for " + fieldName + ": " + value);
	}
}
