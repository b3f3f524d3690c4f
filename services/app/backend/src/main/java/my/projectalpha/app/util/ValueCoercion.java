package my.projectalpha.app.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;

/**
 * Lenient conversion of loosely typed values (LLM output, JSON request maps) into the Java types of
 * {@link FieldType}. Unparseable input yields {@code null} rather than an exception.
 */
public final class ValueCoercion {
	private static final Set<String> TRUE_VALUES = Set.of("yes", "true", "1", "y");
	private static final Set<String> FALSE_VALUES = Set.of("no", "false", "0", "n");
	private static final Set<String> EMPTY_NUMBERS = Set.of("", "-", ".", "-.");

	private ValueCoercion() {
	}

	public static Object coerce(Object value, FieldType type) {
		if (value == null) {
			return null;
		}
		if (value instanceof String text) {
			value = text.trim();
			if (((String) value).isEmpty()) {
				return null;
			}
		}
		return switch (type) {
			case BOOLEAN -> toBoolean(value);
			case DECIMAL, RATE -> toDecimal(value);
			case INTEGER -> toInteger(value);
			case DATE -> toDate(value);
			case STRING, TEXT -> value.toString();
		};
	}

	public static boolean isEmpty(Object value) {
		if (value == null) {
			return true;
		}
		return value instanceof String text && text.isBlank();
	}

	public static Boolean toBoolean(Object value) {
		if (value instanceof Boolean bool) {
			return bool;
		}
		String lowered = value.toString().trim().toLowerCase(Locale.ROOT);
		if (TRUE_VALUES.contains(lowered)) {
			return true;
		}
		if (FALSE_VALUES.contains(lowered)) {
			return false;
		}
		return null;
	}

	public static BigDecimal toDecimal(Object value) {
		if (value instanceof BigDecimal decimal) {
			return decimal;
		}
		if (value instanceof Number number) {
			try {
				return new BigDecimal(number.toString());
			} catch (NumberFormatException ex) {
				return null;
			}
		}
		String cleaned = value.toString().replaceAll("[^0-9.\\-]", "");
		if (EMPTY_NUMBERS.contains(cleaned)) {
			return null;
		}
		try {
			return new BigDecimal(cleaned);
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	public static Integer toInteger(Object value) {
		if (value instanceof Integer integer) {
			return integer;
		}
		BigDecimal decimal = toDecimal(value);
		if (decimal == null) {
			return null;
		}
		try {
			return decimal.setScale(0, RoundingMode.DOWN).intValueExact();
		} catch (ArithmeticException ex) {
			return null;
		}
	}

	public static LocalDate toDate(Object value) {
		if (value instanceof LocalDate date) {
			return date;
		}
		try {
			return LocalDate.parse(value.toString().trim());
		} catch (DateTimeParseException ex) {
			return null;
		}
	}
}
