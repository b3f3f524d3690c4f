package my.projectalpha.app.domain;

import java.util.Locale;

/**
 * Whether a tape row is still part of the bid pool of its trade.
 */
public enum AcqStatus {
	KEEP,
	DROP;

	public static AcqStatus parse(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("acqStatus is required");
		}
		try {
			return AcqStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("Invalid acqStatus: " + value, ex);
		}
	}
}
