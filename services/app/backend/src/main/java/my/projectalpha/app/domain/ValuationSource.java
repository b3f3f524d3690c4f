package my.projectalpha.app.domain;

import java.util.Locale;
import java.util.Optional;

public enum ValuationSource {
	INTERNAL_INITIAL_UW("internalInitialUW", "Internal Initial UW Valuation"),
	INTERNAL("internal", "Internal Valuation"),
	BROKER("broker", "Broker Valuation"),
	DESKTOP("desktop", "Desktop Valuation"),
	BPO_INTERIOR("BPOI", "BPOI"),
	BPO_EXTERIOR("BPOE", "BPOE"),
	SELLER("seller", "Seller Provided"),
	APPRAISAL("appraisal", "Professional Appraisal");

	private final String code;
	private final String label;

	ValuationSource(String code, String label) {
		this.code = code;
		this.label = label;
	}

	public String getCode() {
		return code;
	}

	public String getLabel() {
		return label;
	}

	public static Optional<ValuationSource> fromCode(String code) {
		if (code == null) {
			return Optional.empty();
		}
		for (ValuationSource source : values()) {
			if (source.code.equals(code)) {
				return Optional.of(source);
			}
		}
		return Optional.empty();
	}

	/**
	 * Lenient lookup used for free-text sources: matches code or label case-insensitively with
	 * non-word characters ignored, so "Broker Valuation", "broker" and "B.P.O.I" all resolve.
	 */
	public static Optional<ValuationSource> match(String value) {
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		String lowered = value.trim().toLowerCase(Locale.ROOT);
		String slug = slug(lowered);
		for (ValuationSource source : values()) {
			for (String form : new String[]{source.code, source.label}) {
				String candidate = form.toLowerCase(Locale.ROOT);
				if (candidate.equals(lowered) || slug(candidate).equals(slug)) {
					return Optional.of(source);
				}
			}
		}
		return Optional.empty();
	}

	private static String slug(String value) {
		return value.replaceAll("\\W+", "");
	}
}
