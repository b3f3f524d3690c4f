package my.projectalpha.app.domain;

import java.util.Locale;
import java.util.Optional;

public enum TradeStatus {
	PASS("Passed"),
	INDICATIVE("Indicative"),
	DD("Due Diligence"),
	AWARDED("Awarded"),
	CLOSED("Closed"),
	BOARD("Boarded");

	private final String label;

	TradeStatus(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	public static Optional<TradeStatus> parse(String value) {
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		String normalized = value.trim().toUpperCase(Locale.ROOT);
		for (TradeStatus status : values()) {
			if (status.name().equals(normalized)) {
				return Optional.of(status);
			}
		}
		return Optional.empty();
	}
}
