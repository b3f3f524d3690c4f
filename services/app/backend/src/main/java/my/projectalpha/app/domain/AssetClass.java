package my.projectalpha.app.domain;

import java.util.Locale;

public enum AssetClass {
	NPL,
	REO,
	PERFORMING,
	RPL;

	/**
	 * Accepts the enum name in any case plus the spelled-out forms sellers tend to use.
	 */
	public static AssetClass parse(String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		String normalized = value.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "");
		switch (normalized) {
			case "NPL", "NONPERFORMING", "NONPERFORMINGLOAN":
				return NPL;
			case "REO", "REALESTATEOWNED":
				return REO;
			case "PERFORMING", "PL", "PERFORMINGLOAN":
				return PERFORMING;
			case "RPL", "REPERFORMING", "REPERFORMINGLOAN":
				return RPL;
			default:
				throw new IllegalArgumentException("Unknown asset class: " + value);
		}
	}
}
