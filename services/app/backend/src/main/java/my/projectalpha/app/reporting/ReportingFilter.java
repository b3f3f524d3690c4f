package my.projectalpha.app.reporting;

import my.projectalpha.app.domain.Trade;
import my.projectalpha.app.domain.TradeStatus;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Trade-level filter shared by all reporting endpoints. Empty lists mean "no restriction".
 */
public record ReportingFilter(List<Long> tradeIds, Set<TradeStatus> statuses, LocalDate startDate, LocalDate endDate) {

	public static ReportingFilter none() {
		return new ReportingFilter(List.of(), EnumSet.noneOf(TradeStatus.class), null, null);
	}

	public static ReportingFilter parse(String tradeIds, String statuses, String startDate, String endDate) {
		List<Long> ids = new ArrayList<>();
		for (String part : split(tradeIds)) {
			try {
				ids.add(Long.parseLong(part));
			} catch (NumberFormatException ex) {
				throw new IllegalArgumentException("Invalid trade id: " + part, ex);
			}
		}
		Set<TradeStatus> parsedStatuses = EnumSet.noneOf(TradeStatus.class);
		for (String part : split(statuses)) {
			// unknown statuses are ignored
			TradeStatus.parse(part).ifPresent(parsedStatuses::add);
		}
		return new ReportingFilter(ids, parsedStatuses, parseDate("startDate", startDate), parseDate("endDate", endDate));
	}

	public boolean matches(Trade trade) {
		if (!tradeIds.isEmpty() && !tradeIds.contains(trade.getTradeId())) {
			return false;
		}
		if (!statuses.isEmpty() && !statuses.contains(trade.getStatus())) {
			return false;
		}
		if (startDate == null && endDate == null) {
			return true;
		}
		if (trade.getCreatedAt() == null) {
			return false;
		}
		LocalDate created = trade.getCreatedAt().toLocalDate();
		if (startDate != null && created.isBefore(startDate)) {
			return false;
		}
		return endDate == null || !created.isAfter(endDate);
	}

	private static List<String> split(String value) {
		List<String> parts = new ArrayList<>();
		if (value == null || value.isBlank()) {
			return parts;
		}
		for (String part : value.split(",")) {
			if (!part.isBlank()) {
				parts.add(part.trim());
			}
		}
		return parts;
	}

	private static LocalDate parseDate(String name, String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		try {
			return LocalDate.parse(value.trim());
		} catch (DateTimeParseException ex) {
			throw new IllegalArgumentException("Invalid " + name + ": " + value, ex);
		}
	}
}
