package my.projectalpha.app.reporting;

import my.projectalpha.app.domain.Trade;
import my.projectalpha.app.domain.TradeStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportingFilterTest {

	@Test
	void parsesCommaSeparatedValuesAndIgnoresUnknownStatuses() {
		ReportingFilter filter = ReportingFilter.parse(" 3, 5 ,", "dd,board,bogus", "2024-01-01", "");

		assertThat(filter.tradeIds()).containsExactly(3L, 5L);
		assertThat(filter.statuses()).containsExactlyInAnyOrder(TradeStatus.DD, TradeStatus.BOARD);
		assertThat(filter.startDate()).isEqualTo(LocalDate.of(2024, 1, 1));
		assertThat(filter.endDate()).isNull();
	}

	@Test
	void rejectsMalformedIdsAndDates() {
		assertThatThrownBy(() -> ReportingFilter.parse("abc", null, null, null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Invalid trade id: abc");
		assertThatThrownBy(() -> ReportingFilter.parse(null, null, null, "01/02/2024"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("endDate");
	}

	@Test
	void matchesOnIdsStatusesAndInclusiveDateRange() {
		Trade trade = trade(3L, TradeStatus.DD, LocalDateTime.of(2024, 3, 31, 18, 0));

		assertThat(ReportingFilter.none().matches(trade)).isTrue();
		assertThat(ReportingFilter.parse("3", "DD", "2024-03-31", "2024-03-31").matches(trade)).isTrue();
		assertThat(ReportingFilter.parse("4", null, null, null).matches(trade)).isFalse();
		assertThat(ReportingFilter.parse(null, "PASS", null, null).matches(trade)).isFalse();
		assertThat(ReportingFilter.parse(null, null, "2024-04-01", null).matches(trade)).isFalse();
		assertThat(ReportingFilter.parse(null, null, null, "2024-03-30").matches(trade)).isFalse();
		assertThat(ReportingFilter.parse(null, null, "2024-01-01", null).matches(trade(9L, TradeStatus.DD, null))).isFalse();
	}

	private static Trade trade(Long id, TradeStatus status, LocalDateTime createdAt) {
		Trade trade = new Trade();
		trade.setTradeId(id);
		trade.setStatus(status);
		trade.setCreatedAt(createdAt);
		return trade;
	}
}
