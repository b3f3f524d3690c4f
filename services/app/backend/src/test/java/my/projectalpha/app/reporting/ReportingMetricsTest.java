package my.projectalpha.app.reporting;

import my.projectalpha.app.domain.SellerRawData;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReportingMetricsTest {

	@Test
	void totalsIgnoreMissingValues() {
		List<SellerRawData> rows = List.of(row("100000", "120000", "200000", 0), row(null, null, null, null));

		assertThat(ReportingMetrics.totalUpb(rows)).isEqualByComparingTo("100000.00");
		assertThat(ReportingMetrics.totalDebt(rows)).isEqualByComparingTo("120000");
		assertThat(ReportingMetrics.asisValue(rows)).isEqualByComparingTo("200000");
		assertThat(ReportingMetrics.averageUpb(rows)).isEqualByComparingTo("50000.00");
	}

	@Test
	void averageLtvSkipsRowsWithoutPositiveValue() {
		List<SellerRawData> rows = List.of(
				row("50000", null, "100000", 0),
				row("75000", null, "100000", 0),
				row("90000", null, "0", 0),
				row("90000", null, null, 0));

		assertThat(ReportingMetrics.averageLtv(rows)).isEqualByComparingTo("62.50");
	}

	@Test
	void delinquencyRateCountsRowsBehindOnPayments() {
		List<SellerRawData> rows = List.of(row("1", null, null, 3), row("1", null, null, 0), row("1", null, null, null));

		assertThat(ReportingMetrics.delinquencyRate(rows)).isEqualByComparingTo("33.33");
	}

	@Test
	void emptyInputsYieldZero() {
		assertThat(ReportingMetrics.averageUpb(List.of())).isEqualByComparingTo("0");
		assertThat(ReportingMetrics.averageLtv(List.of())).isEqualByComparingTo("0");
		assertThat(ReportingMetrics.delinquencyRate(List.of())).isEqualByComparingTo("0");
		assertThat(ReportingMetrics.percentOf(BigDecimal.TEN, BigDecimal.ZERO)).isEqualByComparingTo("0");
	}

	@Test
	void returnMetrics() {
		assertThat(ReportingMetrics.percentOf(new BigDecimal("25"), new BigDecimal("200"))).isEqualByComparingTo("12.5");
		assertThat(ReportingMetrics.calculateMoic(new BigDecimal("150"), new BigDecimal("100"))).isEqualByComparingTo("1.5");
		assertThat(ReportingMetrics.calculateMoic(new BigDecimal("150"), BigDecimal.ZERO)).isEqualByComparingTo("0");
		assertThat(ReportingMetrics.calculatePl(new BigDecimal("80"), new BigDecimal("100"))).isEqualByComparingTo("-20");
		assertThat(ReportingMetrics.calculatePl(null, new BigDecimal("100"))).isEqualByComparingTo("-100");
	}

	private static SellerRawData row(String balance, String debt, String asis, Integer monthsDlq) {
		SellerRawData row = new SellerRawData();
		row.setCurrentBalance(balance == null ? null : new BigDecimal(balance));
		row.setTotalDebt(debt == null ? null : new BigDecimal(debt));
		row.setSellerAsisValue(asis == null ? null : new BigDecimal(asis));
		row.setMonthsDlq(monthsDlq);
		return row;
	}
}
