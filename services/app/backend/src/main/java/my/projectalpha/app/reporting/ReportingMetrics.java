package my.projectalpha.app.reporting;

import my.projectalpha.app.domain.SellerRawData;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.function.Function;

public final class ReportingMetrics {
	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

	private ReportingMetrics() {
	}

	public static BigDecimal totalUpb(Collection<SellerRawData> rows) {
		return sum(rows, SellerRawData::getCurrentBalance).setScale(2, RoundingMode.HALF_UP);
	}

	public static BigDecimal totalDebt(Collection<SellerRawData> rows) {
		return sum(rows, SellerRawData::getTotalDebt).setScale(2, RoundingMode.HALF_UP);
	}

	public static BigDecimal asisValue(Collection<SellerRawData> rows) {
		return sum(rows, SellerRawData::getSellerAsisValue).setScale(2, RoundingMode.HALF_UP);
	}

	public static BigDecimal averageUpb(Collection<SellerRawData> rows) {
		if (rows.isEmpty()) {
			return zero();
		}
		return sum(rows, SellerRawData::getCurrentBalance).divide(BigDecimal.valueOf(rows.size()), 2, RoundingMode.HALF_UP);
	}

	/**
	 * Mean of balance over seller as-is value, in percent, across rows with a positive as-is value.
	 */
	public static BigDecimal averageLtv(Collection<SellerRawData> rows) {
		BigDecimal total = BigDecimal.ZERO;
		int count = 0;
		for (SellerRawData row : rows) {
			BigDecimal value = row.getSellerAsisValue();
			if (value == null || value.signum() <= 0) {
				continue;
			}
			BigDecimal balance = row.getCurrentBalance() == null ? BigDecimal.ZERO : row.getCurrentBalance();
			total = total.add(balance.multiply(HUNDRED).divide(value, 10, RoundingMode.HALF_UP));
			count++;
		}
		if (count == 0) {
			return zero();
		}
		return total.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
	}

	public static BigDecimal delinquencyRate(Collection<SellerRawData> rows) {
		if (rows.isEmpty()) {
			return zero();
		}
		long delinquent = rows.stream()
				.filter(row -> row.getMonthsDlq() != null && row.getMonthsDlq() > 0)
				.count();
		return BigDecimal.valueOf(delinquent).multiply(HUNDRED)
				.divide(BigDecimal.valueOf(rows.size()), 2, RoundingMode.HALF_UP);
	}

	public static BigDecimal percentOf(BigDecimal part, BigDecimal total) {
		if (total == null || total.signum() == 0) {
			return BigDecimal.ZERO.setScale(1, RoundingMode.HALF_UP);
		}
		return part.multiply(HUNDRED).divide(total, 1, RoundingMode.HALF_UP);
	}

	/**
	 * Multiple on invested capital. Zero when nothing was invested.
	 */
	public static BigDecimal calculateMoic(BigDecimal proceeds, BigDecimal invested) {
		if (proceeds == null || invested == null || invested.signum() == 0) {
			return BigDecimal.ZERO.setScale(4, RoundingMode.HALF_UP);
		}
		return proceeds.divide(invested, 4, RoundingMode.HALF_UP);
	}

	public static BigDecimal calculatePl(BigDecimal proceeds, BigDecimal costBasis) {
		BigDecimal p = proceeds == null ? BigDecimal.ZERO : proceeds;
		BigDecimal c = costBasis == null ? BigDecimal.ZERO : costBasis;
		return p.subtract(c);
	}

	private static BigDecimal sum(Collection<SellerRawData> rows, Function<SellerRawData, BigDecimal> field) {
		BigDecimal total = BigDecimal.ZERO;
		for (SellerRawData row : rows) {
			BigDecimal value = field.apply(row);
			if (value != null) {
				total = total.add(value);
			}
		}
		return total;
	}

	private static BigDecimal zero() {
		return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
	}
}
