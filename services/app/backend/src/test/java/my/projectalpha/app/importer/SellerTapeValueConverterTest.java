package my.projectalpha.app.importer;

import my.projectalpha.app.domain.SellerRawData;
import my.projectalpha.app.util.TypedField;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SellerTapeValueConverterTest {
	@Test
	void convertsTypedCells() {
		assertThat(SellerTapeValueConverter.convert("$1,250.75", field("current_balance"))).isEqualTo(new BigDecimal("1250.75"));
		assertThat(SellerTapeValueConverter.convert("7.25%", field("interest_rate"))).isEqualTo(new BigDecimal("0.072500"));
		assertThat(SellerTapeValueConverter.convert("360.9", field("original_term"))).isEqualTo(360);
		assertThat(SellerTapeValueConverter.convert("t", field("bk_flag"))).isEqualTo(true);
		assertThat(SellerTapeValueConverter.convert("3/5/24", field("maturity_date"))).isEqualTo(LocalDate.of(2024, 3, 5));
	}

	@Test
	void twoDigitYearsStayWithinACenturyWindow() {
		assertThat(SellerTapeValueConverter.convert("5/1/98", field("origination_date"))).isEqualTo(LocalDate.of(1998, 5, 1));
		assertThat(SellerTapeValueConverter.convert("12/1/35", field("maturity_date"))).isEqualTo(LocalDate.of(2035, 12, 1));
		assertThat(SellerTapeValueConverter.convert("5/1/1998", field("origination_date"))).isEqualTo(LocalDate.of(1998, 5, 1));
	}

	@Test
	void integerOutOfRangeRaises() {
		assertThatThrownBy(() -> SellerTapeValueConverter.convert("3000000000", field("months_dlq")))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Number out of range for months_dlq: 3000000000");
		assertThat(SellerTapeValueConverter.convert("-12", field("months_dlq"))).isEqualTo(-12);
	}

	@Test
	void blankCellsAreNull() {
		assertThat(SellerTapeValueConverter.convert("  ", field("current_balance"))).isNull();
		assertThat(SellerTapeValueConverter.convert(null, field("city"))).isNull();
	}

	@Test
	void longStringsAreCutToColumnWidth() {
		assertThat(SellerTapeValueConverter.convert("Texas", field("state"))).isEqualTo("Te");
	}

	@Test
	void unreadableCellsRaise() {
		assertThatThrownBy(() -> SellerTapeValueConverter.convert("soon", field("maturity_date")))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Invalid date for maturity_date: soon");
		assertThatThrownBy(() -> SellerTapeValueConverter.convert("maybe", field("fc_flag")))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> SellerTapeValueConverter.convert("abc", field("total_debt")))
				.isInstanceOf(IllegalArgumentException.class);
	}

	private static TypedField<SellerRawData> field(String name) {
		return SellerTapeFields.lookup(name).orElseThrow();
	}
}
