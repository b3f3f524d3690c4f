package my.projectalpha.app.importer;

import my.projectalpha.app.domain.AssetClass;
import my.projectalpha.app.domain.SellerRawData;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SellerTapeCsvParserTest {
	private final SellerTapeCsvParser parser = new SellerTapeCsvParser();

	@Test
	void parsesFixtureTape() throws IOException {
		SellerTape tape = parser.parse(fixture(), "seller-tape.csv");

		assertThat(tape.rows()).extracting(SellerTapeRow::sellertapeId).containsExactly("LN-1001", "LN-1002", "LN-1003");
		assertThat(tape.ignoredHeaders()).containsExactly("Servicer Notes");
		assertThat(tape.errors()).singleElement().satisfies(error -> {
			assertThat(error.row()).isEqualTo(4);
			assertThat(error.message()).contains("sellertape_id");
		});

		SellerRawData first = new SellerRawData();
		tape.rows().get(0).applyTo(first);
		assertThat(first.getAssetClass()).isEqualTo(AssetClass.NPL);
		assertThat(first.getCurrentBalance()).isEqualByComparingTo("150000.00");
		assertThat(first.getInterestRate()).isEqualByComparingTo("0.065");
		assertThat(first.getMonthsDlq()).isEqualTo(4);
		assertThat(first.getTotalDebt()).isEqualByComparingTo("165000");
		assertThat(first.getSellerAsisValue()).isEqualByComparingTo("200000");
		assertThat(first.getFcFlag()).isTrue();
		assertThat(first.getNextDueDate()).isEqualTo(LocalDate.of(2023, 10, 1));
		assertThat(first.getState()).isEqualTo("TX");
	}

	@Test
	void unreadableCellsAreDroppedButRowIsKept() throws IOException {
		SellerTape tape = parser.parse(fixture(), "seller-tape.csv");

		SellerRawData third = new SellerRawData();
		tape.rows().get(2).applyTo(third);
		assertThat(third.getAssetClass()).isEqualTo(AssetClass.PERFORMING);
		assertThat(third.getMonthsDlq()).isNull();
		assertThat(third.getInterestRate()).isEqualByComparingTo("0.05");
		assertThat(third.getFcFlag()).isFalse();
	}

	@Test
	void rateAtOrBelowOneIsKeptAsFraction() throws IOException {
		SellerTape tape = parser.parse(fixture(), "seller-tape.csv");

		SellerRawData second = new SellerRawData();
		tape.rows().get(1).applyTo(second);
		assertThat(second.getInterestRate()).isEqualByComparingTo(new BigDecimal("0.055"));
		assertThat(second.getNextDueDate()).isNull();
	}

	@Test
	void semicolonTapesAreSupported() {
		String csv = "sellertape_id;current_balance;city\nA-1;1000;Reno\n;;\n";
		SellerTape tape = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "tape.csv");

		assertThat(tape.rows()).hasSize(1);
		assertThat(tape.errors()).isEmpty();
		SellerRawData row = new SellerRawData();
		tape.rows().get(0).applyTo(row);
		assertThat(row.getCity()).isEqualTo("Reno");
	}

	@Test
	void trailingDelimiterInHeaderIsTolerated() {
		String csv = "sellertape_id,current_balance,\nLN-1,100,\n";
		SellerTape tape = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "tape.csv");

		assertThat(tape.rows()).extracting(SellerTapeRow::sellertapeId).containsExactly("LN-1");
		assertThat(tape.ignoredHeaders()).isEmpty();
		SellerRawData row = new SellerRawData();
		tape.rows().get(0).applyTo(row);
		assertThat(row.getCurrentBalance()).isEqualByComparingTo("100");
	}

	@Test
	void oversizedIntegerCellIsDropped() {
		String csv = "sellertape_id,months_dlq,city\nLN-1,3000000000,Reno\n";
		SellerTape tape = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "tape.csv");

		SellerRawData row = new SellerRawData();
		tape.rows().get(0).applyTo(row);
		assertThat(row.getMonthsDlq()).isNull();
		assertThat(row.getCity()).isEqualTo("Reno");
		assertThat(tape.errors()).isEmpty();
	}

	@Test
	void rejectsTapeWithoutIdColumn() {
		byte[] csv = "Loan,Balance\n1,2\n".getBytes(StandardCharsets.UTF_8);
		assertThatThrownBy(() -> parser.parse(csv, "tape.csv"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("sellertape_id");
	}

	private byte[] fixture() throws IOException {
		try (InputStream input = getClass().getResourceAsStream("/fixtures/seller-tape.csv")) {
			assertThat(input).isNotNull();
			return input.readAllBytes();
		}
	}
}
