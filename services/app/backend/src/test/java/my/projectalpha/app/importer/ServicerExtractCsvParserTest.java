package my.projectalpha.app.importer;

import my.projectalpha.app.domain.ServicerLoanData;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServicerExtractCsvParserTest {
	private final ServicerExtractCsvParser parser = new ServicerExtractCsvParser();

	@Test
	void mapsServicerHeadersAndDerivesReportingPeriod() {
		String csv = """
				Loan Number,Date,UPB,Interest Rate,Occupnacy,FC Flag,Prim Stat,Notes
				000123,3/31/2024,"$98,500.10",7.125,Owner,Y,Active,call back
				""";

		ServicerExtract extract = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "extract.csv");

		assertThat(extract.ignoredHeaders()).containsExactly("Notes");
		assertThat(extract.errors()).isEmpty();
		ServicerExtractRow row = extract.rows().get(0);
		assertThat(row.servicerId()).isEqualTo("123");
		ServicerLoanData data = new ServicerLoanData();
		row.applyTo(data);
		assertThat(data.getServicerId()).isEqualTo("123");
		assertThat(data.getAsOfDate()).isEqualTo(LocalDate.of(2024, 3, 31));
		assertThat(data.getReportingYear()).isEqualTo(2024);
		assertThat(data.getReportingMonth()).isEqualTo(3);
		assertThat(data.getReportingDay()).isEqualTo(31);
		assertThat(data.getCurrentBalance()).isEqualByComparingTo("98500.10");
		assertThat(data.getInterestRate()).isEqualByComparingTo("0.07125");
		assertThat(data.getOccupancy()).isEqualTo("Owner");
		assertThat(data.getFcFlag()).isTrue();
		assertThat(data.getPrimStat()).isEqualTo("Active");
	}

	@Test
	void rowsWithoutLoanNumberOrDateAreReported() {
		String csv = "servicer_id;as_of_date;current_balance\n;2024-01-31;10\n55;soon;20\n56;2024-01-31;30\n";

		ServicerExtract extract = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "extract.csv");

		assertThat(extract.rows()).extracting(ServicerExtractRow::servicerId).containsExactly("56");
		assertThat(extract.errors()).extracting(ServicerExtract.RowError::row).containsExactly(1, 2);
		assertThat(extract.errors()).extracting(ServicerExtract.RowError::message)
				.containsExactly("Missing loan number", "Missing or invalid as-of date");
	}

	@Test
	void headerNeedsLoanNumberAndDate() {
		assertThatThrownBy(() -> parser.parse("date,upb\n2024-01-31,1\n".getBytes(StandardCharsets.UTF_8), "x.csv"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("loan number");
		assertThatThrownBy(() -> parser.parse("loan_number,upb\n1,1\n".getBytes(StandardCharsets.UTF_8), "x.csv"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("as-of date");
	}

	@Test
	void normalizesLoanNumbers() {
		assertThat(ServicerExtractCsvParser.normalizeServicerId(" 00042 ")).isEqualTo("42");
		assertThat(ServicerExtractCsvParser.normalizeServicerId("000")).isEqualTo("0");
		assertThat(ServicerExtractCsvParser.normalizeServicerId("  ")).isNull();
	}
}
