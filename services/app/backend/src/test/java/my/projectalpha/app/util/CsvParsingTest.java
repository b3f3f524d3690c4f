package my.projectalpha.app.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class CsvParsingTest {
	@Test
	void stripBomRemovesLeadingMarker() {
		assertThat(CsvParsing.stripBom("\uFEFFa,b,c")).isEqualTo("a,b,c");
		assertThat(CsvParsing.stripBom(null)).isNull();
		assertThat(CsvParsing.stripBom("")).isEqualTo("");
	}

	@Test
	void sniffDelimiterPrefersSemicolonOnlyWhenDominant() {
		assertThat(CsvParsing.sniffDelimiter("a;b;c\n1;2;3")).isEqualTo(';');
		assertThat(CsvParsing.sniffDelimiter("a,b;c\n1;2;3;4")).isEqualTo(',');
		assertThat(CsvParsing.sniffDelimiter("abc")).isEqualTo(',');
		assertThat(CsvParsing.sniffDelimiter(null)).isEqualTo(',');
	}

	@Test
	void decodeUtf8RemovesBom() {
		byte[] payload = "\uFEFFa,b".getBytes(StandardCharsets.UTF_8);
		assertThat(CsvParsing.decodeUtf8(payload)).isEqualTo("a,b");
	}

	@Test
	void normalizeHeaderCollapsesSeparators() {
		assertThat(CsvParsing.normalizeHeader(" Current Balance ")).isEqualTo("current_balance");
		assertThat(CsvParsing.normalizeHeader("Property-City")).isEqualTo("property_city");
		assertThat(CsvParsing.normalizeHeader("As Is Value / BPO")).isEqualTo("as_is_value_bpo");
		assertThat(CsvParsing.normalizeHeader(null)).isEmpty();
	}
}
