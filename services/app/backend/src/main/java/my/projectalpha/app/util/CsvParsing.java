package my.projectalpha.app.util;

import org.apache.commons.csv.CSVFormat;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

public final class CsvParsing {
	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	/**
	 * Picks the delimiter from the header line: semicolon when it occurs more often than the comma,
	 * comma otherwise.
	 */
	public static char sniffDelimiter(String content) {
		if (content == null || content.isEmpty()) {
			return ',';
		}
		int lineEnd = content.indexOf('\n');
		String header = lineEnd < 0 ? content : content.substring(0, lineEnd);
		long semicolons = header.chars().filter(ch -> ch == ';').count();
		long commas = header.chars().filter(ch -> ch == ',').count();
		return semicolons > commas ? ';' : ',';
	}

	/**
	 * Header-first format for uploaded sheets. Spreadsheet exports often end the header with a
	 * trailing delimiter, so blank column names are accepted and later ignored.
	 */
	public static CSVFormat headerFormat(char delimiter) {
		return CSVFormat.DEFAULT.builder()
				.setDelimiter(delimiter)
				.setHeader()
				.setSkipHeaderRecord(true)
				.setAllowMissingColumnNames(true)
				.build();
	}

	public static String decodeUtf8(byte[] payload) {
		String raw = new String(payload, StandardCharsets.UTF_8);
		return stripBom(raw);
	}

	/**
	 * "Current Balance", "current-balance" and "CURRENT.BALANCE" all become "current_balance".
	 */
	public static String normalizeHeader(String header) {
		if (header == null) {
			return "";
		}
		return stripBom(header).trim()
				.toLowerCase(Locale.ROOT)
				.replaceAll("[\\s.\\-/]+", "_")
				.replaceAll("^_+|_+$", "");
	}
}
