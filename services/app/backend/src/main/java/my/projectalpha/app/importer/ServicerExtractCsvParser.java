package my.projectalpha.app.importer;

import my.projectalpha.app.domain.ServicerLoanData;
import my.projectalpha.app.util.CsvParsing;
import my.projectalpha.app.util.TypedField;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads a monthly servicer extract. Every row needs a loan number and an as-of date; the loan
 * number loses its leading zeros so it matches the servicer id kept on the asset hub.
 */
public class ServicerExtractCsvParser {
	private static final Logger logger = LoggerFactory.getLogger(ServicerExtractCsvParser.class);

	public ServicerExtract parse(byte[] payload, String filename) {
		String content = CsvParsing.decodeUtf8(payload);
		char delimiter = CsvParsing.sniffDelimiter(content);

		List<ServicerExtractRow> rows = new ArrayList<>();
		List<ServicerExtract.RowError> errors = new ArrayList<>();
		List<String> ignored = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(new StringReader(content), CsvParsing.headerFormat(delimiter))) {
			Map<String, TypedField<ServicerLoanData>> columns = mapHeaders(parser.getHeaderNames(), ignored);
			if (!hasField(columns, ServicerExtractFields.SERVICER_ID)) {
				throw new IllegalArgumentException("Servicer extract header must include a loan number column");
			}
			if (!hasField(columns, ServicerExtractFields.AS_OF_DATE)) {
				throw new IllegalArgumentException("Servicer extract header must include an as-of date column");
			}
			int rowNumber = 0;
			for (CSVRecord record : parser) {
				if (isBlank(record)) {
					continue;
				}
				rowNumber += 1;
				Map<TypedField<ServicerLoanData>, Object> values = new LinkedHashMap<>();
				for (Map.Entry<String, TypedField<ServicerLoanData>> column : columns.entrySet()) {
					String raw = record.isSet(column.getKey()) ? record.get(column.getKey()) : null;
					try {
						Object value = SellerTapeValueConverter.convert(raw, column.getValue());
						if (value != null) {
							values.put(column.getValue(), value);
						}
					} catch (IllegalArgumentException ex) {
						logger.warn("{} row {}: {}", filename, rowNumber, ex.getMessage());
					}
				}
				String servicerId = normalizeServicerId((String) valueOf(values, ServicerExtractFields.SERVICER_ID));
				LocalDate asOfDate = (LocalDate) valueOf(values, ServicerExtractFields.AS_OF_DATE);
				if (servicerId == null) {
					errors.add(new ServicerExtract.RowError(rowNumber, "Missing loan number"));
					continue;
				}
				if (asOfDate == null) {
					errors.add(new ServicerExtract.RowError(rowNumber, "Missing or invalid as-of date"));
					continue;
				}
				rows.add(new ServicerExtractRow(rowNumber, servicerId, asOfDate, values));
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read CSV: " + exc.getMessage(), exc);
		}
		if (!ignored.isEmpty()) {
			logger.info("{}: ignored unknown column(s) {}", filename, ignored);
		}
		return new ServicerExtract(rows, errors, ignored);
	}

	/**
	 * "000123" becomes "123"; an all-zero loan number stays "0".
	 */
	public static String normalizeServicerId(String loanNumber) {
		if (loanNumber == null || loanNumber.isBlank()) {
			return null;
		}
		String trimmed = loanNumber.trim().replaceFirst("^0+", "");
		return trimmed.isEmpty() ? "0" : trimmed;
	}

	private Map<String, TypedField<ServicerLoanData>> mapHeaders(List<String> headers, List<String> ignored) {
		Map<String, TypedField<ServicerLoanData>> columns = new LinkedHashMap<>();
		for (String header : headers) {
			if (header == null || header.isBlank()) {
				continue;
			}
			Optional<TypedField<ServicerLoanData>> field = ServicerExtractFields.lookup(CsvParsing.normalizeHeader(header));
			if (field.isPresent() && !columns.containsValue(field.get())) {
				columns.put(header, field.get());
			} else {
				ignored.add(header);
			}
		}
		return columns;
	}

	private static boolean hasField(Map<String, TypedField<ServicerLoanData>> columns, String name) {
		return columns.values().stream().anyMatch(field -> name.equals(field.name()));
	}

	private static Object valueOf(Map<TypedField<ServicerLoanData>, Object> values, String name) {
		return values.entrySet().stream()
				.filter(entry -> name.equals(entry.getKey().name()))
				.map(Map.Entry::getValue)
				.findFirst()
				.orElse(null);
	}

	private boolean isBlank(CSVRecord record) {
		for (String value : record) {
			if (value != null && !value.isBlank()) {
				return false;
			}
		}
		return true;
	}
}
