package my.projectalpha.app.importer;

import my.projectalpha.app.domain.SellerRawData;
import my.projectalpha.app.util.CsvParsing;
import my.projectalpha.app.util.TypedField;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads a seller loan tape. Headers are matched against {@link SellerTapeFields} after
 * normalization; unknown columns are ignored and unreadable cells are dropped with a warning.
 */
public class SellerTapeCsvParser {
	private static final Logger logger = LoggerFactory.getLogger(SellerTapeCsvParser.class);

	public SellerTape parse(byte[] payload, String filename) {
		String content = CsvParsing.decodeUtf8(payload);
		char delimiter = CsvParsing.sniffDelimiter(content);

		List<SellerTapeRow> rows = new ArrayList<>();
		List<SellerTape.RowError> errors = new ArrayList<>();
		List<String> ignored = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(
				new StringReader(content),
				CsvParsing.headerFormat(delimiter)
		)) {
			Map<String, TypedField<SellerRawData>> columns = mapHeaders(parser.getHeaderNames(), ignored);
			if (columns.values().stream().noneMatch(field -> SellerTapeFields.SELLERTAPE_ID.equals(field.name()))) {
				throw new IllegalArgumentException("Tape header must include '" + SellerTapeFields.SELLERTAPE_ID + "'");
			}
			int rowNumber = 0;
			for (CSVRecord record : parser) {
				if (isBlank(record)) {
					continue;
				}
				rowNumber += 1;
				Map<TypedField<SellerRawData>, Object> values = new LinkedHashMap<>();
				SellerRawData scratch = new SellerRawData();
				for (Map.Entry<String, TypedField<SellerRawData>> column : columns.entrySet()) {
					String raw = record.isSet(column.getKey()) ? record.get(column.getKey()) : null;
					try {
						Object value = SellerTapeValueConverter.convert(raw, column.getValue());
						if (value != null) {
							column.getValue().write(scratch, value);
							values.put(column.getValue(), value);
						}
					} catch (IllegalArgumentException ex) {
						logger.warn("{} row {}: {}", filename, rowNumber, ex.getMessage());
					}
				}
				Object sellertapeId = values.keySet().stream()
						.filter(field -> SellerTapeFields.SELLERTAPE_ID.equals(field.name()))
						.findFirst()
						.map(values::get)
						.orElse(null);
				if (sellertapeId == null) {
					errors.add(new SellerTape.RowError(rowNumber, "Missing sellertape_id"));
					continue;
				}
				rows.add(new SellerTapeRow(rowNumber, sellertapeId.toString(), values));
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read CSV: " + exc.getMessage(), exc);
		}
		if (!ignored.isEmpty()) {
			logger.info("{}: ignored unknown column(s) {}", filename, ignored);
		}
		return new SellerTape(rows, errors, ignored);
	}

	private Map<String, TypedField<SellerRawData>> mapHeaders(List<String> headers, List<String> ignored) {
		Map<String, TypedField<SellerRawData>> columns = new LinkedHashMap<>();
		for (String header : headers) {
			if (header == null || header.isBlank()) {
				continue;
			}
			Optional<TypedField<SellerRawData>> field = SellerTapeFields.lookup(CsvParsing.normalizeHeader(header));
			if (field.isPresent()) {
				columns.put(header, field.get());
			} else {
				ignored.add(header);
			}
		}
		return columns;
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
