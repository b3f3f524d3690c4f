package my.projectalpha.app.extraction;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One extracted value with its provenance. {@code value} is a scalar for valuation fields and a map
 * for a whole comparable or repair row.
 */
public record FieldExtractionRecord(String targetModel,
									String field,
									Object value,
									String rawText,
									BigDecimal confidence,
									String method,
									boolean requiresReview,
									Map<String, Object> metadata) {
	public static final String MODEL_VALUATION = "valuation";
	public static final String MODEL_COMPARABLE = "comparable";
	public static final String MODEL_REPAIR = "repair";
	public static final String METHOD_AI = "ai";

	public FieldExtractionRecord {
		if (method == null || method.isBlank()) {
			method = METHOD_AI;
		}
		metadata = metadata == null ? Map.of() : metadata;
	}
}
