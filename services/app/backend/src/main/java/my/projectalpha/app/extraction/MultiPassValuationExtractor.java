package my.projectalpha.app.extraction;

import my.projectalpha.app.llm.DocumentPart;
import my.projectalpha.app.llm.ValuationVisionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the four extraction passes against one document and merges their answers. A failed pass is
 * reported as a warning; only a document on which every pass failed raises.
 */
public class MultiPassValuationExtractor {
	private static final Logger logger = LoggerFactory.getLogger(MultiPassValuationExtractor.class);
	private static final int PASSES = 4;
	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
	};
	private final ValuationVisionClient client;
	private final ObjectMapper objectMapper;

	public MultiPassValuationExtractor(ValuationVisionClient client, ObjectMapper objectMapper) {
		this.client = client;
		this.objectMapper = objectMapper;
	}

	public DocumentExtractionResult extract(DocumentPart document) {
		logger.info("Starting multi-pass extraction of {} ({} bytes, model={}).", document.fileName(), document.size(),
				client.model());
		List<String> warnings = new ArrayList<>();
		List<RuntimeException> failures = new ArrayList<>();

		Map<String, Object> pass1 = runPass(1, "core valuation", document, ValuationPrompts.corePrompt(), warnings, failures);
		Map<String, Object> pass2 = runPass(2, "comparables", document, ValuationPrompts.comparablesPrompt(), warnings, failures);
		Map<String, Object> pass3 = runPass(3, "market", document, ValuationPrompts.marketPrompt(), warnings, failures);
		Map<String, Object> pass4 = runPass(4, "repairs", document, ValuationPrompts.repairsPrompt(), warnings, failures);
		if (failures.size() == PASSES) {
			RuntimeException first = failures.get(0);
			throw new ExtractionFailedException("All extraction passes failed: " + first.getMessage(), null, first);
		}

		Map<String, Object> core = section(pass1, "valuation");
		Map<String, Object> valuation = new LinkedHashMap<>(core);
		valuation.putAll(section(pass3, "valuation"));
		Object repairCost = pass4.get("estimated_repair_cost");
		if (isPresent(repairCost)) {
			valuation.put("estimated_repair_cost", repairCost);
		}
		Object repairComments = pass4.get("general_repair_comments");
		if (isPresent(repairComments)) {
			valuation.put("general_repair_comments", repairComments);
		}
		List<Map<String, Object>> comparables = rows(pass2, "comparables");
		List<Map<String, Object>> repairs = rows(pass4, "repairs");
		logger.info("Multi-pass extraction of {} complete: {} valuation field(s), {} comparable(s), {} repair(s).",
				document.fileName(), valuation.size(), comparables.size(), repairs.size());

		Map<String, Object> raw = new LinkedHashMap<>();
		raw.put("pass1", pass1);
		raw.put("pass2", pass2);
		raw.put("pass3", pass3);
		raw.put("pass4", pass4);
		Object inferred = core.get("valuation_type");
		return new DocumentExtractionResult(document.fileName(), document.mimeType(), LocalDateTime.now(), List.of(),
				valuation, comparables, repairs, raw, warnings, isPresent(inferred) ? inferred.toString() : null);
	}

	private Map<String, Object> runPass(int pass, String name, DocumentPart document, String prompt,
										List<String> warnings, List<RuntimeException> failures) {
		long start = System.nanoTime();
		try {
			String text = client.generate(document, prompt);
			logger.info("Pass {}/{} ({}) complete in {} ms.", pass, PASSES, name, (System.nanoTime() - start) / 1_000_000);
			return parseResponse(text);
		} catch (RuntimeException ex) {
			logger.warn("Pass {}/{} ({}) failed after {} ms: {}", pass, PASSES, name,
					(System.nanoTime() - start) / 1_000_000, ex.getMessage());
			warnings.add("pass " + pass + " failed: " + ex.getMessage());
			failures.add(ex);
			return Map.of();
		}
	}

	/**
	 * Strips a Markdown fence and parses the JSON object. Anything unreadable becomes an empty map.
	 */
	Map<String, Object> parseResponse(String text) {
		if (text == null || text.isBlank()) {
			return Map.of();
		}
		String cleaned = text.trim();
		if (cleaned.startsWith("```")) {
			int firstNewline = cleaned.indexOf('\n');
			cleaned = firstNewline < 0 ? "" : cleaned.substring(firstNewline + 1);
			int fence = cleaned.lastIndexOf("```");
			if (fence >= 0) {
				cleaned = cleaned.substring(0, fence);
			}
		}
		try {
			Map<String, Object> parsed = objectMapper.readValue(cleaned, MAP_TYPE);
			return parsed == null ? Map.of() : parsed;
		} catch (JacksonException ex) {
			logger.error("Failed to parse model response: {}", ex.getOriginalMessage());
			return Map.of();
		}
	}

	private Map<String, Object> section(Map<String, Object> response, String key) {
		Object value = response.get(key);
		return value instanceof Map<?, ?> map ? objectMapper.convertValue(map, MAP_TYPE) : Map.of();
	}

	private List<Map<String, Object>> rows(Map<String, Object> response, String key) {
		Object value = response.get(key);
		if (!(value instanceof List<?> list)) {
			return List.of();
		}
		List<Map<String, Object>> rows = new ArrayList<>();
		for (Object item : list) {
			if (item instanceof Map<?, ?> map) {
				rows.add(objectMapper.convertValue(map, MAP_TYPE));
			}
		}
		return rows;
	}

	private static boolean isPresent(Object value) {
		if (value == null) {
			return false;
		}
		if (value instanceof String text) {
			return !text.isBlank();
		}
		if (value instanceof Number number) {
			return number.doubleValue() != 0d;
		}
		return true;
	}
}
