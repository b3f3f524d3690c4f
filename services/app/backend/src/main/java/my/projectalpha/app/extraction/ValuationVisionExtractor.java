package my.projectalpha.app.extraction;

import my.projectalpha.app.config.AppProperties;
import my.projectalpha.app.llm.DocumentPart;
import my.projectalpha.app.llm.ValuationVisionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Routes a valuation document through multi-pass extraction. Oversized PDFs are split into page
 * chunks that are extracted in parallel and merged back in page order.
 */
@Component
public class ValuationVisionExtractor {
	private static final Logger logger = LoggerFactory.getLogger(ValuationVisionExtractor.class);
	private static final BigDecimal REVIEW_THRESHOLD = new BigDecimal("0.85");

	private final MultiPassValuationExtractor extractor;
	private final PdfPageChunker chunker;
	private final ObjectMapper objectMapper;
	private final long maxDocumentBytes;
	private final BigDecimal defaultConfidence;
	private final int workers;

	@Autowired
	public ValuationVisionExtractor(ValuationVisionClient client, ObjectMapper objectMapper, AppProperties properties) {
		this(new MultiPassValuationExtractor(client, objectMapper),
				new PdfPageChunker(etl(properties).resolvedChunkMaxBytes()),
				objectMapper,
				etl(properties).resolvedMaxDocumentBytes(),
				etl(properties).resolvedDefaultConfidence(),
				etl(properties).resolvedWorkers());
	}

	ValuationVisionExtractor(MultiPassValuationExtractor extractor,
							 PdfPageChunker chunker,
							 ObjectMapper objectMapper,
							 long maxDocumentBytes,
							 BigDecimal defaultConfidence,
							 int workers) {
		this.extractor = extractor;
		this.chunker = chunker;
		this.objectMapper = objectMapper;
		this.maxDocumentBytes = maxDocumentBytes;
		this.defaultConfidence = defaultConfidence;
		this.workers = Math.max(1, workers);
	}

	public DocumentExtractionResult process(DocumentPart document) {
		if (document.size() <= maxDocumentBytes) {
			DocumentExtractionResult result = extractor.extract(document);
			return result.withFields(buildRecords(result, Collections.nCopies(result.comparablesPayload().size(), 1),
					Collections.nCopies(result.repairsPayload().size(), 1)));
		}
		if (!document.isPdf()) {
			String warning = "Document exceeds maximum size of " + maxDocumentBytes + " bytes and cannot be split";
			logger.warn("{}: {}", document.fileName(), warning);
			return DocumentExtractionResult.warningsOnly(document.fileName(), document.mimeType(), List.of(warning));
		}
		List<byte[]> chunks = chunker.split(document.content());
		logger.info("Split {} ({} bytes) into {} chunk(s).", document.fileName(), document.size(), chunks.size());
		return aggregate(document, runChunks(document, chunks));
	}

	private List<ChunkOutcome> runChunks(DocumentPart document, List<byte[]> chunks) {
		ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, chunks.size()));
		List<Future<ChunkOutcome>> futures = new ArrayList<>();
		try {
			for (int i = 0; i < chunks.size(); i++) {
				int chunkNumber = i + 1;
				DocumentPart part = new DocumentPart(chunkName(document.fileName(), chunkNumber), DocumentPart.PDF,
						chunks.get(i));
				futures.add(executor.submit(() -> extractChunk(chunkNumber, part)));
			}
			List<ChunkOutcome> outcomes = new ArrayList<>();
			for (Future<ChunkOutcome> future : futures) {
				try {
					outcomes.add(future.get());
				} catch (ExecutionException ex) {
					Throwable cause = ex.getCause();
					if (cause instanceof RuntimeException runtime) {
						throw runtime;
					}
					throw new IllegalStateException(cause);
				} catch (InterruptedException ex) {
					Thread.currentThread().interrupt();
					throw new CancellationException("Canceled");
				}
			}
			return outcomes;
		} finally {
			executor.shutdownNow();
		}
	}

	private ChunkOutcome extractChunk(int chunkNumber, DocumentPart part) {
		try {
			return new ChunkOutcome(chunkNumber, extractor.extract(part), null);
		} catch (ExtractionFailedException ex) {
			logger.warn("Chunk {} of {} failed: {}", chunkNumber, part.fileName(), ex.getMessage());
			return new ChunkOutcome(chunkNumber, null, ex);
		}
	}

	private DocumentExtractionResult aggregate(DocumentPart document, List<ChunkOutcome> outcomes) {
		Map<String, Object> valuation = new LinkedHashMap<>();
		List<Map<String, Object>> comparables = new ArrayList<>();
		List<Map<String, Object>> repairs = new ArrayList<>();
		List<Integer> comparableChunks = new ArrayList<>();
		List<Integer> repairChunks = new ArrayList<>();
		Map<String, Object> raw = new LinkedHashMap<>();
		List<String> warnings = new ArrayList<>();
		String inferredSource = null;
		ExtractionFailedException firstFailure = null;
		int failed = 0;

		for (ChunkOutcome outcome : outcomes) {
			if (outcome.failure() != null) {
				failed++;
				if (firstFailure == null) {
					firstFailure = outcome.failure();
				}
				warnings.add("chunk " + outcome.chunk() + " failed: " + outcome.failure().getMessage());
				continue;
			}
			DocumentExtractionResult result = outcome.result();
			for (String warning : result.warnings()) {
				warnings.add("chunk " + outcome.chunk() + ": " + warning);
			}
			if (result.hasNoPayload()) {
				warnings.add("chunk " + outcome.chunk() + " returned an empty response");
			}
			for (Map.Entry<String, Object> entry : result.valuationPayload().entrySet()) {
				String key = entry.getKey();
				if (!valuation.containsKey(key) || (isEmpty(valuation.get(key)) && !isEmpty(entry.getValue()))) {
					valuation.put(key, entry.getValue());
				}
			}
			comparables.addAll(result.comparablesPayload());
			result.comparablesPayload().forEach(row -> comparableChunks.add(outcome.chunk()));
			repairs.addAll(result.repairsPayload());
			result.repairsPayload().forEach(row -> repairChunks.add(outcome.chunk()));
			if (inferredSource == null && result.inferredSource() != null) {
				inferredSource = result.inferredSource();
			}
			raw.put("chunk" + outcome.chunk(), result.rawResponse());
		}
		if (failed == outcomes.size() && firstFailure != null) {
			throw firstFailure;
		}
		DocumentExtractionResult merged = new DocumentExtractionResult(document.fileName(), document.mimeType(),
				LocalDateTime.now(), List.of(), valuation, comparables, repairs, raw, warnings, inferredSource);
		return merged.withFields(buildRecords(merged, comparableChunks, repairChunks));
	}

	private List<FieldExtractionRecord> buildRecords(DocumentExtractionResult result,
													 List<Integer> comparableChunks,
													 List<Integer> repairChunks) {
		boolean lowConfidence = defaultConfidence.compareTo(REVIEW_THRESHOLD) < 0;
		List<FieldExtractionRecord> records = new ArrayList<>();
		for (Map.Entry<String, Object> entry : result.valuationPayload().entrySet()) {
			Object value = entry.getValue();
			records.add(new FieldExtractionRecord(FieldExtractionRecord.MODEL_VALUATION, entry.getKey(), value,
					rawText(value), defaultConfidence, FieldExtractionRecord.METHOD_AI, lowConfidence || isEmpty(value),
					Map.of()));
		}
		List<Map<String, Object>> comparables = result.comparablesPayload();
		for (int i = 0; i < comparables.size(); i++) {
			records.add(rowRecord(FieldExtractionRecord.MODEL_COMPARABLE, i, comparables.get(i), comparableChunks.get(i),
					lowConfidence));
		}
		List<Map<String, Object>> repairs = result.repairsPayload();
		for (int i = 0; i < repairs.size(); i++) {
			records.add(rowRecord(FieldExtractionRecord.MODEL_REPAIR, i, repairs.get(i), repairChunks.get(i), lowConfidence));
		}
		if (result.inferredSource() != null && isEmpty(result.valuationPayload().get("valuation_type"))) {
			records.add(new FieldExtractionRecord(FieldExtractionRecord.MODEL_VALUATION, "valuation_type",
					result.inferredSource(), result.inferredSource(), defaultConfidence, FieldExtractionRecord.METHOD_AI,
					lowConfidence, Map.of("inferred", true)));
		}
		return records;
	}

	private FieldExtractionRecord rowRecord(String model, int index, Map<String, Object> row, int chunk,
											boolean lowConfidence) {
		return new FieldExtractionRecord(model, "row_" + (index + 1), row, rawText(row), defaultConfidence,
				FieldExtractionRecord.METHOD_AI, lowConfidence || row.isEmpty(), Map.of("chunk", chunk));
	}

	private String rawText(Object value) {
		if (value == null) {
			return null;
		}
		if (value instanceof Map<?, ?> || value instanceof List<?>) {
			try {
				return objectMapper.writeValueAsString(value);
			} catch (JacksonException ex) {
				return String.valueOf(value);
			}
		}
		return String.valueOf(value);
	}

	static boolean isEmpty(Object value) {
		return value == null || (value instanceof String text && text.isBlank());
	}

	private static String chunkName(String fileName, int chunkNumber) {
		String base = fileName == null ? "document.pdf" : fileName;
		return base + "#chunk" + chunkNumber;
	}

	private static AppProperties.Etl etl(AppProperties properties) {
		return properties.etl() == null ? new AppProperties.Etl(null, null, null, null, null) : properties.etl();
	}

	private record ChunkOutcome(int chunk, DocumentExtractionResult result, ExtractionFailedException failure) {
	}
}
