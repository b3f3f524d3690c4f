package my.projectalpha.app.service;

import my.projectalpha.app.config.AppProperties;
import my.projectalpha.app.domain.ExtractionFieldResult;
import my.projectalpha.app.domain.ExtractionLogEntry;
import my.projectalpha.app.domain.ExtractionStatus;
import my.projectalpha.app.domain.ValuationComparable;
import my.projectalpha.app.domain.ValuationDocument;
import my.projectalpha.app.domain.ValuationEtl;
import my.projectalpha.app.domain.ValuationRepairItem;
import my.projectalpha.app.domain.ValuationSource;
import my.projectalpha.app.dto.ExtractedValuationDto;
import my.projectalpha.app.dto.ExtractionFieldResultDto;
import my.projectalpha.app.dto.PipelineSummary;
import my.projectalpha.app.extraction.DocumentExtractionResult;
import my.projectalpha.app.extraction.ExtractionFailedException;
import my.projectalpha.app.extraction.FieldExtractionRecord;
import my.projectalpha.app.extraction.ValuationVisionExtractor;
import my.projectalpha.app.llm.DocumentPart;
import my.projectalpha.app.repository.AssetIdHubRepository;
import my.projectalpha.app.repository.ExtractionFieldResultRepository;
import my.projectalpha.app.repository.ExtractionLogEntryRepository;
import my.projectalpha.app.repository.ValuationComparableRepository;
import my.projectalpha.app.repository.ValuationDocumentRepository;
import my.projectalpha.app.repository.ValuationEtlRepository;
import my.projectalpha.app.repository.ValuationRepairItemRepository;
import my.projectalpha.app.util.TypedField;
import my.projectalpha.app.util.ValueCoercion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Stores an uploaded valuation document, runs vision extraction on it and persists the raw field
 * results plus a typed valuation with its comparables and repair items. Every step is its own
 * transaction so that the document row keeps its FAILED or PARTIAL status when a later step fails.
 */
@Service
public class ValuationExtractionPipeline {
	private static final Logger logger = LoggerFactory.getLogger(ValuationExtractionPipeline.class);
	static final String LEVEL_INFO = "info";
	static final String LEVEL_WARNING = "warning";
	static final String LEVEL_ERROR = "error";
	private static final int MESSAGE_MAX = 1000;
	private static final int SOURCE_MAX = 20;
	private static final int FIELD_NAME_MAX = 100;
	private static final int DEFAULT_REPAIR_PRIORITY = 3;
	// first entry is the default
	private static final List<String> COMP_TYPES = List.of("SALE", "LISTING");
	private static final List<String> REPAIR_TYPES = List.of("INTERIOR", "EXTERIOR");
	private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
	};

	private final ValuationVisionExtractor extractor;
	private final AssetIdHubRepository assetIdHubRepository;
	private final ValuationDocumentRepository documentRepository;
	private final ExtractionFieldResultRepository fieldResultRepository;
	private final ExtractionLogEntryRepository logEntryRepository;
	private final ValuationEtlRepository valuationEtlRepository;
	private final ValuationComparableRepository comparableRepository;
	private final ValuationRepairItemRepository repairItemRepository;
	private final ValuationDocumentService documentService;
	private final ObjectMapper objectMapper;
	private final AppProperties properties;

	public ValuationExtractionPipeline(ValuationVisionExtractor extractor,
									   AssetIdHubRepository assetIdHubRepository,
									   ValuationDocumentRepository documentRepository,
									   ExtractionFieldResultRepository fieldResultRepository,
									   ExtractionLogEntryRepository logEntryRepository,
									   ValuationEtlRepository valuationEtlRepository,
									   ValuationComparableRepository comparableRepository,
									   ValuationRepairItemRepository repairItemRepository,
									   ValuationDocumentService documentService,
									   ObjectMapper objectMapper,
									   AppProperties properties) {
		this.extractor = extractor;
		this.assetIdHubRepository = assetIdHubRepository;
		this.documentRepository = documentRepository;
		this.fieldResultRepository = fieldResultRepository;
		this.logEntryRepository = logEntryRepository;
		this.valuationEtlRepository = valuationEtlRepository;
		this.comparableRepository = comparableRepository;
		this.repairItemRepository = repairItemRepository;
		this.documentService = documentService;
		this.objectMapper = objectMapper;
		this.properties = properties;
	}

	public PipelineSummary processDocument(byte[] content, String fileName, Long assetHubId, String sourceOverride,
										   String createdBy) {
		if (content == null || content.length == 0) {
			throw new IllegalArgumentException("File is empty");
		}
		if (assetHubId == null) {
			throw new IllegalArgumentException("assetHubId is required");
		}
		if (!assetIdHubRepository.existsById(assetHubId)) {
			throw NotFoundException.of("Asset hub", assetHubId);
		}
		String name = fileName == null || fileName.isBlank() ? "document" : fileName;
		List<String> warnings = new ArrayList<>();
		ValuationDocument document = createDocument(content, name, assetHubId, createdBy);
		storeFile(document, content, warnings);

		DocumentExtractionResult result;
		try {
			result = extractor.process(new DocumentPart(name, document.getMimeType(), content));
			logger.info("Extraction produced {} field(s) for document {}.", result.fields().size(), document.getDocumentId());
		} catch (RuntimeException ex) {
			logger.error("Failed to extract valuation document {} ({}): {}", document.getDocumentId(), name, ex.getMessage());
			markFailed(document, "Extraction failed: " + ex.getMessage());
			throw new ExtractionFailedException("Extraction failed: " + ex.getMessage(), document.getDocumentId(), ex);
		}

		List<ExtractionFieldResult> fieldResults;
		String chosenSource;
		ValuationEtl valuation = null;
		try {
			fieldResults = persistFieldResults(document.getDocumentId(), result.fields(), warnings);
			warnings.addAll(result.warnings());
			if (warnings.isEmpty()) {
				writeLog(document.getDocumentId(), LEVEL_INFO, "Extraction completed without warnings.");
			} else {
				for (String warning : warnings) {
					writeLog(document.getDocumentId(), LEVEL_WARNING, warning);
				}
			}

			chosenSource = chooseSource(document.getDocumentId(), sourceOverride, result.inferredSource(), warnings);
			String effectiveSource = normalizeSource(document.getDocumentId(), chosenSource, warnings);

			try {
				valuation = persistValuation(document, effectiveSource, result, createdBy);
			} catch (RuntimeException ex) {
				warnings.add("Valuation persistence failed: " + ex.getMessage());
				logger.warn("Valuation persistence failed for document {}: {}", document.getDocumentId(), ex.getMessage());
			}
		} catch (RuntimeException ex) {
			logger.error("Storing extraction results of document {} failed: {}", document.getDocumentId(), ex.getMessage());
			try {
				markFailed(document, "Storing extraction results failed: " + ex.getMessage());
			} catch (RuntimeException markEx) {
				ex.addSuppressed(markEx);
			}
			throw ex;
		}

		document.setStatus(valuation != null ? ExtractionStatus.COMPLETE : ExtractionStatus.PARTIAL);
		document.setStatusMessage(truncate(String.join("; ", warnings), MESSAGE_MAX));
		document.setProcessedAt(LocalDateTime.now());
		document = documentRepository.save(document);
		logger.info("Valuation document {} finished with status {} ({} warning(s)).", document.getDocumentId(),
				document.getStatus(), warnings.size());

		ExtractedValuationDto valuationDto = valuation == null ? null : documentService.toDto(valuation);
		List<ExtractionFieldResultDto> fieldDtos = fieldResults.stream().map(ValuationDocumentService::toDto).toList();
		return new PipelineSummary(ValuationDocumentService.toDto(document), valuationDto, fieldDtos,
				List.copyOf(warnings), chosenSource);
	}

	private ValuationDocument createDocument(byte[] content, String fileName, Long assetHubId, String createdBy) {
		ValuationDocument document = new ValuationDocument();
		document.setAssetHubId(assetHubId);
		document.setFileName(truncate(fileName, 255));
		document.setMimeType(DocumentPart.guessMimeType(fileName));
		document.setSize((long) content.length);
		document.setUploadedAt(LocalDateTime.now());
		document.setStatus(ExtractionStatus.IN_PROGRESS);
		document.setCreatedBy(createdBy);
		return documentRepository.save(document);
	}

	private void storeFile(ValuationDocument document, byte[] content, List<String> warnings) {
		String safeName = document.getFileName().replaceAll("[^A-Za-z0-9._-]", "_");
		Path target = Paths.get(properties.etl() == null
				? new AppProperties.Etl(null, null, null, null, null).resolvedUploadDir()
				: properties.etl().resolvedUploadDir())
				.resolve(document.getDocumentId() + "-" + safeName);
		try {
			Files.createDirectories(target.getParent());
			Files.write(target, content);
			document.setFilePath(target.toString());
			documentRepository.save(document);
		} catch (IOException ex) {
			logger.error("Failed to store valuation document {} at {}: {}", document.getDocumentId(), target, ex.getMessage());
			warnings.add("Failed to store document file: " + ex.getMessage());
		}
	}

	private void markFailed(ValuationDocument document, String message) {
		document.setStatus(ExtractionStatus.FAILED);
		document.setStatusMessage(truncate(message, MESSAGE_MAX));
		document.setProcessedAt(LocalDateTime.now());
		documentRepository.save(document);
		writeLog(document.getDocumentId(), LEVEL_ERROR, message);
	}

	private List<ExtractionFieldResult> persistFieldResults(Long documentId, List<FieldExtractionRecord> records,
															 List<String> warnings) {
		List<ExtractionFieldResult> stored = new ArrayList<>();
		for (FieldExtractionRecord record : records) {
			if (record.field() == null || record.field().isBlank() || record.field().length() > FIELD_NAME_MAX) {
				String shown = record.field() == null ? "null"
						: record.field().length() > 40 ? record.field().substring(0, 40) + "..." : record.field();
				warnings.add("Dropped " + record.targetModel() + " field with unusable name '" + shown + "'.");
				logger.warn("Dropping extracted {} field '{}' for document {}: name is missing or longer than {} characters.",
						record.targetModel(), shown, documentId, FIELD_NAME_MAX);
				continue;
			}
			ExtractionFieldResult entity = fieldResultRepository
					.findByDocumentIdAndTargetModelAndTargetField(documentId, record.targetModel(), record.field())
					.orElseGet(ExtractionFieldResult::new);
			entity.setDocumentId(documentId);
			entity.setTargetModel(record.targetModel());
			entity.setTargetField(record.field());
			if (record.value() instanceof Map<?, ?> || record.value() instanceof List<?>) {
				entity.setValueText(null);
				entity.setValueJson(toJson(record.value()));
			} else {
				entity.setValueText(record.value() == null ? null : String.valueOf(record.value()));
				entity.setValueJson(null);
			}
			entity.setConfidence(record.confidence());
			entity.setExtractionMethod(record.method());
			entity.setRequiresReview(record.requiresReview());
			if (entity.getCreatedAt() == null) {
				entity.setCreatedAt(LocalDateTime.now());
			}
			stored.add(fieldResultRepository.save(entity));
		}
		return stored;
	}

	private String chooseSource(Long documentId, String override, String inferred, List<String> warnings) {
		String requested = override == null || override.isBlank() ? null : override.trim();
		String chosen = requested != null ? requested : inferred;
		if (chosen == null || chosen.isBlank()) {
			chosen = ValuationSource.BROKER.getCode();
			String message = "Unable to determine valuation source automatically; defaulted to '" + chosen + "'.";
			warnings.add(message);
			logger.info(message);
		}
		if (requested != null && inferred != null && !requested.equals(inferred)) {
			String message = "Provided valuation source '" + requested + "' differs from inferred '" + inferred + "'.";
			warnings.add(message);
			writeLog(documentId, LEVEL_WARNING, message);
		} else {
			writeLog(documentId, LEVEL_INFO, "Using valuation source '" + chosen + "' ("
					+ (requested != null ? "override" : "inferred") + ").");
		}
		return chosen;
	}

	private String normalizeSource(Long documentId, String source, List<String> warnings) {
		Optional<ValuationSource> matched = ValuationSource.match(source);
		if (matched.isPresent()) {
			return matched.get().getCode();
		}
		if (source.length() > SOURCE_MAX) {
			String truncated = source.substring(0, SOURCE_MAX);
			warnings.add("Valuation source exceeded max length and was truncated to fit field constraints.");
			writeLog(documentId, LEVEL_WARNING, "Source value '" + source + "' trimmed to '" + truncated + "'.");
			return truncated;
		}
		return source;
	}

	private ValuationEtl persistValuation(ValuationDocument document, String source, DocumentExtractionResult result,
										  String createdBy) {
		Long documentId = document.getDocumentId();
		Map<String, Object> fallbackValuation = new LinkedHashMap<>();
		List<Map<String, Object>> fallbackComparables = new ArrayList<>();
		List<Map<String, Object>> fallbackRepairs = new ArrayList<>();
		collectFallbacks(result.fields(), fallbackValuation, fallbackComparables, fallbackRepairs);

		Map<String, Object> payload = mergeWithFallback(result.valuationPayload(), fallbackValuation);
		List<Map<String, Object>> comparables = result.comparablesPayload();
		if (comparables.isEmpty() && !fallbackComparables.isEmpty()) {
			comparables = fallbackComparables;
			writeLog(documentId, LEVEL_INFO, "Using fallback comparable rows from field records.");
		}
		List<Map<String, Object>> repairs = result.repairsPayload();
		if (repairs.isEmpty() && !fallbackRepairs.isEmpty()) {
			repairs = fallbackRepairs;
			writeLog(documentId, LEVEL_INFO, "Using fallback repair rows from field records.");
		}
		if (payload.isEmpty()) {
			writeLog(documentId, LEVEL_WARNING, "No valuation payload available; skipping valuation creation.");
			return null;
		}
		payload.remove("source");
		payload.remove("asset_hub");

		ValuationEtl valuation = new ValuationEtl();
		List<String> applied = applyFields(ValuationFields.VALUATION, valuation, payload, documentId, "Valuation");
		if (valuation.getInspectionDate() == null) {
			valuation.setInspectionDate(LocalDate.now());
		}
		if (valuation.getLoanNumber() == null) {
			valuation.setLoanNumber("UNKNOWN");
		}
		valuation.setAssetHubId(document.getAssetHubId());
		valuation.setDocumentId(documentId);
		valuation.setSource(source);
		valuation.setPayloadJson(toJson(payload));
		valuation.setCreatedAt(LocalDateTime.now());
		valuation.setCreatedBy(createdBy);
		logger.info("Persisting extracted valuation with {} field(s): {}", applied.size(), applied);
		valuation = valuationEtlRepository.save(valuation);
		writeLog(documentId, LEVEL_INFO, "Created valuation " + valuation.getValuationEtlId() + " with fields: " + applied);

		int comparablesCreated = persistComparables(valuation.getValuationEtlId(), comparables, documentId);
		int repairsCreated = persistRepairs(valuation.getValuationEtlId(), repairs, documentId);
		if (comparablesCreated > 0) {
			writeLog(documentId, LEVEL_INFO, "Created " + comparablesCreated + " comparable record(s).");
		}
		if (repairsCreated > 0) {
			writeLog(documentId, LEVEL_INFO, "Created " + repairsCreated + " repair item(s).");
		}
		return valuation;
	}

	private int persistComparables(Long valuationId, List<Map<String, Object>> rows, Long documentId) {
		int created = 0;
		for (int i = 0; i < rows.size(); i++) {
			int index = i + 1;
			Map<String, Object> row = new LinkedHashMap<>(rows.get(i));
			if (ValueCoercion.isEmpty(row.get("comp_number"))) {
				row.put("comp_number", index);
			}
			ValuationComparable comparable = new ValuationComparable();
			applyFields(ValuationFields.COMPARABLE, comparable, row, documentId, "Comparable #" + index);
			if (comparable.getAddress() == null) {
				writeLog(documentId, LEVEL_WARNING, "Skipped comparable " + index + ": missing address.");
				continue;
			}
			if (comparable.getSalePrice() == null) {
				writeLog(documentId, LEVEL_WARNING, "Skipped comparable " + index + ": missing sale price.");
				continue;
			}
			comparable.setCompType(choice(comparable.getCompType(), COMP_TYPES));
			comparable.setValuationEtlId(valuationId);
			comparable.setPayloadJson(toJson(rows.get(i)));
			try {
				comparableRepository.save(comparable);
				created++;
			} catch (RuntimeException ex) {
				logger.warn("Failed to create comparable {} for valuation {}: {}", index, valuationId, ex.getMessage());
				writeLog(documentId, LEVEL_WARNING, "Failed to create comparable " + index + ": " + ex.getMessage());
			}
		}
		return created;
	}

	private int persistRepairs(Long valuationId, List<Map<String, Object>> rows, Long documentId) {
		int created = 0;
		for (int i = 0; i < rows.size(); i++) {
			int index = i + 1;
			Map<String, Object> row = new LinkedHashMap<>(rows.get(i));
			if (ValueCoercion.isEmpty(row.get("repair_number"))) {
				row.put("repair_number", index);
			}
			ValuationRepairItem repair = new ValuationRepairItem();
			applyFields(ValuationFields.REPAIR, repair, row, documentId, "Repair #" + index);
			repair.setRepairType(choice(repair.getRepairType(), REPAIR_TYPES));
			if (repair.getCategory() == null) {
				repair.setCategory("GENERAL");
			}
			if (repair.getEstimatedCost() == null) {
				repair.setEstimatedCost(BigDecimal.ZERO);
			}
			if (repair.getPriority() == null) {
				repair.setPriority(DEFAULT_REPAIR_PRIORITY);
			}
			repair.setValuationEtlId(valuationId);
			try {
				repairItemRepository.save(repair);
				created++;
			} catch (RuntimeException ex) {
				logger.warn("Failed to create repair {} for valuation {}: {}", index, valuationId, ex.getMessage());
				writeLog(documentId, LEVEL_WARNING, "Failed to create repair " + index + ": " + ex.getMessage());
			}
		}
		return created;
	}

	/**
	 * Coerces every known key onto the target. Returns the names of the fields that received a value.
	 */
	private <T> List<String> applyFields(Map<String, TypedField<T>> fields, T target, Map<String, Object> values,
										 Long documentId, String context) {
		List<String> applied = new ArrayList<>();
		for (Map.Entry<String, Object> entry : values.entrySet()) {
			TypedField<T> field = fields.get(entry.getKey());
			if (field == null) {
				continue;
			}
			Object coerced = ValueCoercion.coerce(entry.getValue(), field.type());
			if (coerced == null) {
				continue;
			}
			if (field.exceedsMaxLength(coerced)) {
				String text = (String) coerced;
				coerced = text.substring(0, field.maxLength());
				String message = context + ": truncated value for '" + field.name() + "' from " + text.length()
						+ " to " + field.maxLength() + " characters.";
				logger.warn(message);
				writeLog(documentId, LEVEL_WARNING, message);
			}
			field.write(target, coerced);
			applied.add(field.name());
		}
		return applied;
	}

	private void collectFallbacks(List<FieldExtractionRecord> records,
										 Map<String, Object> valuation,
										 List<Map<String, Object>> comparables,
										 List<Map<String, Object>> repairs) {
		for (FieldExtractionRecord record : records) {
			Object value = record.value();
			switch (record.targetModel()) {
				case FieldExtractionRecord.MODEL_VALUATION:
					if (!(value instanceof Map<?, ?>) && !(value instanceof List<?>)) {
						valuation.put(record.field(), value);
					}
					break;
				case FieldExtractionRecord.MODEL_COMPARABLE:
					if (value instanceof Map<?, ?> map) {
						comparables.add(objectMapper.convertValue(map, MAP_TYPE));
					}
					break;
				case FieldExtractionRecord.MODEL_REPAIR:
					if (value instanceof Map<?, ?> map) {
						repairs.add(objectMapper.convertValue(map, MAP_TYPE));
					}
					break;
				default:
					break;
			}
		}
	}

	static Map<String, Object> mergeWithFallback(Map<String, Object> primary, Map<String, Object> fallback) {
		Map<String, Object> merged = new LinkedHashMap<>(primary);
		for (Map.Entry<String, Object> entry : fallback.entrySet()) {
			if (ValueCoercion.isEmpty(merged.get(entry.getKey()))) {
				merged.put(entry.getKey(), entry.getValue());
			}
		}
		merged.values().removeIf(ValueCoercion::isEmpty);
		return merged;
	}

	private String toJson(Object value) {
		try {
			return objectMapper.writeValueAsString(value);
		} catch (JacksonException ex) {
			logger.warn("Failed to serialize extraction payload: {}", ex.getOriginalMessage());
			return null;
		}
	}

	private void writeLog(Long documentId, String level, String message) {
		ExtractionLogEntry entry = new ExtractionLogEntry();
		entry.setDocumentId(documentId);
		entry.setLevel(level);
		entry.setMessage(truncate(message, MESSAGE_MAX));
		entry.setCreatedAt(LocalDateTime.now());
		logEntryRepository.save(entry);
	}

	private static String choice(String value, List<String> allowed) {
		if (value != null) {
			String upper = value.trim().toUpperCase(Locale.ROOT);
			if (allowed.contains(upper)) {
				return upper;
			}
		}
		return allowed.get(0);
	}

	private static String truncate(String value, int max) {
		if (value == null || value.length() <= max) {
			return value;
		}
		return value.substring(0, max);
	}
}
