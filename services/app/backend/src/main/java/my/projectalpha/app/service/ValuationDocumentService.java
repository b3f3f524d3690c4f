package my.projectalpha.app.service;

import my.projectalpha.app.domain.ExtractionFieldResult;
import my.projectalpha.app.domain.ExtractionLogEntry;
import my.projectalpha.app.domain.ValuationComparable;
import my.projectalpha.app.domain.ValuationDocument;
import my.projectalpha.app.domain.ValuationEtl;
import my.projectalpha.app.domain.ValuationRepairItem;
import my.projectalpha.app.dto.ExtractedValuationDto;
import my.projectalpha.app.dto.ExtractionFieldResultDto;
import my.projectalpha.app.dto.ExtractionLogEntryDto;
import my.projectalpha.app.dto.ValuationDocumentDetailDto;
import my.projectalpha.app.dto.ValuationDocumentDto;
import my.projectalpha.app.repository.ExtractionFieldResultRepository;
import my.projectalpha.app.repository.ExtractionLogEntryRepository;
import my.projectalpha.app.repository.ValuationComparableRepository;
import my.projectalpha.app.repository.ValuationDocumentRepository;
import my.projectalpha.app.repository.ValuationEtlRepository;
import my.projectalpha.app.repository.ValuationRepairItemRepository;
import my.projectalpha.app.util.TypedField;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of the valuation extraction tables.
 */
@Service
public class ValuationDocumentService {
	private final ValuationDocumentRepository documentRepository;
	private final ExtractionFieldResultRepository fieldResultRepository;
	private final ExtractionLogEntryRepository logEntryRepository;
	private final ValuationEtlRepository valuationEtlRepository;
	private final ValuationComparableRepository comparableRepository;
	private final ValuationRepairItemRepository repairItemRepository;

	public ValuationDocumentService(ValuationDocumentRepository documentRepository,
									ExtractionFieldResultRepository fieldResultRepository,
									ExtractionLogEntryRepository logEntryRepository,
									ValuationEtlRepository valuationEtlRepository,
									ValuationComparableRepository comparableRepository,
									ValuationRepairItemRepository repairItemRepository) {
		this.documentRepository = documentRepository;
		this.fieldResultRepository = fieldResultRepository;
		this.logEntryRepository = logEntryRepository;
		this.valuationEtlRepository = valuationEtlRepository;
		this.comparableRepository = comparableRepository;
		this.repairItemRepository = repairItemRepository;
	}

	@Transactional(readOnly = true)
	public List<ValuationDocumentDto> list(Long assetHubId) {
		if (assetHubId == null) {
			throw new IllegalArgumentException("assetHubId is required");
		}
		return documentRepository.findByAssetHubIdOrderByUploadedAtDescDocumentIdDesc(assetHubId).stream()
				.map(ValuationDocumentService::toDto)
				.toList();
	}

	@Transactional(readOnly = true)
	public ValuationDocumentDetailDto get(Long documentId) {
		ValuationDocument document = documentRepository.findById(documentId)
				.orElseThrow(() -> NotFoundException.of("Valuation document", documentId));
		List<ExtractionFieldResultDto> fields = fieldResultRepository.findByDocumentIdOrderByIdAsc(documentId).stream()
				.map(ValuationDocumentService::toDto)
				.toList();
		List<ExtractionLogEntryDto> logs = logEntryRepository.findByDocumentIdOrderByIdAsc(documentId).stream()
				.map(ValuationDocumentService::toDto)
				.toList();
		Long valuationId = valuationEtlRepository.findFirstByDocumentId(documentId)
				.map(ValuationEtl::getValuationEtlId)
				.orElse(null);
		return new ValuationDocumentDetailDto(toDto(document), fields, logs, valuationId);
	}

	@Transactional(readOnly = true)
	public ExtractedValuationDto getValuation(Long valuationId) {
		ValuationEtl valuation = valuationEtlRepository.findById(valuationId)
				.orElseThrow(() -> NotFoundException.of("Extracted valuation", valuationId));
		return toDto(valuation);
	}

	ExtractedValuationDto toDto(ValuationEtl valuation) {
		List<Map<String, Object>> comparables = comparableRepository
				.findByValuationEtlIdOrderByCompNumberAsc(valuation.getValuationEtlId()).stream()
				.map(comp -> {
					Map<String, Object> row = read(ValuationFields.COMPARABLE, comp);
					row.put("id", comp.getComparableId());
					return row;
				})
				.toList();
		List<Map<String, Object>> repairs = repairItemRepository
				.findByValuationEtlIdOrderByRepairNumberAsc(valuation.getValuationEtlId()).stream()
				.map(repair -> {
					Map<String, Object> row = read(ValuationFields.REPAIR, repair);
					row.put("id", repair.getRepairItemId());
					return row;
				})
				.toList();
		return new ExtractedValuationDto(valuation.getValuationEtlId(), valuation.getAssetHubId(),
				valuation.getDocumentId(), valuation.getSource(), read(ValuationFields.VALUATION, valuation),
				comparables, repairs, valuation.getCreatedAt(), valuation.getCreatedBy());
	}

	private static <T> Map<String, Object> read(Map<String, TypedField<T>> fields, T target) {
		Map<String, Object> values = new LinkedHashMap<>();
		for (TypedField<T> field : fields.values()) {
			values.put(field.name(), field.read(target));
		}
		return values;
	}

	static ValuationDocumentDto toDto(ValuationDocument document) {
		return new ValuationDocumentDto(document.getDocumentId(), document.getAssetHubId(), document.getFileName(),
				document.getMimeType(), document.getSize(), document.getUploadedAt(), document.getProcessedAt(),
				document.getStatus() == null ? null : document.getStatus().name(), document.getStatusMessage(),
				document.getCreatedBy());
	}

	static ExtractionFieldResultDto toDto(ExtractionFieldResult result) {
		return new ExtractionFieldResultDto(result.getId(), result.getTargetModel(), result.getTargetField(),
				result.getValueText(), result.getValueJson(), result.getConfidence(), result.getExtractionMethod(),
				result.isRequiresReview());
	}

	static ExtractionLogEntryDto toDto(ExtractionLogEntry entry) {
		return new ExtractionLogEntryDto(entry.getId(), entry.getLevel(), entry.getMessage(), entry.getCreatedAt());
	}
}
