package my.projectalpha.app.service;

import my.projectalpha.app.config.AppProperties;
import my.projectalpha.app.domain.ExtractionLogEntry;
import my.projectalpha.app.domain.ExtractionStatus;
import my.projectalpha.app.domain.ValuationDocument;
import my.projectalpha.app.extraction.DocumentExtractionResult;
import my.projectalpha.app.extraction.FieldExtractionRecord;
import my.projectalpha.app.extraction.ValuationVisionExtractor;
import my.projectalpha.app.repository.AssetIdHubRepository;
import my.projectalpha.app.repository.ExtractionFieldResultRepository;
import my.projectalpha.app.repository.ExtractionLogEntryRepository;
import my.projectalpha.app.repository.ValuationComparableRepository;
import my.projectalpha.app.repository.ValuationDocumentRepository;
import my.projectalpha.app.repository.ValuationEtlRepository;
import my.projectalpha.app.repository.ValuationRepairItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValuationExtractionPipelineTest {
	private static final byte[] PDF = "%PDF-1.4 stub".getBytes(StandardCharsets.US_ASCII);

	@Mock
	private ValuationVisionExtractor extractor;

	@Mock
	private AssetIdHubRepository assetIdHubRepository;

	@Mock
	private ValuationDocumentRepository documentRepository;

	@Mock
	private ExtractionFieldResultRepository fieldResultRepository;

	@Mock
	private ExtractionLogEntryRepository logEntryRepository;

	@Mock
	private ValuationEtlRepository valuationEtlRepository;

	@Mock
	private ValuationComparableRepository comparableRepository;

	@Mock
	private ValuationRepairItemRepository repairItemRepository;

	@Mock
	private ValuationDocumentService documentService;

	@TempDir
	Path uploadDir;

	private ValuationExtractionPipeline pipeline;

	@BeforeEach
	void setUp() {
		AppProperties properties = new AppProperties(null, null, null,
				new AppProperties.Etl(null, null, null, null, uploadDir.toString()));
		pipeline = new ValuationExtractionPipeline(extractor, assetIdHubRepository, documentRepository,
				fieldResultRepository, logEntryRepository, valuationEtlRepository, comparableRepository,
				repairItemRepository, documentService, new ObjectMapper(), properties);
		when(assetIdHubRepository.existsById(7L)).thenReturn(true);
		when(documentRepository.save(any(ValuationDocument.class))).thenAnswer(invocation -> {
			ValuationDocument document = invocation.getArgument(0);
			if (document.getDocumentId() == null) {
				document.setDocumentId(41L);
			}
			return document;
		});
	}

	@Test
	void storageFailureAfterExtractionMarksDocumentFailed() {
		FieldExtractionRecord record = new FieldExtractionRecord(FieldExtractionRecord.MODEL_VALUATION, "loan_number",
				"L-1", "L-1", new BigDecimal("0.85"), null, false, Map.of());
		when(extractor.process(any())).thenReturn(new DocumentExtractionResult("bpo.pdf", "application/pdf",
				LocalDateTime.now(), List.of(record), Map.of("loan_number", "L-1"), List.of(), List.of(), Map.of(),
				List.of(), null));
		when(fieldResultRepository.save(any())).thenThrow(new DataIntegrityViolationException("value too long"));

		assertThatThrownBy(() -> pipeline.processDocument(PDF, "bpo.pdf", 7L, null, "admin"))
				.isInstanceOf(DataIntegrityViolationException.class);

		ArgumentCaptor<ValuationDocument> documents = ArgumentCaptor.forClass(ValuationDocument.class);
		verify(documentRepository, atLeastOnce()).save(documents.capture());
		ValuationDocument last = documents.getValue();
		assertThat(last.getStatus()).isEqualTo(ExtractionStatus.FAILED);
		assertThat(last.getStatusMessage()).isEqualTo("Storing extraction results failed: value too long");
		assertThat(last.getProcessedAt()).isNotNull();

		ArgumentCaptor<ExtractionLogEntry> logs = ArgumentCaptor.forClass(ExtractionLogEntry.class);
		verify(logEntryRepository, atLeastOnce()).save(logs.capture());
		assertThat(logs.getAllValues()).extracting(ExtractionLogEntry::getLevel).containsExactly("error");
	}
}
