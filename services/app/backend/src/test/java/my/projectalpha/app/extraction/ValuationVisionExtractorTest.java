package my.projectalpha.app.extraction;

import my.projectalpha.app.llm.DocumentPart;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValuationVisionExtractorTest {
	private static final BigDecimal CONFIDENCE = new BigDecimal("0.90");

	@Mock
	private MultiPassValuationExtractor multiPass;

	@Mock
	private PdfPageChunker chunker;

	@Test
	void smallDocumentIsExtractedDirectly() {
		Map<String, Object> valuation = new HashMap<>();
		valuation.put("as_is_value", 185000);
		valuation.put("occupancy", "");
		when(multiPass.extract(any(DocumentPart.class))).thenReturn(result(valuation,
				List.of(Map.of("address", "14 Main St")), List.of(), List.of(), "broker"));

		DocumentExtractionResult result = extractor(1000).process(new DocumentPart("bpo.pdf", null, new byte[10]));

		assertThat(result.fields()).extracting(FieldExtractionRecord::field)
				.containsExactlyInAnyOrder("as_is_value", "occupancy", "row_1", "valuation_type");
		FieldExtractionRecord value = field(result, "as_is_value");
		assertThat(value.requiresReview()).isFalse();
		assertThat(value.rawText()).isEqualTo("185000");
		assertThat(value.confidence()).isEqualByComparingTo(CONFIDENCE);
		assertThat(field(result, "occupancy").requiresReview()).isTrue();
		FieldExtractionRecord comparable = field(result, "row_1");
		assertThat(comparable.targetModel()).isEqualTo(FieldExtractionRecord.MODEL_COMPARABLE);
		assertThat(comparable.metadata()).containsEntry("chunk", 1);
		assertThat(comparable.rawText()).isEqualTo("{\"address\":\"14 Main St\"}");
		assertThat(field(result, "valuation_type").metadata()).containsEntry("inferred", true);
		verifyNoInteractions(chunker);
	}

	@Test
	void oversizedNonPdfIsNotSplit() {
		DocumentExtractionResult result = extractor(5).process(new DocumentPart("photo.png", null, new byte[10]));

		assertThat(result.warnings()).containsExactly("Document exceeds maximum size of 5 bytes and cannot be split");
		assertThat(result.hasNoPayload()).isTrue();
		verifyNoInteractions(multiPass, chunker);
	}

	@Test
	void chunksAreMergedInPageOrder() {
		when(chunker.split(any())).thenReturn(List.of(new byte[]{1}, new byte[]{2}, new byte[]{3}));
		when(multiPass.extract(any(DocumentPart.class))).thenAnswer(invocation -> {
			DocumentPart part = invocation.getArgument(0);
			if (part.fileName().endsWith("#chunk1")) {
				Map<String, Object> valuation = new HashMap<>();
				valuation.put("property_address", "12 Main St");
				valuation.put("as_is_value", "");
				return result(valuation, List.of(Map.of("address", "A")), List.of(), List.of("pass 3 failed: timeout"), null);
			}
			if (part.fileName().endsWith("#chunk2")) {
				return result(Map.of("as_is_value", 150000, "property_address", "ignored"),
						List.of(Map.of("address", "B")), List.of(Map.of("description", "Roof")), List.of(), "BPOE");
			}
			return result(Map.of(), List.of(), List.of(), List.of(), null);
		});

		DocumentExtractionResult result = extractor(5).process(new DocumentPart("bpo.pdf", null, new byte[10]));

		assertThat(result.valuationPayload())
				.containsEntry("property_address", "12 Main St")
				.containsEntry("as_is_value", 150000);
		assertThat(result.comparablesPayload()).extracting(row -> row.get("address")).containsExactly("A", "B");
		assertThat(result.inferredSource()).isEqualTo("BPOE");
		assertThat(result.warnings()).containsExactly("chunk 1: pass 3 failed: timeout", "chunk 3 returned an empty response");
		assertThat(field(result, "row_2").metadata()).containsEntry("chunk", 2);
		assertThat(result.fields()).filteredOn(record -> record.targetModel().equals(FieldExtractionRecord.MODEL_REPAIR))
				.singleElement()
				.satisfies(record -> assertThat(record.metadata()).containsEntry("chunk", 2));
		assertThat(result.rawResponse()).containsKeys("chunk1", "chunk2", "chunk3");
	}

	@Test
	void failedChunkIsReportedWhileOthersSucceed() {
		when(chunker.split(any())).thenReturn(List.of(new byte[]{1}, new byte[]{2}));
		when(multiPass.extract(any(DocumentPart.class))).thenAnswer(invocation -> {
			DocumentPart part = invocation.getArgument(0);
			if (part.fileName().endsWith("#chunk1")) {
				throw new ExtractionFailedException("All extraction passes failed: boom", null, null);
			}
			return result(Map.of("as_is_value", 1), List.of(), List.of(), List.of(), null);
		});

		DocumentExtractionResult result = extractor(5).process(new DocumentPart("bpo.pdf", null, new byte[10]));

		assertThat(result.warnings()).containsExactly("chunk 1 failed: All extraction passes failed: boom");
		assertThat(result.valuationPayload()).containsEntry("as_is_value", 1);
	}

	@Test
	void everyChunkFailingRaises() {
		when(chunker.split(any())).thenReturn(List.of(new byte[]{1}, new byte[]{2}));
		when(multiPass.extract(any(DocumentPart.class)))
				.thenThrow(new ExtractionFailedException("All extraction passes failed: down", null, null));

		assertThatThrownBy(() -> extractor(5).process(new DocumentPart("bpo.pdf", null, new byte[10])))
				.isInstanceOf(ExtractionFailedException.class)
				.hasMessageContaining("down");
	}

	@Test
	void lowDefaultConfidenceFlagsEverythingForReview() {
		when(multiPass.extract(any(DocumentPart.class))).thenReturn(result(Map.of("as_is_value", 1), List.of(),
				List.of(), List.of(), null));
		ValuationVisionExtractor extractor = new ValuationVisionExtractor(multiPass, chunker, new ObjectMapper(), 1000,
				new BigDecimal("0.50"), 2);

		DocumentExtractionResult result = extractor.process(new DocumentPart("bpo.pdf", null, new byte[10]));

		assertThat(result.fields()).allMatch(FieldExtractionRecord::requiresReview);
	}

	private ValuationVisionExtractor extractor(long maxBytes) {
		return new ValuationVisionExtractor(multiPass, chunker, new ObjectMapper(), maxBytes, CONFIDENCE, 2);
	}

	private static DocumentExtractionResult result(Map<String, Object> valuation,
												   List<Map<String, Object>> comparables,
												   List<Map<String, Object>> repairs,
												   List<String> warnings,
												   String inferredSource) {
		return new DocumentExtractionResult("part.pdf", DocumentPart.PDF, LocalDateTime.now(), List.of(), valuation,
				comparables, repairs, Map.of("pass1", Map.of()), warnings, inferredSource);
	}

	private static FieldExtractionRecord field(DocumentExtractionResult result, String name) {
		return result.fields().stream().filter(record -> record.field().equals(name)).findFirst().orElseThrow();
	}
}
