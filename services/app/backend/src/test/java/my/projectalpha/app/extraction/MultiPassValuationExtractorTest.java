package my.projectalpha.app.extraction;

import my.projectalpha.app.llm.DocumentPart;
import my.projectalpha.app.llm.LlmRequestException;
import my.projectalpha.app.llm.ValuationVisionClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.jackson.databind.ObjectMapper;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MultiPassValuationExtractorTest {
	private static final DocumentPart DOCUMENT = new DocumentPart("bpo.pdf", null, new byte[]{1});

	@Mock
	private ValuationVisionClient client;

	private MultiPassValuationExtractor extractor;

	@BeforeEach
	void setUp() {
		extractor = new MultiPassValuationExtractor(client, new ObjectMapper());
		lenient().when(client.model()).thenReturn("vision-test");
	}

	@Test
	void mergesAllFourPasses() {
		answer(Map.of(
				ValuationPrompts.corePrompt(), "{\"valuation\":{\"property_address\":\"12 Main St\",\"as_is_value\":185000,\"valuation_type\":\"BPOI\"}}",
				ValuationPrompts.comparablesPrompt(), "```json\n{\"comparables\":[{\"address\":\"14 Main St\",\"sale_price\":180000},\"junk\"]}\n```",
				ValuationPrompts.marketPrompt(), "{\"valuation\":{\"market_trend\":\"stable\"}}",
				ValuationPrompts.repairsPrompt(), "{\"estimated_repair_cost\":12000,\"general_repair_comments\":\"\",\"repairs\":[{\"description\":\"Roof\"}]}"));

		DocumentExtractionResult result = extractor.extract(DOCUMENT);

		assertThat(result.valuationPayload())
				.containsEntry("property_address", "12 Main St")
				.containsEntry("as_is_value", 185000)
				.containsEntry("market_trend", "stable")
				.containsEntry("estimated_repair_cost", 12000)
				.doesNotContainKey("general_repair_comments");
		assertThat(result.comparablesPayload()).singleElement()
				.satisfies(row -> assertThat(row).containsEntry("address", "14 Main St"));
		assertThat(result.repairsPayload()).hasSize(1);
		assertThat(result.inferredSource()).isEqualTo("BPOI");
		assertThat(result.rawResponse()).containsKeys("pass1", "pass2", "pass3", "pass4");
		assertThat(result.warnings()).isEmpty();
		assertThat(result.mimeType()).isEqualTo(DocumentPart.PDF);
	}

	@Test
	void failedPassBecomesWarning() {
		when(client.generate(any(DocumentPart.class), anyString())).thenAnswer(invocation -> {
			String prompt = invocation.getArgument(1);
			if (prompt.equals(ValuationPrompts.comparablesPrompt())) {
				throw new LlmRequestException("timeout", null, true, null);
			}
			if (prompt.equals(ValuationPrompts.corePrompt())) {
				return "{\"valuation\":{\"as_is_value\":100000}}";
			}
			return "{}";
		});

		DocumentExtractionResult result = extractor.extract(DOCUMENT);

		assertThat(result.warnings()).containsExactly("pass 2 failed: timeout");
		assertThat(result.valuationPayload()).containsEntry("as_is_value", 100000);
		assertThat(result.comparablesPayload()).isEmpty();
		assertThat(result.inferredSource()).isNull();
	}

	@Test
	void allPassesFailingRaises() {
		when(client.generate(any(DocumentPart.class), anyString())).thenThrow(LlmRequestException.disabled());

		assertThatThrownBy(() -> extractor.extract(DOCUMENT))
				.isInstanceOf(ExtractionFailedException.class)
				.hasMessage("All extraction passes failed: Vision extraction disabled")
				.hasCauseInstanceOf(LlmRequestException.class);
	}

	@Test
	void parseResponseToleratesFencesAndGarbage() {
		assertThat(extractor.parseResponse("```\n{\"a\":1}\n```")).containsEntry("a", 1);
		assertThat(extractor.parseResponse("not json")).isEmpty();
		assertThat(extractor.parseResponse("  ")).isEmpty();
		assertThat(extractor.parseResponse(null)).isEmpty();
	}

	private void answer(Map<String, String> responses) {
		when(client.generate(any(DocumentPart.class), anyString()))
				.thenAnswer(invocation -> responses.getOrDefault(invocation.<String>getArgument(1), "{}"));
	}
}
