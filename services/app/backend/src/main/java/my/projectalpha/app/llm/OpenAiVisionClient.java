package my.projectalpha.app.llm;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls an OpenAI compatible {@code /responses} endpoint with the document inlined as a base64
 * {@code input_file} part.
 */
public class OpenAiVisionClient implements ValuationVisionClient {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(5);
	private static final String SYSTEM_PROMPT = "You read property valuation reports. Respond in JSON only. Do not wrap in Markdown code fences.";
	private final RestClient restClient;
	private final String model;

	public OpenAiVisionClient(String baseUrl, String apiKey, String model) {
		this(baseUrl, apiKey, model, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
	}

	public OpenAiVisionClient(String baseUrl, String apiKey, String model, Duration connectTimeout, Duration readTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.build();
		this.model = model;
	}

	@Override
	public String generate(DocumentPart document, String prompt) {
		Map<?, ?> response;
		try {
			response = restClient.post().uri("/responses").body(buildRequest(document, prompt)).retrieve().body(Map.class);
		} catch (RestClientResponseException ex) {
			int status = ex.getStatusCode().value();
			throw new LlmRequestException(safeMessage(ex), status, LlmRequestException.isRetryableStatus(status), ex);
		} catch (ResourceAccessException ex) {
			throw new LlmRequestException(safeMessage(ex), null, true, ex);
		} catch (Exception ex) {
			throw new LlmRequestException(safeMessage(ex), null, false, ex);
		}
		String text = extractOutputText(response);
		if (text == null || text.isBlank()) {
			throw new LlmRequestException("No output_text", null, false, null);
		}
		return text;
	}

	@Override
	public String model() {
		return model;
	}

	Map<String, Object> buildRequest(DocumentPart document, String prompt) {
		String fileData = "data:" + document.mimeType() + ";base64," + Base64.getEncoder().encodeToString(document.content());
		Map<String, Object> filePart = new HashMap<>();
		filePart.put("type", "input_file");
		filePart.put("filename", document.fileName() == null ? "document" : document.fileName());
		filePart.put("file_data", fileData);
		Map<String, Object> request = new HashMap<>();
		request.put("model", model);
		request.put("input", List.of(
				Map.of("role", "system", "content", SYSTEM_PROMPT),
				Map.of("role", "user", "content", List.of(filePart, Map.of("type", "input_text", "text", prompt)))
		));
		request.put("text", Map.of("format", Map.of("type", "json_object")));
		return request;
	}

	private String extractOutputText(Map<?, ?> response) {
		if (response == null) {
			return null;
		}
		Object outputText = response.get("output_text");
		if (outputText instanceof String text && !text.isBlank()) {
			return text;
		}
		Object output = response.get("output");
		if (!(output instanceof List<?> outputList) || outputList.isEmpty()) {
			return null;
		}
		StringBuilder combined = new StringBuilder();
		for (Object outputItem : outputList) {
			if (!(outputItem instanceof Map<?, ?> outputMap) || !(outputMap.get("content") instanceof List<?> contentList)) {
				continue;
			}
			for (Object contentItem : contentList) {
				if (!(contentItem instanceof Map<?, ?> contentMap)) {
					continue;
				}
				Object type = contentMap.get("type");
				Object text = contentMap.get("text");
				if (text == null || (type != null && !"output_text".equals(type.toString()))) {
					continue;
				}
				if (combined.length() > 0) {
					combined.append("\n");
				}
				combined.append(text);
			}
		}
		return combined.toString();
	}

	private String safeMessage(Exception ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		return message;
	}
}
