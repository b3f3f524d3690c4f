package my.projectalpha.app.llm;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VisionClientTest {
	private static final DocumentPart DOCUMENT = new DocumentPart("report.pdf", null, new byte[]{1, 2, 3});

	@Test
	void noopClientRefusesToExtract() {
		NoopVisionClient client = new NoopVisionClient();
		assertThatThrownBy(() -> client.generate(DOCUMENT, "prompt"))
				.isInstanceOf(LlmRequestException.class)
				.hasMessageContaining("disabled");
		assertThat(client.model()).isEqualTo("noop");
	}

	@Test
	void documentPartGuessesMimeTypeFromName() {
		assertThat(DOCUMENT.mimeType()).isEqualTo(DocumentPart.PDF);
		assertThat(DOCUMENT.isPdf()).isTrue();
		assertThat(DocumentPart.guessMimeType("photo.JPG")).isEqualTo("image/jpeg");
		assertThat(DocumentPart.guessMimeType(null)).isEqualTo("application/octet-stream");
	}

	@Test
	void openAiClientReadsOutputText() throws IOException {
		AtomicReference<String> requestBody = new AtomicReference<>();
		AtomicReference<String> authorization = new AtomicReference<>();
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/responses", exchange -> {
			requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
			authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
			respond(exchange, 200, "{\"output_text\":\"{\\\"valuation\\\":{}}\"}");
		});
		server.start();
		try {
			OpenAiVisionClient client = new OpenAiVisionClient("http://localhost:" + server.getAddress().getPort(), "test-key", "vision-test");
			String text = client.generate(DOCUMENT, "Extract");
			assertThat(text).isEqualTo("{\"valuation\":{}}");
			assertThat(authorization.get()).isEqualTo("Bearer test-key");
			assertThat(requestBody.get()).contains("\"model\":\"vision-test\"")
					.contains("input_file")
					.contains("data:application/pdf;base64,AQID");
		} finally {
			server.stop(0);
		}
	}

	@Test
	void openAiClientJoinsOutputContentParts() throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/responses", exchange -> respond(exchange, 200, """
				{"output":[{"content":[{"type":"output_text","text":"first"},{"type":"refusal","text":"skip"}]},
				{"content":[{"type":"output_text","text":"second"}]}]}
				"""));
		server.start();
		try {
			OpenAiVisionClient client = new OpenAiVisionClient("http://localhost:" + server.getAddress().getPort(), "k", "m");
			assertThat(client.generate(DOCUMENT, "Extract")).isEqualTo("first\nsecond");
		} finally {
			server.stop(0);
		}
	}

	@Test
	void openAiClientFailsOnEmptyOutput() throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/responses", exchange -> respond(exchange, 200, "{\"output\":[]}"));
		server.start();
		try {
			OpenAiVisionClient client = new OpenAiVisionClient("http://localhost:" + server.getAddress().getPort(), "k", "m");
			assertThatThrownBy(() -> client.generate(DOCUMENT, "Extract"))
					.isInstanceOf(LlmRequestException.class)
					.hasMessageContaining("No output_text");
		} finally {
			server.stop(0);
		}
	}

	@Test
	void openAiClientMarksThrottlingAsRetryable() throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/responses", exchange -> respond(exchange, 429, "{\"error\":\"slow down\"}"));
		server.start();
		try {
			OpenAiVisionClient client = new OpenAiVisionClient("http://localhost:" + server.getAddress().getPort(), "k", "m");
			assertThatThrownBy(() -> client.generate(DOCUMENT, "Extract"))
					.isInstanceOfSatisfying(LlmRequestException.class, ex -> {
						assertThat(ex.getStatusCode()).isEqualTo(429);
						assertThat(ex.isRetryable()).isTrue();
					});
		} finally {
			server.stop(0);
		}
	}

	@Test
	void buildRequestAsksForJsonObjects() {
		OpenAiVisionClient client = new OpenAiVisionClient("http://localhost:1", "k", "m");
		Map<String, Object> request = client.buildRequest(DOCUMENT, "Extract");
		assertThat(request.get("text")).isEqualTo(Map.of("format", Map.of("type", "json_object")));
		assertThat((List<?>) request.get("input")).hasSize(2);
	}

	private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body) throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().add("Content-Type", "application/json");
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream output = exchange.getResponseBody()) {
			output.write(bytes);
		}
	}
}
