package my.projectalpha.app.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Security security,
		Jwt jwt,
		Llm llm,
		Etl etl
) {
	public record Security(
			@NotBlank String adminUser,
			@NotBlank String adminPass
	) {
	}

	public record Jwt(
			String secret,
			@NotBlank String issuer,
			Long ttlSeconds
	) {
		public static final long DEFAULT_TTL_SECONDS = 3600;

		public long resolvedTtlSeconds() {
			return ttlSeconds == null || ttlSeconds <= 0 ? DEFAULT_TTL_SECONDS : ttlSeconds;
		}
	}

	public record Llm(
			@NotBlank String provider,
			OpenAi openai
	) {
		public record OpenAi(
				String apiKey,
				String baseUrl,
				String model,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}

	public record Etl(
			Long maxDocumentBytes,
			Long chunkMaxBytes,
			BigDecimal defaultConfidence,
			Integer workers,
			String uploadDir
	) {
		public static final long DEFAULT_MAX_DOCUMENT_BYTES = 20L * 1024 * 1024;
		public static final BigDecimal DEFAULT_CONFIDENCE = new BigDecimal("0.85");

		public long resolvedMaxDocumentBytes() {
			return maxDocumentBytes == null || maxDocumentBytes <= 0 ? DEFAULT_MAX_DOCUMENT_BYTES : maxDocumentBytes;
		}

		public long resolvedChunkMaxBytes() {
			return chunkMaxBytes == null || chunkMaxBytes <= 0 ? resolvedMaxDocumentBytes() : chunkMaxBytes;
		}

		public BigDecimal resolvedDefaultConfidence() {
			return defaultConfidence == null ? DEFAULT_CONFIDENCE : defaultConfidence;
		}

		public int resolvedWorkers() {
			return workers == null || workers < 1 ? 4 : workers;
		}

		public String resolvedUploadDir() {
			if (uploadDir == null || uploadDir.isBlank()) {
				return System.getProperty("java.io.tmpdir") + "/projectalpha/valuation-documents";
			}
			return uploadDir;
		}
	}
}
