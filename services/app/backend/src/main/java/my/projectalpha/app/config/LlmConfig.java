package my.projectalpha.app.config;

import my.projectalpha.app.llm.NoopVisionClient;
import my.projectalpha.app.llm.OpenAiVisionClient;
import my.projectalpha.app.llm.ValuationVisionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LlmConfig {
	private static final Logger logger = LoggerFactory.getLogger(LlmConfig.class);
	private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
	private static final String DEFAULT_MODEL = "gpt-5-mini";

	@Bean
	@ConditionalOnProperty(name = "app.llm.provider", havingValue = "openai")
	public ValuationVisionClient openAiVisionClient(AppProperties properties) {
		AppProperties.Llm.OpenAi openai = properties.llm().openai();
		if (openai == null || openai.apiKey() == null || openai.apiKey().isBlank()) {
			throw new IllegalStateException("app.llm.openai.api-key is required when app.llm.provider=openai");
		}
		String baseUrl = openai.baseUrl() == null || openai.baseUrl().isBlank() ? DEFAULT_BASE_URL : openai.baseUrl();
		String model = openai.model() == null || openai.model().isBlank() ? DEFAULT_MODEL : openai.model();
		int connectTimeout = openai.connectTimeoutSeconds() == null ? 30 : Math.max(5, openai.connectTimeoutSeconds());
		int readTimeout = openai.readTimeoutSeconds() == null ? 300 : Math.max(60, openai.readTimeoutSeconds());
		logger.info("Vision client enabled (provider=openai, model={}).", model);
		return new OpenAiVisionClient(baseUrl, openai.apiKey(), model,
				Duration.ofSeconds(connectTimeout), Duration.ofSeconds(readTimeout));
	}

	@Bean
	@ConditionalOnMissingBean(ValuationVisionClient.class)
	public ValuationVisionClient noopVisionClient() {
		logger.info("Vision client disabled (provider=noop).");
		return new NoopVisionClient();
	}
}
