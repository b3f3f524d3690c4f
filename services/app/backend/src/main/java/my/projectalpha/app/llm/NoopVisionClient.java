package my.projectalpha.app.llm;

public class NoopVisionClient implements ValuationVisionClient {
	@Override
	public String generate(DocumentPart document, String prompt) {
		throw LlmRequestException.disabled();
	}

	@Override
	public String model() {
		return "noop";
	}
}
