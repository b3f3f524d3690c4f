package my.projectalpha.app.llm;

/**
 * A multimodal model that reads a valuation report and answers a prompt about it.
 */
public interface ValuationVisionClient {
	/**
	 * Sends the document together with the prompt and returns the raw text answer.
	 *
	 * @throws LlmRequestException when the call fails or returns no text
	 */
	String generate(DocumentPart document, String prompt);

	String model();
}
