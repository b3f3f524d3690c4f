package my.projectalpha.app.support;

import my.projectalpha.app.extraction.ValuationPrompts;
import my.projectalpha.app.llm.DocumentPart;
import my.projectalpha.app.llm.LlmRequestException;
import my.projectalpha.app.llm.ValuationVisionClient;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers each extraction pass with a canned JSON response. Passes without a response fail like a
 * disabled model.
 */
public class ScriptedVisionClient implements ValuationVisionClient {
	private final Map<String, String> responses = new ConcurrentHashMap<>();

	public void respond(String core, String comparables, String market, String repairs) {
		responses.clear();
		put(ValuationPrompts.corePrompt(), core);
		put(ValuationPrompts.comparablesPrompt(), comparables);
		put(ValuationPrompts.marketPrompt(), market);
		put(ValuationPrompts.repairsPrompt(), repairs);
	}

	public void reset() {
		responses.clear();
	}

	@Override
	public String generate(DocumentPart document, String prompt) {
		String response = responses.get(prompt);
		if (response == null) {
			throw LlmRequestException.disabled();
		}
		return response;
	}

	@Override
	public String model() {
		return "scripted";
	}

	private void put(String prompt, String response) {
		if (response != null) {
			responses.put(prompt, response);
		}
	}
}
