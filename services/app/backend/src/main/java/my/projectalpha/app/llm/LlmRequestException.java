package my.projectalpha.app.llm;

/**
 * Transport or protocol failure talking to a vision model. {@link #isRetryable()} is true for
 * timeouts, throttling and server errors.
 */
public class LlmRequestException extends RuntimeException {
	private final Integer statusCode;
	private final boolean retryable;

	public LlmRequestException(String message, Integer statusCode, boolean retryable, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.retryable = retryable;
	}

	public static LlmRequestException disabled() {
		return new LlmRequestException("Vision extraction disabled", null, false, null);
	}

	public Integer getStatusCode() {
		return statusCode;
	}

	public boolean isRetryable() {
		return retryable;
	}

	public static boolean isRetryableStatus(int status) {
		return status == 408 || status == 429 || status >= 500;
	}
}
