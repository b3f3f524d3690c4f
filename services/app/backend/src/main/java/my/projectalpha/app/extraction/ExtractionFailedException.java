package my.projectalpha.app.extraction;

/**
 * The document could not be read by the vision model at all. Mapped to 502.
 */
public class ExtractionFailedException extends RuntimeException {
	private final Long documentId;

	public ExtractionFailedException(String message, Long documentId, Throwable cause) {
		super(message, cause);
		this.documentId = documentId;
	}

	public Long getDocumentId() {
		return documentId;
	}
}
