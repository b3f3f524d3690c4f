package my.projectalpha.app.llm;

import java.util.Locale;

public record DocumentPart(String fileName, String mimeType, byte[] content) {
	public static final String PDF = "application/pdf";

	public DocumentPart {
		if (content == null) {
			throw new IllegalArgumentException("Document content is required");
		}
		if (mimeType == null || mimeType.isBlank()) {
			mimeType = guessMimeType(fileName);
		}
	}

	public long size() {
		return content.length;
	}

	public boolean isPdf() {
		return PDF.equalsIgnoreCase(mimeType);
	}

	public static String guessMimeType(String fileName) {
		if (fileName == null) {
			return "application/octet-stream";
		}
		String lower = fileName.toLowerCase(Locale.ROOT);
		if (lower.endsWith(".pdf")) {
			return PDF;
		}
		if (lower.endsWith(".png")) {
			return "image/png";
		}
		if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
			return "image/jpeg";
		}
		return "application/octet-stream";
	}
}
