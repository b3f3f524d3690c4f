package my.projectalpha.app.extraction;

import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a PDF into runs of consecutive pages, each saved as its own document no larger than the
 * configured limit.
 */
public class PdfPageChunker {
	private final long chunkMaxBytes;

	public PdfPageChunker(long chunkMaxBytes) {
		if (chunkMaxBytes <= 0) {
			throw new IllegalArgumentException("chunkMaxBytes must be positive");
		}
		this.chunkMaxBytes = chunkMaxBytes;
	}

	public List<byte[]> split(byte[] pdf) {
		try (PDDocument source = PDDocument.load(pdf)) {
			int pages = source.getNumberOfPages();
			List<byte[]> chunks = new ArrayList<>();
			int start = 0;
			byte[] current = null;
			for (int page = 0; page < pages; page++) {
				byte[] candidate = render(source, start, page);
				if (candidate.length <= chunkMaxBytes) {
					current = candidate;
					continue;
				}
				if (page == start) {
					throw new IllegalArgumentException("Page " + (page + 1) + " exceeds maximum chunk size");
				}
				chunks.add(current);
				start = page;
				current = render(source, page, page);
				if (current.length > chunkMaxBytes) {
					throw new IllegalArgumentException("Page " + (page + 1) + " exceeds maximum chunk size");
				}
			}
			if (current != null) {
				chunks.add(current);
			}
			return chunks;
		} catch (IOException ex) {
			throw new IllegalArgumentException("Failed to read PDF: " + ex.getMessage(), ex);
		}
	}

	private static byte[] render(PDDocument source, int from, int to) throws IOException {
		try (PDDocument target = new PDDocument();
			 ByteArrayOutputStream out = new ByteArrayOutputStream()) {
			for (int page = from; page <= to; page++) {
				target.importPage(source.getPage(page));
			}
			target.save(out);
			return out.toByteArray();
		}
	}
}
