package my.statementfusion.app.importer;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.Line;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts text page by page so every line keeps the page it was printed on.
 */
public class PdfTextSource implements TextSource {
	private final String name;
	private final PayloadLoader loader;

	public PdfTextSource(Path path) {
		this(path.getFileName().toString(), () -> Files.readAllBytes(path));
	}

	public PdfTextSource(String name, byte[] payload) {
		this(name, () -> payload);
	}

	PdfTextSource(String name, PayloadLoader loader) {
		this.name = name == null || name.isBlank() ? "pdf" : name;
		this.loader = loader;
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public Document read() {
		byte[] payload;
		try {
			payload = loader.load();
		} catch (IOException exc) {
			throw new TextSourceException("Failed to load PDF: " + exc.getMessage(), name, true, exc);
		}
		try (PDDocument doc = PDDocument.load(payload)) {
			PDFTextStripper stripper = new PDFTextStripper();
			List<Line> lines = new ArrayList<>();
			for (int page = 1; page <= doc.getNumberOfPages(); page++) {
				stripper.setStartPage(page);
				stripper.setEndPage(page);
				String text = stripper.getText(doc);
				for (String line : text.split("\\R")) {
					lines.add(new Line(lines.size(), line, page, null));
				}
			}
			return new Document(name, lines);
		} catch (IOException exc) {
			throw new TextSourceException("Failed to read PDF: " + exc.getMessage(), name, false, exc);
		}
	}

	@FunctionalInterface
	interface PayloadLoader {
		byte[] load() throws IOException;
	}
}
