package my.statementfusion.app.importer;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.util.TextDecoding;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class TextFileSource implements TextSource {
	private final Path path;

	public TextFileSource(Path path) {
		if (path == null) {
			throw new IllegalArgumentException("Text file path is required");
		}
		this.path = path;
	}

	@Override
	public String name() {
		return path.getFileName().toString();
	}

	@Override
	public Document read() {
		try {
			return Document.fromText(name(), TextDecoding.decode(Files.readAllBytes(path)));
		} catch (NoSuchFileException exc) {
			throw new TextSourceException("Text file not found: " + path, name(), false, exc);
		} catch (IOException exc) {
			throw new TextSourceException("Failed to read text file: " + exc.getMessage(), name(), true, exc);
		}
	}
}
