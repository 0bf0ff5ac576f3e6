package my.statementfusion.app.importer;

import my.statementfusion.app.model.Document;

public class InMemoryTextSource implements TextSource {
	private final String name;
	private final String text;

	public InMemoryTextSource(String name, String text) {
		this.name = name == null || name.isBlank() ? "memory" : name;
		this.text = text == null ? "" : text;
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public Document read() {
		return Document.fromText(name, text);
	}
}
