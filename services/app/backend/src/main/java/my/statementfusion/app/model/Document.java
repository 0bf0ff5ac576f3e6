package my.statementfusion.app.model;

import java.util.ArrayList;
import java.util.List;

public record Document(
		String sourceName,
		List<Line> lines
) {
	public Document {
		sourceName = sourceName == null || sourceName.isBlank() ? "document" : sourceName;
		lines = lines == null ? List.of() : List.copyOf(lines);
	}

	public static Document fromText(String sourceName, String text) {
		return fromLines(sourceName, text == null ? List.of() : List.of(text.split("\\R", -1)));
	}

	public static Document fromLines(String sourceName, List<String> rawLines) {
		List<Line> lines = new ArrayList<>();
		if (rawLines != null) {
			for (String raw : rawLines) {
				lines.add(new Line(lines.size(), raw));
			}
		}
		return new Document(sourceName, lines);
	}

	public int size() {
		return lines.size();
	}

	public String text(int lineIndex) {
		if (lineIndex < 0 || lineIndex >= lines.size()) {
			return "";
		}
		return lines.get(lineIndex).text();
	}

	public boolean isReadable() {
		return lines.stream().anyMatch(line -> !line.isBlank());
	}
}
