package my.statementfusion.app.model;

public record Line(
		int index,
		String text,
		Integer page,
		BoundingBox boundingBox
) {
	public Line {
		text = text == null ? "" : text;
	}

	public Line(int index, String text) {
		this(index, text, null, null);
	}

	public boolean isBlank() {
		return text.isBlank();
	}
}
