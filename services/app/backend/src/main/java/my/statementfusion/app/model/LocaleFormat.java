package my.statementfusion.app.model;

/**
 * Numeric grammar a value candidate was parsed with. The constraint rank orders grammars
 * from the least ambiguous (apostrophe grouping cannot be confused with a decimal mark) to
 * the most ambiguous; the grammar confidence feeds candidate scoring.
 */
public enum LocaleFormat {
	SWISS_APOSTROPHE(0, 1.0),
	EURO_COMMA(1, 0.9),
	US_COMMA(2, 0.85),
	PLAIN(3, 0.6);

	private final int constraintRank;
	private final double grammarConfidence;

	LocaleFormat(int constraintRank, double grammarConfidence) {
		this.constraintRank = constraintRank;
		this.grammarConfidence = grammarConfidence;
	}

	public int constraintRank() {
		return constraintRank;
	}

	public double grammarConfidence() {
		return grammarConfidence;
	}
}
