package my.statementfusion.app.model;

import java.math.BigDecimal;

public record ValueCandidate(
		String raw,
		BigDecimal numericValue,
		LocaleFormat localeFormat,
		int lineIndex,
		Integer columnHint,
		int startOffset
) {
	public BigDecimal magnitude() {
		return numericValue.abs();
	}

	public int lineDistance(int otherLineIndex) {
		return Math.abs(lineIndex - otherLineIndex);
	}
}
