package my.statementfusion.app.model;

import java.math.BigDecimal;
import java.util.List;

public record SecurityRecord(
		String identifierCode,
		String name,
		BigDecimal value,
		String currency,
		double confidence,
		Integer sourceLineIndex,
		List<String> contributingStrategies,
		List<StrategyProposal> alternatives,
		boolean outOfBand,
		boolean ambiguous
) {
	public SecurityRecord {
		contributingStrategies = contributingStrategies == null ? List.of() : List.copyOf(contributingStrategies);
		alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
	}

	public static SecurityRecord unresolved(String identifierCode) {
		return new SecurityRecord(identifierCode, null, null, null, 0.0, null, List.of(), List.of(), false, false);
	}

	public boolean hasValue() {
		return value != null;
	}

	public boolean needsReview() {
		return value == null || outOfBand || ambiguous;
	}

	public String winningStrategy() {
		return contributingStrategies.isEmpty() ? null : contributingStrategies.get(0);
	}

	public SecurityRecord withDescription(String newName, String newCurrency) {
		return new SecurityRecord(identifierCode, newName, value, newCurrency, confidence, sourceLineIndex,
				contributingStrategies, alternatives, outOfBand, ambiguous);
	}

	public SecurityRecord flaggedOutOfBand(double cappedConfidence) {
		return new SecurityRecord(identifierCode, name, value, currency, cappedConfidence, sourceLineIndex,
				contributingStrategies, alternatives, true, ambiguous);
	}
}
