package my.statementfusion.app.model;

import java.math.BigDecimal;

public record StrategyProposal(
		String identifierCode,
		BigDecimal value,
		double confidence,
		String strategyName,
		int sourceLineIndex,
		String reasoning
) {
	public StrategyProposal {
		if (Double.isNaN(confidence)) {
			confidence = 0.0;
		}
		confidence = Math.max(0.0, Math.min(1.0, confidence));
		reasoning = reasoning == null ? "" : reasoning;
	}

	public StrategyProposal withStrategyName(String name) {
		return new StrategyProposal(identifierCode, value, confidence, name, sourceLineIndex, reasoning);
	}
}
