package my.statementfusion.app.fusion;

import my.statementfusion.app.strategy.CompoundTemplateStrategy;
import my.statementfusion.app.strategy.ContextWindowStrategy;
import my.statementfusion.app.strategy.FixedOffsetStrategy;
import my.statementfusion.app.strategy.OverrideStrategy;
import my.statementfusion.app.strategy.RowAdjacencyStrategy;

import java.math.BigDecimal;
import java.util.List;

public record FusionPolicy(
		List<String> priority,
		BigDecimal absoluteTolerance,
		BigDecimal relativeTolerance,
		double singleSourcePenalty,
		double ambiguityThreshold
) {
	public static final List<String> DEFAULT_PRIORITY = List.of(
			OverrideStrategy.NAME,
			FixedOffsetStrategy.NAME,
			CompoundTemplateStrategy.NAME,
			RowAdjacencyStrategy.NAME,
			ContextWindowStrategy.NAME
	);
	public static final BigDecimal DEFAULT_ABSOLUTE_TOLERANCE = new BigDecimal("0.01");
	public static final BigDecimal DEFAULT_RELATIVE_TOLERANCE = new BigDecimal("0.001");
	public static final double DEFAULT_SINGLE_SOURCE_PENALTY = 0.1;
	public static final double DEFAULT_AMBIGUITY_THRESHOLD = 0.6;

	public static final FusionPolicy DEFAULT = new FusionPolicy(DEFAULT_PRIORITY, DEFAULT_ABSOLUTE_TOLERANCE,
			DEFAULT_RELATIVE_TOLERANCE, DEFAULT_SINGLE_SOURCE_PENALTY, DEFAULT_AMBIGUITY_THRESHOLD);

	public FusionPolicy {
		priority = priority == null || priority.isEmpty() ? DEFAULT_PRIORITY : List.copyOf(priority);
		absoluteTolerance = absoluteTolerance == null ? DEFAULT_ABSOLUTE_TOLERANCE : absoluteTolerance;
		relativeTolerance = relativeTolerance == null ? DEFAULT_RELATIVE_TOLERANCE : relativeTolerance;
		if (singleSourcePenalty < 0.0 || singleSourcePenalty >= 1.0) {
			throw new IllegalArgumentException("Single source penalty must be in [0, 1): " + singleSourcePenalty);
		}
		if (ambiguityThreshold < 0.0 || ambiguityThreshold > 1.0) {
			throw new IllegalArgumentException("Ambiguity threshold must be in [0, 1]: " + ambiguityThreshold);
		}
	}

	public int rankOf(String strategyName) {
		int rank = priority.indexOf(FusionEngine.baseName(strategyName));
		return rank < 0 ? priority.size() : rank;
	}

	public boolean agree(BigDecimal left, BigDecimal right) {
		BigDecimal magnitude = left.abs().max(right.abs());
		BigDecimal tolerance = absoluteTolerance.max(magnitude.multiply(relativeTolerance));
		return left.subtract(right).abs().compareTo(tolerance) <= 0;
	}
}
