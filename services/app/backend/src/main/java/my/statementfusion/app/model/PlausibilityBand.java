package my.statementfusion.app.model;

import java.math.BigDecimal;

public record PlausibilityBand(
		BigDecimal min,
		BigDecimal max
) {
	private static final BigDecimal DEFAULT_MIN = new BigDecimal("100");
	private static final BigDecimal DEFAULT_MAX = new BigDecimal("100000000");

	public static final PlausibilityBand DEFAULT = new PlausibilityBand(DEFAULT_MIN, DEFAULT_MAX);

	public PlausibilityBand {
		min = min == null ? DEFAULT_MIN : min;
		max = max == null ? DEFAULT_MAX : max;
		if (max.compareTo(min) < 0) {
			throw new IllegalArgumentException("Plausibility band max " + max + " is below min " + min);
		}
	}

	public boolean contains(BigDecimal value) {
		return value != null && value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
	}
}
