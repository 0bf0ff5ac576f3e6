package my.statementfusion.app.model;

import java.math.BigDecimal;
import java.util.Map;

public record ExtractionRequest(
		Map<String, BigDecimal> overrides,
		BigDecimal expectedTotal
) {
	public ExtractionRequest {
		overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
	}

	public static ExtractionRequest empty() {
		return new ExtractionRequest(Map.of(), null);
	}

	public static ExtractionRequest withOverrides(Map<String, BigDecimal> overrides) {
		return new ExtractionRequest(overrides, null);
	}

	public static ExtractionRequest withExpectedTotal(BigDecimal expectedTotal) {
		return new ExtractionRequest(Map.of(), expectedTotal);
	}
}
