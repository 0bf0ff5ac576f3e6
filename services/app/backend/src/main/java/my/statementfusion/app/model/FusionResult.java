package my.statementfusion.app.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public record FusionResult(
		List<SecurityRecord> records,
		BigDecimal totalValue,
		int recordCount,
		Double accuracyAgainstExpected,
		boolean validationShortfall,
		List<String> failedStrategies
) {
	public FusionResult {
		records = records == null ? List.of() : List.copyOf(records);
		totalValue = totalValue == null ? BigDecimal.ZERO : totalValue;
		failedStrategies = failedStrategies == null ? List.of() : List.copyOf(failedStrategies);
	}

	public Optional<SecurityRecord> find(String identifierCode) {
		return records.stream().filter(record -> record.identifierCode().equals(identifierCode)).findFirst();
	}

	public long resolvedCount() {
		return records.stream().filter(SecurityRecord::hasValue).count();
	}
}
