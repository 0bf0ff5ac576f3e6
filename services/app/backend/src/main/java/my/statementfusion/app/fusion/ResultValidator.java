package my.statementfusion.app.fusion;

import my.statementfusion.app.model.FusionResult;
import my.statementfusion.app.model.PlausibilityBand;
import my.statementfusion.app.model.SecurityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Computes the statement total and flags implausible values. Validation never blocks a
 * result; a shortfall against the expected total is only reported.
 */
public class ResultValidator {
	private static final Logger logger = LoggerFactory.getLogger(ResultValidator.class);

	public static final double DEFAULT_OUT_OF_BAND_CAP = 0.3;
	public static final double DEFAULT_SHORTFALL_THRESHOLD = 0.95;

	private final PlausibilityBand band;
	private final double outOfBandCap;
	private final double shortfallThreshold;

	public ResultValidator() {
		this(PlausibilityBand.DEFAULT, DEFAULT_OUT_OF_BAND_CAP, DEFAULT_SHORTFALL_THRESHOLD);
	}

	public ResultValidator(PlausibilityBand band, double outOfBandCap, double shortfallThreshold) {
		this.band = band == null ? PlausibilityBand.DEFAULT : band;
		this.outOfBandCap = outOfBandCap;
		this.shortfallThreshold = shortfallThreshold;
	}

	public PlausibilityBand band() {
		return band;
	}

	public FusionResult validate(List<SecurityRecord> records, BigDecimal expectedTotal, List<String> failedStrategies) {
		List<SecurityRecord> checked = new ArrayList<>();
		BigDecimal total = BigDecimal.ZERO;
		for (SecurityRecord record : records) {
			SecurityRecord current = record;
			if (record.hasValue()) {
				total = total.add(record.value());
				if (!band.contains(record.value())) {
					double confidence = FusionEngine.isOverride(record.winningStrategy())
							? record.confidence()
							: Math.min(record.confidence(), outOfBandCap);
					logger.debug("Value {} for {} is outside the plausible band", record.value(), record.identifierCode());
					current = record.flaggedOutOfBand(confidence);
				}
			}
			checked.add(current);
		}

		Double accuracy = null;
		boolean shortfall = false;
		if (expectedTotal != null) {
			accuracy = accuracy(total, expectedTotal);
			if (accuracy < shortfallThreshold) {
				shortfall = true;
				logger.info("Extracted total {} covers {} of expected total {}", total.toPlainString(),
						String.format(Locale.ROOT, "%.1f%%", accuracy * 100.0), expectedTotal.toPlainString());
			}
		}
		return new FusionResult(checked, total, checked.size(), accuracy, shortfall, failedStrategies);
	}

	public static double accuracy(BigDecimal total, BigDecimal expected) {
		BigDecimal smaller = total.min(expected);
		BigDecimal larger = total.max(expected);
		if (larger.signum() <= 0) {
			return total.compareTo(expected) == 0 ? 1.0 : 0.0;
		}
		if (smaller.signum() < 0) {
			return 0.0;
		}
		return smaller.divide(larger, MathContext.DECIMAL64).doubleValue();
	}
}
