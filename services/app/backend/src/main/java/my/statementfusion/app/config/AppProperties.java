package my.statementfusion.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Extraction extraction,
		@Valid Runner runner,
		@Valid Sources sources,
		@Valid Cli cli
) {
	public record Extraction(
			@DecimalMin("0") BigDecimal minValue,
			@DecimalMin("0") BigDecimal maxValue,
			@DecimalMin("0") BigDecimal minCandidateValue,
			Boolean checksumValidation,
			Integer fixedOffset,
			Boolean fixedOffsetValidated,
			@Min(0) Integer contextWindowLines,
			@Min(0) Integer rowContinuationLines,
			@Min(0) Integer templateLinesBefore,
			@Min(0) Integer templateLinesAfter,
			List<@Valid Template> templates,
			List<String> priority,
			@DecimalMin("0.0") @DecimalMax(value = "1.0", inclusive = false) Double singleSourcePenalty,
			@DecimalMin("0.0") @DecimalMax("1.0") Double ambiguityThreshold,
			@DecimalMin("0.0") @DecimalMax("1.0") Double outOfBandCap,
			@DecimalMin("0.0") @DecimalMax("1.0") Double shortfallThreshold
	) {
		public record Template(
				@NotBlank String name,
				@NotBlank String pattern
		) {
		}
	}

	public record Runner(
			@Min(1) @Max(64) Integer strategyThreads,
			Duration strategyTimeout
	) {
	}

	public record Sources(
			@Min(1) @Max(16) Integer threads,
			@Min(1) @Max(10) Integer maxAttempts,
			Duration initialBackoff,
			Duration maxBackoff,
			Duration attemptTimeout
	) {
	}

	public record Cli(
			String input,
			String overrides,
			BigDecimal expectedTotal,
			String output,
			String calibrationReference,
			String calibrationValues,
			@Min(0) @Max(10) Integer calibrationMaxOffset
	) {
	}
}
