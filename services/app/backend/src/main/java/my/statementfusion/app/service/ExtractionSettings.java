package my.statementfusion.app.service;

import my.statementfusion.app.config.AppProperties;
import my.statementfusion.app.extraction.ValueCandidateExtractor;
import my.statementfusion.app.fusion.FusionPolicy;
import my.statementfusion.app.fusion.ResultValidator;
import my.statementfusion.app.model.PlausibilityBand;
import my.statementfusion.app.strategy.CompoundTemplate;
import my.statementfusion.app.strategy.CompoundTemplateStrategy;
import my.statementfusion.app.strategy.ContextWindowStrategy;
import my.statementfusion.app.strategy.FixedOffsetStrategy;
import my.statementfusion.app.strategy.RowAdjacencyStrategy;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolved extraction configuration. Every missing property falls back to its default here
 * and nowhere else.
 */
public record ExtractionSettings(
		PlausibilityBand band,
		BigDecimal minCandidateValue,
		boolean checksumValidation,
		int fixedOffset,
		boolean fixedOffsetValidated,
		int contextWindowLines,
		int rowContinuationLines,
		int templateLinesBefore,
		int templateLinesAfter,
		List<CompoundTemplate> templates,
		FusionPolicy fusionPolicy,
		double outOfBandCap,
		double shortfallThreshold
) {
	public ExtractionSettings {
		band = band == null ? PlausibilityBand.DEFAULT : band;
		minCandidateValue = minCandidateValue == null ? ValueCandidateExtractor.DEFAULT_MIN_ABSOLUTE_VALUE : minCandidateValue;
		templates = templates == null || templates.isEmpty() ? CompoundTemplate.DEFAULTS : List.copyOf(templates);
		fusionPolicy = fusionPolicy == null ? FusionPolicy.DEFAULT : fusionPolicy;
	}

	public static ExtractionSettings defaults() {
		return from(null);
	}

	public static ExtractionSettings from(AppProperties.Extraction raw) {
		if (raw == null) {
			raw = new AppProperties.Extraction(null, null, null, null, null, null, null, null, null, null, null,
					null, null, null, null, null);
		}
		PlausibilityBand band = new PlausibilityBand(raw.minValue(), raw.maxValue());
		List<CompoundTemplate> templates = new ArrayList<>();
		if (raw.templates() != null) {
			for (AppProperties.Extraction.Template template : raw.templates()) {
				templates.add(CompoundTemplate.of(template.name(), template.pattern()));
			}
		}
		FusionPolicy policy = new FusionPolicy(
				raw.priority(),
				FusionPolicy.DEFAULT_ABSOLUTE_TOLERANCE,
				FusionPolicy.DEFAULT_RELATIVE_TOLERANCE,
				valueOr(raw.singleSourcePenalty(), FusionPolicy.DEFAULT_SINGLE_SOURCE_PENALTY),
				valueOr(raw.ambiguityThreshold(), FusionPolicy.DEFAULT_AMBIGUITY_THRESHOLD)
		);
		return new ExtractionSettings(
				band,
				raw.minCandidateValue(),
				Boolean.TRUE.equals(raw.checksumValidation()),
				valueOr(raw.fixedOffset(), FixedOffsetStrategy.DEFAULT_OFFSET),
				Boolean.TRUE.equals(raw.fixedOffsetValidated()),
				valueOr(raw.contextWindowLines(), ContextWindowStrategy.DEFAULT_WINDOW_LINES),
				valueOr(raw.rowContinuationLines(), RowAdjacencyStrategy.DEFAULT_CONTINUATION_LINES),
				valueOr(raw.templateLinesBefore(), CompoundTemplateStrategy.DEFAULT_LINES_BEFORE),
				valueOr(raw.templateLinesAfter(), CompoundTemplateStrategy.DEFAULT_LINES_AFTER),
				templates,
				policy,
				valueOr(raw.outOfBandCap(), ResultValidator.DEFAULT_OUT_OF_BAND_CAP),
				valueOr(raw.shortfallThreshold(), ResultValidator.DEFAULT_SHORTFALL_THRESHOLD)
		);
	}

	public ExtractionSettings withFixedOffset(int offset, boolean validated) {
		return new ExtractionSettings(band, minCandidateValue, checksumValidation, offset, validated,
				contextWindowLines, rowContinuationLines, templateLinesBefore, templateLinesAfter, templates,
				fusionPolicy, outOfBandCap, shortfallThreshold);
	}

	private static int valueOr(Integer value, int fallback) {
		return value == null ? fallback : value;
	}

	private static double valueOr(Double value, double fallback) {
		return value == null ? fallback : value;
	}
}
