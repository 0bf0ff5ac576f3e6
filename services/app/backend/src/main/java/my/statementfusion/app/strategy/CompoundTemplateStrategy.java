package my.statementfusion.app.strategy;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.IdentifierMatch;
import my.statementfusion.app.model.PlausibilityBand;
import my.statementfusion.app.model.StrategyProposal;
import my.statementfusion.app.model.ValueCandidate;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class CompoundTemplateStrategy extends PerIdentifierStrategy {
	public static final String NAME = "compound-template";
	public static final int DEFAULT_LINES_BEFORE = 2;
	public static final int DEFAULT_LINES_AFTER = 4;
	static final double EXACT_CONFIDENCE = 0.8;
	static final double CROSS_CHECKED_CONFIDENCE = 0.9;
	private static final BigDecimal HUNDRED = new BigDecimal("100");
	private static final BigDecimal CROSS_CHECK_TOLERANCE = new BigDecimal("0.02");

	private final List<CompoundTemplate> templates;
	private final int linesBefore;
	private final int linesAfter;
	private final PlausibilityBand band;

	public CompoundTemplateStrategy() {
		this(CompoundTemplate.DEFAULTS, DEFAULT_LINES_BEFORE, DEFAULT_LINES_AFTER, PlausibilityBand.DEFAULT);
	}

	public CompoundTemplateStrategy(List<CompoundTemplate> templates, int linesBefore, int linesAfter,
									PlausibilityBand band) {
		this.templates = templates == null || templates.isEmpty() ? CompoundTemplate.DEFAULTS : List.copyOf(templates);
		this.linesBefore = Math.max(0, linesBefore);
		this.linesAfter = Math.max(0, linesAfter);
		this.band = band == null ? PlausibilityBand.DEFAULT : band;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	protected Optional<StrategyProposal> proposeFor(IdentifierMatch match, CandidateIndex candidates,
													List<IdentifierMatch> allMatches, Document document) {
		for (int line : searchOrder(match.lineIndex())) {
			if (line < 0 || line >= document.size() || closerToOtherIdentifier(line, match, allMatches)) {
				continue;
			}
			for (CompoundTemplate template : templates) {
				for (CompoundTemplate.Decomposition decomposition : template.decompose(document.text(line))) {
					if (!band.contains(decomposition.value())) {
						continue;
					}
					List<ValueCandidate> nominals = candidates.within(match.lineIndex() - linesBefore,
							match.lineIndex() + linesAfter);
					return Optional.of(toProposal(match, line, template, decomposition, nominals));
				}
			}
		}
		return Optional.empty();
	}

	private StrategyProposal toProposal(IdentifierMatch match, int line, CompoundTemplate template,
										CompoundTemplate.Decomposition decomposition, List<ValueCandidate> nominals) {
		Optional<String> crossCheck = crossCheck(decomposition, nominals);
		double confidence = crossCheck.isPresent() ? CROSS_CHECKED_CONFIDENCE : EXACT_CONFIDENCE;
		String reasoning = "template " + template.name() + " decomposed '" + decomposition.matched()
				+ "' on line " + line + " into value " + decomposition.value().toPlainString()
				+ crossCheck.map(check -> "; " + check).orElse("");
		return new StrategyProposal(match.code(), decomposition.value(), confidence, NAME, line, reasoning);
	}

	/**
	 * Bond positions are quoted in percent of nominal, so a nominal amount nearby that satisfies
	 * {@code nominal * multiplier / 100 ~ value} confirms the decomposition.
	 */
	static Optional<String> crossCheck(CompoundTemplate.Decomposition decomposition, List<ValueCandidate> nominals) {
		BigDecimal value = decomposition.value();
		BigDecimal allowed = value.abs().multiply(CROSS_CHECK_TOLERANCE);
		for (BigDecimal multiplier : decomposition.multipliers()) {
			for (ValueCandidate nominal : nominals) {
				BigDecimal expected = nominal.numericValue().multiply(multiplier).divide(HUNDRED, MathContext.DECIMAL64);
				if (expected.subtract(value).abs().compareTo(allowed) <= 0) {
					return Optional.of("nominal " + nominal.raw() + " x " + multiplier.toPlainString() + "% matches");
				}
			}
		}
		return Optional.empty();
	}

	private List<Integer> searchOrder(int anchor) {
		List<Integer> order = new ArrayList<>();
		order.add(anchor);
		int maxDistance = Math.max(linesBefore, linesAfter);
		for (int distance = 1; distance <= maxDistance; distance++) {
			if (distance <= linesBefore) {
				order.add(anchor - distance);
			}
			if (distance <= linesAfter) {
				order.add(anchor + distance);
			}
		}
		return order;
	}
}
