package my.statementfusion.app.strategy;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.IdentifierMatch;
import my.statementfusion.app.model.PlausibilityBand;
import my.statementfusion.app.model.StrategyProposal;
import my.statementfusion.app.model.ValueCandidate;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores every candidate inside a symmetric window of lines around the identifier.
 * <pre>
 * score      = 0.5 * inBand + 0.3 * grammarConfidence + 0.2 * proximity
 * proximity  = 1 - distance / (window + 1)
 * confidence = 0.3 + 0.4 * score
 * </pre>
 * {@code inBand} is 1 when the value lies in the plausible band and is not year-like. Lines
 * that sit closer to a different identifier are left to that identifier.
 */
public class ContextWindowStrategy extends PerIdentifierStrategy {
	public static final String NAME = "context-window";
	public static final int DEFAULT_WINDOW_LINES = 3;

	private final int windowLines;
	private final PlausibilityBand band;

	public ContextWindowStrategy() {
		this(DEFAULT_WINDOW_LINES, PlausibilityBand.DEFAULT);
	}

	public ContextWindowStrategy(int windowLines, PlausibilityBand band) {
		this.windowLines = Math.max(0, windowLines);
		this.band = band == null ? PlausibilityBand.DEFAULT : band;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	protected Optional<StrategyProposal> proposeFor(IdentifierMatch match, CandidateIndex candidates,
													List<IdentifierMatch> allMatches, Document document) {
		int anchor = match.lineIndex();
		List<ScoredCandidate> scored = candidates.within(anchor - windowLines, anchor + windowLines).stream()
				.filter(candidate -> !closerToOtherIdentifier(candidate.lineIndex(), match, allMatches))
				.map(candidate -> new ScoredCandidate(candidate, score(candidate, anchor, windowLines, band)))
				.toList();
		if (scored.isEmpty()) {
			return Optional.empty();
		}
		Comparator<ValueCandidate> ranking = CandidateRanking.relativeTo(anchor);
		ScoredCandidate best = scored.stream()
				.min(Comparator.comparingDouble(ScoredCandidate::score).reversed()
						.thenComparing(ScoredCandidate::candidate, ranking))
				.orElseThrow();
		return Optional.of(new StrategyProposal(
				match.code(),
				best.candidate().numericValue(),
				confidence(best.score()),
				NAME,
				best.candidate().lineIndex(),
				String.format(Locale.ROOT, "best of %d candidates within %d lines, score %.2f: %s",
						scored.size(), windowLines, best.score(), describe(best.candidate()))
		));
	}

	static double score(ValueCandidate candidate, int anchorLine, int windowLines, PlausibilityBand band) {
		double inBand = band.contains(candidate.numericValue()) && !CandidateRanking.isYearLike(candidate) ? 1.0 : 0.0;
		double grammar = candidate.localeFormat().grammarConfidence();
		double proximity = 1.0 - (double) candidate.lineDistance(anchorLine) / (windowLines + 1);
		return 0.5 * inBand + 0.3 * grammar + 0.2 * Math.max(0.0, proximity);
	}

	static double confidence(double score) {
		return 0.3 + 0.4 * score;
	}

	private record ScoredCandidate(ValueCandidate candidate, double score) {
	}
}
