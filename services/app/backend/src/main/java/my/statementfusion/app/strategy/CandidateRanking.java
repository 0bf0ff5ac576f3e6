package my.statementfusion.app.strategy;

import my.statementfusion.app.model.LocaleFormat;
import my.statementfusion.app.model.StrategyProposal;
import my.statementfusion.app.model.ValueCandidate;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Tie-break shared by all strategies: the most constrained grammar first, then the smallest
 * line distance to the identifier, then the larger magnitude. Year-like integers only win
 * when nothing else qualifies.
 */
public final class CandidateRanking {
	private static final BigDecimal YEAR_MIN = new BigDecimal("1900");
	private static final BigDecimal YEAR_MAX = new BigDecimal("2100");

	private CandidateRanking() {
	}

	public static Comparator<ValueCandidate> relativeTo(int anchorLine) {
		return Comparator.comparingInt((ValueCandidate candidate) -> candidate.localeFormat().constraintRank())
				.thenComparingInt(candidate -> candidate.lineDistance(anchorLine))
				.thenComparing(ValueCandidate::magnitude, Comparator.reverseOrder())
				.thenComparingInt(ValueCandidate::lineIndex)
				.thenComparingInt(ValueCandidate::startOffset);
	}

	public static Optional<ValueCandidate> best(List<ValueCandidate> candidates, int anchorLine) {
		if (candidates == null || candidates.isEmpty()) {
			return Optional.empty();
		}
		List<ValueCandidate> preferred = candidates.stream().filter(candidate -> !isYearLike(candidate)).toList();
		List<ValueCandidate> pool = preferred.isEmpty() ? candidates : preferred;
		return pool.stream().min(relativeTo(anchorLine));
	}

	public static boolean isYearLike(ValueCandidate candidate) {
		if (candidate.localeFormat() != LocaleFormat.PLAIN || candidate.raw().length() != 4) {
			return false;
		}
		BigDecimal value = candidate.numericValue();
		return value.compareTo(YEAR_MIN) >= 0 && value.compareTo(YEAR_MAX) <= 0;
	}

	static StrategyProposal preferProposal(StrategyProposal current, StrategyProposal challenger) {
		if (challenger.confidence() > current.confidence()) {
			return challenger;
		}
		return current;
	}
}
