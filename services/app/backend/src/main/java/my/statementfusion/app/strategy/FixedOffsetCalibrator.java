package my.statementfusion.app.strategy;

import my.statementfusion.app.model.IdentifierMatch;
import my.statementfusion.app.model.ValueCandidate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Learns the line offset between identifiers and their values from a reference document whose
 * values are known, so a document family can be configured with a validated offset.
 */
public final class FixedOffsetCalibrator {
	private static final BigDecimal TOLERANCE = new BigDecimal("0.01");

	private FixedOffsetCalibrator() {
	}

	public static OptionalInt calibrate(List<IdentifierMatch> matches, List<ValueCandidate> candidates,
										Map<String, BigDecimal> knownValues, int maxOffset) {
		if (matches == null || knownValues == null || knownValues.isEmpty()) {
			return OptionalInt.empty();
		}
		CandidateIndex index = CandidateIndex.of(candidates);
		int bestOffset = 0;
		int bestHits = 0;
		int range = Math.max(0, maxOffset);
		for (int distance = 0; distance <= range; distance++) {
			for (int offset : distance == 0 ? new int[]{0} : new int[]{distance, -distance}) {
				int hits = countHits(matches, index, knownValues, offset);
				if (hits > bestHits) {
					bestHits = hits;
					bestOffset = offset;
				}
			}
		}
		return bestHits == 0 ? OptionalInt.empty() : OptionalInt.of(bestOffset);
	}

	private static int countHits(List<IdentifierMatch> matches, CandidateIndex index,
								 Map<String, BigDecimal> knownValues, int offset) {
		int hits = 0;
		for (IdentifierMatch match : matches) {
			BigDecimal known = knownValues.get(match.code());
			if (known == null) {
				continue;
			}
			boolean found = index.onLine(match.lineIndex() + offset).stream()
					.anyMatch(candidate -> candidate.numericValue().subtract(known).abs().compareTo(TOLERANCE) <= 0);
			if (found) {
				hits++;
			}
		}
		return hits;
	}
}
