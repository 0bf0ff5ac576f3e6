package my.statementfusion.app.strategy;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.IdentifierMatch;
import my.statementfusion.app.model.StrategyProposal;
import my.statementfusion.app.model.ValueCandidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Takes the value at a constant line offset from the identifier. The offset is a property of
 * the document family; only an offset validated against known values (see
 * {@link FixedOffsetCalibrator}) earns a high confidence. A miss falls back to the neighbouring
 * lines at a reduced confidence.
 */
public class FixedOffsetStrategy extends PerIdentifierStrategy {
	public static final String NAME = "fixed-offset";
	public static final int DEFAULT_OFFSET = 0;
	static final double VALIDATED_CONFIDENCE = 0.85;
	static final double UNVALIDATED_CONFIDENCE = 0.6;
	static final double MISS_FACTOR = 0.6;

	private final int offset;
	private final boolean validated;

	public FixedOffsetStrategy() {
		this(DEFAULT_OFFSET, false);
	}

	public FixedOffsetStrategy(int offset, boolean validated) {
		this.offset = offset;
		this.validated = validated;
	}

	@Override
	public String name() {
		return NAME;
	}

	public int offset() {
		return offset;
	}

	public boolean validated() {
		return validated;
	}

	@Override
	protected Optional<StrategyProposal> proposeFor(IdentifierMatch match, CandidateIndex candidates,
													List<IdentifierMatch> allMatches, Document document) {
		double base = validated ? VALIDATED_CONFIDENCE : UNVALIDATED_CONFIDENCE;
		int target = match.lineIndex() + offset;
		Optional<ValueCandidate> exact = CandidateRanking.best(candidates.onLine(target), match.lineIndex());
		if (exact.isPresent()) {
			return Optional.of(toProposal(match, exact.get(), base,
					"value at offset " + offset + ": " + describe(exact.get())));
		}
		List<ValueCandidate> neighbours = new ArrayList<>(candidates.onLine(target - 1));
		neighbours.addAll(candidates.onLine(target + 1));
		return CandidateRanking.best(neighbours, target)
				.map(candidate -> toProposal(match, candidate, base * MISS_FACTOR,
						"offset " + offset + " missed, nearest line used: " + describe(candidate)));
	}

	private StrategyProposal toProposal(IdentifierMatch match, ValueCandidate candidate, double confidence,
										String reasoning) {
		return new StrategyProposal(match.code(), candidate.numericValue(), confidence, NAME,
				candidate.lineIndex(), reasoning);
	}
}
