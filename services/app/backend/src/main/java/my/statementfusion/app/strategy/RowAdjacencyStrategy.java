package my.statementfusion.app.strategy;

import my.statementfusion.app.extraction.ColumnSplitter;
import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.IdentifierMatch;
import my.statementfusion.app.model.PlausibilityBand;
import my.statementfusion.app.model.StrategyProposal;
import my.statementfusion.app.model.ValueCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Treats each identifier occurrence as the start of a table row and learns which column,
 * counted from the right, holds the market value across all rows of the document.
 */
public class RowAdjacencyStrategy implements ExtractionStrategy {
	private static final Logger logger = LoggerFactory.getLogger(RowAdjacencyStrategy.class);

	public static final String NAME = "row-adjacency";
	public static final int DEFAULT_CONTINUATION_LINES = 2;
	static final double BASE_CONFIDENCE = 0.4;
	static final double REGULARITY_WEIGHT = 0.3;

	private final int continuationLines;
	private final PlausibilityBand band;

	public RowAdjacencyStrategy() {
		this(DEFAULT_CONTINUATION_LINES, PlausibilityBand.DEFAULT);
	}

	public RowAdjacencyStrategy(int continuationLines, PlausibilityBand band) {
		this.continuationLines = Math.max(0, continuationLines);
		this.band = band == null ? PlausibilityBand.DEFAULT : band;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public List<StrategyProposal> propose(List<IdentifierMatch> identifierMatches,
										  List<ValueCandidate> valueCandidates,
										  Document document) {
		if (identifierMatches == null || identifierMatches.isEmpty()) {
			return List.of();
		}
		CandidateIndex index = CandidateIndex.of(valueCandidates);
		Set<Integer> identifierLines = new HashSet<>();
		for (IdentifierMatch match : identifierMatches) {
			identifierLines.add(match.lineIndex());
		}

		List<Row> rows = new ArrayList<>();
		for (IdentifierMatch match : identifierMatches) {
			rows.add(buildRow(match, index, identifierLines, document));
		}

		Map<Integer, Integer> votes = new TreeMap<>();
		int votingRows = 0;
		for (Row row : rows) {
			Optional<SlottedCandidate> largest = row.cells().stream()
					.max(Comparator.comparing(cell -> cell.candidate().magnitude()));
			if (largest.isPresent()) {
				votes.merge(largest.get().slot(), 1, Integer::sum);
				votingRows++;
			}
		}
		if (votingRows == 0) {
			return List.of();
		}
		int dominantSlot = dominant(votes);
		double regularity = votes.get(dominantSlot) / (double) votingRows;
		logger.debug("Row adjacency learned value slot {} from the right with regularity {}", dominantSlot, regularity);

		List<StrategyProposal> proposals = new ArrayList<>();
		for (Row row : rows) {
			pick(row, dominantSlot, regularity).ifPresent(proposals::add);
		}
		return PerIdentifierStrategy.bestPerIdentifier(proposals);
	}

	private Row buildRow(IdentifierMatch match, CandidateIndex index, Set<Integer> identifierLines, Document document) {
		List<SlottedCandidate> cells = new ArrayList<>();
		int last = Math.min(document.size() - 1, match.lineIndex() + continuationLines);
		for (int line = match.lineIndex(); line <= last; line++) {
			if (line != match.lineIndex() && identifierLines.contains(line)) {
				break;
			}
			List<ValueCandidate> onLine = index.onLine(line);
			int columnCount = ColumnSplitter.split(document.text(line)).size();
			for (ValueCandidate candidate : onLine) {
				if (!band.contains(candidate.numericValue())) {
					continue;
				}
				cells.add(new SlottedCandidate(candidate, slotFromRight(candidate, onLine, columnCount)));
			}
		}
		return new Row(match, cells);
	}

	static int slotFromRight(ValueCandidate candidate, List<ValueCandidate> lineCandidates, int columnCount) {
		if (candidate.columnHint() != null && columnCount >= 2 && candidate.columnHint() < columnCount) {
			return columnCount - 1 - candidate.columnHint();
		}
		int slot = 0;
		for (ValueCandidate other : lineCandidates) {
			if (other.startOffset() > candidate.startOffset()) {
				slot++;
			}
		}
		return slot;
	}

	private static int dominant(Map<Integer, Integer> votes) {
		int best = -1;
		int bestVotes = -1;
		// TreeMap iteration keeps the rightmost slot on ties
		for (Map.Entry<Integer, Integer> entry : votes.entrySet()) {
			if (entry.getValue() > bestVotes) {
				best = entry.getKey();
				bestVotes = entry.getValue();
			}
		}
		return best;
	}

	private Optional<StrategyProposal> pick(Row row, int dominantSlot, double regularity) {
		IdentifierMatch match = row.match();
		List<ValueCandidate> aligned = row.cells().stream()
				.filter(cell -> cell.slot() == dominantSlot)
				.map(SlottedCandidate::candidate)
				.toList();
		Optional<ValueCandidate> alignedPick = CandidateRanking.best(aligned, match.lineIndex());
		if (alignedPick.isPresent()) {
			ValueCandidate candidate = alignedPick.get();
			double confidence = BASE_CONFIDENCE + REGULARITY_WEIGHT * regularity;
			return Optional.of(new StrategyProposal(match.code(), candidate.numericValue(), confidence, NAME,
					candidate.lineIndex(), String.format(Locale.ROOT,
					"column %d from the right (regularity %.2f): %s", dominantSlot, regularity,
					PerIdentifierStrategy.describe(candidate))));
		}
		return row.cells().stream()
				.map(SlottedCandidate::candidate)
				.max(Comparator.comparing(ValueCandidate::magnitude))
				.map(candidate -> new StrategyProposal(match.code(), candidate.numericValue(), BASE_CONFIDENCE, NAME,
						candidate.lineIndex(), "row does not follow the learned column " + dominantSlot
						+ ", largest value used: " + PerIdentifierStrategy.describe(candidate)));
	}

	private record Row(IdentifierMatch match, List<SlottedCandidate> cells) {
	}

	private record SlottedCandidate(ValueCandidate candidate, int slot) {
	}
}
