package my.statementfusion.app.strategy;

import my.statementfusion.app.model.ValueCandidate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

public final class CandidateIndex {
	private final NavigableMap<Integer, List<ValueCandidate>> byLine;

	private CandidateIndex(NavigableMap<Integer, List<ValueCandidate>> byLine) {
		this.byLine = byLine;
	}

	public static CandidateIndex of(Collection<ValueCandidate> candidates) {
		NavigableMap<Integer, List<ValueCandidate>> byLine = new TreeMap<>();
		if (candidates != null) {
			for (ValueCandidate candidate : candidates) {
				byLine.computeIfAbsent(candidate.lineIndex(), ignored -> new ArrayList<>()).add(candidate);
			}
		}
		return new CandidateIndex(byLine);
	}

	public List<ValueCandidate> onLine(int lineIndex) {
		return byLine.getOrDefault(lineIndex, List.of());
	}

	public List<ValueCandidate> within(int fromLine, int toLine) {
		if (toLine < fromLine) {
			return List.of();
		}
		List<ValueCandidate> out = new ArrayList<>();
		for (Map.Entry<Integer, List<ValueCandidate>> entry : byLine.subMap(fromLine, true, toLine, true).entrySet()) {
			out.addAll(entry.getValue());
		}
		return out;
	}
}
