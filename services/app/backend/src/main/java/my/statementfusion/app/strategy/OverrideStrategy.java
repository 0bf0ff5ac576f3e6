package my.statementfusion.app.strategy;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.IdentifierMatch;
import my.statementfusion.app.model.StrategyProposal;
import my.statementfusion.app.model.ValueCandidate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Emits externally supplied values for the identifiers that actually occur in the document.
 */
public class OverrideStrategy implements ExtractionStrategy {
	public static final String NAME = "override";
	static final double CONFIDENCE = 1.0;

	private final Map<String, BigDecimal> overrides;

	public OverrideStrategy(Map<String, BigDecimal> overrides) {
		Map<String, BigDecimal> copy = new LinkedHashMap<>();
		if (overrides != null) {
			overrides.forEach((code, value) -> {
				if (code != null && value != null) {
					copy.put(code.trim().toUpperCase(Locale.ROOT), value);
				}
			});
		}
		this.overrides = Map.copyOf(copy);
	}

	@Override
	public String name() {
		return NAME;
	}

	public boolean isEmpty() {
		return overrides.isEmpty();
	}

	@Override
	public List<StrategyProposal> propose(List<IdentifierMatch> identifierMatches,
										  List<ValueCandidate> valueCandidates,
										  Document document) {
		if (identifierMatches == null) {
			return List.of();
		}
		Set<String> seen = new LinkedHashSet<>();
		List<StrategyProposal> proposals = new ArrayList<>();
		for (IdentifierMatch match : identifierMatches) {
			BigDecimal value = overrides.get(match.code());
			if (value != null && seen.add(match.code())) {
				proposals.add(new StrategyProposal(match.code(), value, CONFIDENCE, NAME, match.lineIndex(),
						"externally supplied value"));
			}
		}
		return proposals;
	}
}
