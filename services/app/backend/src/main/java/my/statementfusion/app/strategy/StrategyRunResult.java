package my.statementfusion.app.strategy;

import my.statementfusion.app.model.StrategyProposal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record StrategyRunResult(
		Map<String, List<StrategyProposal>> proposalsByStrategy,
		List<String> failedStrategies
) {
	public StrategyRunResult {
		Map<String, List<StrategyProposal>> copy = new LinkedHashMap<>();
		if (proposalsByStrategy != null) {
			proposalsByStrategy.forEach((name, proposals) -> copy.put(name, List.copyOf(proposals)));
		}
		proposalsByStrategy = Collections.unmodifiableMap(copy);
		failedStrategies = failedStrategies == null ? List.of() : List.copyOf(failedStrategies);
	}

	public List<StrategyProposal> allProposals() {
		List<StrategyProposal> out = new ArrayList<>();
		proposalsByStrategy.values().forEach(out::addAll);
		return out;
	}
}
