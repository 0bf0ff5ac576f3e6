package my.statementfusion.app.fusion;

import my.statementfusion.app.model.SecurityRecord;
import my.statementfusion.app.model.StrategyProposal;
import my.statementfusion.app.strategy.OverrideStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reconciles the proposals of all strategies into one record per identifier. The outcome
 * depends only on the set of proposals, never on the order they arrive in.
 */
public class FusionEngine {
	private static final Logger logger = LoggerFactory.getLogger(FusionEngine.class);
	private static final char SOURCE_SEPARATOR = '@';

	private final FusionPolicy policy;
	private final Comparator<StrategyProposal> order;

	public FusionEngine() {
		this(FusionPolicy.DEFAULT);
	}

	public FusionEngine(FusionPolicy policy) {
		this.policy = policy == null ? FusionPolicy.DEFAULT : policy;
		this.order = Comparator.comparingDouble(StrategyProposal::confidence).reversed()
				.thenComparingInt(proposal -> this.policy.rankOf(proposal.strategyName()))
				.thenComparing(StrategyProposal::strategyName)
				.thenComparing(StrategyProposal::value, Comparator.reverseOrder())
				.thenComparingInt(StrategyProposal::sourceLineIndex);
	}

	public FusionPolicy policy() {
		return policy;
	}

	/**
	 * @param identifierCodes every located code, in first-occurrence order; codes without
	 *                        proposals come back as unresolved records
	 */
	public List<SecurityRecord> fuse(Collection<String> identifierCodes, Collection<StrategyProposal> proposals) {
		Map<String, List<StrategyProposal>> grouped = new LinkedHashMap<>();
		Set<String> codes = new LinkedHashSet<>();
		if (identifierCodes != null) {
			codes.addAll(identifierCodes);
		}
		codes.forEach(code -> grouped.put(code, new ArrayList<>()));
		if (proposals != null) {
			for (StrategyProposal proposal : proposals) {
				if (proposal == null || proposal.value() == null) {
					continue;
				}
				grouped.computeIfAbsent(proposal.identifierCode(), ignored -> new ArrayList<>()).add(proposal);
			}
		}

		List<SecurityRecord> records = new ArrayList<>();
		for (Map.Entry<String, List<StrategyProposal>> entry : grouped.entrySet()) {
			records.add(fuseOne(entry.getKey(), entry.getValue()));
		}
		return records;
	}

	SecurityRecord fuseOne(String code, List<StrategyProposal> proposals) {
		if (proposals.isEmpty()) {
			logger.debug("No strategy proposed a value for {}", code);
			return SecurityRecord.unresolved(code);
		}
		List<StrategyProposal> sorted = new ArrayList<>(proposals);
		sorted.sort(order);
		StrategyProposal winner = sorted.get(0);

		List<String> contributing = new ArrayList<>();
		contributing.add(winner.strategyName());
		List<Double> agreeing = new ArrayList<>();
		agreeing.add(winner.confidence());
		boolean ambiguous = false;
		for (StrategyProposal other : sorted.subList(1, sorted.size())) {
			if (policy.agree(winner.value(), other.value())) {
				if (!contributing.contains(other.strategyName())) {
					contributing.add(other.strategyName());
					agreeing.add(other.confidence());
				}
			} else if (other.confidence() >= policy.ambiguityThreshold()) {
				ambiguous = true;
			}
		}

		double confidence = isOverride(winner.strategyName())
				? winner.confidence()
				: Math.min(winner.confidence(), noisyOr(agreeing) * (1.0 - policy.singleSourcePenalty()));
		if (ambiguous) {
			logger.info("Conflicting values for {}: {} won over a confident alternative", code, winner.strategyName());
		}
		return new SecurityRecord(code, null, winner.value(), null, confidence, winner.sourceLineIndex(),
				contributing, sorted.subList(1, sorted.size()), false, ambiguous);
	}

	static double noisyOr(List<Double> confidences) {
		double miss = 1.0;
		for (double confidence : confidences) {
			miss *= 1.0 - confidence;
		}
		return 1.0 - miss;
	}

	/**
	 * Tags a strategy name with the text source its proposal came from. Strategy names never
	 * contain the separator, so the first separator splits the tag even when the source name
	 * contains one.
	 */
	public static String tagged(String strategyName, String sourceName) {
		return strategyName + SOURCE_SEPARATOR + sourceName;
	}

	public static Optional<String> sourceName(String strategyName) {
		if (strategyName == null) {
			return Optional.empty();
		}
		int separator = strategyName.indexOf(SOURCE_SEPARATOR);
		return separator < 0 ? Optional.empty() : Optional.of(strategyName.substring(separator + 1));
	}

	public static String baseName(String strategyName) {
		if (strategyName == null) {
			return "";
		}
		int separator = strategyName.indexOf(SOURCE_SEPARATOR);
		return separator < 0 ? strategyName : strategyName.substring(0, separator);
	}

	public static boolean isOverride(String strategyName) {
		return OverrideStrategy.NAME.equals(baseName(strategyName));
	}
}
