package my.statementfusion.app.strategy;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.IdentifierMatch;
import my.statementfusion.app.model.StrategyProposal;
import my.statementfusion.app.model.ValueCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every strategy against the same read-only inputs on a bounded pool. A strategy that
 * throws or exceeds its time budget contributes nothing and is reported by name; the others
 * are unaffected.
 * <p>
 * Strategies sharing a name are configured variants of one heuristic (for example two window
 * sizes). Their proposals are merged, keeping the best proposal per identifier.
 */
public class StrategyRunner {
	private static final Logger logger = LoggerFactory.getLogger(StrategyRunner.class);

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

	private final ExecutorService executor;
	private final Duration timeout;

	public StrategyRunner(ExecutorService executor, Duration timeout) {
		if (executor == null) {
			throw new IllegalArgumentException("Strategy executor is required");
		}
		this.executor = executor;
		this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
	}

	public StrategyRunResult run(List<ExtractionStrategy> strategies,
								 List<IdentifierMatch> identifierMatches,
								 List<ValueCandidate> valueCandidates,
								 Document document) {
		List<IdentifierMatch> matches = List.copyOf(identifierMatches);
		List<ValueCandidate> candidates = List.copyOf(valueCandidates);
		Set<String> knownCodes = new HashSet<>();
		matches.forEach(match -> knownCodes.add(match.code()));

		List<Map.Entry<String, Future<List<StrategyProposal>>>> futures = new ArrayList<>();
		List<String> failed = new ArrayList<>();
		for (ExtractionStrategy strategy : strategies) {
			try {
				futures.add(Map.entry(strategy.name(),
						executor.submit(() -> strategy.propose(matches, candidates, document))));
			} catch (RejectedExecutionException ex) {
				logger.warn("Strategy {} could not be scheduled: {}", strategy.name(), ex.getMessage());
				failed.add(strategy.name());
			}
		}

		long deadline = System.nanoTime() + timeout.toNanos();
		Map<String, List<StrategyProposal>> byStrategy = new LinkedHashMap<>();
		for (Map.Entry<String, Future<List<StrategyProposal>>> entry : futures) {
			String name = entry.getKey();
			Future<List<StrategyProposal>> future = entry.getValue();
			try {
				long remaining = Math.max(0L, deadline - System.nanoTime());
				List<StrategyProposal> proposals = future.get(remaining, TimeUnit.NANOSECONDS);
				List<StrategyProposal> sanitized = sanitize(name, proposals, knownCodes);
				byStrategy.merge(name, sanitized, (earlier, later) -> {
					List<StrategyProposal> combined = new ArrayList<>(earlier);
					combined.addAll(later);
					return sanitize(name, combined, knownCodes);
				});
			} catch (ExecutionException ex) {
				logger.warn("Strategy {} failed: {}", name, String.valueOf(ex.getCause()), ex.getCause());
				failed.add(name);
			} catch (TimeoutException ex) {
				future.cancel(true);
				logger.warn("Strategy {} timed out after {} ms", name, timeout.toMillis());
				failed.add(name);
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				future.cancel(true);
				logger.warn("Interrupted while waiting for strategy {}", name);
				failed.add(name);
			}
		}
		return new StrategyRunResult(byStrategy, failed);
	}

	static List<StrategyProposal> sanitize(String strategyName, List<StrategyProposal> proposals, Set<String> knownCodes) {
		if (proposals == null || proposals.isEmpty()) {
			return List.of();
		}
		Map<String, StrategyProposal> best = new LinkedHashMap<>();
		for (StrategyProposal proposal : proposals) {
			if (proposal == null || proposal.value() == null || !knownCodes.contains(proposal.identifierCode())) {
				continue;
			}
			StrategyProposal named = strategyName.equals(proposal.strategyName())
					? proposal
					: proposal.withStrategyName(strategyName);
			best.merge(named.identifierCode(), named, CandidateRanking::preferProposal);
		}
		return List.copyOf(best.values());
	}
}
