package my.statementfusion.app.strategy;

import my.statementfusion.app.extraction.IdentifierLocator;
import my.statementfusion.app.extraction.ValueCandidateExtractor;
import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.IdentifierMatch;
import my.statementfusion.app.model.StrategyProposal;
import my.statementfusion.app.model.ValueCandidate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static my.statementfusion.app.strategy.StrategyTestSupport.document;
import static org.assertj.core.api.Assertions.assertThat;

class StrategyRunnerTest {
	private final ExecutorService executor = Executors.newFixedThreadPool(4);
	private final Document statement = document("Holding XS1234567890 USD 199'080.00");

	@AfterEach
	void shutdown() {
		executor.shutdownNow();
	}

	@Test
	void isolatesThrowingStrategy() {
		StrategyRunner runner = new StrategyRunner(executor, Duration.ofSeconds(5));

		StrategyRunResult result = run(runner, List.of(new FixedOffsetStrategy(), new ExplodingStrategy()));

		assertThat(result.failedStrategies()).containsExactly("exploding");
		assertThat(result.proposalsByStrategy()).containsOnlyKeys(FixedOffsetStrategy.NAME);
		assertThat(result.allProposals()).extracting(StrategyProposal::value)
				.usingElementComparator(BigDecimal::compareTo)
				.containsExactly(new BigDecimal("199080.00"));
	}

	@Test
	void reportsStrategyThatExceedsTimeout() {
		StrategyRunner runner = new StrategyRunner(executor, Duration.ofMillis(200));

		StrategyRunResult result = run(runner, List.of(new SlowStrategy(), new ContextWindowStrategy()));

		assertThat(result.failedStrategies()).containsExactly("slow");
		assertThat(result.proposalsByStrategy()).containsOnlyKeys(ContextWindowStrategy.NAME);
	}

	@Test
	void mergesVariantsSharingAName() {
		StrategyRunner runner = new StrategyRunner(executor, Duration.ofSeconds(5));
		Document distant = document(
				"Holding XS1234567890",
				"Goldman Sachs note",
				"maturity open end",
				"custody Zurich",
				"Market value 199'080.00");
		List<ExtractionStrategy> variants = List.of(
				new ContextWindowStrategy(6, null),
				new ContextWindowStrategy(1, null));

		StrategyRunResult result = runner.run(variants, new IdentifierLocator().locate(distant),
				new ValueCandidateExtractor().extract(distant), distant);

		assertThat(result.failedStrategies()).isEmpty();
		assertThat(result.proposalsByStrategy()).containsOnlyKeys(ContextWindowStrategy.NAME);
		assertThat(result.allProposals()).singleElement().satisfies(proposal -> {
			assertThat(proposal.value()).isEqualByComparingTo(new BigDecimal("199080.00"));
			assertThat(proposal.sourceLineIndex()).isEqualTo(4);
		});
	}

	@Test
	void sanitizeDropsUnknownCodesAndForcesStrategyName() {
		List<StrategyProposal> proposals = List.of(
				new StrategyProposal("XS1234567890", new BigDecimal("1"), 0.4, "other", 0, ""),
				new StrategyProposal("XS1234567890", new BigDecimal("2"), 0.5, "other", 0, ""),
				new StrategyProposal("US0378331005", new BigDecimal("3"), 0.9, "other", 0, ""),
				new StrategyProposal("XS1234567890", null, 0.9, "other", 0, ""));

		List<StrategyProposal> sanitized = StrategyRunner.sanitize("mine", proposals, Set.of("XS1234567890"));

		assertThat(sanitized).singleElement().satisfies(proposal -> {
			assertThat(proposal.value()).isEqualByComparingTo(new BigDecimal("2"));
			assertThat(proposal.strategyName()).isEqualTo("mine");
		});
		assertThat(StrategyRunner.sanitize("mine", null, Set.of())).isEmpty();
	}

	private StrategyRunResult run(StrategyRunner runner, List<ExtractionStrategy> strategies) {
		List<IdentifierMatch> matches = new IdentifierLocator().locate(statement);
		List<ValueCandidate> candidates = new ValueCandidateExtractor().extract(statement);
		return runner.run(strategies, matches, candidates, statement);
	}

	private static final class ExplodingStrategy implements ExtractionStrategy {
		@Override
		public String name() {
			return "exploding";
		}

		@Override
		public List<StrategyProposal> propose(List<IdentifierMatch> identifierMatches,
											  List<ValueCandidate> valueCandidates, Document document) {
			throw new IllegalStateException("boom");
		}
	}

	private static final class SlowStrategy implements ExtractionStrategy {
		@Override
		public String name() {
			return "slow";
		}

		@Override
		public List<StrategyProposal> propose(List<IdentifierMatch> identifierMatches,
											  List<ValueCandidate> valueCandidates, Document document) {
			try {
				Thread.sleep(5_000);
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
			}
			return List.of();
		}
	}
}
