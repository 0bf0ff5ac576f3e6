package my.statementfusion.app.strategy;

import my.statementfusion.app.model.StrategyProposal;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static my.statementfusion.app.strategy.StrategyTestSupport.document;
import static my.statementfusion.app.strategy.StrategyTestSupport.only;
import static my.statementfusion.app.strategy.StrategyTestSupport.propose;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CompoundTemplateStrategyTest {
	private final CompoundTemplateStrategy strategy = new CompoundTemplateStrategy();

	@Test
	void decomposesPriceFactorAndValue() {
		List<CompoundTemplate.Decomposition> parts = CompoundTemplate.DEFAULTS.get(0)
				.decompose("  100.1000106.9200737'748  ");

		assertThat(parts).singleElement().satisfies(part -> {
			assertThat(part.price()).isEqualByComparingTo(new BigDecimal("100.1000"));
			assertThat(part.factor()).isEqualByComparingTo(new BigDecimal("106.9200"));
			assertThat(part.value()).isEqualByComparingTo(new BigDecimal("737748"));
		});
	}

	@Test
	void nominalCrossCheckRaisesConfidence() {
		StrategyProposal proposal = only(propose(strategy, document(
				"Nominal 690'000 ISIN XS1111111116",
				"100.1000106.9200737'748")), "XS1111111116");

		assertThat(proposal.value()).isEqualByComparingTo(new BigDecimal("737748"));
		assertThat(proposal.confidence()).isCloseTo(0.9, within(1e-9));
		assertThat(proposal.sourceLineIndex()).isEqualTo(1);
		assertThat(proposal.reasoning()).contains("price-factor-value");
	}

	@Test
	void plainTemplateMatchWithoutNominal() {
		StrategyProposal proposal = only(propose(strategy, document(
				"Corporate bond XS2222222228",
				"",
				"99.6285200'288")), "XS2222222228");

		assertThat(proposal.value()).isEqualByComparingTo(new BigDecimal("200288"));
		assertThat(proposal.confidence()).isCloseTo(0.8, within(1e-9));
	}

	@Test
	void ignoresOrdinaryNumbers() {
		assertThat(propose(strategy, document("Holding XS1234567890 USD 199'080.00"))).isEmpty();
	}

	@Test
	void templateNeedsValueGroup() {
		assertThatThrownBy(() -> CompoundTemplate.of("broken", "(?<price>\\d+)"))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> CompoundTemplate.of("invalid", "(?<value>\\d+"))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
