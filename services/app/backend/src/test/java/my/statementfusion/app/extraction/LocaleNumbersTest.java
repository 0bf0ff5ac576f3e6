package my.statementfusion.app.extraction;

import my.statementfusion.app.model.LocaleFormat;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocaleNumbersTest {
	@Test
	void parsesEachGrammar() {
		assertParsed("199'080.00", "199080.00", LocaleFormat.SWISS_APOSTROPHE);
		assertParsed("1’234’567.8", "1234567.8", LocaleFormat.SWISS_APOSTROPHE);
		assertParsed("1,234,567.89", "1234567.89", LocaleFormat.US_COMMA);
		assertParsed("1.234.567,89", "1234567.89", LocaleFormat.EURO_COMMA);
		assertParsed("1234,56", "1234.56", LocaleFormat.EURO_COMMA);
		assertParsed("1234567.89", "1234567.89", LocaleFormat.PLAIN);
		assertParsed("-2'500.00", "-2500.00", LocaleFormat.SWISS_APOSTROPHE);
	}

	@Test
	void separatorFollowedByThreeDigitsGroups() {
		assertParsed("1.234", "1234", LocaleFormat.EURO_COMMA);
		assertParsed("1,234", "1234", LocaleFormat.US_COMMA);
		assertParsed("1,23", "1.23", LocaleFormat.EURO_COMMA);
	}

	@Test
	void rejectsMalformedTokens() {
		assertThat(LocaleNumbers.parse("1,2345")).isEmpty();
		assertThat(LocaleNumbers.parse("12'34")).isEmpty();
		assertThat(LocaleNumbers.parse("1.234.56")).isEmpty();
		assertThat(LocaleNumbers.parse("-")).isEmpty();
		assertThat(LocaleNumbers.parse(null)).isEmpty();
	}

	@Test
	void formatsWithTheGrammarsSeparators() {
		BigDecimal value = new BigDecimal("1234567.891");

		assertThat(LocaleNumbers.format(value, LocaleFormat.SWISS_APOSTROPHE)).isEqualTo("1'234'567.89");
		assertThat(LocaleNumbers.format(value, LocaleFormat.US_COMMA)).isEqualTo("1,234,567.89");
		assertThat(LocaleNumbers.format(value, LocaleFormat.EURO_COMMA)).isEqualTo("1.234.567,89");
		assertThat(LocaleNumbers.format(value, LocaleFormat.PLAIN)).isEqualTo("1234567.89");
		assertThatThrownBy(() -> LocaleNumbers.format(null, LocaleFormat.PLAIN))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void parsingAFormattedValueGivesTheValueBack() {
		for (String raw : List.of("100.00", "4521.5", "199080", "737748.25", "98765432.10")) {
			BigDecimal value = new BigDecimal(raw);
			for (LocaleFormat format : LocaleFormat.values()) {
				String formatted = LocaleNumbers.format(value, format);
				assertThat(LocaleNumbers.parse(formatted))
						.as("%s formatted as %s", raw, format)
						.hasValueSatisfying(parsed -> assertThat(parsed.value()).isEqualByComparingTo(value));
			}
		}
	}

	private static void assertParsed(String token, String expected, LocaleFormat format) {
		assertThat(LocaleNumbers.parse(token)).hasValueSatisfying(parsed -> {
			assertThat(parsed.value()).isEqualByComparingTo(new BigDecimal(expected));
			assertThat(parsed.format()).isEqualTo(format);
		});
	}
}
