package my.statementfusion.app.strategy;

import my.statementfusion.app.extraction.LocaleNumbers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A line layout where several numbers are printed without separators between them, for
 * example a price with four decimals, a percentage factor and a Swiss-formatted market value
 * ({@code 100.1000106.9200737'748}). The pattern must define a {@code value} group and may
 * define {@code price} and {@code factor} groups.
 */
public record CompoundTemplate(String name, Pattern pattern) {
	private static final String VALUE_GROUP = "(?<value>";

	public static final List<CompoundTemplate> DEFAULTS = List.of(
			of("price-factor-value",
					"(?<![\\p{Alnum}.'’])(?<price>\\d{1,3}\\.\\d{4})(?<factor>\\d{1,3}\\.\\d{4})"
							+ "(?<value>\\d{1,3}(?:['’]\\d{3})+(?:\\.\\d{2})?)(?![\\d'’])"),
			of("price-value",
					"(?<![\\p{Alnum}.'’])(?<price>\\d{1,3}\\.\\d{4})"
							+ "(?<value>\\d{1,3}(?:['’]\\d{3})+(?:\\.\\d{2})?)(?![\\d'’])")
	);

	public CompoundTemplate {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Template name is required");
		}
		if (pattern == null || !pattern.pattern().contains(VALUE_GROUP)) {
			throw new IllegalArgumentException("Template " + name + " must define a named 'value' group");
		}
	}

	public static CompoundTemplate of(String name, String regex) {
		try {
			return new CompoundTemplate(name, Pattern.compile(regex == null ? "" : regex));
		} catch (PatternSyntaxException exc) {
			throw new IllegalArgumentException("Template " + name + " has an invalid pattern: " + exc.getDescription(), exc);
		}
	}

	public List<Decomposition> decompose(String line) {
		List<Decomposition> out = new ArrayList<>();
		Matcher matcher = pattern.matcher(line == null ? "" : line);
		while (matcher.find()) {
			Optional<LocaleNumbers.ParsedNumber> value = LocaleNumbers.parse(matcher.group("value"));
			if (value.isEmpty()) {
				continue;
			}
			out.add(new Decomposition(
					matcher.group(),
					value.get().value(),
					optionalNumber(matcher, "price"),
					optionalNumber(matcher, "factor")
			));
		}
		return out;
	}

	private static BigDecimal optionalNumber(Matcher matcher, String group) {
		String raw;
		try {
			raw = matcher.group(group);
		} catch (IllegalArgumentException exc) {
			return null;
		}
		if (raw == null) {
			return null;
		}
		try {
			return new BigDecimal(raw);
		} catch (NumberFormatException exc) {
			return null;
		}
	}

	public record Decomposition(String matched, BigDecimal value, BigDecimal price, BigDecimal factor) {
		List<BigDecimal> multipliers() {
			List<BigDecimal> out = new ArrayList<>();
			if (price != null) {
				out.add(price);
			}
			if (factor != null) {
				out.add(factor);
			}
			return out;
		}
	}
}
