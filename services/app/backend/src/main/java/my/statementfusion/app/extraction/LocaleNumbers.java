package my.statementfusion.app.extraction;

import my.statementfusion.app.model.LocaleFormat;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses and formats the numeric grammars found in statements.
 * <p>
 * A separator groups digits only when exactly three digits follow it; a trailing separator
 * followed by one or two digits is a decimal mark. {@code 1,234} is therefore a grouped
 * thousand while {@code 1,23} is a decimal comma, and {@code 1,2345} matches nothing.
 */
public final class LocaleNumbers {
	private static final Pattern SWISS_RE = Pattern.compile("^\\d{1,3}(?:['’]\\d{3})+(?:\\.\\d{1,2})?$");
	private static final Pattern US_RE = Pattern.compile("^\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?$");
	private static final Pattern EURO_GROUPED_RE = Pattern.compile("^\\d{1,3}(?:\\.\\d{3})+(?:,\\d{1,2})?$");
	private static final Pattern EURO_DECIMAL_RE = Pattern.compile("^\\d+,\\d{1,2}$");
	private static final Pattern PLAIN_RE = Pattern.compile("^\\d+(?:\\.\\d+)?$");

	private LocaleNumbers() {
	}

	public static Optional<ParsedNumber> parse(String token) {
		if (token == null) {
			return Optional.empty();
		}
		String value = token.trim();
		boolean negative = value.startsWith("-");
		if (negative) {
			value = value.substring(1);
		}
		if (value.isEmpty()) {
			return Optional.empty();
		}
		Optional<ParsedNumber> parsed = parseUnsigned(value);
		if (negative) {
			return parsed.map(number -> new ParsedNumber(number.value().negate(), number.format()));
		}
		return parsed;
	}

	public static String format(BigDecimal value, LocaleFormat format) {
		if (value == null) {
			throw new IllegalArgumentException("Cannot format a missing value");
		}
		BigDecimal scaled = value.setScale(2, RoundingMode.HALF_UP);
		return switch (format) {
			case SWISS_APOSTROPHE -> formatter('\'', '.').format(scaled);
			case EURO_COMMA -> formatter('.', ',').format(scaled);
			case US_COMMA -> formatter(',', '.').format(scaled);
			case PLAIN -> scaled.toPlainString();
		};
	}

	private static Optional<ParsedNumber> parseUnsigned(String value) {
		if (SWISS_RE.matcher(value).matches()) {
			return toNumber(value.replace("'", "").replace("’", ""), LocaleFormat.SWISS_APOSTROPHE);
		}
		if (US_RE.matcher(value).matches()) {
			return toNumber(value.replace(",", ""), LocaleFormat.US_COMMA);
		}
		if (EURO_GROUPED_RE.matcher(value).matches() || EURO_DECIMAL_RE.matcher(value).matches()) {
			return toNumber(value.replace(".", "").replace(",", "."), LocaleFormat.EURO_COMMA);
		}
		if (PLAIN_RE.matcher(value).matches()) {
			return toNumber(value, LocaleFormat.PLAIN);
		}
		return Optional.empty();
	}

	private static Optional<ParsedNumber> toNumber(String canonical, LocaleFormat format) {
		try {
			return Optional.of(new ParsedNumber(new BigDecimal(canonical), format));
		} catch (NumberFormatException exc) {
			return Optional.empty();
		}
	}

	private static DecimalFormat formatter(char groupingSeparator, char decimalSeparator) {
		DecimalFormatSymbols symbols = new DecimalFormatSymbols(Locale.ROOT);
		symbols.setGroupingSeparator(groupingSeparator);
		symbols.setDecimalSeparator(decimalSeparator);
		symbols.setMinusSign('-');
		DecimalFormat format = new DecimalFormat("#,##0.00", symbols);
		format.setRoundingMode(RoundingMode.HALF_UP);
		return format;
	}

	public record ParsedNumber(BigDecimal value, LocaleFormat format) {
	}
}
