package my.statementfusion.app.extraction;

import my.statementfusion.app.model.Document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class CurrencyDetector {
	public static final int DEFAULT_SEARCH_LINES = 3;

	public static final Pattern CURRENCY_RE = Pattern.compile(
			"(?<![A-Za-z0-9])(USD|EUR|CHF|GBP|JPY|CAD|AUD|SEK|NOK|DKK)(?![A-Za-z0-9])|([$€£])");
	private static final Map<String, String> SYMBOLS = Map.of("$", "USD", "€", "EUR", "£", "GBP");

	private final int searchLines;

	public CurrencyDetector() {
		this(DEFAULT_SEARCH_LINES);
	}

	public CurrencyDetector(int searchLines) {
		this.searchLines = Math.max(0, searchLines);
	}

	public List<Mention> find(String text) {
		List<Mention> mentions = new ArrayList<>();
		Matcher matcher = CURRENCY_RE.matcher(text == null ? "" : text);
		while (matcher.find()) {
			String code = matcher.group(1) != null ? matcher.group(1) : SYMBOLS.get(matcher.group(2));
			mentions.add(new Mention(code, matcher.start()));
		}
		return mentions;
	}

	/**
	 * Picks the currency token nearest to the value on its own line, then the first token on the
	 * identifier line, then the first token on the closest line within the search distance.
	 */
	public Optional<String> infer(Document document, int identifierLine, Integer valueLine, Integer valueOffset) {
		if (document == null) {
			return Optional.empty();
		}
		if (valueLine != null) {
			List<Mention> onValueLine = find(document.text(valueLine));
			if (!onValueLine.isEmpty()) {
				int anchor = valueOffset == null ? 0 : valueOffset;
				return onValueLine.stream()
						.min(Comparator.comparingInt(mention -> Math.abs(mention.offset() - anchor)))
						.map(Mention::code);
			}
		}
		List<Mention> onIdentifierLine = find(document.text(identifierLine));
		if (!onIdentifierLine.isEmpty()) {
			return Optional.of(onIdentifierLine.get(0).code());
		}
		for (int distance = 1; distance <= searchLines; distance++) {
			for (int line : new int[]{identifierLine - distance, identifierLine + distance}) {
				List<Mention> mentions = find(document.text(line));
				if (!mentions.isEmpty()) {
					return Optional.of(mentions.get(0).code());
				}
			}
		}
		return Optional.empty();
	}

	public record Mention(String code, int offset) {
	}
}
