package my.statementfusion.app.extraction;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.IdentifierMatch;

import java.util.Optional;
import java.util.regex.Pattern;

public class SecurityNameResolver {
	public static final int DEFAULT_LOOKBACK_LINES = 2;

	private static final Pattern LABEL_RE = Pattern.compile("(?i)\\b(ISIN|Valor|WKN|CUSIP|SEDOL)\\b\\s*[:#]?");
	private static final Pattern NUMBER_RE = Pattern.compile("(?<![A-Za-z])-?\\d[\\d'’.,]*%?(?![A-Za-z])");
	private static final Pattern FILLER_RE = Pattern.compile("\\.{2,}|…|[|;]");
	private static final Pattern EDGE_PUNCT_RE = Pattern.compile("^[\\s:,\\-/]+|[\\s:,\\-/]+$");
	private static final int MIN_LETTERS = 3;

	private final int lookbackLines;

	public SecurityNameResolver() {
		this(DEFAULT_LOOKBACK_LINES);
	}

	public SecurityNameResolver(int lookbackLines) {
		this.lookbackLines = Math.max(0, lookbackLines);
	}

	public Optional<String> resolve(Document document, IdentifierMatch match) {
		Optional<String> before = clean(match.contextBefore());
		if (before.isPresent()) {
			return before;
		}
		Optional<String> after = clean(match.contextAfter());
		if (after.isPresent()) {
			return after;
		}
		if (document == null) {
			return Optional.empty();
		}
		for (int distance = 1; distance <= lookbackLines; distance++) {
			String previous = document.text(match.lineIndex() - distance);
			if (IdentifierLocator.CODE_RE.matcher(previous).find()) {
				break;
			}
			Optional<String> cleaned = clean(previous);
			if (cleaned.isPresent()) {
				return cleaned;
			}
		}
		return Optional.empty();
	}

	Optional<String> clean(String raw) {
		if (raw == null || raw.isBlank()) {
			return Optional.empty();
		}
		String value = IdentifierLocator.CODE_RE.matcher(raw).replaceAll(" ");
		value = LABEL_RE.matcher(value).replaceAll(" ");
		value = CurrencyDetector.CURRENCY_RE.matcher(value).replaceAll(" ");
		value = FILLER_RE.matcher(value).replaceAll(" ");
		value = NUMBER_RE.matcher(value).replaceAll(" ");
		value = value.replaceAll("\\s+", " ");
		value = EDGE_PUNCT_RE.matcher(value).replaceAll("").trim();
		long letters = value.chars().filter(Character::isLetter).count();
		if (letters < MIN_LETTERS) {
			return Optional.empty();
		}
		return Optional.of(value);
	}
}
