package my.statementfusion.app.extraction;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.Line;
import my.statementfusion.app.model.ValueCandidate;
import my.statementfusion.app.util.TextDecoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ValueCandidateExtractor {
	private static final Logger logger = LoggerFactory.getLogger(ValueCandidateExtractor.class);
	public static final BigDecimal DEFAULT_MIN_ABSOLUTE_VALUE = new BigDecimal("100");

	private static final Pattern TOKEN_RE = Pattern.compile("(?<![\\p{L}\\p{N}'’.,\\-])-?\\d[\\d'’.,]*");
	private static final Pattern DATE_RE = Pattern.compile("(?<!\\d)\\d{1,4}[./-]\\d{1,2}[./-]\\d{2,4}(?!\\d)");
	private static final String TRAILING_SEPARATORS = ".,'’";

	private final BigDecimal minAbsoluteValue;

	public ValueCandidateExtractor() {
		this(DEFAULT_MIN_ABSOLUTE_VALUE);
	}

	public ValueCandidateExtractor(BigDecimal minAbsoluteValue) {
		this.minAbsoluteValue = minAbsoluteValue == null ? DEFAULT_MIN_ABSOLUTE_VALUE : minAbsoluteValue.abs();
	}

	public List<ValueCandidate> extract(Document document) {
		List<ValueCandidate> candidates = new ArrayList<>();
		if (document == null) {
			return candidates;
		}
		for (Line line : document.lines()) {
			candidates.addAll(extract(line));
		}
		logger.debug("Extracted {} value candidates from {}", candidates.size(), document.sourceName());
		return candidates;
	}

	List<ValueCandidate> extract(Line line) {
		String normalized = TextDecoding.normalizeSpaces(line.text());
		String text = maskDates(normalized);
		List<ColumnSplitter.Column> columns = ColumnSplitter.split(normalized);
		List<ValueCandidate> out = new ArrayList<>();
		Matcher matcher = TOKEN_RE.matcher(text);
		while (matcher.find()) {
			if (isGluedToWord(text, matcher.end())) {
				continue;
			}
			String raw = trimTrailingSeparators(matcher.group());
			int end = matcher.start() + raw.length();
			if (isPercentage(text, end)) {
				continue;
			}
			Optional<LocaleNumbers.ParsedNumber> parsed = LocaleNumbers.parse(raw);
			if (parsed.isEmpty()) {
				continue;
			}
			BigDecimal value = parsed.get().value();
			if (value.abs().compareTo(minAbsoluteValue) < 0) {
				continue;
			}
			out.add(new ValueCandidate(
					raw,
					value,
					parsed.get().format(),
					line.index(),
					ColumnSplitter.columnAt(columns, matcher.start()),
					matcher.start()
			));
		}
		return out;
	}

	private String maskDates(String text) {
		Matcher matcher = DATE_RE.matcher(text);
		if (!matcher.find()) {
			return text;
		}
		StringBuilder masked = new StringBuilder(text);
		matcher.reset();
		while (matcher.find()) {
			for (int i = matcher.start(); i < matcher.end(); i++) {
				masked.setCharAt(i, ' ');
			}
		}
		return masked.toString();
	}

	private boolean isGluedToWord(String text, int end) {
		return end < text.length() && Character.isLetter(text.charAt(end));
	}

	private boolean isPercentage(String text, int end) {
		for (int i = end; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (ch == ' ') {
				continue;
			}
			return ch == '%';
		}
		return false;
	}

	private String trimTrailingSeparators(String token) {
		int end = token.length();
		while (end > 0 && TRAILING_SEPARATORS.indexOf(token.charAt(end - 1)) >= 0) {
			end--;
		}
		return token.substring(0, end);
	}
}
