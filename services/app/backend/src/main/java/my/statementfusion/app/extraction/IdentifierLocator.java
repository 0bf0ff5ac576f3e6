package my.statementfusion.app.extraction;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.IdentifierMatch;
import my.statementfusion.app.model.Line;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class IdentifierLocator {
	private static final Logger logger = LoggerFactory.getLogger(IdentifierLocator.class);
	public static final Pattern CODE_RE = Pattern.compile("(?<![A-Za-z0-9])([A-Z]{2}[A-Z0-9]{10})(?![A-Za-z0-9])");
	private static final Pattern SHAPE_RE = Pattern.compile("^[A-Z]{2}[A-Z0-9]{10}$");

	private final IdentifierCheck check;

	public IdentifierLocator() {
		this(IdentifierCheck.SHAPE_ONLY);
	}

	public IdentifierLocator(IdentifierCheck check) {
		this.check = check == null ? IdentifierCheck.SHAPE_ONLY : check;
	}

	public List<IdentifierMatch> locate(Document document) {
		List<IdentifierMatch> matches = new ArrayList<>();
		if (document == null) {
			return matches;
		}
		for (Line line : document.lines()) {
			String text = line.text();
			Matcher matcher = CODE_RE.matcher(text);
			while (matcher.find()) {
				String code = matcher.group(1);
				if (!hasDigitInTail(code)) {
					continue;
				}
				if (!check.accepts(code)) {
					logger.debug("Rejected identifier {} on line {} of {}", code, line.index(), document.sourceName());
					continue;
				}
				matches.add(new IdentifierMatch(
						code,
						line.index(),
						text.substring(0, matcher.start()).trim(),
						text.substring(matcher.end()).trim()
				));
			}
		}
		logger.debug("Located {} identifier occurrences in {}", matches.size(), document.sourceName());
		return matches;
	}

	public static boolean hasIdentifierShape(String value) {
		String code = normalize(value);
		return SHAPE_RE.matcher(code).matches() && hasDigitInTail(code);
	}

	public static String normalize(String value) {
		return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
	}

	private static boolean hasDigitInTail(String code) {
		for (int i = 2; i < code.length(); i++) {
			if (Character.isDigit(code.charAt(i))) {
				return true;
			}
		}
		return false;
	}
}
