package my.statementfusion.app.extraction;

import my.statementfusion.app.util.TextDecoding;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a statement line into columns on runs of two or more spaces, tabs, pipes or
 * semicolons. Non-breaking spaces count as spaces; they are replaced one for one, so column
 * offsets match the raw line.
 */
public final class ColumnSplitter {
	private static final Pattern COLUMN_BREAK_RE = Pattern.compile("\\s{2,}|\\t|\\s*\\|\\s*|\\s*;\\s*");

	private ColumnSplitter() {
	}

	public static List<Column> split(String text) {
		String line = TextDecoding.normalizeSpaces(text);
		List<Column> columns = new ArrayList<>();
		Matcher matcher = COLUMN_BREAK_RE.matcher(line);
		int start = 0;
		while (matcher.find()) {
			addColumn(line, start, matcher.start(), columns);
			start = matcher.end();
		}
		addColumn(line, start, line.length(), columns);
		return columns;
	}

	public static Integer columnAt(List<Column> columns, int offset) {
		if (columns.size() < 2) {
			return null;
		}
		for (Column column : columns) {
			if (offset >= column.start() && offset < column.end()) {
				return column.index();
			}
		}
		return null;
	}

	private static void addColumn(String line, int start, int end, List<Column> out) {
		if (end <= start) {
			return;
		}
		String text = line.substring(start, end);
		if (text.isBlank()) {
			return;
		}
		out.add(new Column(out.size(), start, end, text.trim()));
	}

	public record Column(int index, int start, int end, String text) {
	}
}
