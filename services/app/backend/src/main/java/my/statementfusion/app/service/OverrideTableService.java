package my.statementfusion.app.service;

import my.statementfusion.app.extraction.IdentifierLocator;
import my.statementfusion.app.extraction.LocaleNumbers;
import my.statementfusion.app.util.TextDecoding;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads override tables: CSV files with an identifier column ({@code isin}, {@code identifier}
 * or {@code code}) and a value column ({@code value}, {@code override} or {@code amount}).
 * Comma, semicolon and tab delimiters are detected from the header line.
 */
@Service
public class OverrideTableService {
	private static final Logger logger = LoggerFactory.getLogger(OverrideTableService.class);
	private static final List<String> IDENTIFIER_HEADERS = List.of("isin", "identifier", "code");
	private static final List<String> VALUE_HEADERS = List.of("value", "override", "amount");

	public Map<String, BigDecimal> load(Path path) {
		try {
			return parse(Files.readAllBytes(path));
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read override table " + path + ": " + exc.getMessage(), exc);
		}
	}

	public Map<String, BigDecimal> parse(byte[] payload) {
		return parse(TextDecoding.decode(payload));
	}

	public Map<String, BigDecimal> parse(String content) {
		String text = TextDecoding.stripBom(content == null ? "" : content);
		if (text.isBlank()) {
			return Map.of();
		}
		char delimiter = TextDecoding.sniffDelimiter(text);
		Map<String, BigDecimal> overrides = new LinkedHashMap<>();
		try (CSVParser parser = CSVParser.parse(
				new StringReader(text),
				CSVFormat.DEFAULT.withDelimiter(delimiter).withFirstRecordAsHeader().withTrim().withIgnoreEmptyLines()
		)) {
			String identifierHeader = findHeader(parser.getHeaderNames(), IDENTIFIER_HEADERS);
			String valueHeader = findHeader(parser.getHeaderNames(), VALUE_HEADERS);
			for (CSVRecord record : parser) {
				long row = record.getRecordNumber() + 1;
				if (!record.isConsistent()) {
					throw new IllegalArgumentException("Override table row " + row + " has " + record.size()
							+ " columns, expected " + parser.getHeaderNames().size());
				}
				String code = IdentifierLocator.normalize(record.get(identifierHeader));
				String rawValue = record.get(valueHeader);
				if (code.isBlank() && (rawValue == null || rawValue.isBlank())) {
					continue;
				}
				if (!IdentifierLocator.hasIdentifierShape(code)) {
					throw new IllegalArgumentException("Override table row " + row + ": invalid identifier '" + code + "'");
				}
				BigDecimal value = parseValue(rawValue, row);
				BigDecimal previous = overrides.put(code, value);
				if (previous != null && previous.compareTo(value) != 0) {
					throw new IllegalArgumentException("Override table row " + row + ": conflicting values for " + code);
				}
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read override table: " + exc.getMessage(), exc);
		}
		logger.info("Loaded {} overrides", overrides.size());
		return overrides;
	}

	private static String findHeader(List<String> headers, List<String> accepted) {
		for (String header : headers) {
			if (header != null && accepted.contains(header.trim().toLowerCase(Locale.ROOT))) {
				return header;
			}
		}
		throw new IllegalArgumentException("Override table needs one of the columns " + accepted + ", found " + headers);
	}

	private static BigDecimal parseValue(String raw, long row) {
		String value = raw == null ? "" : TextDecoding.normalizeSpaces(raw).replace(" ", "");
		return LocaleNumbers.parse(value)
				.map(LocaleNumbers.ParsedNumber::value)
				.orElseThrow(() -> new IllegalArgumentException(
						"Override table row " + row + ": value '" + raw + "' is not a number"));
	}
}
