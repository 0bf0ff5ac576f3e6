package my.statementfusion.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import my.statementfusion.app.importer.PdfTextSource;
import my.statementfusion.app.importer.TextFileSource;
import my.statementfusion.app.importer.TextSource;
import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.ExtractionRequest;
import my.statementfusion.app.model.FusionResult;
import my.statementfusion.app.model.SecurityRecord;
import my.statementfusion.app.service.OverrideTableService;
import my.statementfusion.app.service.StatementExtractionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs one extraction at startup when {@code app.cli.input} names one or more files
 * (comma separated). Does nothing otherwise. With {@code app.cli.calibration-reference} and
 * {@code app.cli.calibration-values} the fixed line offset is first learned from a reference
 * statement of the same family.
 */
@Component
public class StatementExtractionRunner implements ApplicationRunner {
	private static final Logger logger = LoggerFactory.getLogger(StatementExtractionRunner.class);
	private static final int DEFAULT_CALIBRATION_MAX_OFFSET = 3;

	private final AppProperties properties;
	private final StatementExtractionService extractionService;
	private final OverrideTableService overrideTableService;
	private final ObjectMapper objectMapper;

	public StatementExtractionRunner(AppProperties properties,
									 StatementExtractionService extractionService,
									 OverrideTableService overrideTableService,
									 ObjectMapper objectMapper) {
		this.properties = properties;
		this.extractionService = extractionService;
		this.overrideTableService = overrideTableService;
		this.objectMapper = objectMapper;
	}

	@Override
	public void run(ApplicationArguments args) throws IOException {
		AppProperties.Cli cli = properties.cli();
		if (cli == null || cli.input() == null || cli.input().isBlank()) {
			return;
		}
		List<TextSource> sources = new ArrayList<>();
		for (String input : cli.input().split(",")) {
			if (!input.isBlank()) {
				sources.add(toSource(Path.of(input.trim())));
			}
		}
		Map<String, BigDecimal> overrides = cli.overrides() == null || cli.overrides().isBlank()
				? Map.of()
				: overrideTableService.load(Path.of(cli.overrides().trim()));
		StatementExtractionService service = calibrate(cli);
		FusionResult result = service.extract(sources, new ExtractionRequest(overrides, cli.expectedTotal()));

		for (SecurityRecord record : result.records()) {
			logger.info("{} {} {} {} (confidence {}, {}){}",
					record.identifierCode(),
					record.name() == null ? "-" : record.name(),
					record.value() == null ? "-" : record.value().toPlainString(),
					record.currency() == null ? "" : record.currency(),
					String.format(Locale.ROOT, "%.2f", record.confidence()),
					record.winningStrategy() == null ? "no proposal" : record.winningStrategy(),
					record.needsReview() ? " needs review" : "");
		}
		if (result.accuracyAgainstExpected() != null) {
			logger.info("Accuracy against expected total: {}",
					String.format(Locale.ROOT, "%.4f", result.accuracyAgainstExpected()));
		}
		if (cli.output() != null && !cli.output().isBlank()) {
			Path output = Path.of(cli.output().trim());
			objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(output.toFile(), result);
			logger.info("Wrote extraction result to {}", output);
		}
	}

	private StatementExtractionService calibrate(AppProperties.Cli cli) {
		if (isBlank(cli.calibrationReference())) {
			return extractionService;
		}
		if (isBlank(cli.calibrationValues())) {
			throw new IllegalArgumentException("app.cli.calibration-values is required with a calibration reference");
		}
		Document reference = toSource(Path.of(cli.calibrationReference().trim())).read();
		Map<String, BigDecimal> knownValues = overrideTableService.load(Path.of(cli.calibrationValues().trim()));
		int maxOffset = cli.calibrationMaxOffset() == null ? DEFAULT_CALIBRATION_MAX_OFFSET : cli.calibrationMaxOffset();
		return extractionService.calibrated(reference, knownValues, maxOffset);
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}

	static TextSource toSource(Path path) {
		String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
		if (fileName.endsWith(".pdf")) {
			return new PdfTextSource(path);
		}
		return new TextFileSource(path);
	}
}
