package my.statementfusion.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import my.statementfusion.app.importer.PdfTextSource;
import my.statementfusion.app.importer.TextFileSource;
import my.statementfusion.app.importer.TextSource;
import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.ExtractionRequest;
import my.statementfusion.app.model.FusionResult;
import my.statementfusion.app.model.SecurityRecord;
import my.statementfusion.app.service.OverrideTableService;
import my.statementfusion.app.service.StatementExtractionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class StatementExtractionRunnerTest {
	@TempDir
	Path tempDir;

	@Test
	void doesNothingWithoutInput() throws Exception {
		StatementExtractionService extractionService = mock(StatementExtractionService.class);
		OverrideTableService overrideTableService = mock(OverrideTableService.class);
		StatementExtractionRunner runner = new StatementExtractionRunner(
				properties(new AppProperties.Cli("", null, null, null, null, null, null)),
				extractionService, overrideTableService, new ObjectMapper());

		runner.run(null);

		verifyNoInteractions(extractionService, overrideTableService);
	}

	@Test
	@SuppressWarnings("unchecked")
	void extractsInputsAndWritesJson() throws Exception {
		Path statement = tempDir.resolve("statement.txt");
		Files.writeString(statement, "GOLDMAN SACHS NOTE XS1234567890 USD 199'080.00", StandardCharsets.UTF_8);
		Path overrides = tempDir.resolve("overrides.csv");
		Path output = tempDir.resolve("result.json");
		SecurityRecord record = new SecurityRecord("XS1234567890", "GOLDMAN SACHS NOTE", new BigDecimal("199080.00"),
				"USD", 1.0, 0, List.of("override"), List.of(), false, false);
		FusionResult result = new FusionResult(List.of(record), new BigDecimal("199080.00"), 1, 1.0, false, List.of());

		StatementExtractionService extractionService = mock(StatementExtractionService.class);
		when(extractionService.extract(anyList(), any(ExtractionRequest.class))).thenReturn(result);
		OverrideTableService overrideTableService = mock(OverrideTableService.class);
		when(overrideTableService.load(overrides)).thenReturn(Map.of("XS1234567890", new BigDecimal("199080.00")));

		StatementExtractionRunner runner = new StatementExtractionRunner(
				properties(new AppProperties.Cli(statement + ", " + tempDir.resolve("scan.pdf"), overrides.toString(),
						new BigDecimal("199080.00"), output.toString(), null, null, null)),
				extractionService, overrideTableService, new ObjectMapper());

		runner.run(null);

		ArgumentCaptor<List<TextSource>> sources = ArgumentCaptor.forClass(List.class);
		ArgumentCaptor<ExtractionRequest> request = ArgumentCaptor.forClass(ExtractionRequest.class);
		verify(extractionService).extract(sources.capture(), request.capture());
		assertThat(sources.getValue()).hasSize(2);
		assertThat(sources.getValue().get(0)).isInstanceOf(TextFileSource.class);
		assertThat(sources.getValue().get(1)).isInstanceOf(PdfTextSource.class);
		assertThat(request.getValue().overrides()).containsOnlyKeys("XS1234567890");
		assertThat(request.getValue().expectedTotal()).isEqualByComparingTo("199080.00");

		String json = Files.readString(output, StandardCharsets.UTF_8);
		assertThat(json).contains("\"identifierCode\" : \"XS1234567890\"");
		assertThat(json).contains("\"accuracyAgainstExpected\" : 1.0");
	}

	@Test
	void calibratesOnReferenceBeforeExtracting() throws Exception {
		Path statement = tempDir.resolve("statement.txt");
		Files.writeString(statement, "XS1234567890 Nominal 200'000.00\nMarket value USD 199'080.00", StandardCharsets.UTF_8);
		Path reference = tempDir.resolve("reference.txt");
		Files.writeString(reference, "XS1234567890 Nominal 100'000.00\nMarket value USD 99'540.00", StandardCharsets.UTF_8);
		Path knownValues = tempDir.resolve("known.csv");
		Map<String, BigDecimal> known = Map.of("XS1234567890", new BigDecimal("99540.00"));

		StatementExtractionService extractionService = mock(StatementExtractionService.class);
		StatementExtractionService calibratedService = mock(StatementExtractionService.class);
		when(extractionService.calibrated(any(Document.class), eq(known), eq(2))).thenReturn(calibratedService);
		when(calibratedService.extract(anyList(), any(ExtractionRequest.class))).thenReturn(
				new FusionResult(List.of(), BigDecimal.ZERO, 0, null, false, List.of()));
		OverrideTableService overrideTableService = mock(OverrideTableService.class);
		when(overrideTableService.load(knownValues)).thenReturn(known);

		StatementExtractionRunner runner = new StatementExtractionRunner(
				properties(new AppProperties.Cli(statement.toString(), null, null, null,
						reference.toString(), knownValues.toString(), 2)),
				extractionService, overrideTableService, new ObjectMapper());

		runner.run(null);

		ArgumentCaptor<Document> captured = ArgumentCaptor.forClass(Document.class);
		verify(extractionService).calibrated(captured.capture(), eq(known), eq(2));
		assertThat(captured.getValue().sourceName()).isEqualTo("reference.txt");
		verify(calibratedService).extract(anyList(), any(ExtractionRequest.class));
		verify(extractionService, never()).extract(anyList(), any(ExtractionRequest.class));
	}

	@Test
	void calibrationNeedsKnownValues() {
		StatementExtractionRunner runner = new StatementExtractionRunner(
				properties(new AppProperties.Cli("statement.txt", null, null, null, "reference.txt", " ", null)),
				mock(StatementExtractionService.class), mock(OverrideTableService.class), new ObjectMapper());

		assertThatThrownBy(() -> runner.run(null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("calibration-values");
	}

	@Test
	void picksSourceByExtension() {
		assertThat(StatementExtractionRunner.toSource(Path.of("scan.PDF"))).isInstanceOf(PdfTextSource.class);
		assertThat(StatementExtractionRunner.toSource(Path.of("export.txt"))).isInstanceOf(TextFileSource.class);
	}

	private static AppProperties properties(AppProperties.Cli cli) {
		return new AppProperties(null, null, null, cli);
	}
}
