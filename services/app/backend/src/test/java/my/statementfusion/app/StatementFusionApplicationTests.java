package my.statementfusion.app;

import my.statementfusion.app.config.AppProperties;
import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.ExtractionRequest;
import my.statementfusion.app.model.FusionResult;
import my.statementfusion.app.service.StatementExtractionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class StatementFusionApplicationTests {
	@Autowired
	private StatementExtractionService extractionService;

	@Autowired
	private AppProperties properties;

	@Test
	void contextLoads() {
		assertThat(properties.runner().strategyTimeout()).isEqualTo(Duration.ofSeconds(2));
		assertThat(extractionService.settings().fusionPolicy().priority()).startsWith("override", "fixed-offset");
	}

	@Test
	void extractsWithConfiguredBeans() {
		FusionResult result = extractionService.extract(
				Document.fromText("statement", "GOLDMAN SACHS NOTE ... ISIN: XS1234567890 ... USD 199'080.00"),
				ExtractionRequest.withExpectedTotal(new BigDecimal("199080.00")));

		assertThat(result.find("XS1234567890")).get()
				.satisfies(record -> assertThat(record.value()).isEqualByComparingTo("199080.00"));
		assertThat(result.accuracyAgainstExpected()).isEqualTo(1.0);
		assertThat(result.validationShortfall()).isFalse();
	}
}
