package my.statementfusion.app.extraction;

import my.statementfusion.app.model.Document;
import my.statementfusion.app.model.IdentifierMatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class IdentifierLocatorTest {
	@Test
	void findsIdentifierWithSameLineContext() {
		List<IdentifierMatch> matches = new IdentifierLocator().locate(
				Document.fromText("t", "GOLDMAN SACHS NOTE ... ISIN: XS1234567890 ... USD 199'080.00"));

		assertThat(matches).hasSize(1);
		IdentifierMatch match = matches.get(0);
		assertThat(match.code()).isEqualTo("XS1234567890");
		assertThat(match.lineIndex()).isZero();
		assertThat(match.contextBefore()).isEqualTo("GOLDMAN SACHS NOTE ... ISIN:");
		assertThat(match.contextAfter()).isEqualTo("... USD 199'080.00");
	}

	@Test
	void returnsEveryOccurrenceInDocumentOrder() {
		Document document = Document.fromText("t", String.join("\n",
				"US0378331005 Apple",
				"heading",
				"CH0038863350 Nestle and again US0378331005"));

		assertThat(new IdentifierLocator().locate(document))
				.extracting(IdentifierMatch::code, IdentifierMatch::lineIndex)
				.containsExactly(
						tuple("US0378331005", 0),
						tuple("CH0038863350", 2),
						tuple("US0378331005", 2));
	}

	@Test
	void ignoresWordsAndEmbeddedCodes() {
		Document document = Document.fromText("t", String.join("\n",
				"INTERNATIONAL equities",
				"REFXS1234567890",
				"XS12345678901",
				"xs1234567890"));

		assertThat(new IdentifierLocator().locate(document)).isEmpty();
		assertThat(new IdentifierLocator().locate(null)).isEmpty();
	}

	@Test
	void checksumValidationIsOptional() {
		Document document = Document.fromText("t", "US0378331005 US0378331006");

		assertThat(new IdentifierLocator().locate(document)).hasSize(2);
		assertThat(new IdentifierLocator(new IsinChecksumCheck()).locate(document))
				.extracting(IdentifierMatch::code)
				.containsExactly("US0378331005");
	}

	@Test
	void shapeCheckNormalizesInput() {
		assertThat(IdentifierLocator.hasIdentifierShape(" xs1234567890 ")).isTrue();
		assertThat(IdentifierLocator.hasIdentifierShape("ABCDEFGHIJKL")).isFalse();
		assertThat(IdentifierLocator.hasIdentifierShape(null)).isFalse();
	}
}
