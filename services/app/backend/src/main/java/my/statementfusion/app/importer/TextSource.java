package my.statementfusion.app.importer;

import my.statementfusion.app.model.Document;

public interface TextSource {
	String name();

	/**
	 * @throws TextSourceException when the source cannot be read; {@link TextSourceException#isRetryable()}
	 *                             tells the reader whether another attempt makes sense
	 */
	Document read();
}
