package my.statementfusion.app.importer;

public class TextSourceException extends RuntimeException {
	private final String sourceName;
	private final boolean retryable;

	public TextSourceException(String message, String sourceName, boolean retryable, Throwable cause) {
		super(message, cause);
		this.sourceName = sourceName;
		this.retryable = retryable;
	}

	public String getSourceName() {
		return sourceName;
	}

	public boolean isRetryable() {
		return retryable;
	}
}
