package my.statementfusion.app.model;

public class UnreadableDocumentException extends RuntimeException {
	public UnreadableDocumentException(String message) {
		super(message);
	}
}
