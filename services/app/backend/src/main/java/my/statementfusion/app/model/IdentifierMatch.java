package my.statementfusion.app.model;

public record IdentifierMatch(
		String code,
		int lineIndex,
		String contextBefore,
		String contextAfter
) {
	public IdentifierMatch {
		contextBefore = contextBefore == null ? "" : contextBefore;
		contextAfter = contextAfter == null ? "" : contextAfter;
	}
}
