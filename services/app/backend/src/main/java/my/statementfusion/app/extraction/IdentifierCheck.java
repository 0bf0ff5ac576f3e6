package my.statementfusion.app.extraction;

@FunctionalInterface
public interface IdentifierCheck {
	IdentifierCheck SHAPE_ONLY = code -> true;

	boolean accepts(String code);
}
