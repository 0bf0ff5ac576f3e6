package my.statementfusion.app.model;

public record BoundingBox(
		double x,
		double y,
		double width,
		double height
) {
}
