package cobol.mapper.graph;

/**
 * Visual category of a node, with its DOT attributes.
 */
public enum NodeStyle {
    ENTRY("box", "rounded,filled", "#e0f7e9", null, null),
    ANOMALY("box", "rounded,filled", "#ffe9d6", null, null),
    SHARED("box", "rounded,filled", "#f0e5ff", null, null),
    KEYED("box", "rounded,filled", "#e0ecff", null, null),
    DEFAULT("box", "rounded,filled", "#f5f5f5", null, null),
    EXIT("doublecircle", "filled", "#ffebee", "#e53935", "1.5");

    private final String shape;
    private final String style;
    private final String fillColor;
    private final String color;     // outline, null for the renderer default
    private final String penWidth;

    NodeStyle(String shape, String style, String fillColor, String color, String penWidth) {
        this.shape = shape;
        this.style = style;
        this.fillColor = fillColor;
        this.color = color;
        this.penWidth = penWidth;
    }

    public String shape() {
        return shape;
    }

    public String style() {
        return style;
    }

    public String fillColor() {
        return fillColor;
    }

    public String color() {
        return color;
    }

    public String penWidth() {
        return penWidth;
    }
}
