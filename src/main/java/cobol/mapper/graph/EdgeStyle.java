package cobol.mapper.graph;

/**
 * Visual category of an edge, with its DOT attributes.
 */
public enum EdgeStyle {
    DASHED("dashed", "#666666", null),
    SOLID("solid", "#444444", null),
    SOLID_HEAVY("solid", "#444444", "2.0"),
    HEAVY_COLORED("solid", "#e53935", "1.3");

    private final String style;
    private final String color;
    private final String penWidth;

    EdgeStyle(String style, String color, String penWidth) {
        this.style = style;
        this.color = color;
        this.penWidth = penWidth;
    }

    public String style() {
        return style;
    }

    public String color() {
        return color;
    }

    public String penWidth() {
        return penWidth;
    }
}
