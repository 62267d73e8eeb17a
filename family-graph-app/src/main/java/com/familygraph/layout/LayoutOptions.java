package com.familygraph.layout;

/**
 * Parameters of a single layout run.
 *
 * @param direction    generation axis; {@code null} means top-down
 * @param rootPersonId person the recursive placement starts from
 * @param spacingX     distance between neighbours on the family axis
 * @param spacingY     distance between generations
 */
public record LayoutOptions(
    LayoutDirection direction,
    String rootPersonId,
    double spacingX,
    double spacingY
) {
    public static final double DEFAULT_SPACING_X = 200.0;
    public static final double DEFAULT_SPACING_Y = 150.0;

    public LayoutOptions {
        if (direction == null) {
            direction = LayoutDirection.TOP_DOWN;
        }
        if (!(spacingX > 0) || !(spacingY > 0)) {
            throw new IllegalArgumentException(
                    "Spacing must be positive, got spacingX=" + spacingX + ", spacingY=" + spacingY);
        }
    }

    public static LayoutOptions of(String rootPersonId) {
        return new LayoutOptions(LayoutDirection.TOP_DOWN, rootPersonId, DEFAULT_SPACING_X, DEFAULT_SPACING_Y);
    }

    public LayoutOptions withDirection(LayoutDirection newDirection) {
        return new LayoutOptions(newDirection, rootPersonId, spacingX, spacingY);
    }
}
