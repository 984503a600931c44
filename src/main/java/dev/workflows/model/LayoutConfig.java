package dev.workflows.model;

/**
 * Canvas geometry. Lane {@code d} sits at {@code x = baseOffset + d * laneWidth};
 * the trigger occupies lane 0 and the root sequence lane 1.
 */
public record LayoutConfig(
    int baseOffset,
    int laneWidth,
    int rowHeight
) {
    public static final int DEFAULT_BASE_OFFSET = 48;
    public static final int DEFAULT_LANE_WIDTH = 280;
    public static final int DEFAULT_ROW_HEIGHT = 120;

    public LayoutConfig {
        if (laneWidth <= 0 || rowHeight <= 0) {
            throw new IllegalArgumentException(
                "laneWidth and rowHeight must be positive: %d, %d".formatted(laneWidth, rowHeight));
        }
    }

    public static LayoutConfig defaults() {
        return new LayoutConfig(DEFAULT_BASE_OFFSET, DEFAULT_LANE_WIDTH, DEFAULT_ROW_HEIGHT);
    }

    public int laneX(int lane) {
        return baseOffset + lane * laneWidth;
    }

    public int rowY(int row) {
        return baseOffset + row * rowHeight;
    }
}
