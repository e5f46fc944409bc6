package dev.neuronic.matrix.format;

/**
 * Display settings for {@link MatrixFormatter}.
 *
 * @param width minimum characters per element; shorter elements are right-justified,
 *              longer ones are printed in full, and 0 disables padding
 */
public record OutputFormat(int width) {

    public static final int DEFAULT_WIDTH = 5;

    public static final OutputFormat DEFAULT = new OutputFormat(DEFAULT_WIDTH);

    public OutputFormat {
        if (width < 0)
            throw new IllegalArgumentException("Output width must be non-negative: " + width);
    }

    public static OutputFormat width(int width) {
        return new OutputFormat(width);
    }
}
