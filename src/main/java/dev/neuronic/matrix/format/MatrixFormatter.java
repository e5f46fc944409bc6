package dev.neuronic.matrix.format;

import dev.neuronic.matrix.MatrixView;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Renders matrices as text for diagnostics and demos.
 *
 * <p>Layout, for a 2x2 matrix at width 3:
 * <pre>
 * (   1   2 )
 * (   3   4 )
 *
 * </pre>
 * Each row is parenthesized, each element right-justified and followed by a
 * space, and a blank line ends the matrix. A moved-from matrix renders as
 * {@code "()\n"}. The output is not meant to be parsed back.
 *
 * <p>The shared width is kept per element type and applies to
 * {@link #format(MatrixView)} and {@code Matrix.toString()}. Set it once during
 * setup; concurrent writers are not ordered against concurrent formatting.
 */
public final class MatrixFormatter {

    private static final Map<Class<?>, Integer> OUTPUT_WIDTHS = new ConcurrentHashMap<>();

    /**
     * Set the shared element width for every matrix of the given element type.
     *
     * @throws IllegalArgumentException if width is negative
     */
    public static void setOutputWidth(Class<?> elementType, int width) {
        Objects.requireNonNull(elementType, "elementType");
        if (width < 0)
            throw new IllegalArgumentException("Output width must be non-negative: " + width);
        OUTPUT_WIDTHS.put(elementType, width);
    }

    /**
     * @return the shared width for the element type, {@value OutputFormat#DEFAULT_WIDTH} unless changed
     */
    public static int outputWidth(Class<?> elementType) {
        return OUTPUT_WIDTHS.getOrDefault(elementType, OutputFormat.DEFAULT_WIDTH);
    }

    /**
     * Forget every width set through {@link #setOutputWidth}.
     */
    public static void resetOutputWidths() {
        OUTPUT_WIDTHS.clear();
    }

    /**
     * Format using the shared width of the matrix's element type.
     */
    public static String format(MatrixView<?> matrix) {
        return format(matrix, new OutputFormat(outputWidth(matrix.elementType())));
    }

    public static String format(MatrixView<?> matrix, OutputFormat format) {
        StringBuilder sb = new StringBuilder();
        try {
            write(sb, matrix, format);
        } catch (IOException e) {
            // StringBuilder never throws
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    /**
     * Write the matrix to any character sink.
     *
     * @throws IOException if the sink fails
     */
    public static void write(Appendable out, MatrixView<?> matrix, OutputFormat format) throws IOException {
        Objects.requireNonNull(format, "format");
        if (matrix.rows() == 0 && matrix.cols() == 0) {
            out.append("()\n");
            return;
        }

        for (int i = 0; i < matrix.rows(); i++) {
            out.append("( ");
            for (int j = 0; j < matrix.cols(); j++) {
                String text = matrix.elementText(i, j);
                for (int pad = text.length(); pad < format.width(); pad++)
                    out.append(' ');
                out.append(text).append(' ');
            }
            out.append(")\n");
        }
        out.append('\n');
    }

    /**
     * Print the matrix to a stream using the shared width, e.g. {@code print(System.out, m)}.
     */
    public static void print(PrintStream out, MatrixView<?> matrix) {
        out.print(format(matrix));
    }

    public static void print(PrintStream out, MatrixView<?> matrix, OutputFormat format) {
        out.print(format(matrix, format));
    }

    private MatrixFormatter() {}
}
