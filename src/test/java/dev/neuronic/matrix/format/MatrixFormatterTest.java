package dev.neuronic.matrix.format;

import dev.neuronic.matrix.Matrix;
import dev.neuronic.matrix.math.Arithmetics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MatrixFormatterTest {

    @AfterEach
    void resetWidths() {
        MatrixFormatter.resetOutputWidths();
    }

    @Test
    void testDefaultWidthIsFive() {
        Matrix<Integer> m = Matrix.of(Arithmetics.integers(), 2, 2, 1, 2, 3, 4);

        assertEquals(5, MatrixFormatter.outputWidth(Integer.class));
        assertEquals("(     1     2 )\n" +
                     "(     3     4 )\n" +
                     "\n", m.toString());
    }

    @Test
    void testExplicitFormat() {
        Matrix<Double> m = Matrix.diagonal(Arithmetics.doubles(), 1.0, 2.5);

        assertEquals("(   1   0 )\n" +
                     "(   0 2.5 )\n" +
                     "\n", MatrixFormatter.format(m, OutputFormat.width(3)));
    }

    @Test
    void testZeroWidthMeansNoPadding() {
        Matrix<Integer> m = Matrix.of(Arithmetics.integers(), 1, 3, 1, -20, 300);

        assertEquals("( 1 -20 300 )\n\n", MatrixFormatter.format(m, OutputFormat.width(0)));
    }

    @Test
    void testLongElementsAreNotTruncated() {
        Matrix<Integer> m = Matrix.filled(Arithmetics.integers(), 1, 1, 123456);

        assertEquals("( 123456 )\n\n", MatrixFormatter.format(m, OutputFormat.width(2)));
    }

    @Test
    void testSharedWidthIsPerElementType() {
        Matrix<Double> d = Matrix.filled(Arithmetics.doubles(), 1, 2, 7.0);
        Matrix<Integer> i = Matrix.filled(Arithmetics.integers(), 1, 2, 7);

        Matrix.setOutputWidth(Arithmetics.doubles(), 3);

        assertEquals(3, MatrixFormatter.outputWidth(Double.class));
        assertEquals("(   7   7 )\n\n", d.toString());
        assertEquals("(     7     7 )\n\n", i.toString());

        // applies to matrices created after the change as well
        assertEquals("(   1 )\n\n", Matrix.filled(Arithmetics.doubles(), 1, 1, 1.0).toString());
    }

    @Test
    void testResetRestoresDefault() {
        MatrixFormatter.setOutputWidth(Integer.class, 9);
        MatrixFormatter.resetOutputWidths();

        assertEquals(OutputFormat.DEFAULT_WIDTH, MatrixFormatter.outputWidth(Integer.class));
    }

    @Test
    void testNegativeWidthRejected() {
        assertThrows(IllegalArgumentException.class, () -> MatrixFormatter.setOutputWidth(Integer.class, -1));
        assertThrows(IllegalArgumentException.class, () -> Matrix.setOutputWidth(Arithmetics.doubles(), -3));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.width(-1));
    }

    @Test
    void testMovedFromMatrixRendersEmptyMarker() {
        Matrix<Integer> m = Matrix.filled(Arithmetics.integers(), 2, 2, 1);
        Matrix.moveFrom(m);

        assertEquals("()\n", m.toString());
        assertEquals("()\n", MatrixFormatter.format(m.view(), OutputFormat.DEFAULT));
    }

    @Test
    void testUninitializedElementsRenderAsNull() {
        Matrix<Double> m = Matrix.uninitialized(Arithmetics.doubles(), 1, 2);
        m.setAt(0, 0, 1.0);

        assertEquals("(     1  null )\n\n", m.toString());
    }

    @Test
    void testViewFormatsLikeMatrix() {
        Matrix<Integer> m = Matrix.of(Arithmetics.integers(), 2, 1, 4, 5);

        assertEquals(m.toString(), m.view().toString());
    }

    @Test
    void testPrintToStream() {
        Matrix<Integer> m = Matrix.of(Arithmetics.integers(), 1, 2, 1, 2);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        try (PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
            MatrixFormatter.print(out, m);
            MatrixFormatter.print(out, m, OutputFormat.width(1));
        }

        assertEquals("(     1     2 )\n\n( 1 2 )\n\n", bytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testWriteToAppendable() throws IOException {
        Matrix<Integer> m = Matrix.filled(Arithmetics.integers(), 1, 1, 8);
        StringBuilder sb = new StringBuilder("matrix:\n");

        MatrixFormatter.write(sb, m, OutputFormat.width(2));

        assertEquals("matrix:\n(  8 )\n\n", sb.toString());
    }

    @Test
    void testSinkFailurePropagates() {
        Matrix<Integer> m = Matrix.filled(Arithmetics.integers(), 1, 1, 8);
        Writer failing = new Writer() {
            @Override public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("sink closed");
            }
            @Override public void flush() {}
            @Override public void close() {}
        };

        IOException e = assertThrows(IOException.class, () ->
            MatrixFormatter.write(failing, m, OutputFormat.DEFAULT));
        assertEquals("sink closed", e.getMessage());
    }
}
