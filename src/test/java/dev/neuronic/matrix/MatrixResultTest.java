package dev.neuronic.matrix;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatrixResultTest {

    @Test
    void testOk() {
        MatrixResult<String> result = MatrixResult.ok("value");

        assertTrue(result.isOk());
        assertEquals("value", result.value());
        assertEquals("value", result.orElseThrow());
        assertNull(result.error());
        assertEquals(MatrixResult.ok(5), result.map(String::length));
    }

    @Test
    void testFailure() {
        MatrixResult<String> result = MatrixResult.failure(MatrixError.SIZE_MISMATCH);

        assertFalse(result.isOk());
        assertEquals(MatrixError.SIZE_MISMATCH, result.error());
        assertThrows(IllegalStateException.class, result::value);
        assertThrows(MatrixException.SizeMismatch.class, result::orElseThrow);
        assertEquals(MatrixError.SIZE_MISMATCH, result.map(String::length).error());
    }

    @Test
    void testNullValueIsSuccess() {
        MatrixResult<String> result = MatrixResult.ok(null);

        assertTrue(result.isOk());
        assertNull(result.value());
        assertNull(result.orElseThrow());
    }

    @Test
    void testNullErrorIsRejected() {
        assertThrows(NullPointerException.class, () -> MatrixResult.failure(null));
    }

    @Test
    void testEveryKindMapsToItsException() {
        assertInstanceOf(MatrixException.ZeroSize.class, MatrixError.ZERO_SIZE.toException());
        assertInstanceOf(MatrixException.SizeMismatch.class, MatrixError.SIZE_MISMATCH.toException());
        assertInstanceOf(MatrixException.IncompatibleSizesAdd.class,
                         MatrixError.INCOMPATIBLE_SIZES_ADD.toException());
        assertInstanceOf(MatrixException.IncompatibleSizesMultiply.class,
                         MatrixError.INCOMPATIBLE_SIZES_MULTIPLY.toException());
        assertInstanceOf(MatrixException.IndexOutOfRange.class, MatrixError.INDEX_OUT_OF_RANGE.toException());

        for (MatrixError kind : MatrixError.values()) {
            MatrixException e = kind.toException();
            assertEquals(kind, e.kind());
            assertEquals(kind.description(), e.getMessage());
        }
    }

    @Test
    void testToString() {
        assertEquals("Ok[1]", MatrixResult.ok(1).toString());
        assertEquals("Failure[ZERO_SIZE]", MatrixResult.failure(MatrixError.ZERO_SIZE).toString());
    }
}
