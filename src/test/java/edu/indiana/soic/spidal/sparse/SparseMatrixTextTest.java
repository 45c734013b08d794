package edu.indiana.soic.spidal.sparse;

import junit.framework.TestCase;

public class SparseMatrixTextTest extends TestCase {

    public void testParse() throws MatrixFormatException {
        SparseMatrix matrix = SparseMatrix.fromText("rows=3\ncols=4\n(0,1,5)\n(2, 3, -7)\n");
        assertEquals(3, matrix.getRows());
        assertEquals(4, matrix.getCols());
        assertEquals(5L, matrix.getElement(0, 1));
        assertEquals(-7L, matrix.getElement(2, 3));
        assertEquals(2, matrix.getEntryCount());
    }

    public void testParseSkipsBlankLinesAndSurroundingWhitespace() throws MatrixFormatException {
        SparseMatrix matrix = SparseMatrix.fromText(
            "\n  rows = 2 \r\n\t\r\ncols=2\r\n\n   (1 , 0 ,  3 )   \n\n");
        assertEquals(2, matrix.getRows());
        assertEquals(2, matrix.getCols());
        assertEquals(3L, matrix.getElement(1, 0));
        assertEquals(1, matrix.getEntryCount());
    }

    public void testParseHeaderOnly() throws MatrixFormatException {
        SparseMatrix matrix = SparseMatrix.fromText("rows=0\ncols=0");
        assertEquals(0, matrix.getRows());
        assertEquals(0, matrix.getCols());
        assertEquals(0, matrix.getEntryCount());
    }

    public void testLaterDuplicateWins() throws MatrixFormatException {
        SparseMatrix matrix = SparseMatrix.fromText("rows=2\ncols=2\n(0,0,1)\n(1,1,4)\n(0,0,9)\n");
        assertEquals(9L, matrix.getElement(0, 0));
        assertEquals(2, matrix.getEntryCount());
    }

    public void testEnclosingCharactersAreNotChecked() throws MatrixFormatException {
        SparseMatrix matrix = SparseMatrix.fromText("rows=2\ncols=2\n[0,1,6]\n");
        assertEquals(6L, matrix.getElement(0, 1));
    }

    public void testMissingColsLine() {
        assertMalformed("rows=2\n");
    }

    public void testEmptyInput() {
        assertMalformed("");
        assertMalformed("\n   \n");
    }

    public void testWrongEntryArity() {
        assertMalformed("rows=2\ncols=2\n(1,1)\n");
        assertMalformed("rows=2\ncols=2\n(1,1,2,3)\n");
        assertMalformed("rows=2\ncols=2\n(1,1,2,)\n");
    }

    public void testNonNumericTokens() {
        assertMalformed("rows=two\ncols=2\n");
        assertMalformed("rows=2\ncols=\n");
        assertMalformed("rows=2\ncols=2\n(a,1,2)\n");
        assertMalformed("rows=2\ncols=2\n(0,1,2.5)\n");
    }

    public void testHeaderWithoutEquals() {
        assertMalformed("rows 2\ncols=2\n");
    }

    public void testSingleCharacterEntryLine() {
        assertMalformed("rows=2\ncols=2\n(\n");
    }

    public void testNumberOutOfRange() {
        try {
            SparseMatrix.fromText("rows=2\ncols=2\n(0,0,9223372036854775808)\n");
            fail("expected MatrixFormatException");
        } catch (MatrixFormatException e) {
            assertEquals("Number 9223372036854775808 is out of long range", e.getMessage());
        }
        try {
            SparseMatrix.fromText("rows=3000000000\ncols=2\n");
            fail("expected MatrixFormatException");
        } catch (MatrixFormatException e) {
            assertEquals("Number 3000000000 is out of int range", e.getMessage());
        }
    }

    public void testLongLimitsParse() throws MatrixFormatException {
        SparseMatrix matrix = SparseMatrix.fromText(
            "rows=2\ncols=2\n(0,0,9223372036854775807)\n(1,1,-9223372036854775808)\n");
        assertEquals(Long.MAX_VALUE, matrix.getElement(0, 0));
        assertEquals(Long.MIN_VALUE, matrix.getElement(1, 1));
    }

    public void testMalformedMessage() {
        try {
            SparseMatrix.fromText("rows=2\n");
            fail("expected MatrixFormatException");
        } catch (MatrixFormatException e) {
            assertEquals("Input file has wrong format", e.getMessage());
        }
    }

    public void testToTextKeepsInsertionOrder() {
        SparseMatrix matrix = new SparseMatrix(3, 3);
        matrix.setElement(2, 0, 1);
        matrix.setElement(0, 2, -3);
        matrix.setElement(2, 1, 0);
        assertEquals("rows=3\ncols=3\n(2, 0, 1)\n(2, 1, 0)\n(0, 2, -3)\n", matrix.toText());
        assertEquals(matrix.toText(), matrix.toString());
    }

    public void testRoundTrip() throws MatrixFormatException {
        String text = "rows=5\ncols=6\n(4, 5, 11)\n(4, 1, 3)\n(0, 0, -2)\n";
        SparseMatrix matrix = SparseMatrix.fromText(text);
        assertEquals(text, matrix.toText());

        SparseMatrix reparsed = SparseMatrix.fromText(matrix.toText());
        assertEquals(matrix, reparsed);
        assertEquals(matrix.getEntryCount(), reparsed.getEntryCount());
    }

    public void testToTextGroupsEntriesByRow() throws MatrixFormatException {
        SparseMatrix matrix = SparseMatrix.fromText(
            "rows=5\ncols=6\n(4,5,11)\n(0,0,-2)\n(4,1,3)\n");
        assertEquals("rows=5\ncols=6\n(4, 5, 11)\n(4, 1, 3)\n(0, 0, -2)\n", matrix.toText());
        assertEquals(matrix, SparseMatrix.fromText(matrix.toText()));
    }

    private static void assertMalformed(String content) {
        try {
            SparseMatrix.fromText(content);
            fail("expected MatrixFormatException for: " + content);
        } catch (MatrixFormatException e) {
            // expected
        }
    }
}
