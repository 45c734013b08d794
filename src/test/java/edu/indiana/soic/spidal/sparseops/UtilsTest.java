package edu.indiana.soic.spidal.sparseops;

import junit.framework.TestCase;

public class UtilsTest extends TestCase {

    public void testResultFileName() {
        assertEquals("easy_a_add_easy_b_result.txt",
                     Utils.resultFileName("matrices/easy_a.txt", MatrixOperation.ADD,
                                          "/tmp/easy_b.txt", "_result.txt"));
    }

    public void testResultFileNameDropsOnlyLastExtension() {
        assertEquals("m.v1_multiply_plain_result.txt",
                     Utils.resultFileName("m.v1.txt", MatrixOperation.MULTIPLY,
                                          "plain", "_result.txt"));
    }
}
