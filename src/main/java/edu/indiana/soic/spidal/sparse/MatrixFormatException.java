package edu.indiana.soic.spidal.sparse;

/**
 * Thrown when matrix text does not follow the
 * <code>rows=</code>, <code>cols=</code>, <code>(row,col,value)</code> layout.
 */
public class MatrixFormatException extends MatrixException {
    private static final long serialVersionUID = 1L;

    public static final String WRONG_FORMAT = "Input file has wrong format";

    public MatrixFormatException() {
        super(WRONG_FORMAT);
    }

    public MatrixFormatException(Throwable cause) {
        super(WRONG_FORMAT, cause);
    }

    public MatrixFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    static MatrixFormatException outOfRange(String number, String type, Throwable cause) {
        return new MatrixFormatException(
            String.format("Number %1$s is out of %2$s range", number, type), cause);
    }
}
