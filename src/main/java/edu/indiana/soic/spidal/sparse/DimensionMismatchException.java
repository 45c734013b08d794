package edu.indiana.soic.spidal.sparse;

public class DimensionMismatchException extends MatrixException {
    private static final long serialVersionUID = 1L;

    public DimensionMismatchException(String message) {
        super(message);
    }

    static DimensionMismatchException forAddition() {
        return new DimensionMismatchException(
            "Matrices must have the same dimensions for addition to perform");
    }

    static DimensionMismatchException forSubtraction() {
        return new DimensionMismatchException(
            "Matrices must have the same dimensions for subtraction to perform");
    }

    static DimensionMismatchException forMultiplication() {
        return new DimensionMismatchException(
            "Number of columns in the first matrix must be equal to the number " +
            "of rows in the second matrix for multiplication to perform");
    }
}
