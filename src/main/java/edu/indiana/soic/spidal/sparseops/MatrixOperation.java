package edu.indiana.soic.spidal.sparseops;

import com.google.common.base.Optional;
import edu.indiana.soic.spidal.sparse.DimensionMismatchException;
import edu.indiana.soic.spidal.sparse.SparseMatrix;

/**
 * The binary operations the program can apply to two matrices.
 */
public enum MatrixOperation {
    ADD("add") {
        @Override
        public SparseMatrix apply(SparseMatrix first, SparseMatrix second)
            throws DimensionMismatchException {
            return first.add(second);
        }
    },
    SUBTRACT("subtract") {
        @Override
        public SparseMatrix apply(SparseMatrix first, SparseMatrix second)
            throws DimensionMismatchException {
            return first.subtract(second);
        }
    },
    MULTIPLY("multiply") {
        @Override
        public SparseMatrix apply(SparseMatrix first, SparseMatrix second)
            throws DimensionMismatchException {
            return first.multiply(second);
        }
    };

    private final String commandName;

    MatrixOperation(String name) {
        this.commandName = name;
    }

    /**
     * @return lower case name used on the command line and in result file
     * names
     */
    public String getName() {
        return commandName;
    }

    public abstract SparseMatrix apply(SparseMatrix first, SparseMatrix second)
        throws DimensionMismatchException;

    /**
     * Look up an operation by name, ignoring case and surrounding whitespace
     *
     * @param name operation name such as <code>add</code> or
     *             <code>MULTIPLY</code>
     * @return the operation, or absent if the name is not recognized
     */
    public static Optional<MatrixOperation> fromName(String name) {
        if (name == null) {
            return Optional.absent();
        }
        String trimmed = name.trim();
        for (MatrixOperation operation : values()) {
            if (operation.commandName.equalsIgnoreCase(trimmed)) {
                return Optional.of(operation);
            }
        }
        return Optional.absent();
    }
}
