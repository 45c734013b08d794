package edu.indiana.soic.spidal.sparse;

import org.apache.commons.lang3.StringUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Integer sparse matrix stored as a map of rows, each row being a map from
 * column index to value. Both levels keep insertion order so that
 * {@link #toText()} lists entries in the order they were set.
 * <p/>
 * Indices are not checked against the dimensions and setting a zero keeps
 * an explicit zero entry. Only {@link #multiply(SparseMatrix)} leaves zero
 * results out of its output.
 */
public class SparseMatrix {
    private final int rows;
    private final int cols;
    private final Map<Integer, Map<Integer, Long>> data = new LinkedHashMap<>();

    /**
     * Callback for {@link #forEachEntry(EntryConsumer)}
     */
    @FunctionalInterface
    public interface EntryConsumer {
        void accept(int row, int col, long value);
    }

    public SparseMatrix(int rows, int cols) {
        this.rows = rows;
        this.cols = cols;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    /**
     * Get the value of the element at the specified position
     *
     * @param row row index
     * @param col column index
     * @return the stored value or 0 if nothing is stored at (row, col)
     */
    public long getElement(int row, int col) {
        Map<Integer, Long> rowData = data.get(row);
        if (rowData == null) {
            return 0L;
        }
        Long value = rowData.get(col);
        return value == null ? 0L : value;
    }

    /**
     * Set the value of the element at the specified position. A zero value
     * is stored as given.
     *
     * @param row   row index
     * @param col   column index
     * @param value value to store
     */
    public void setElement(int row, int col, long value) {
        data.computeIfAbsent(row, r -> new LinkedHashMap<>()).put(col, value);
    }

    /**
     * @return number of stored entries, explicit zeros included
     */
    public int getEntryCount() {
        int count = 0;
        for (Map<Integer, Long> rowData : data.values()) {
            count += rowData.size();
        }
        return count;
    }

    public void forEachEntry(EntryConsumer consumer) {
        for (Map.Entry<Integer, Map<Integer, Long>> rowEntry : data.entrySet()) {
            int row = rowEntry.getKey();
            for (Map.Entry<Integer, Long> colEntry : rowEntry.getValue().entrySet()) {
                consumer.accept(row, colEntry.getKey(), colEntry.getValue());
            }
        }
    }

    /**
     * Add another matrix to this one.
     *
     * @param matrix matrix with the same dimensions as this one
     * @return a new matrix holding the sum, with an entry for every position
     * stored in either operand
     * @throws DimensionMismatchException if the dimensions differ
     */
    public SparseMatrix add(SparseMatrix matrix) throws DimensionMismatchException {
        if (rows != matrix.rows || cols != matrix.cols) {
            throw DimensionMismatchException.forAddition();
        }

        SparseMatrix result = copy();
        matrix.forEachEntry((row, col, value) -> result.setElement(
            row, col, Math.addExact(result.getElement(row, col), value)));
        return result;
    }

    /**
     * Subtract another matrix from this one.
     *
     * @param matrix matrix with the same dimensions as this one
     * @return a new matrix holding the difference, with an entry for every
     * position stored in either operand
     * @throws DimensionMismatchException if the dimensions differ
     */
    public SparseMatrix subtract(SparseMatrix matrix) throws DimensionMismatchException {
        if (rows != matrix.rows || cols != matrix.cols) {
            throw DimensionMismatchException.forSubtraction();
        }

        SparseMatrix result = copy();
        matrix.forEachEntry((row, col, value) -> result.setElement(
            row, col, Math.subtractExact(result.getElement(row, col), value)));
        return result;
    }

    /**
     * Multiply this matrix with another one. Only rows that hold entries in
     * this matrix produce output, and a dot product of zero is not stored.
     * The dot product of a row with column <code>col</code> covers
     * <code>k</code> in <code>[0, cols)</code> and output columns cover
     * <code>[0, matrix.cols)</code>, so entries stored outside those ranges
     * do not contribute.
     *
     * @param matrix matrix whose row count equals this matrix's column count
     * @return a new <code>rows x matrix.cols</code> matrix, entries of each
     * row in ascending column order
     * @throws DimensionMismatchException if <code>cols != matrix.rows</code>
     * @throws ArithmeticException        if a dot product does not fit in a
     *                                    <code>long</code>
     */
    public SparseMatrix multiply(SparseMatrix matrix) throws DimensionMismatchException {
        if (cols != matrix.rows) {
            throw DimensionMismatchException.forMultiplication();
        }

        SparseMatrix result = new SparseMatrix(rows, matrix.cols);
        for (Map.Entry<Integer, Map<Integer, Long>> rowEntry : data.entrySet()) {
            TreeMap<Integer, BigInteger> dotProducts = new TreeMap<>();
            for (Map.Entry<Integer, Long> aEntry : rowEntry.getValue().entrySet()) {
                int k = aEntry.getKey();
                if (k < 0 || k >= cols) {
                    continue;
                }
                Map<Integer, Long> bRow = matrix.data.get(k);
                if (bRow == null) {
                    continue;
                }
                BigInteger aVal = BigInteger.valueOf(aEntry.getValue());
                for (Map.Entry<Integer, Long> bEntry : bRow.entrySet()) {
                    int col = bEntry.getKey();
                    if (col < 0 || col >= matrix.cols) {
                        continue;
                    }
                    dotProducts.merge(col, aVal.multiply(BigInteger.valueOf(bEntry.getValue())), BigInteger::add);
                }
            }

            int row = rowEntry.getKey();
            for (Map.Entry<Integer, BigInteger> product : dotProducts.entrySet()) {
                if (product.getValue().signum() != 0) {
                    result.setElement(row, product.getKey(), product.getValue().longValueExact());
                }
            }
        }
        return result;
    }

    /**
     * Parse a matrix from its text form
     * <pre>
     * rows=&lt;int&gt;
     * cols=&lt;int&gt;
     * (&lt;row&gt;,&lt;col&gt;,&lt;value&gt;)
     * ...
     * </pre>
     * Blank lines are ignored. For the two header lines only the text after
     * the first <code>=</code> is read. Entry lines lose their first and
     * last character and the rest must be three comma separated integers.
     * Entries are applied in order, so a repeated position keeps the last
     * value.
     *
     * @param content matrix text
     * @return the parsed matrix
     * @throws MatrixFormatException if the header or any entry line is
     *                               malformed
     */
    public static SparseMatrix fromText(String content) throws MatrixFormatException {
        List<String> lines = new ArrayList<>();
        for (String line : content.split("\r\n|\r|\n")) {
            if (!StringUtils.isBlank(line)) {
                lines.add(StringUtils.strip(line));
            }
        }
        if (lines.size() < 2) {
            throw new MatrixFormatException();
        }

        SparseMatrix matrix = new SparseMatrix(
            parseHeader(lines.get(0)), parseHeader(lines.get(1)));

        for (String line : lines.subList(2, lines.size())) {
            if (line.length() < 2) {
                throw new MatrixFormatException();
            }
            String[] tokens = line.substring(1, line.length() - 1).split(",", -1);
            if (tokens.length != 3) {
                throw new MatrixFormatException();
            }
            matrix.setElement(parseInt(tokens[0]), parseInt(tokens[1]), parseLong(tokens[2]));
        }
        return matrix;
    }

    /**
     * @return the text form read by {@link #fromText(String)}, entries
     * written as <code>(row, col, value)</code> in storage order
     */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append("rows=").append(rows).append('\n');
        sb.append("cols=").append(cols).append('\n');
        forEachEntry((row, col, value) -> sb.append('(').append(row).append(", ")
                                            .append(col).append(", ")
                                            .append(value).append(")\n"));
        return sb.toString();
    }

    @Override
    public String toString() {
        return toText();
    }

    /**
     * Two matrices are equal when their dimensions match and they hold the
     * same nonzero values at the same positions. Explicit zeros and entry
     * order are ignored.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SparseMatrix)) {
            return false;
        }
        SparseMatrix that = (SparseMatrix) o;
        return rows == that.rows && cols == that.cols
               && nonZeroEntriesFoundIn(this, that)
               && nonZeroEntriesFoundIn(that, this);
    }

    @Override
    public int hashCode() {
        int hash = 31 * rows + cols;
        for (Map.Entry<Integer, Map<Integer, Long>> rowEntry : data.entrySet()) {
            for (Map.Entry<Integer, Long> colEntry : rowEntry.getValue().entrySet()) {
                long value = colEntry.getValue();
                if (value != 0L) {
                    hash += (rowEntry.getKey() * 31 + colEntry.getKey()) ^ Long.hashCode(value);
                }
            }
        }
        return hash;
    }

    private static boolean nonZeroEntriesFoundIn(SparseMatrix source, SparseMatrix target) {
        for (Map.Entry<Integer, Map<Integer, Long>> rowEntry : source.data.entrySet()) {
            for (Map.Entry<Integer, Long> colEntry : rowEntry.getValue().entrySet()) {
                long value = colEntry.getValue();
                if (value != 0L && target.getElement(rowEntry.getKey(), colEntry.getKey()) != value) {
                    return false;
                }
            }
        }
        return true;
    }

    private SparseMatrix copy() {
        SparseMatrix result = new SparseMatrix(rows, cols);
        forEachEntry(result::setElement);
        return result;
    }

    private static int parseHeader(String line) throws MatrixFormatException {
        String[] tokens = line.split("=", -1);
        if (tokens.length < 2) {
            throw new MatrixFormatException();
        }
        return parseInt(tokens[1]);
    }

    private static int parseInt(String token) throws MatrixFormatException {
        try {
            return Integer.parseInt(StringUtils.strip(token));
        } catch (NumberFormatException e) {
            throw formatError(token, "int", e);
        }
    }

    private static long parseLong(String token) throws MatrixFormatException {
        try {
            return Long.parseLong(StringUtils.strip(token));
        } catch (NumberFormatException e) {
            throw formatError(token, "long", e);
        }
    }

    /**
     * A well formed integer that does not fit the target type is reported
     * as out of range, anything else as a format error.
     */
    private static MatrixFormatException formatError(String token, String type,
                                                     NumberFormatException e) {
        String stripped = StringUtils.strip(token);
        try {
            new BigInteger(stripped);
        } catch (NumberFormatException notAnInteger) {
            return new MatrixFormatException(e);
        }
        return MatrixFormatException.outOfRange(stripped, type, e);
    }
}
