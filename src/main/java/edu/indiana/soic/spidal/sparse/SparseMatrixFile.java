package edu.indiana.soic.spidal.sparse;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads and writes sparse matrices in their text form.
 */
public class SparseMatrixFile {

    private SparseMatrixFile() {
    }

    /**
     * Load a matrix from a text file
     *
     * @param pathname path to the matrix file
     * @return the matrix
     * @throws IOException           if the file cannot be read
     * @throws MatrixFormatException if the file content is malformed
     */
    public static SparseMatrix load(String pathname) throws IOException, MatrixFormatException {
        return load(Paths.get(pathname));
    }

    public static SparseMatrix load(Path path) throws IOException, MatrixFormatException {
        String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        return SparseMatrix.fromText(content);
    }

    /**
     * Write a matrix, replacing any existing file. The parent directory must
     * exist.
     *
     * @param matrix matrix to write
     * @param path   output file
     * @throws IOException if the file cannot be written
     */
    public static void store(SparseMatrix matrix, Path path) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(matrix.toText());
        }
    }
}
