package edu.indiana.soic.spidal.sparseops;

import com.google.common.io.Files;

public class Utils {

    public static void printMessage(String msg) {
        System.out.println(msg);
    }

    public static void printPrompt(String prompt) {
        System.out.print(prompt);
        System.out.flush();
    }

    /**
     * Result file name built from the operand file names, e.g.
     * <code>a_add_b_result.txt</code> for <code>dir/a.txt</code> and
     * <code>b.txt</code>. Only the last extension of each operand is
     * dropped.
     *
     * @param firstPath  path of the first operand file
     * @param operation  applied operation
     * @param secondPath path of the second operand file
     * @param suffix     appended after the second operand name
     * @return the file name, without a directory
     */
    public static String resultFileName(String firstPath, MatrixOperation operation,
                                        String secondPath, String suffix) {
        return Files.getNameWithoutExtension(firstPath) + '_' + operation.getName()
               + '_' + Files.getNameWithoutExtension(secondPath) + suffix;
    }
}
