package edu.indiana.soic.spidal.configuration.section;

import com.google.common.base.Strings;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Properties;
import java.util.stream.IntStream;

public class SparseOpsSection {

    public static final String DEFAULT_RESULTS_DIRECTORY = "sparse_matrix/sample_results";
    public static final String DEFAULT_RESULT_FILE_SUFFIX = "_result.txt";

    public SparseOpsSection(String configurationFilePath) {
        Properties p = new Properties();
        if (!Strings.isNullOrEmpty(configurationFilePath)) {
            try (InputStream in = new FileInputStream(configurationFilePath)) {
                p.load(in);
            } catch (IOException e) {
                throw new RuntimeException("IO exception occurred while reading configuration properties file", e);
            }
        }
        resultsDirectory = getProperty(p, "ResultsDirectory", DEFAULT_RESULTS_DIRECTORY);
        resultFileSuffix = getProperty(p, "ResultFileSuffix", DEFAULT_RESULT_FILE_SUFFIX);
        printTimings = Boolean.parseBoolean(getProperty(p, "PrintTimings", "false"));
    }

    private static String getProperty(Properties p, String name, String def) {
        String val = System.getProperty(name);
        if (val == null) {
            if (def != null) {
                val = p.getProperty(name, def);
            } else {
                val = p.getProperty(name);
            }
        }
        return val;
    }

    public String resultsDirectory;
    public String resultFileSuffix;
    public boolean printTimings;

    private String getPadding(int count, String prefix){
        StringBuilder sb = new StringBuilder(prefix);
        IntStream.range(0,count).forEach(i -> sb.append(" "));
        return sb.toString();
    }

    public String toString(boolean centerAligned) {
        String[] params = new String[]{"Results Directory",
                                       "Result File Suffix",
                                       "Print timings (boolean)"};
        Object[] args =
            new Object[]{resultsDirectory,
                         resultFileSuffix,
                         printTimings};

        java.util.Optional<Integer> maxLength =
            Arrays.stream(params).map(String::length).reduce(Math::max);
        if (!maxLength.isPresent()) { return ""; }
        final int max = maxLength.get();
        final String prefix = "  ";
        StringBuilder sb = new StringBuilder("Parameters...\n");
        if (centerAligned) {
            IntStream.range(0, params.length).forEach(
                i -> {
                    String param = params[i];
                    sb.append(getPadding(max - param.length(), prefix))
                      .append(param).append(": ").append(args[i]).append("\n");
                });
        }
        else {
            IntStream.range(0, params.length).forEach(
                i -> {
                    String param = params[i];
                    sb.append(prefix).append(param).append(":")
                      .append(getPadding(max - param.length(), ""))
                      .append(args[i]).append("\n");
                });
        }
        return sb.toString();
    }
}
