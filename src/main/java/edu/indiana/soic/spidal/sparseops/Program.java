package edu.indiana.soic.spidal.sparseops;

import com.google.common.base.Optional;
import com.google.common.base.Strings;
import edu.indiana.soic.spidal.configuration.ConfigurationMgr;
import edu.indiana.soic.spidal.configuration.section.SparseOpsSection;
import edu.indiana.soic.spidal.sparse.MatrixException;
import edu.indiana.soic.spidal.sparse.SparseMatrix;
import edu.indiana.soic.spidal.sparse.SparseMatrixFile;
import edu.indiana.soic.spidal.sparseops.timing.OperationTimings;
import org.apache.commons.cli.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

import edu.indiana.soic.spidal.sparseops.timing.OperationTimings.TimingTask;

public class Program {
    private static Options programOptions = new Options();

    static {
        programOptions.addOption(
            String.valueOf(Constants.CMD_OPTION_SHORT_C),
            Constants.CMD_OPTION_LONG_C, true,
            Constants.CMD_OPTION_DESCRIPTION_C);
        programOptions.addOption(
            String.valueOf(Constants.CMD_OPTION_SHORT_O),
            Constants.CMD_OPTION_LONG_O, true,
            Constants.CMD_OPTION_DESCRIPTION_O);
        programOptions.addOption(
            String.valueOf(Constants.CMD_OPTION_SHORT_F),
            Constants.CMD_OPTION_LONG_F, true,
            Constants.CMD_OPTION_DESCRIPTION_F);
        programOptions.addOption(
            String.valueOf(Constants.CMD_OPTION_SHORT_S),
            Constants.CMD_OPTION_LONG_S, true,
            Constants.CMD_OPTION_DESCRIPTION_S);
    }

    //Config Settings
    public static SparseOpsSection config;

    /**
     * Applies add, subtract or multiply to two sparse matrix files and
     * writes the result into the results directory.
     *
     * @param args command line arguments to the program, which may include
     *             -c path to config file
     *             -o operation name
     *             -f path to the first matrix file
     *             -s path to the second matrix file
     *             The options may also be given as longer names
     *             --configFile, --operation, --first and --second
     *             respectively. Values not given are read from standard
     *             input.
     */
    public static void main(String[] args) {
        Optional<CommandLine> parserResult =
            parseCommandLineArguments(args, programOptions);

        if (!parserResult.isPresent()) {
            System.out.println(Constants.ERR_PROGRAM_ARGUMENTS_PARSING_FAILED);
            new HelpFormatter()
                .printHelp(Constants.PROGRAM_NAME, programOptions);
            return;
        }

        CommandLine cmd = parserResult.get();
        try {
            readConfiguration(cmd);
            if (config.printTimings) {
                Utils.printMessage(config.toString(false));
            }

            BufferedReader stdin = new BufferedReader(
                new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String operation = optionOrPrompt(
                cmd, Constants.CMD_OPTION_LONG_O, Constants.PROMPT_OPERATION, stdin);
            String firstPath = optionOrPrompt(
                cmd, Constants.CMD_OPTION_LONG_F, Constants.PROMPT_FIRST_FILE, stdin);
            String secondPath = optionOrPrompt(
                cmd, Constants.CMD_OPTION_LONG_S, Constants.PROMPT_SECOND_FILE, stdin);

            performOperation(operation, firstPath, secondPath, config);
        } catch (IOException | RuntimeException e) {
            Utils.printMessage(e.getMessage());
        }
    }

    /**
     * Load both operands, apply the named operation and store the result.
     * Failures are reported on the console and end the request.
     *
     * @param operationName <code>add</code>, <code>subtract</code> or
     *                      <code>multiply</code>, case insensitive
     * @param firstPath     first operand file
     * @param secondPath    second operand file
     * @param config        output settings
     * @return the written result file, or absent if the request failed
     */
    public static Optional<Path> performOperation(
        String operationName, String firstPath, String secondPath,
        SparseOpsSection config) {
        if (Strings.isNullOrEmpty(firstPath) || Strings.isNullOrEmpty(secondPath)) {
            Utils.printMessage(Constants.ERR_EMPTY_FILE_NAME);
            return Optional.absent();
        }

        OperationTimings timings = new OperationTimings();
        try {
            timings.startTiming(TimingTask.LOAD);
            SparseMatrix first = SparseMatrixFile.load(firstPath);
            SparseMatrix second = SparseMatrixFile.load(secondPath);
            timings.endTiming(TimingTask.LOAD);

            Optional<MatrixOperation> operation =
                MatrixOperation.fromName(operationName);
            if (!operation.isPresent()) {
                Utils.printMessage(Constants.ERR_INVALID_OPERATION);
                return Optional.absent();
            }

            timings.startTiming(TimingTask.OPERATION);
            SparseMatrix result = operation.get().apply(first, second);
            timings.endTiming(TimingTask.OPERATION);

            timings.startTiming(TimingTask.WRITE);
            Path resultsDirectory = Paths.get(config.resultsDirectory);
            Files.createDirectories(resultsDirectory);
            Path resultFile = resultsDirectory.resolve(Utils.resultFileName(
                firstPath, operation.get(), secondPath, config.resultFileSuffix));
            SparseMatrixFile.store(result, resultFile);
            timings.endTiming(TimingTask.WRITE);

            Utils.printMessage(Constants.msgResultSaved(resultFile.toString()));
            if (config.printTimings) {
                Utils.printMessage(timings.toString());
            }
            return Optional.of(resultFile);
        }
        catch (NoSuchFileException e) {
            Utils.printMessage("No such file or directory: " + e.getFile());
        }
        catch (IOException e) {
            Utils.printMessage(e.toString());
        }
        catch (MatrixException | ArithmeticException e) {
            Utils.printMessage(e.getMessage());
        }
        return Optional.absent();
    }

    private static String optionOrPrompt(
        CommandLine cmd, String option, String prompt, BufferedReader in)
        throws IOException {
        if (cmd.hasOption(option)) {
            return cmd.getOptionValue(option).trim();
        }
        Utils.printPrompt(prompt);
        String line = in.readLine();
        return line == null ? "" : line.trim();
    }

    private static void readConfiguration(CommandLine cmd) {
        config = ConfigurationMgr.LoadConfiguration(
            cmd.getOptionValue(Constants.CMD_OPTION_LONG_C)).sparseOpsSection;
    }

    /**
     * Parse command line arguments
     *
     * @param args Command line arguments
     * @param opts Command line options
     * @return An <code>Optional&lt;CommandLine&gt;</code> object
     */
    private static Optional<CommandLine> parseCommandLineArguments(
        String[] args, Options opts) {

        CommandLineParser optParser = new GnuParser();

        try {
            return Optional.fromNullable(optParser.parse(opts, args));
        }
        catch (ParseException e) {
            e.printStackTrace();
        }
        return Optional.fromNullable(null);
    }
}
