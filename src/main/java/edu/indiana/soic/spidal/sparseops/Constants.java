package edu.indiana.soic.spidal.sparseops;

public class Constants {
    static final String PROGRAM_NAME = "SparseOps";

    static final char CMD_OPTION_SHORT_C = 'c';
    static final String CMD_OPTION_LONG_C = "configFile";
    static final String CMD_OPTION_DESCRIPTION_C = "Configuration file";
    static final char CMD_OPTION_SHORT_O = 'o';
    static final String CMD_OPTION_LONG_O = "operation";
    static final String CMD_OPTION_DESCRIPTION_O = "Operation: add, subtract or multiply";
    static final char CMD_OPTION_SHORT_F = 'f';
    static final String CMD_OPTION_LONG_F = "first";
    static final String CMD_OPTION_DESCRIPTION_F = "First matrix file";
    static final char CMD_OPTION_SHORT_S = 's';
    static final String CMD_OPTION_LONG_S = "second";
    static final String CMD_OPTION_DESCRIPTION_S = "Second matrix file";

    static final String PROMPT_OPERATION = "Enter the operation (add, subtract, multiply): ";
    static final String PROMPT_FIRST_FILE = "Enter the path for the first matrix file: ";
    static final String PROMPT_SECOND_FILE = "Enter the path for the second matrix file: ";

    static final String
        ERR_PROGRAM_ARGUMENTS_PARSING_FAILED =
        "Argument parsing failed!";
    static final String ERR_INVALID_OPERATION = "Invalid operation";
    static final String ERR_EMPTY_FILE_NAME = "File name is null or empty!";

    static String msgResultSaved(String path) {
        return String.format("Result saved to %1$s", path);
    }
}
