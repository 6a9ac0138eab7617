package ai.tumblestone;

/**
 * Process exit codes of the solver, following the BSD {@code sysexits} conventions.
 */
public enum ExitStatus {
    /** A solution was presented, or the board was reported unsolvable. */
    OK(0),
    /** No board file was named on the command line. */
    USAGE(64),
    /** The board file could not be parsed. */
    PARSE_ERROR(65),
    /** The board file does not exist. */
    FILE_NOT_FOUND(66),
    /** The board file exists but could not be read. */
    IO_ERROR(74);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
