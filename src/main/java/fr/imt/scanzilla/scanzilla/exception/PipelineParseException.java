package fr.imt.scanzilla.scanzilla.exception;

/**
 * Exception thrown when a workflow file is not valid YAML or not shaped like a workflow.
 */
public class PipelineParseException extends ScanzillaException {

    private static final String ERROR_CODE = "PARSE_ERR";

    private final String path;
    private final int line;
    private final int column;

    public PipelineParseException(String path, int line, int column, String problem) {
        this(path, line, column, problem, null);
    }

    public PipelineParseException(String path, int line, int column, String problem, Throwable cause) {
        super(ERROR_CODE, "Invalid workflow " + path + " at line " + line + ", column " + column + ": " + problem, cause);
        this.path = path;
        this.line = line;
        this.column = column;
    }

    public String getPath() {
        return path;
    }

    /**
     * @return 1-based line of the problem, 0 when unknown
     */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
