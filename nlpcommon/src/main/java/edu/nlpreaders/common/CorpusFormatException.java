package edu.nlpreaders.common;

/**
 * Thrown when a corpus file does not follow the layout of its dialect.
 */
public class CorpusFormatException extends Exception {

    private static final long serialVersionUID = 4170355846209836591L;

    final String fileName;
    final int    lineNumber;

    public CorpusFormatException(String message, String fileName, int lineNumber) {
        super(message);
        this.fileName = fileName;
        this.lineNumber = lineNumber;
    }

    public CorpusFormatException(String message, String fileName, int lineNumber, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
        this.lineNumber = lineNumber;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * @return 1-based line number in the file, 0 when unknown
     */
    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public String getMessage() {
        return (fileName==null?"<input>":fileName)+":"+lineNumber+": "+super.getMessage();
    }
}
