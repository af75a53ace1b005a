package edu.nlpreaders.srl.reader;

import edu.nlpreaders.srl.LabeledSpan;

/**
 * Records an argument a tolerant reader could not attach to its sentence.
 */
public class DroppedArgument {

    public enum Reason {
        /** the role column has no predicate to attach to */
        NO_PREDICATE
    }

    final String      fileName;
    final int         lineNumber;
    final String      sentenceId;
    final int         column;
    final LabeledSpan span;
    final Reason      reason;

    public DroppedArgument(String fileName, int lineNumber, String sentenceId, int column, LabeledSpan span, Reason reason) {
        this.fileName = fileName;
        this.lineNumber = lineNumber;
        this.sentenceId = sentenceId;
        this.column = column;
        this.span = span;
        this.reason = reason;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * @return line number of the first token line of the sentence
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getSentenceId() {
        return sentenceId;
    }

    /**
     * @return 0-based role column (predicate position) the span came from
     */
    public int getColumn() {
        return column;
    }

    public LabeledSpan getSpan() {
        return span;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return String.format("%s:%d sentence %s column %d: dropped %s (%s)", fileName, lineNumber, sentenceId, column, span, reason);
    }
}
