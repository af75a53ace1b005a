package edu.nlpreaders.common.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.nlpreaders.common.CorpusFormatException;

/**
 * The lines of one sentence block of a column formatted corpus file, with
 * the comment lines that preceded them and the line number of every line.
 */
public class LineBlock {

    final String        fileName;
    final List<String>  lines;
    final List<Integer> lineNumbers;
    final List<String>  comments;

    public LineBlock(String fileName) {
        this.fileName = fileName;
        lines = new ArrayList<String>();
        lineNumbers = new ArrayList<Integer>();
        comments = new ArrayList<String>();
    }

    public LineBlock(String fileName, List<String> lines) {
        this(fileName);
        for (int i=0; i<lines.size(); ++i)
            addLine(lines.get(i), i+1);
    }

    void addLine(String line, int lineNumber) {
        lines.add(line);
        lineNumbers.add(lineNumber);
    }

    void addComment(String comment) {
        comments.add(comment);
    }

    public String getFileName() {
        return fileName;
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public String getLine(int i) {
        return lines.get(i);
    }

    public List<String> getLines() {
        return Collections.unmodifiableList(lines);
    }

    /**
     * @return 1-based line number of the i-th line of the block in its file
     */
    public int getLineNumber(int i) {
        return lineNumbers.get(i);
    }

    /**
     * @return comment lines, with the comment marker, in file order
     */
    public List<String> getComments() {
        return Collections.unmodifiableList(comments);
    }

    public int getFirstLineNumber() {
        return lineNumbers.isEmpty()?0:lineNumbers.get(0);
    }

    /**
     * Convenience for building an exception pointing at the i-th line.
     */
    public CorpusFormatException formatException(int i, String message) {
        return new CorpusFormatException(message, fileName, getLineNumber(i));
    }

    @Override
    public String toString() {
        StringBuilder buffer = new StringBuilder();
        for (String line:lines)
            buffer.append(line).append('\n');
        return buffer.toString();
    }
}
