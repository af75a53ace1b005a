package edu.nlpreaders.common.io;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

/**
 * Reads a column formatted corpus file one sentence block at a time.
 * <p>
 * Blocks are separated by blank lines. Lines starting with the comment
 * marker are not part of a block, they are attached to the block that
 * follows them. Lines are handed over untrimmed (only the line terminator is
 * removed) since some formats use whitespace as content.
 */
public class ConllBlockReader implements Closeable {
    private static Logger logger = Logger.getLogger(ConllBlockReader.class.getPackage().getName());

    public static final String DEFAULT_COMMENT_MARKER = "#";

    BufferedReader reader;
    String         fileName;
    String         commentMarker;
    int            lineNumber;
    int            blockCount;
    boolean        closed;

    public ConllBlockReader(File file) throws IOException {
        this(file, DEFAULT_COMMENT_MARKER);
    }

    public ConllBlockReader(File file, String commentMarker) throws IOException {
        this(new InputStreamReader(open(file), StandardCharsets.UTF_8), file.getPath(), commentMarker);
    }

    public ConllBlockReader(Reader reader, String fileName) {
        this(reader, fileName, DEFAULT_COMMENT_MARKER);
    }

    /**
     * @param commentMarker prefix of comment lines, <code>null</code> if the format has no comments
     */
    public ConllBlockReader(Reader reader, String fileName, String commentMarker) {
        this.reader = reader instanceof BufferedReader?(BufferedReader)reader:new BufferedReader(reader);
        this.fileName = fileName;
        this.commentMarker = commentMarker;
        lineNumber = 0;
        blockCount = 0;
        closed = false;
    }

    static InputStream open(File file) throws IOException {
        InputStream in = new FileInputStream(file);
        return file.getName().endsWith(".gz")?new GZIPInputStream(in):in;
    }

    public String getFileName() {
        return fileName;
    }

    public int getBlockCount() {
        return blockCount;
    }

    /**
     * Returns the next sentence block, <code>null</code> at the end of the input.
     * The last block does not need a trailing blank line.
     */
    public LineBlock nextBlock() throws IOException {
        if (closed) return null;

        LineBlock block = new LineBlock(fileName);
        String line;
        while ((line=reader.readLine())!=null) {
            ++lineNumber;
            if (line.trim().isEmpty()) {
                if (!block.isEmpty()) {
                    ++blockCount;
                    return block;
                }
                continue;
            }
            if (commentMarker!=null && line.startsWith(commentMarker)) {
                block.addComment(line);
                continue;
            }
            block.addLine(line, lineNumber);
        }
        close();
        if (block.isEmpty())
            return null;
        ++blockCount;
        return block;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            reader.close();
        } catch (IOException e) {
            logger.warning("failed to close "+fileName+": "+e.getMessage());
        }
    }

    public boolean isOpen() {
        return !closed;
    }
}
