package edu.nlpreaders.srl.reader;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import edu.nlpreaders.common.CorpusFormatException;
import edu.nlpreaders.common.io.ConllBlockReader;
import edu.nlpreaders.common.io.LineBlock;
import edu.nlpreaders.common.util.FileUtil;
import edu.nlpreaders.srl.Argument;
import edu.nlpreaders.srl.LabeledSpan;
import edu.nlpreaders.srl.Predicate;
import edu.nlpreaders.srl.SrlSentence;

/**
 * Base class of the corpus dialect readers. A dialect only has to turn one
 * sentence block into an {@link SrlSentence}; file handling, directory
 * walking and column validation live here.
 * <p>
 * Readers keep no state between sentences (besides diagnostics), so a
 * single reader may parse several files concurrently.
 */
public abstract class SrlReader {
    static Logger logger = Logger.getLogger(SrlReader.class.getPackage().getName());

    /** role label of the predicate itself in span annotated corpora */
    public static final String PREDICATE_LABEL = "V";

    Pattern filePattern;

    protected SrlReader(String fileRegex) {
        setFileRegex(fileRegex);
    }

    public void setFileRegex(String fileRegex) {
        filePattern = Pattern.compile(fileRegex);
    }

    public Pattern getFilePattern() {
        return filePattern;
    }

    /**
     * @return the comment line marker of the dialect, <code>null</code> if it has none
     */
    protected String getCommentMarker() {
        return ConllBlockReader.DEFAULT_COMMENT_MARKER;
    }

    /**
     * Builds one sentence from the lines of a sentence block. The block is
     * validated before any object is built, a malformed block never yields a
     * partial sentence.
     */
    public abstract SrlSentence parseSentence(LineBlock block) throws CorpusFormatException;

    /**
     * Lists the corpus files of input: input itself if it is a file,
     * otherwise the files under it matching the dialect's file pattern, in
     * sorted path order.
     */
    public List<File> listFiles(File input) throws FileNotFoundException {
        if (!input.exists())
            throw new FileNotFoundException(input.getPath());
        if (input.isFile())
            return Collections.singletonList(input);
        return FileUtil.getFiles(input, filePattern);
    }

    /**
     * Reads a corpus file, or every corpus file of a directory.
     */
    public List<SrlSentence> read(File input) throws IOException, CorpusFormatException {
        List<SrlSentence> sentences = new ArrayList<SrlSentence>();
        for (File file:listFiles(input))
            sentences.addAll(readFile(file));
        return sentences;
    }

    public List<SrlSentence> readFile(File file) throws IOException, CorpusFormatException {
        logger.fine("Processing "+file.getPath());
        try (SrlFileReader reader = open(file)) {
            return readAll(reader);
        }
    }

    public List<SrlSentence> read(Reader in, String name) throws IOException, CorpusFormatException {
        try (SrlFileReader reader = open(in, name)) {
            return readAll(reader);
        }
    }

    public SrlFileReader open(File file) throws IOException {
        return new SrlFileReader(this, new ConllBlockReader(file, getCommentMarker()));
    }

    public SrlFileReader open(Reader in, String name) {
        return new SrlFileReader(this, new ConllBlockReader(in, name, getCommentMarker()));
    }

    List<SrlSentence> readAll(SrlFileReader reader) throws IOException, CorpusFormatException {
        List<SrlSentence> sentences = new ArrayList<SrlSentence>();
        SrlSentence sentence;
        while ((sentence=reader.nextSentence())!=null)
            sentences.add(sentence);
        logger.info(String.format("Read %d sentences from %s", sentences.size(), reader.getFileName()));
        return sentences;
    }

    /**
     * Splits every line of the block into columns, checking that all lines
     * have the same number of columns and at least minColumns.
     */
    protected static String[][] splitColumns(LineBlock block, String separatorRegex, int minColumns) throws CorpusFormatException {
        String[][] rows = new String[block.size()][];
        for (int i=0; i<block.size(); ++i) {
            String line = block.getLine(i);
            // whitespace separated formats tolerate indentation, tab separated ones keep blank cells
            rows[i] = separatorRegex.equals("\t")?line.split("\t", -1):line.trim().split(separatorRegex);
            if (rows[i].length<minColumns)
                throw block.formatException(i, String.format("expected at least %d columns, found %d", minColumns, rows[i].length));
            if (rows[i].length!=rows[0].length)
                throw block.formatException(i, String.format("expected %d columns like the first line of the sentence, found %d", rows[0].length, rows[i].length));
        }
        return rows;
    }

    /**
     * Parses an integer column, reporting the line on failure.
     */
    protected static int parseInt(LineBlock block, int line, String value, String column) throws CorpusFormatException {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new CorpusFormatException(column+" is not an integer: "+value, block.getFileName(), block.getLineNumber(line), e);
        }
    }

    /**
     * Checks that a token position column counts 0, 1, 2... from base.
     */
    protected static void checkPosition(LineBlock block, int line, int position, int base, String column) throws CorpusFormatException {
        if (position!=line+base)
            throw block.formatException(line, String.format("%s %d does not match token position %d", column, position, line+base));
    }

    protected static boolean isNumeric(String value) {
        if (value==null || value.isEmpty())
            return false;
        for (int i=0; i<value.length(); ++i)
            if (!Character.isDigit(value.charAt(i)))
                return false;
        return true;
    }

    /**
     * Attaches spans as arguments of predicate, skipping the predicate's own span.
     */
    protected static void attachArguments(SrlSentence sentence, Predicate predicate, List<LabeledSpan> spans) {
        for (LabeledSpan span:spans) {
            if (span.getLabel().equals(PREDICATE_LABEL))
                continue;
            predicate.addArgument(new Argument(span.getLabel(), predicate, sentence, span.getStart(), span.getEnd()));
        }
    }
}
