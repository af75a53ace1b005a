package edu.nlpreaders.srl.reader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.nlpreaders.common.CorpusFormatException;
import edu.nlpreaders.common.Word;
import edu.nlpreaders.common.io.LineBlock;
import edu.nlpreaders.srl.Argument;
import edu.nlpreaders.srl.BIOCodec;
import edu.nlpreaders.srl.LabeledSpan;
import edu.nlpreaders.srl.Predicate;
import edu.nlpreaders.srl.SrlSentence;

/**
 * Reads the CoNLL-U derived format of the United SRL corpus. Token lines
 * are tab separated: id, form, lemma, frame, then one role column per
 * predicate. A role column is either BIO encoded (span based data) or holds
 * bare labels on single tokens (dependency based data).
 * <p>
 * The corpus has role columns without a matching predicate. Arguments from
 * such columns are dropped and recorded as {@link DroppedArgument}s unless
 * the reader is strict, in which case the sentence is rejected.
 */
public class UnitedSrlReader extends SrlReader {

    static final int ID_IDX    = 0;
    static final int FORM_IDX  = 1;
    static final int LEMMA_IDX = 2;
    static final int FRAME_IDX = 3;
    static final int ROLES_IDX = 4;

    static final int MIN_COLUMNS = ROLES_IDX;

    static final String PLACEHOLDER = "_";
    /** dependency based data still marks the predicate with a B- tag */
    static final String PREDICATE_TAG = BIOCodec.BEGIN_PREFIX+PREDICATE_LABEL;

    static final String DOCUMENT_ID_KEY = "document_id";
    static final String SENTENCE_ID_KEY = "sentence_id";

    public static final String DEFAULT_FILE_REGEX = ".+\\.conllu\\z";

    boolean              strict;
    List<DroppedArgument> dropped;

    public UnitedSrlReader() {
        this(DEFAULT_FILE_REGEX, false);
    }

    public UnitedSrlReader(String fileRegex, boolean strict) {
        super(fileRegex);
        this.strict = strict;
        dropped = Collections.synchronizedList(new ArrayList<DroppedArgument>());
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    /**
     * @return the arguments dropped so far, in the order they were dropped
     */
    public List<DroppedArgument> getDroppedArguments() {
        synchronized (dropped) {
            return new ArrayList<DroppedArgument>(dropped);
        }
    }

    public void clearDroppedArguments() {
        dropped.clear();
    }

    @Override
    public SrlSentence parseSentence(LineBlock block) throws CorpusFormatException {
        String[][] rows = splitColumns(block, "\t", MIN_COLUMNS);
        int roleColumns = rows[0].length-MIN_COLUMNS;

        for (int i=0; i<rows.length; ++i)
            checkPosition(block, i, parseInt(block, i, rows[i][ID_IDX], "token id"), 1, "token id");

        // span lists are computed up front so that a strict reader fails before building anything
        List<List<LabeledSpan>> columnSpans = new ArrayList<List<LabeledSpan>>(roleColumns);
        for (int c=0; c<roleColumns; ++c) {
            List<String> roles = new ArrayList<String>(rows.length);
            for (String[] row:rows)
                roles.add(row[ROLES_IDX+c]);
            columnSpans.add(isSpanEncoded(roles)?BIOCodec.decode(roles):toSingleTokenSpans(roles));
        }

        int predicateCount = 0;
        for (String[] row:rows)
            if (!row[FRAME_IDX].equals(PLACEHOLDER))
                ++predicateCount;
        if (strict && roleColumns>predicateCount)
            throw block.formatException(0, String.format("%d role columns but only %d predicates", roleColumns, predicateCount));

        SrlSentence sentence = new SrlSentence(getSentenceId(block.getComments()));
        for (int i=0; i<rows.length; ++i) {
            String[] row = rows[i];
            String lemma = row[LEMMA_IDX].equals(PLACEHOLDER)?null:row[LEMMA_IDX];
            sentence.add(new Word(TokenNormalizer.unescapeBlank(row[FORM_IDX]), i, lemma, null));
            if (!row[FRAME_IDX].equals(PLACEHOLDER))
                sentence.promote(i, row[FRAME_IDX]);
        }

        List<Predicate> predicates = sentence.getPredicates();
        for (int c=0; c<roleColumns; ++c)
            for (LabeledSpan span:columnSpans.get(c)) {
                if (isPredicateSpan(span))
                    continue;
                if (c>=predicates.size()) {
                    drop(block, sentence, c, span, DroppedArgument.Reason.NO_PREDICATE);
                    continue;
                }
                Predicate predicate = predicates.get(c);
                predicate.addArgument(new Argument(span.getLabel(), predicate, sentence, span.getStart(), span.getEnd()));
            }
        return sentence;
    }

    void drop(LineBlock block, SrlSentence sentence, int column, LabeledSpan span, DroppedArgument.Reason reason) throws CorpusFormatException {
        DroppedArgument argument = new DroppedArgument(block.getFileName(), block.getFirstLineNumber(), sentence.getId(), column, span, reason);
        if (strict)
            throw block.formatException(0, argument.toString());
        logger.warning(argument.toString());
        dropped.add(argument);
    }

    /**
     * A column is span encoded when any entry but the predicate marker opens a span.
     */
    static boolean isSpanEncoded(List<String> roles) {
        for (String role:roles)
            if (!role.equals(PREDICATE_TAG) && role.startsWith(BIOCodec.BEGIN_PREFIX))
                return true;
        return false;
    }

    static List<LabeledSpan> toSingleTokenSpans(List<String> roles) {
        List<LabeledSpan> spans = new ArrayList<LabeledSpan>();
        for (int i=0; i<roles.size(); ++i)
            if (!BIOCodec.isOutside(roles.get(i)))
                spans.add(LabeledSpan.widthOne(roles.get(i), i));
        return spans;
    }

    static boolean isPredicateSpan(LabeledSpan span) {
        return span.getLabel().equals(PREDICATE_LABEL) || span.getLabel().equals(PREDICATE_TAG);
    }

    /**
     * Joins the <code># document_id</code> and <code># sentence_id</code> metadata.
     */
    static String getSentenceId(List<String> comments) {
        String documentId = null;
        String sentenceId = null;
        for (String comment:comments) {
            String line = comment.substring(1).trim();
            int eq = line.indexOf('=');
            if (eq<0) continue;
            String key = line.substring(0, eq).trim();
            String value = line.substring(eq+1).trim();
            if (key.equals(DOCUMENT_ID_KEY))
                documentId = value;
            else if (key.equals(SENTENCE_ID_KEY))
                sentenceId = value;
        }
        if (documentId==null)
            return sentenceId;
        if (sentenceId==null)
            return documentId;
        return documentId+"_"+sentenceId;
    }
}
