package edu.nlpreaders.srl.reader;

import java.util.ArrayList;
import java.util.List;

import edu.nlpreaders.common.CorpusFormatException;
import edu.nlpreaders.common.Word;
import edu.nlpreaders.common.io.LineBlock;
import edu.nlpreaders.srl.BIOCodec;
import edu.nlpreaders.srl.Predicate;
import edu.nlpreaders.srl.SrlSentence;

/**
 * Reads CoNLL-2012 (OntoNotes 5) <code>*_conll</code> files.
 */
public class Conll2012Reader extends SrlReader {

    /*
     * Columns :
     * 0    Document ID
     * 1    Part number
     * 2    Word number
     * 3    Word itself
     * 4    Part-of-Speech
     * 5    Parse bit
     * 6    Predicate lemma
     * 7    Predicate Frameset ID
     * 8    Word sense
     * 9    Speaker/Author
     * 10   Named Entities
     * 11:N Predicate Arguments
     * N    Coreference
     */
    static final int DOC_IDX   = 0;
    static final int PART_IDX  = 1;
    static final int WORD_IDX  = 2;
    static final int FORM_IDX  = 3;
    static final int POS_IDX   = 4;
    static final int LEMMA_IDX = 6;
    static final int SENSE_IDX = 7;
    static final int SRL_IDX   = 11;

    /** role columns plus the document/token columns and the trailing coreference column */
    static final int MIN_COLUMNS = SRL_IDX+1;

    static final String PLACEHOLDER = "-";

    public static final String DEFAULT_FILE_REGEX = ".+\\.gold_conll\\z";

    public Conll2012Reader() {
        this(DEFAULT_FILE_REGEX);
    }

    public Conll2012Reader(String fileRegex) {
        super(fileRegex);
    }

    @Override
    public SrlSentence parseSentence(LineBlock block) throws CorpusFormatException {
        String[][] rows = splitColumns(block, "\\s+", MIN_COLUMNS);
        int roleColumns = rows[0].length-MIN_COLUMNS;

        int predicateCount = 0;
        for (int i=0; i<rows.length; ++i) {
            checkPosition(block, i, parseInt(block, i, rows[i][WORD_IDX], "word number"), 0, "word number");
            if (!rows[i][SENSE_IDX].equals(PLACEHOLDER))
                ++predicateCount;
        }
        if (roleColumns>predicateCount)
            throw block.formatException(0, String.format("%d argument columns but only %d predicates", roleColumns, predicateCount));

        SrlSentence sentence = new SrlSentence(rows[0][DOC_IDX]+"_"+rows[0][PART_IDX]);
        for (int i=0; i<rows.length; ++i) {
            String[] row = rows[i];
            String lemma = row[LEMMA_IDX].equals(PLACEHOLDER)?null:row[LEMMA_IDX];
            sentence.add(new Word(TokenNormalizer.unescape(row[FORM_IDX]), i, lemma, row[POS_IDX]));
            if (!row[SENSE_IDX].equals(PLACEHOLDER))
                sentence.promote(i, getSense(row[LEMMA_IDX], row[SENSE_IDX]));
        }

        List<Predicate> predicates = sentence.getPredicates();
        for (int c=0; c<roleColumns; ++c) {
            List<String> tags = new ArrayList<String>(rows.length);
            String currentLabel = null;
            for (String[] row:rows) {
                String annotation = row[SRL_IDX+c];
                if (annotation.indexOf('(')>=0) {
                    currentLabel = strip(annotation, "()*");
                    tags.add(BIOCodec.BEGIN_PREFIX+currentLabel);
                } else if (currentLabel!=null)
                    tags.add(BIOCodec.INSIDE_PREFIX+currentLabel);
                else
                    tags.add(BIOCodec.OUTSIDE);
                if (annotation.indexOf(')')>=0)
                    currentLabel = null;
            }
            attachArguments(sentence, predicates.get(c), BIOCodec.decode(tags));
        }
        return sentence;
    }

    /**
     * PropBank style frame.sense when the frame column is a number, the sense column as is otherwise.
     */
    static String getSense(String frame, String sense) {
        return isNumeric(frame)?frame+'.'+sense:sense;
    }

    /**
     * Removes the given characters from both ends of value.
     */
    static String strip(String value, String chars) {
        int start = 0;
        int end = value.length();
        while (start<end && chars.indexOf(value.charAt(start))>=0)
            ++start;
        while (end>start && chars.indexOf(value.charAt(end-1))>=0)
            --end;
        return value.substring(start, end);
    }
}
