package edu.nlpreaders.srl.reader;

import java.util.List;

import edu.nlpreaders.common.CorpusFormatException;
import edu.nlpreaders.common.Word;
import edu.nlpreaders.common.io.LineBlock;
import edu.nlpreaders.srl.Argument;
import edu.nlpreaders.srl.Predicate;
import edu.nlpreaders.srl.SrlSentence;

/**
 * Reads CoNLL-2009 shared task files. Arguments in this format are
 * dependency based: every argument is the single token carrying the role.
 */
public class Conll2009Reader extends SrlReader {

    /*
     * Columns :
     * 0    ID (1-based)
     * 1    FORM
     * 2    LEMMA
     * 3    PLEMMA
     * 4    POS
     * 5    PPOS
     * 6    FEAT
     * 7    PFEAT
     * 8    HEAD (0 for the root)
     * 9    PHEAD
     * 10   DEPREL
     * 11   PDEPREL
     * 12   FILLPRED
     * 13   PRED
     * 14:N APREDs, one per predicate
     */
    static final int ID_IDX       = 0;
    static final int FORM_IDX     = 1;
    static final int LEMMA_IDX    = 2;
    static final int POS_IDX      = 4;
    static final int HEAD_IDX     = 8;
    static final int DEPREL_IDX   = 10;
    static final int FILLPRED_IDX = 12;
    static final int PRED_IDX     = 13;
    static final int APRED_IDX    = 14;

    static final int MIN_COLUMNS = APRED_IDX;

    static final String PLACEHOLDER = "_";
    static final String PREDICATE_FLAG = "Y";

    public static final String DEFAULT_FILE_REGEX = ".+\\.txt\\z";

    public Conll2009Reader() {
        this(DEFAULT_FILE_REGEX);
    }

    public Conll2009Reader(String fileRegex) {
        super(fileRegex);
    }

    @Override
    public SrlSentence parseSentence(LineBlock block) throws CorpusFormatException {
        String[][] rows = splitColumns(block, "\\s+", MIN_COLUMNS);
        int roleColumns = rows[0].length-MIN_COLUMNS;

        Integer[] heads = new Integer[rows.length];
        int predicateCount = 0;
        for (int i=0; i<rows.length; ++i) {
            checkPosition(block, i, parseInt(block, i, rows[i][ID_IDX], "ID"), 1, "ID");
            String head = rows[i][HEAD_IDX];
            if (head.equals(PLACEHOLDER))
                heads[i] = null;
            else {
                int h = parseInt(block, i, head, "HEAD");
                if (h<0 || h>rows.length)
                    throw block.formatException(i, "HEAD "+h+" outside the sentence");
                heads[i] = h==0?Word.ROOT_HEAD:h-1;
            }
            if (rows[i][FILLPRED_IDX].equals(PREDICATE_FLAG))
                ++predicateCount;
        }
        if (roleColumns>predicateCount)
            throw block.formatException(0, String.format("%d APRED columns but only %d predicates", roleColumns, predicateCount));

        // CoNLL-2009 has no sentence id
        SrlSentence sentence = new SrlSentence();
        for (int i=0; i<rows.length; ++i) {
            String[] row = rows[i];
            String dep = row[DEPREL_IDX].equals(PLACEHOLDER)?null:row[DEPREL_IDX];
            Word word = new Word(row[FORM_IDX], i, -1, -1, row[LEMMA_IDX], row[POS_IDX], dep, null);
            word.setHead(heads[i]);
            sentence.add(word);
            if (row[FILLPRED_IDX].equals(PREDICATE_FLAG))
                sentence.promote(i, row[PRED_IDX]);
        }

        List<Predicate> predicates = sentence.getPredicates();
        for (int i=0; i<rows.length; ++i)
            for (int c=0; c<roleColumns; ++c) {
                String role = rows[i][APRED_IDX+c];
                if (role.equals(PLACEHOLDER))
                    continue;
                Predicate predicate = predicates.get(c);
                predicate.addArgument(new Argument(role, predicate, sentence, i, i+1));
            }
        return sentence;
    }
}
