package edu.nlpreaders.srl;

import java.util.ArrayList;
import java.util.List;

import edu.nlpreaders.common.Sentence;
import edu.nlpreaders.common.Word;

/**
 * A labeled span of a sentence filling a semantic role of a predicate.
 * The span is half-open, it covers the tokens [start, end).
 */
public class Argument {

    final String     role;
    final Predicate  predicate;
    final List<Word> words;
    final int        start;
    final int        end;

    /**
     * @throws IndexOutOfBoundsException unless 0 &lt;= start &lt; end &lt;= sentence.size()
     */
    public Argument(String role, Predicate predicate, Sentence sentence, int start, int end) {
        if (role==null || predicate==null)
            throw new IllegalArgumentException("argument needs a role and a predicate");
        if (start<0 || start>=end || end>sentence.size())
            throw new IndexOutOfBoundsException(String.format("argument span [%d, %d) invalid for sentence of length %d", start, end, sentence.size()));
        this.role = role;
        this.predicate = predicate;
        this.words = sentence.words(start, end);
        this.start = start;
        this.end = end;
    }

    public String getRole() {
        return role;
    }

    public Predicate getPredicate() {
        return predicate;
    }

    /**
     * @return a view of the sentence slots the argument covers
     */
    public List<Word> getWords() {
        return words;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public LabeledSpan getSpan() {
        return new LabeledSpan(role, start, end);
    }

    public List<String> getBIOTags() {
        List<String> tags = new ArrayList<String>(end-start);
        tags.add(BIOCodec.BEGIN_PREFIX+role);
        for (int i=start+1; i<end; ++i)
            tags.add(BIOCodec.INSIDE_PREFIX+role);
        return tags;
    }

    @Override
    public String toString() {
        return "("+role+", "+start+", "+end+")";
    }
}
