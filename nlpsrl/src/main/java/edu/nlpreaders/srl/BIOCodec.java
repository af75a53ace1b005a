package edu.nlpreaders.srl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Converts between per-token BIO tags and labeled spans. Shared by every
 * corpus reader.
 * <p>
 * Tags are <code>O</code> (or <code>_</code>) outside any span,
 * <code>B-label</code> at the beginning of a span and <code>I-label</code>
 * inside it. Decoding is permissive: a missing <code>B-</code> or a label
 * change without one still produces sensible spans, malformed input never
 * raises.
 */
public final class BIOCodec {

    public static final String OUTSIDE = "O";
    public static final String NO_LABEL = "_";
    public static final String BEGIN_PREFIX = "B-";
    public static final String INSIDE_PREFIX = "I-";

    private BIOCodec() {
    }

    public static boolean isOutside(String tag) {
        return tag==null || tag.equals(OUTSIDE) || tag.equals(NO_LABEL);
    }

    /**
     * @return the label of a tag without its BIO prefix, <code>null</code> for outside tags
     */
    public static String labelOf(String tag) {
        if (isOutside(tag))
            return null;
        if (tag.startsWith(BEGIN_PREFIX) || tag.startsWith(INSIDE_PREFIX))
            return tag.substring(2);
        return tag;
    }

    public static List<LabeledSpan> decode(String... tags) {
        return decode(Arrays.asList(tags));
    }

    /**
     * Decodes a tag sequence into spans ordered by start.
     */
    public static List<LabeledSpan> decode(List<String> tags) {
        List<LabeledSpan> spans = new ArrayList<LabeledSpan>();

        String openLabel = null;
        int openStart = -1;

        for (int i=0; i<tags.size(); ++i) {
            String tag = tags.get(i);
            if (isOutside(tag)) {
                openLabel = null;
                continue;
            }
            String label = labelOf(tag);
            if (openLabel==null || tag.startsWith(BEGIN_PREFIX) || !label.equals(openLabel)) {
                openLabel = label;
                openStart = i;
            }
            if (i==tags.size()-1) {
                spans.add(new LabeledSpan(label, openStart, i+1));
                openLabel = null;
                continue;
            }
            String next = tags.get(i+1);
            if ((next!=null && next.startsWith(BEGIN_PREFIX)) || !label.equals(labelOf(next))) {
                spans.add(new LabeledSpan(label, openStart, i+1));
                openLabel = null;
            }
        }
        return spans;
    }

    /**
     * Expands spans into a tag sequence of the given length, positions no
     * span covers are <code>O</code>.
     * @throws IllegalArgumentException if two spans overlap
     * @throws IndexOutOfBoundsException if a span ends beyond length
     */
    public static List<String> encode(List<LabeledSpan> spans, int length) {
        String[] tags = new String[length];
        Arrays.fill(tags, OUTSIDE);

        List<LabeledSpan> sorted = new ArrayList<LabeledSpan>(spans);
        Collections.sort(sorted);
        for (int i=1; i<sorted.size(); ++i)
            if (sorted.get(i-1).overlaps(sorted.get(i)))
                throw new IllegalArgumentException("overlapping spans "+sorted.get(i-1)+" and "+sorted.get(i));

        for (LabeledSpan span:sorted) {
            if (span.getEnd()>length)
                throw new IndexOutOfBoundsException("span "+span+" exceeds sequence length "+length);
            tags[span.getStart()] = BEGIN_PREFIX+span.getLabel();
            for (int i=span.getStart()+1; i<span.getEnd(); ++i)
                tags[i] = INSIDE_PREFIX+span.getLabel();
        }
        return new ArrayList<String>(Arrays.asList(tags));
    }
}
