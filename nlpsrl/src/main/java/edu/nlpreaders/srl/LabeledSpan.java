package edu.nlpreaders.srl;

/**
 * A labeled half-open token range [start, end).
 */
public final class LabeledSpan implements Comparable<LabeledSpan> {

    final String label;
    final int    start;
    final int    end;

    public LabeledSpan(String label, int start, int end) {
        if (label==null)
            throw new IllegalArgumentException("span label cannot be null");
        if (start<0 || start>=end)
            throw new IllegalArgumentException("start must be non-negative and less than end: "+start+" >= "+end);
        this.label = label;
        this.start = start;
        this.end = end;
    }

    public static LabeledSpan widthOne(String label, int index) {
        return new LabeledSpan(label, index, index+1);
    }

    public String getLabel() {
        return label;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean overlaps(LabeledSpan other) {
        return start<other.end && other.start<end;
    }

    @Override
    public int compareTo(LabeledSpan o) {
        if (start!=o.start) return start-o.start;
        if (end!=o.end) return end-o.end;
        return label.compareTo(o.label);
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof LabeledSpan))
            return false;
        LabeledSpan s = (LabeledSpan)other;
        return start==s.start && end==s.end && label.equals(s.label);
    }

    @Override
    public int hashCode() {
        return (label.hashCode()*31+start)*31+end;
    }

    @Override
    public String toString() {
        return "("+label+", "+start+", "+end+")";
    }
}
