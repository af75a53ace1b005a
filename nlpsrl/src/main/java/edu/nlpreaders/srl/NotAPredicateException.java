package edu.nlpreaders.srl;

/**
 * Thrown when a predicate operation is requested on a slot holding a plain word.
 */
public class NotAPredicateException extends RuntimeException {

    private static final long serialVersionUID = -2291893645123750815L;

    final int index;

    public NotAPredicateException(int index) {
        super("Index "+index+" is not a predicate");
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
