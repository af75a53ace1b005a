package edu.nlpreaders.common;

/**
 * A token of a sentence with the linguistic attributes the corpus provides.
 * <p>
 * Everything except the dependency head is fixed at construction, and the
 * head is fixed too once the sentence holding the word is sealed. Optional
 * string attributes are <code>null</code> when absent, optional character
 * offsets are -1.
 */
public class Word {

    public static final int NO_INDEX = -1;
    /** head value of the root token of a dependency tree */
    public static final int ROOT_HEAD = -1;

    final String  text;
    int           index;
    final int     startChar;
    final int     endChar;
    final String  lemma;
    final String  pos;
    final String  dep;
    Integer       head;
    boolean       sealed;

    public Word(String text, int index) {
        this(text, index, -1, -1, null, null, null, null);
    }

    public Word(String text, int index, String lemma, String pos) {
        this(text, index, -1, -1, lemma, pos, null, null);
    }

    public Word(String text, int index, int startChar, int endChar, String lemma, String pos, String dep, Integer head) {
        if (text==null)
            throw new IllegalArgumentException("word text cannot be null");
        this.text = text;
        this.index = index;
        this.startChar = startChar;
        this.endChar = endChar;
        this.lemma = lemma;
        this.pos = pos;
        this.dep = dep;
        this.head = head;
    }

    /**
     * Copy constructor, used when a word changes its role in a sentence
     * (e.g. becomes a predicate).
     */
    protected Word(Word word) {
        this(word.text, word.index, word.startChar, word.endChar, word.lemma, word.pos, word.dep, word.head);
    }

    public String getText() {
        return text;
    }

    public int getIndex() {
        return index;
    }

    public boolean hasIndex() {
        return index!=NO_INDEX;
    }

    protected void setIndex(int index) {
        this.index = index;
    }

    public int getStartChar() {
        return startChar;
    }

    public int getEndChar() {
        return endChar;
    }

    public String getLemma() {
        return lemma;
    }

    public String getPOS() {
        return pos;
    }

    public String getDep() {
        return dep;
    }

    /**
     * @return 0-based index of the governor, {@link #ROOT_HEAD} for the root,
     * <code>null</code> when the corpus has no dependency information
     */
    public Integer getHead() {
        return head;
    }

    public void setHead(Integer head) {
        checkModifiable();
        this.head = head;
    }

    void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    protected void checkModifiable() {
        if (sealed)
            throw new UnsupportedOperationException("word "+index+" ("+text+") belongs to a sealed sentence");
    }

    public boolean isPredicate() {
        return false;
    }

    @Override
    public String toString() {
        return text;
    }
}
