package edu.nlpreaders.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered sequence of word slots. A slot is addressed by its position,
 * replacing the content of a slot never moves any other slot.
 */
public class Sentence implements Iterable<Word> {

    final List<Word> words;
    String           id;
    boolean          sealed;

    public Sentence() {
        this(null);
    }

    public Sentence(String id) {
        this.words = new ArrayList<Word>();
        this.id = id;
        this.sealed = false;
    }

    public Sentence(List<? extends Word> words, String id) {
        this(id);
        for (Word word:words)
            add(word);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        checkModifiable();
        this.id = id;
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    public Word get(int index) {
        checkIndex(index);
        return words.get(index);
    }

    /**
     * Replaces the content of a slot.
     * @return the previous content of the slot
     */
    public Word set(int index, Word word) {
        checkModifiable();
        checkIndex(index);
        if (word==null)
            throw new IllegalArgumentException("slot content cannot be null");
        return words.set(index, word);
    }

    public void add(Word word) {
        checkModifiable();
        if (word==null)
            throw new IllegalArgumentException("slot content cannot be null");
        words.add(word);
    }

    /**
     * @return an unmodifiable view of the slots in [start, end), it reflects later slot replacements
     */
    public List<Word> words(int start, int end) {
        if (start<0 || end>words.size() || start>end)
            throw new IndexOutOfBoundsException(String.format("Span [%d, %d) out of range, sentence length is %d", start, end, words.size()));
        return Collections.unmodifiableList(words.subList(start, end));
    }

    public List<Word> words() {
        return Collections.unmodifiableList(words);
    }

    /**
     * Makes the slot sequence and the words in it read-only. Readers seal
     * every sentence they return.
     */
    public void seal() {
        sealed = true;
        for (Word word:words)
            word.seal();
    }

    public boolean isSealed() {
        return sealed;
    }

    @Override
    public Iterator<Word> iterator() {
        return Collections.unmodifiableList(words).iterator();
    }

    protected void checkIndex(int index) {
        if (index<0 || index>=words.size())
            throw new IndexOutOfBoundsException(String.format("Index out of range: provided index is %d, sentence length is %d", index, words.size()));
    }

    protected void checkModifiable() {
        if (sealed)
            throw new UnsupportedOperationException("sentence "+id+" is sealed");
    }

    @Override
    public String toString() {
        StringBuilder buffer = new StringBuilder("[");
        for (int i=0; i<words.size(); ++i) {
            if (i>0) buffer.append(", ");
            buffer.append(words.get(i).getText());
        }
        buffer.append(']');
        return buffer.toString();
    }
}
