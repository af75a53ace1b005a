package edu.nlpreaders.srl;

import java.util.ArrayList;
import java.util.List;

import edu.nlpreaders.common.Sentence;
import edu.nlpreaders.common.Word;

/**
 * A sentence whose slots may hold predicates. The predicate list is computed
 * from the slots on every call, so it always reflects their current content.
 */
public class SrlSentence extends Sentence {

    public SrlSentence() {
        super();
    }

    public SrlSentence(String id) {
        super(id);
    }

    public SrlSentence(List<? extends Word> words, String id) {
        super(words, id);
    }

    /**
     * Puts a predicate in the slot given by its own index.
     * @see #addPredicate(Predicate, int)
     */
    public Predicate addPredicate(Predicate predicate) {
        return addPredicate(predicate, Word.NO_INDEX);
    }

    /**
     * Replaces the content of a slot with a predicate. If index is
     * {@link Word#NO_INDEX} it is taken from the predicate, if the predicate
     * has no index it receives this one.
     * @throws IllegalArgumentException if neither gives an index
     * @throws IndexOutOfBoundsException if the index is outside the sentence
     */
    public Predicate addPredicate(Predicate predicate, int index) {
        if (index==Word.NO_INDEX && !predicate.hasIndex())
            throw new IllegalArgumentException("Cannot infer index of predicate "+predicate);
        if (index==Word.NO_INDEX)
            index = predicate.getIndex();
        checkIndex(index);
        checkModifiable();
        if (!predicate.hasIndex())
            predicate.assignIndex(index);
        set(index, predicate);
        return predicate;
    }

    /**
     * Promotes the word at index to a predicate with the given sense.
     */
    public Predicate promote(int index, String sense) {
        Word word = get(index);
        if (word.isPredicate())
            throw new IllegalArgumentException("Index "+index+" is already a predicate");
        Predicate predicate = Predicate.fromWord(word, sense);
        if (predicate.getIndex()!=index)
            predicate.assignIndex(index);
        set(index, predicate);
        return predicate;
    }

    /**
     * @throws IndexOutOfBoundsException if index is outside the sentence
     * @throws NotAPredicateException if the slot holds a plain word
     */
    public Predicate getPredicate(int index) {
        Word word = get(index);
        if (!word.isPredicate())
            throw new NotAPredicateException(index);
        return (Predicate)word;
    }

    public boolean isPredicate(int index) {
        return get(index).isPredicate();
    }

    public List<Predicate> getPredicates() {
        List<Predicate> predicates = new ArrayList<Predicate>();
        for (Word word:this)
            if (word.isPredicate())
                predicates.add((Predicate)word);
        return predicates;
    }

    public List<Argument> getPredicateArguments(int index) {
        return getPredicate(index).getArguments();
    }

    public List<Argument> getPredicateArguments(Predicate predicate) {
        return getPredicateArguments(indexOf(predicate));
    }

    /**
     * @return one tag per token: B-role at the start of each argument, I-role for the rest, O elsewhere
     */
    public List<String> getPredicateBIOTags(int index) {
        List<LabeledSpan> spans = new ArrayList<LabeledSpan>();
        for (Argument argument:getPredicate(index).getArguments())
            spans.add(argument.getSpan());
        return BIOCodec.encode(spans, size());
    }

    public List<String> getPredicateBIOTags(Predicate predicate) {
        return getPredicateBIOTags(indexOf(predicate));
    }

    /**
     * @param format <code>span</code> for the argument objects, <code>bio</code> for a tag sequence
     * @throws IllegalArgumentException for any other format
     */
    public List<?> getPredicateArguments(int index, String format) {
        return getPredicateArguments(index, ArgumentFormat.fromString(format));
    }

    public List<?> getPredicateArguments(Predicate predicate, String format) {
        return getPredicateArguments(indexOf(predicate), ArgumentFormat.fromString(format));
    }

    public List<?> getPredicateArguments(int index, ArgumentFormat format) {
        switch (format) {
        case SPAN:
            return getPredicateArguments(index);
        case BIO:
            return getPredicateBIOTags(index);
        default:
            throw new IllegalArgumentException("Unknown format: "+format);
        }
    }

    int indexOf(Predicate predicate) {
        if (!predicate.hasIndex())
            throw new IllegalArgumentException("Cannot infer index of predicate "+predicate);
        int index = predicate.getIndex();
        checkIndex(index);
        if (get(index)!=predicate)
            throw new IllegalArgumentException("predicate "+predicate+" is not in sentence "+getId()+" at index "+index);
        return index;
    }
}
