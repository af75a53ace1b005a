package edu.nlpreaders.srl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.nlpreaders.common.Word;

/**
 * A word whose semantic roles are annotated: its sense and its arguments in
 * the order they were discovered.
 */
public class Predicate extends Word {

    String         sense;
    List<Argument> arguments;
    double         score;

    public Predicate(String text, int index, String sense) {
        super(text, index);
        this.sense = sense;
        this.arguments = new ArrayList<Argument>();
        this.score = 0.0;
    }

    Predicate(Word word, String sense) {
        super(word);
        this.sense = sense;
        this.arguments = new ArrayList<Argument>();
        this.score = 0.0;
    }

    /**
     * Creates a predicate carrying all the fields of word. The word itself
     * is left untouched, the caller puts the predicate in its slot.
     */
    public static Predicate fromWord(Word word, String sense) {
        return new Predicate(word, sense);
    }

    public String getSense() {
        return sense;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        checkModifiable();
        this.score = score;
    }

    /**
     * @throws UnsupportedOperationException once the sentence holding the predicate is sealed
     */
    public Predicate addArgument(Argument argument) {
        checkModifiable();
        if (argument.getPredicate()!=this)
            throw new IllegalArgumentException("argument "+argument+" belongs to another predicate");
        arguments.add(argument);
        return this;
    }

    public List<Argument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    void assignIndex(int index) {
        setIndex(index);
    }

    @Override
    public boolean isPredicate() {
        return true;
    }
}
