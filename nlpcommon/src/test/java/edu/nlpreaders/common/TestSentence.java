package edu.nlpreaders.common;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class TestSentence {

    Sentence sentence;

    @Before
    public void setUp() {
        sentence = new Sentence(Arrays.asList(new Word("John", 0), new Word("likes", 1), new Word("apples", 2)), "s1");
    }

    @Test
    public void testAccess() {
        assertEquals(3, sentence.size());
        assertEquals("s1", sentence.getId());
        assertEquals("likes", sentence.get(1).getText());
        assertEquals("[John, likes, apples]", sentence.toString());

        Iterator<Word> iter = sentence.iterator();
        assertEquals("John", iter.next().getText());
        assertEquals("likes", iter.next().getText());
        assertEquals("apples", iter.next().getText());
        assertFalse(iter.hasNext());
    }

    @Test(expected=IndexOutOfBoundsException.class)
    public void testGetOutOfRange() {
        sentence.get(3);
    }

    @Test(expected=IndexOutOfBoundsException.class)
    public void testSetOutOfRange() {
        sentence.set(5, new Word("x", 5));
    }

    @Test
    public void testViewReflectsSlotReplacement() {
        List<Word> view = sentence.words(1, 3);
        assertEquals(2, view.size());
        Word replacement = new Word("loves", 1);
        sentence.set(1, replacement);
        assertSame(replacement, view.get(0));
        assertEquals("apples", sentence.get(2).getText());
    }

    @Test(expected=UnsupportedOperationException.class)
    public void testViewIsReadOnly() {
        sentence.words(0, 2).set(0, new Word("x", 0));
    }

    @Test(expected=IndexOutOfBoundsException.class)
    public void testViewOutOfRange() {
        sentence.words(2, 4);
    }

    @Test
    public void testSeal() {
        sentence.seal();
        assertTrue(sentence.isSealed());
        try {
            sentence.add(new Word("!", 3));
            fail("sealed sentence accepted a word");
        } catch (UnsupportedOperationException e) {
            assertEquals(3, sentence.size());
        }
        try {
            sentence.set(0, new Word("Mary", 0));
            fail("sealed sentence accepted a replacement");
        } catch (UnsupportedOperationException e) {
            assertEquals("John", sentence.get(0).getText());
        }
    }

    @Test
    public void testSealFreezesWords() {
        Word john = sentence.get(0);
        john.setHead(1);
        sentence.seal();
        assertTrue(john.isSealed());
        try {
            john.setHead(2);
            fail("head changed after sealing");
        } catch (UnsupportedOperationException e) {
            assertEquals(Integer.valueOf(1), john.getHead());
        }
    }

    @Test
    public void testWordFields() {
        Word word = new Word("ran", 3, 10, 13, "run", "VBD", "ROOT", Word.ROOT_HEAD);
        assertEquals("run", word.getLemma());
        assertEquals("VBD", word.getPOS());
        assertEquals("ROOT", word.getDep());
        assertEquals(Integer.valueOf(Word.ROOT_HEAD), word.getHead());
        assertEquals(10, word.getStartChar());
        assertEquals(13, word.getEndChar());
        assertFalse(word.isPredicate());
        word.setHead(1);
        assertEquals(Integer.valueOf(1), word.getHead());

        Word bare = new Word("x", Word.NO_INDEX);
        assertFalse(bare.hasIndex());
        assertNull(bare.getHead());
        assertEquals(-1, bare.getStartChar());
    }
}
