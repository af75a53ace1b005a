package edu.nlpreaders.srl.reader;

import static org.junit.Assert.*;

import java.io.File;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import edu.nlpreaders.common.CorpusFormatException;
import edu.nlpreaders.srl.Argument;
import edu.nlpreaders.srl.LabeledSpan;
import edu.nlpreaders.srl.Predicate;
import edu.nlpreaders.srl.SrlSentence;

public class TestConll2012Reader {

    static String line(String... columns) {
        StringBuilder buffer = new StringBuilder();
        for (String column:columns)
            buffer.append(column).append("   ");
        return buffer.append('\n').toString();
    }

    static List<LabeledSpan> spans(Predicate predicate) {
        List<LabeledSpan> spans = new ArrayList<LabeledSpan>();
        for (Argument argument:predicate.getArguments())
            spans.add(argument.getSpan());
        return spans;
    }

    @Test
    public void testReadFile() throws Exception {
        File file = new File(getClass().getResource("/conll2012/sample.gold_conll").toURI());
        List<SrlSentence> sentences = new Conll2012Reader().read(file);
        assertEquals(2, sentences.size());

        SrlSentence sentence = sentences.get(0);
        assertEquals("bc/cctv/00/cctv_0001_0", sentence.getId());
        assertEquals(9, sentence.size());
        assertEquals("[The, man, likes, to, eat, (, apples, ), .]", sentence.toString());
        assertEquals("NNS", sentence.get(6).getPOS());
        assertNull(sentence.get(6).getLemma());
        assertTrue(sentence.isSealed());

        List<Predicate> predicates = sentence.getPredicates();
        assertEquals(2, predicates.size());

        Predicate likes = predicates.get(0);
        assertEquals(2, likes.getIndex());
        assertEquals("01", likes.getSense());
        assertEquals(Arrays.asList(new LabeledSpan("ARG0", 0, 2), new LabeledSpan("ARG1", 3, 8)), spans(likes));

        Predicate eat = predicates.get(1);
        assertEquals(4, eat.getIndex());
        assertEquals("01", eat.getSense());
        assertEquals(Arrays.asList(new LabeledSpan("ARG0", 0, 2), new LabeledSpan("ARG1", 5, 8)), spans(eat));
        assertEquals(Arrays.asList("B-ARG0", "I-ARG0", "O", "O", "O", "B-ARG1", "I-ARG1", "I-ARG1", "O"),
                sentence.getPredicateBIOTags(4));

        SrlSentence yes = sentences.get(1);
        assertEquals(2, yes.size());
        assertTrue(yes.getPredicates().isEmpty());
    }

    @Test
    public void testReadDirectory() throws Exception {
        File dir = new File(getClass().getResource("/conll2012").toURI());
        assertEquals(2, new Conll2012Reader().read(dir).size());
    }

    @Test
    public void testSingleTokenArgument() throws Exception {
        String input =
                line("d", "0", "0", "John", "NNP", "*", "-", "-", "-", "-", "*", "(ARG0*)", "-")+
                line("d", "0", "1", "runs", "VBZ", "*", "run", "01", "-", "-", "*", "(V*)", "-");
        List<SrlSentence> sentences = new Conll2012Reader().read(new StringReader(input), "inline");
        assertEquals(1, sentences.size());
        SrlSentence sentence = sentences.get(0);
        assertEquals("d_0", sentence.getId());
        Predicate runs = sentence.getPredicate(1);
        assertEquals("01", runs.getSense());
        assertEquals(Arrays.asList(new LabeledSpan("ARG0", 0, 1)), spans(runs));
    }

    @Test
    public void testTooFewColumns() throws Exception {
        String input =
                "#begin document (d); part 000\n"+
                line("d", "0", "0", "John", "NNP", "*", "-", "-");
        try {
            new Conll2012Reader().read(new StringReader(input), "short.gold_conll");
            fail("short line accepted");
        } catch (CorpusFormatException e) {
            assertEquals(2, e.getLineNumber());
            assertEquals("short.gold_conll", e.getFileName());
        }
    }

    @Test
    public void testMorePredicateColumnsThanPredicates() throws Exception {
        String input =
                line("d", "0", "0", "John", "NNP", "*", "-", "-", "-", "-", "*", "(ARG0*)", "*", "-")+
                line("d", "0", "1", "runs", "VBZ", "*", "run", "01", "-", "-", "*", "(V*)", "*", "-");
        try {
            new Conll2012Reader().read(new StringReader(input), "inline");
            fail("orphan argument column accepted");
        } catch (CorpusFormatException e) {
            assertEquals(1, e.getLineNumber());
        }
    }

    @Test(expected=CorpusFormatException.class)
    public void testWordNumberMismatch() throws Exception {
        String input =
                line("d", "0", "0", "John", "NNP", "*", "-", "-", "-", "-", "*", "-")+
                line("d", "0", "2", "runs", "VBZ", "*", "-", "-", "-", "-", "*", "-");
        new Conll2012Reader().read(new StringReader(input), "inline");
    }

    @Test(expected=CorpusFormatException.class)
    public void testRaggedSentence() throws Exception {
        String input =
                line("d", "0", "0", "John", "NNP", "*", "-", "-", "-", "-", "*", "-")+
                line("d", "0", "1", "runs", "VBZ", "*", "-", "-", "-", "-", "*", "*", "-");
        new Conll2012Reader().read(new StringReader(input), "inline");
    }

    @Test
    public void testSense() {
        assertEquals("01", Conll2012Reader.getSense("like", "01"));
        assertEquals("01", Conll2012Reader.getSense("-", "01"));
        assertEquals("go.02", Conll2012Reader.getSense("go", "go.02"));
        assertEquals("12.01", Conll2012Reader.getSense("12", "01"));
        assertEquals("7.like", Conll2012Reader.getSense("7", "like"));
    }

    @Test
    public void testNumericFrameColumn() throws Exception {
        String input =
                line("d", "0", "0", "John", "NNP", "*", "-", "-", "-", "-", "*", "(ARG0*)", "-")+
                line("d", "0", "1", "runs", "VBZ", "*", "3", "01", "-", "-", "*", "(V*)", "-");
        SrlSentence sentence = new Conll2012Reader().read(new StringReader(input), "inline").get(0);
        assertEquals("3.01", sentence.getPredicate(1).getSense());
    }

    @Test
    public void testReturnedSentenceIsReadOnly() throws Exception {
        File file = new File(getClass().getResource("/conll2012/sample.gold_conll").toURI());
        SrlSentence sentence = new Conll2012Reader().read(file).get(0);
        Predicate likes = sentence.getPredicate(2);
        try {
            likes.addArgument(new Argument("ARGX", likes, sentence, 8, 9));
            fail("argument added to a sealed sentence");
        } catch (UnsupportedOperationException e) {
            assertEquals(2, likes.getArguments().size());
        }
        try {
            sentence.get(0).setHead(5);
            fail("head changed in a sealed sentence");
        } catch (UnsupportedOperationException e) {
            assertNull(sentence.get(0).getHead());
        }
        try {
            likes.setScore(0.5);
            fail("score changed in a sealed sentence");
        } catch (UnsupportedOperationException e) {
            assertEquals(0.0, likes.getScore(), 0.0);
        }
    }

    @Test
    public void testStrip() {
        assertEquals("ARG0", Conll2012Reader.strip("(ARG0*)", "()*"));
        assertEquals("ARGM-TMP", Conll2012Reader.strip("(ARGM-TMP*", "()*"));
        assertEquals("", Conll2012Reader.strip("*)", "()*"));
    }
}
