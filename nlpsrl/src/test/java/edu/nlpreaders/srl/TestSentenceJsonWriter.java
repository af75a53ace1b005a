package edu.nlpreaders.srl;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;

import org.junit.Test;

import edu.nlpreaders.common.Word;

public class TestSentenceJsonWriter {

    @Test
    public void testWrite() throws IOException {
        SrlSentence sentence = new SrlSentence(Arrays.asList(
                new Word("John", 0),
                new Word("likes", 1, -1, -1, "like", "VBZ", "ROOT", Word.ROOT_HEAD)), "s1");
        Predicate likes = sentence.promote(1, "like.01");
        likes.addArgument(new Argument("A0", likes, sentence, 0, 1));

        SrlSentence empty = new SrlSentence();
        empty.add(new Word("Yes", 0));

        StringWriter out = new StringWriter();
        SentenceJsonWriter writer = new SentenceJsonWriter(out);
        writer.write(sentence);
        writer.write(empty);
        writer.close();

        assertEquals(2, writer.getCount());
        assertEquals(
                "{\"id\":\"s1\",\"words\":[{\"text\":\"John\",\"index\":0},"+
                "{\"text\":\"likes\",\"index\":1,\"lemma\":\"like\",\"pos\":\"VBZ\",\"dep\":\"ROOT\",\"head\":-1}],"+
                "\"predicates\":[{\"index\":1,\"sense\":\"like.01\",\"arguments\":[{\"role\":\"A0\",\"start\":0,\"end\":1}]}]}\n"+
                "{\"words\":[{\"text\":\"Yes\",\"index\":0}],\"predicates\":[]}\n",
                out.toString());
    }
}
