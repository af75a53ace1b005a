package edu.nlpreaders.srl;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.Writer;

import com.google.gson.stream.JsonWriter;

import edu.nlpreaders.common.Word;

/**
 * Writes sentences as JSON, one object per line:
 * <pre>
 * {"id":"doc_0","words":[{"text":"John","index":0,...}],
 *  "predicates":[{"index":1,"sense":"like.01","arguments":[{"role":"A0","start":0,"end":1}]}]}
 * </pre>
 * Absent optional fields are left out.
 */
public class SentenceJsonWriter implements Closeable, Flushable {

    final Writer out;
    int          count;

    public SentenceJsonWriter(Writer out) {
        this.out = out;
        count = 0;
    }

    public void write(SrlSentence sentence) throws IOException {
        JsonWriter writer = new JsonWriter(out);
        writer.beginObject();
        if (sentence.getId()!=null)
            writer.name("id").value(sentence.getId());

        writer.name("words").beginArray();
        for (Word word:sentence) {
            writer.beginObject();
            writer.name("text").value(word.getText());
            writer.name("index").value(word.getIndex());
            if (word.getStartChar()>=0)
                writer.name("start_char").value(word.getStartChar());
            if (word.getEndChar()>=0)
                writer.name("end_char").value(word.getEndChar());
            if (word.getLemma()!=null)
                writer.name("lemma").value(word.getLemma());
            if (word.getPOS()!=null)
                writer.name("pos").value(word.getPOS());
            if (word.getDep()!=null)
                writer.name("dep").value(word.getDep());
            if (word.getHead()!=null)
                writer.name("head").value(word.getHead());
            writer.endObject();
        }
        writer.endArray();

        writer.name("predicates").beginArray();
        for (Predicate predicate:sentence.getPredicates()) {
            writer.beginObject();
            writer.name("index").value(predicate.getIndex());
            if (predicate.getSense()!=null)
                writer.name("sense").value(predicate.getSense());
            writer.name("arguments").beginArray();
            for (Argument argument:predicate.getArguments()) {
                writer.beginObject();
                writer.name("role").value(argument.getRole());
                writer.name("start").value(argument.getStart());
                writer.name("end").value(argument.getEnd());
                writer.endObject();
            }
            writer.endArray();
            writer.endObject();
        }
        writer.endArray();

        writer.endObject();
        writer.flush();
        out.write('\n');
        ++count;
    }

    public int getCount() {
        return count;
    }

    @Override
    public void flush() throws IOException {
        out.flush();
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
