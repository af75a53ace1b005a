package edu.nlpreaders.srl.reader;

import java.io.Closeable;
import java.io.IOException;

import edu.nlpreaders.common.CorpusFormatException;
import edu.nlpreaders.common.io.ConllBlockReader;
import edu.nlpreaders.common.io.LineBlock;
import edu.nlpreaders.srl.SrlSentence;

/**
 * Reads the sentences of one corpus file incrementally, holding a single
 * sentence block in memory at a time.
 */
public class SrlFileReader implements Closeable {

    final SrlReader        dialect;
    final ConllBlockReader blockReader;
    int                    sentenceCount;

    SrlFileReader(SrlReader dialect, ConllBlockReader blockReader) {
        this.dialect = dialect;
        this.blockReader = blockReader;
        sentenceCount = 0;
    }

    /**
     * Returns the next sentence of the file, <code>null</code> if there is none.
     * The returned sentence is sealed.
     * @throws CorpusFormatException if the next sentence block is malformed,
     * the reader should not be used afterwards
     */
    public SrlSentence nextSentence() throws IOException, CorpusFormatException {
        LineBlock block = blockReader.nextBlock();
        if (block==null)
            return null;
        SrlSentence sentence;
        try {
            sentence = dialect.parseSentence(block);
        } catch (CorpusFormatException e) {
            close();
            throw e;
        }
        sentence.seal();
        ++sentenceCount;
        return sentence;
    }

    public String getFileName() {
        return blockReader.getFileName();
    }

    public int getSentenceCount() {
        return sentenceCount;
    }

    @Override
    public void close() {
        blockReader.close();
    }
}
