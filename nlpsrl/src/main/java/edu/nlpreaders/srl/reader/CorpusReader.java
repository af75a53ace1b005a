package edu.nlpreaders.srl.reader;

import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

import edu.nlpreaders.common.CorpusFormatException;
import edu.nlpreaders.srl.SrlSentence;

/**
 * Reads all the files of a corpus, optionally in parallel. Sentences are
 * returned in file order (sorted path order) and, within a file, in the
 * order they appear, whatever order the files finish in.
 */
public class CorpusReader {
    private static Logger logger = Logger.getLogger(CorpusReader.class.getPackage().getName());

    final SrlReader reader;
    final int       threads;
    boolean         skipMalformedFiles;

    public CorpusReader(SrlReader reader) {
        this(reader, 1);
    }

    public CorpusReader(SrlReader reader, int threads) {
        this.reader = reader;
        this.threads = threads<1?1:threads;
        skipMalformedFiles = false;
    }

    public SrlReader getReader() {
        return reader;
    }

    /**
     * When set, a file with a malformed sentence is logged and left out
     * entirely instead of failing the whole corpus.
     */
    public void setSkipMalformedFiles(boolean skipMalformedFiles) {
        this.skipMalformedFiles = skipMalformedFiles;
    }

    class FileTask implements Callable<List<SrlSentence>> {
        final File file;

        FileTask(File file) {
            this.file = file;
        }

        @Override
        public List<SrlSentence> call() throws IOException, CorpusFormatException {
            return readFile(file);
        }
    }

    List<SrlSentence> readFile(File file) throws IOException, CorpusFormatException {
        try {
            return reader.readFile(file);
        } catch (CorpusFormatException e) {
            if (!skipMalformedFiles)
                throw e;
            logger.severe("skipping "+file.getPath()+": "+e.getMessage());
            return new ArrayList<SrlSentence>();
        }
    }

    public List<SrlSentence> read(File input) throws IOException, CorpusFormatException {
        List<File> files = reader.listFiles(input);
        logger.info(String.format("Reading %d file(s) from %s", files.size(), input.getPath()));

        List<SrlSentence> sentences = new ArrayList<SrlSentence>();
        if (threads==1 || files.size()<2) {
            for (File file:files)
                sentences.addAll(readFile(file));
            return sentences;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, files.size()));
        try {
            List<Future<List<SrlSentence>>> futures = new ArrayList<Future<List<SrlSentence>>>(files.size());
            for (File file:files)
                futures.add(executor.submit(new FileTask(file)));
            for (Future<List<SrlSentence>> future:futures)
                sentences.addAll(get(future));
        } finally {
            executor.shutdownNow();
        }
        return sentences;
    }

    static List<SrlSentence> get(Future<List<SrlSentence>> future) throws IOException, CorpusFormatException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException ie = new InterruptedIOException("interrupted while reading corpus");
            ie.initCause(e);
            throw ie;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CorpusFormatException)
                throw (CorpusFormatException)cause;
            if (cause instanceof IOException)
                throw (IOException)cause;
            if (cause instanceof RuntimeException)
                throw (RuntimeException)cause;
            if (cause instanceof Error)
                throw (Error)cause;
            throw new IOException(cause);
        }
    }
}
