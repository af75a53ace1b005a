package edu.nlpreaders.srl;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import edu.nlpreaders.common.CorpusFormatException;
import edu.nlpreaders.common.util.PropertyUtil;
import edu.nlpreaders.srl.reader.CorpusFormat;
import edu.nlpreaders.srl.reader.CorpusReader;
import edu.nlpreaders.srl.reader.DroppedArgument;
import edu.nlpreaders.srl.reader.SrlReader;
import edu.nlpreaders.srl.reader.UnitedSrlReader;

/**
 * Reads an SRL corpus and writes its sentences as JSON lines.
 */
public class ReadCorpus {
    private static Logger logger = Logger.getLogger("edu.nlpreaders");

    static final String DEFAULT_PROPERTIES = "/nlpsrl.properties";

    @Option(name="-format",usage="corpus format: CONLL2009/CONLL2012/UNITED",required=true)
    private CorpusFormat format = null;

    @Option(name="-in",usage="input file/directory",required=true)
    private File inFile = null;

    @Option(name="-prop",usage="properties file (overrides the defaults)")
    private File propFile = null;

    @Option(name="-out",usage="JSON lines output file (stdout if absent)")
    private File outFile = null;

    @Option(name="-threads",usage="number of files read concurrently (overrides srl.threads)")
    private int threads = -1;

    @Option(name="-strict",usage="reject United sentences with unattachable arguments")
    private boolean strict = false;

    @Option(name="-skipMalformed",usage="leave out malformed files instead of failing")
    private boolean skipMalformed = false;

    @Option(name="-h",usage="help message")
    private boolean help = false;

    static Properties loadProperties(File propFile) throws IOException {
        Properties props = PropertyUtil.loadResource(ReadCorpus.class, DEFAULT_PROPERTIES);
        if (propFile!=null)
            props = PropertyUtil.load(propFile, props);
        props = PropertyUtil.resolveEnvironmentVariables(props);
        return PropertyUtil.filterProperties(props, "srl.", true);
    }

    static void configureLogging(Properties props) {
        String logLevel = props.getProperty("logger.level");
        if (logLevel!=null) {
            ConsoleHandler ch = new ConsoleHandler();
            ch.setLevel(Level.parse(logLevel.trim()));
            logger.addHandler(ch);
            logger.setLevel(Level.parse(logLevel.trim()));
            logger.setUseParentHandlers(false);
        }
    }

    int run() throws IOException {
        Properties props = loadProperties(propFile);
        configureLogging(props);
        logger.config(PropertyUtil.toString(props));

        if (strict)
            props.setProperty(CorpusFormat.UNITED.getKey()+".strict", "true");
        SrlReader reader = format.newReader(props);

        CorpusReader corpusReader = new CorpusReader(reader, threads>0?threads:PropertyUtil.getInt(props, "threads", 1));
        corpusReader.setSkipMalformedFiles(skipMalformed || PropertyUtil.getBoolean(props, "skip-malformed-files", false));

        List<SrlSentence> sentences;
        try {
            sentences = corpusReader.read(inFile);
        } catch (CorpusFormatException e) {
            logger.severe(e.getMessage());
            return 1;
        }

        Writer writer = outFile==null
                ?new OutputStreamWriter(System.out, StandardCharsets.UTF_8)
                :new OutputStreamWriter(new FileOutputStream(outFile), StandardCharsets.UTF_8);
        SentenceJsonWriter jsonWriter = new SentenceJsonWriter(writer);
        try {
            for (SrlSentence sentence:sentences)
                jsonWriter.write(sentence);
        } finally {
            if (outFile==null)
                jsonWriter.flush();
            else
                jsonWriter.close();
        }

        logger.info("Corpus statistics\n"+new CorpusStats(sentences));
        if (reader instanceof UnitedSrlReader) {
            List<DroppedArgument> dropped = ((UnitedSrlReader)reader).getDroppedArguments();
            if (!dropped.isEmpty())
                logger.warning(dropped.size()+" argument(s) dropped");
        }
        return 0;
    }

    public static void main(String[] args) throws Exception {
        ReadCorpus options = new ReadCorpus();
        CmdLineParser parser = new CmdLineParser(options);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException e)
        {
            System.err.println("invalid options:"+e);
            parser.printUsage(System.err);
            System.exit(1);
        }
        if (options.help){
            parser.printUsage(System.err);
            System.exit(0);
        }
        System.exit(options.run());
    }
}
