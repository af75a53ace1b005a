package edu.nlpreaders.srl;

import static org.junit.Assert.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.kohsuke.args4j.CmdLineParser;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

public class TestReadCorpus {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testDefaultProperties() throws Exception {
        Properties props = ReadCorpus.loadProperties(null);
        assertEquals("1", props.getProperty("threads"));
        assertEquals("false", props.getProperty("united.strict"));
        assertEquals(".+\\.conllu\\z", props.getProperty("united.file-regex"));
    }

    @Test
    public void testRun() throws Exception {
        File in = new File(getClass().getResource("/united").toURI());
        File out = folder.newFile("out.jsonl");

        ReadCorpus options = new ReadCorpus();
        new CmdLineParser(options).parseArgument("-format", "UNITED", "-in", in.getPath(), "-out", out.getPath(), "-threads", "2");
        assertEquals(0, options.run());

        List<String> lines = Files.readAllLines(out.toPath(), StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        JsonObject first = JsonParser.parseString(lines.get(0)).getAsJsonObject();
        assertEquals("doc1_0", first.get("id").getAsString());
        assertEquals(7, first.getAsJsonArray("words").size());
        assertEquals("sit.01", first.getAsJsonArray("predicates").get(0).getAsJsonObject().get("sense").getAsString());
    }

    @Test
    public void testStrictRunFails() throws Exception {
        File in = new File(getClass().getResource("/united/sample.conllu").toURI());
        File out = folder.newFile("out.jsonl");

        ReadCorpus options = new ReadCorpus();
        new CmdLineParser(options).parseArgument("-format", "UNITED", "-in", in.getPath(), "-out", out.getPath(), "-strict");
        assertEquals(1, options.run());
    }
}
