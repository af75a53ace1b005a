package edu.nlpreaders.srl;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class TestBIOCodec {

    @Test
    public void testDecode() {
        List<LabeledSpan> spans = BIOCodec.decode("B-ARG0", "I-ARG0", "B-V", "O", "B-ARG1", "I-ARG1", "I-ARG1");
        assertEquals(Arrays.asList(
                new LabeledSpan("ARG0", 0, 2),
                new LabeledSpan("V", 2, 3),
                new LabeledSpan("ARG1", 4, 7)), spans);
    }

    @Test
    public void testDecodeAllOutside() {
        assertTrue(BIOCodec.decode("O", "O", "_").isEmpty());
        assertTrue(BIOCodec.decode().isEmpty());
    }

    @Test
    public void testDecodeMissingBegin() {
        assertEquals(Arrays.asList(new LabeledSpan("ARG0", 0, 2)), BIOCodec.decode("I-ARG0", "I-ARG0", "O"));
    }

    @Test
    public void testDecodeConsecutiveBegins() {
        assertEquals(Arrays.asList(new LabeledSpan("A", 0, 1), new LabeledSpan("A", 1, 3)),
                BIOCodec.decode("B-A", "B-A", "I-A"));
    }

    @Test
    public void testDecodeLabelChange() {
        assertEquals(Arrays.asList(new LabeledSpan("A", 0, 2), new LabeledSpan("B", 2, 3)),
                BIOCodec.decode("B-A", "I-A", "I-B"));
    }

    @Test
    public void testDecodeBareLabels() {
        // single token roles without prefix, as in dependency based data
        assertEquals(Arrays.asList(new LabeledSpan("A0", 0, 1), new LabeledSpan("A1", 2, 3)),
                BIOCodec.decode("A0", "_", "A1"));
    }

    @Test
    public void testEncode() {
        List<String> tags = BIOCodec.encode(Arrays.asList(
                new LabeledSpan("ARG1", 3, 5),
                new LabeledSpan("ARG0", 0, 2)), 6);
        assertEquals(Arrays.asList("B-ARG0", "I-ARG0", "O", "B-ARG1", "I-ARG1", "O"), tags);
    }

    @Test
    public void testRoundTrip() {
        List<LabeledSpan> spans = Arrays.asList(
                new LabeledSpan("ARG0", 0, 1),
                new LabeledSpan("V", 1, 2),
                new LabeledSpan("ARG1", 2, 5),
                new LabeledSpan("ARGM-TMP", 6, 8));
        assertEquals(spans, BIOCodec.decode(BIOCodec.encode(spans, 9)));
    }

    static void assertTagRoundTrip(String... tags) {
        List<String> expected = Arrays.asList(tags);
        assertEquals(expected, BIOCodec.encode(BIOCodec.decode(expected), tags.length));
    }

    @Test
    public void testTagRoundTrip() {
        assertTagRoundTrip("B-ARG0", "I-ARG0", "B-V", "O", "B-ARG1", "I-ARG1");
        assertTagRoundTrip("B-X", "B-X");
        assertTagRoundTrip("B-X", "B-X", "I-X", "B-X");
        assertTagRoundTrip("B-ARG0");
        assertTagRoundTrip("O");
        assertTagRoundTrip("O", "O", "O", "O");
        assertTagRoundTrip("O", "O", "B-ARGM-TMP");
        assertTagRoundTrip("O", "B-ARG1", "I-ARG1", "I-ARG1");
        assertTagRoundTrip();
    }

    @Test(expected=IllegalArgumentException.class)
    public void testEncodeOverlap() {
        BIOCodec.encode(Arrays.asList(new LabeledSpan("A", 0, 3), new LabeledSpan("B", 2, 4)), 5);
    }

    @Test(expected=IndexOutOfBoundsException.class)
    public void testEncodeTooLong() {
        BIOCodec.encode(Arrays.asList(new LabeledSpan("A", 2, 4)), 3);
    }

    @Test
    public void testLabelOf() {
        assertEquals("ARGM-LOC", BIOCodec.labelOf("B-ARGM-LOC"));
        assertEquals("ARGM-LOC", BIOCodec.labelOf("I-ARGM-LOC"));
        assertEquals("A0", BIOCodec.labelOf("A0"));
        assertNull(BIOCodec.labelOf("O"));
        assertNull(BIOCodec.labelOf("_"));
    }

    @Test(expected=IllegalArgumentException.class)
    public void testEmptySpan() {
        new LabeledSpan("A", 2, 2);
    }
}
