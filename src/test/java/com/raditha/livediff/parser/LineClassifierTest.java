package com.raditha.livediff.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineClassifierTest {

    private LineClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new LineClassifier();
    }

    @Test
    void testPlainHeader() {
        DumpLine line = classifier.classify("final: live values at end of each block: foo");

        DumpLine.SectionHeader header = assertInstanceOf(DumpLine.SectionHeader.class, line);
        assertEquals("foo", header.functionName());
        assertNull(header.description());
        assertEquals("final: live values at end of each block: foo", header.text());
    }

    @Test
    void testAnnotatedHeader() {
        DumpLine line = classifier.classify("final (SCC 2-pass): live values at end of each block: main.init.0  ");

        DumpLine.SectionHeader header = assertInstanceOf(DumpLine.SectionHeader.class, line);
        assertEquals("main.init.0", header.functionName());
        assertEquals("SCC 2-pass", header.description());
    }

    @Test
    void testAnnotationIsTrimmed() {
        DumpLine.SectionHeader header = assertInstanceOf(DumpLine.SectionHeader.class,
                classifier.classify("final(  iterative ):live values at end of each block:bar"));
        assertEquals("iterative", header.description());
        assertEquals("bar", header.functionName());
    }

    @Test
    void testEmptyAnnotationIsAbsent() {
        DumpLine.SectionHeader header = assertInstanceOf(DumpLine.SectionHeader.class,
                classifier.classify("final (): live values at end of each block: bar"));
        assertNull(header.description());
    }

    @Test
    void testHeaderWithLeadingWhitespace() {
        assertInstanceOf(DumpLine.SectionHeader.class,
                classifier.classify("   final: live values at end of each block: foo"));
    }

    @Test
    void testHeaderWithoutFunctionNameIsUnrecognized() {
        assertSame(DumpLine.UNRECOGNIZED, classifier.classify("final: live values at end of each block:   "));
    }

    @Test
    void testNearMissHeadersAreUnrecognized() {
        assertSame(DumpLine.UNRECOGNIZED, classifier.classify("finally: live values at end of each block: foo"));
        assertSame(DumpLine.UNRECOGNIZED, classifier.classify("final (open: live values at end of each block: foo"));
        assertSame(DumpLine.UNRECOGNIZED, classifier.classify("final: live values at start of each block: foo"));
        assertSame(DumpLine.UNRECOGNIZED, classifier.classify("final : live values at end of each block: foo"));
    }

    @Test
    void testBlockSummary() {
        DumpLine.BlockSummary block = assertInstanceOf(DumpLine.BlockSummary.class,
                classifier.classify("  b12:  v8(459) v9(12)[R0] avoid=R0  "));
        assertEquals(12, block.blockId());
        assertEquals("v8(459) v9(12)[R0] avoid=R0", block.body());
    }

    @Test
    void testBlockSummaryWithEmptyBody() {
        DumpLine.BlockSummary block = assertInstanceOf(DumpLine.BlockSummary.class, classifier.classify("b3:"));
        assertEquals(3, block.blockId());
        assertEquals("", block.body());
    }

    @Test
    void testMalformedBlockLines() {
        assertSame(DumpLine.UNRECOGNIZED, classifier.classify("b: v1(1)"));
        assertSame(DumpLine.UNRECOGNIZED, classifier.classify("bx1: v1(1)"));
        assertSame(DumpLine.UNRECOGNIZED, classifier.classify("b1 v1(1)"));
        assertSame(DumpLine.UNRECOGNIZED, classifier.classify("b99999999999: v1(1)"));
    }

    @Test
    void testSectionEnd() {
        assertSame(DumpLine.SECTION_END, classifier.classify("Begin processing block b4"));
        assertSame(DumpLine.UNRECOGNIZED, classifier.classify("  Begin processing block b4"));
    }

    @Test
    void testNoiseIsUnrecognized() {
        assertSame(DumpLine.UNRECOGNIZED, classifier.classify(""));
        assertSame(DumpLine.UNRECOGNIZED, classifier.classify("regalloc: spilling v12"));
        assertSame(DumpLine.UNRECOGNIZED, classifier.classify(null));
    }
}
