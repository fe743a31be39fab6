package com.cyclomatic;

import com.cyclomatic.analysis.ComplexityCalculator;
import com.cyclomatic.analysis.FunctionLocator;
import com.cyclomatic.connectors.JavaParserFrontend;
import com.cyclomatic.connectors.SourceParseException;
import com.cyclomatic.model.ComplexityRecord;
import com.github.javaparser.ParserConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end: source text in, report file out.
 */
class ComplexityPipelineTest {

    @TempDir
    Path tempDir;

    private Path output;
    private ComplexityPipeline pipeline;

    @BeforeEach
    void setUp() {
        output = tempDir.resolve("output.cy");
        pipeline = new ComplexityPipeline(new JavaParserFrontend(ParserConfiguration.LanguageLevel.JAVA_17, true),
                new FunctionLocator(), new ComplexityCalculator(), "unsaved.java", output);
    }

    private static String fixture(final String name) throws IOException {
        try (InputStream input = ComplexityPipelineTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(input, "Missing fixture " + name);
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private String report() throws IOException {
        return Files.readString(output, StandardCharsets.UTF_8);
    }

    @Test
    void reportsEveryFunctionOfFixture() throws Exception {
        final List<ComplexityRecord> records = pipeline.run(fixture("Inventory.java"));

        assertEquals(String.join("\n",
                "9 Inventory 1",
                "13 count 1",
                "20 find 4",
                "29 describe 5",
                "40 drain 3",
                "50 name 1",
                "52 stock 1",
                ""), report());
        assertEquals(7, records.size());
        assertEquals(new ComplexityRecord(20, "find", 4), records.get(2));
    }

    @Test
    void reportLinesMatchFunctionCount() throws Exception {
        final List<ComplexityRecord> records = pipeline.run("class A { void a() {} class B { void b() {} } }\ninterface C { void c(); }");

        assertEquals(3, records.size());
        assertEquals(3, report().lines().count());
        records.forEach(record -> assertEquals(1, record.complexity()));
    }

    @Test
    void bareFunctionIsAnalysed() throws Exception {
        pipeline.run("int f(int x){ return x + 1; }");
        assertEquals("1 f 1\n", report());
    }

    @Test
    void recordCompactConstructorIsReported() throws Exception {
        final List<ComplexityRecord> records = pipeline.run(String.join("\n",
                "record P(int x) {",
                "  P {",
                "    if (x < 0 && x > -5) throw new IllegalArgumentException();",
                "  }",
                "}"));

        assertEquals(List.of(new ComplexityRecord(2, "P", 3)), records);
        assertEquals("2 P 3\n", report());
    }

    @Test
    void readsSourceFromStream() throws Exception {
        final InputStream input = new ByteArrayInputStream("class A { int f(boolean a) { return a ? 1 : 0; } }".getBytes(StandardCharsets.UTF_8));

        pipeline.run(input);

        assertEquals("1 f 2\n", report());
    }

    @Test
    void unreadableInputStillTruncatesReport() throws IOException {
        Files.writeString(output, "1 stale 1\n");
        final InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("stdin closed");
            }
        };

        assertThrows(IOException.class, () -> pipeline.run(failing));
        assertEquals("", report());
    }

    @Test
    void rerunIsByteIdentical() throws Exception {
        final String source = fixture("Inventory.java");

        pipeline.run(source);
        final byte[] first = Files.readAllBytes(output);
        pipeline.run(source);

        assertArrayEquals(first, Files.readAllBytes(output));
    }

    @Test
    void parseFailureLeavesEmptyReport() throws IOException {
        Files.writeString(output, "1 stale 1\n");

        assertThrows(SourceParseException.class, () -> pipeline.run("class Broken { void f( }"));
        assertEquals("", report());
    }

    @Test
    void unitWithoutFunctionsGivesEmptyReport() throws Exception {
        assertTrue(pipeline.run("class Empty { int field = 1 + 2; }").isEmpty());
        assertEquals("", report());
    }
}
