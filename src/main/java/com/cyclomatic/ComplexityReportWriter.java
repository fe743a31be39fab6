package com.cyclomatic;

import com.cyclomatic.model.ComplexityRecord;
import com.cyclomatic.util.FileUtils;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append-only report of {@code <line> <name> <complexity>} lines.
 * The file is truncated once when the writer opens; every record is flushed as soon as
 * it is appended.
 */
public class ComplexityReportWriter implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ComplexityReportWriter.class);

    private static final CSVFormat REPORT_FORMAT = CSVFormat.DEFAULT.builder()
            .setDelimiter(' ')
            .setQuoteMode(QuoteMode.NONE)
            .setEscape('\\')
            .setRecordSeparator('\n')
            .build();

    private final Path outputFile;
    private final CSVPrinter printer;
    private int recordCount;

    private ComplexityReportWriter(final Path outputFile, final CSVPrinter printer) {
        this.outputFile = outputFile;
        this.printer = printer;
    }

    public static ComplexityReportWriter open(final Path outputFile) throws IOException {
        FileUtils.createParentDirectories(outputFile, log);
        final CSVPrinter printer = new CSVPrinter(Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE), REPORT_FORMAT);
        log.debug("Truncated report file {}", outputFile);
        return new ComplexityReportWriter(outputFile, printer);
    }

    public void append(final ComplexityRecord record) throws IOException {
        printer.printRecord(record.line(), record.functionName(), record.complexity());
        printer.flush();
        recordCount++;
    }

    public int getRecordCount() {
        return recordCount;
    }

    @Override
    public void close() throws IOException {
        printer.close(true);
        log.debug("Closed report file {} after {} records", outputFile, recordCount);
    }
}
