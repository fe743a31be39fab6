package com.cyclomatic;

import com.cyclomatic.analysis.ComplexityCalculator;
import com.cyclomatic.analysis.FunctionLocator;
import com.cyclomatic.connectors.JavaParserFrontend;
import com.cyclomatic.connectors.SourceFrontend;
import com.cyclomatic.connectors.SourceParseException;
import com.cyclomatic.model.ComplexityRecord;
import com.cyclomatic.model.SyntaxNode;
import com.cyclomatic.model.SyntaxTree;
import com.cyclomatic.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses one unit, finds every function in it and reports one complexity record per
 * function, in discovery order.
 */
public class ComplexityPipeline {
    private static final Logger log = LoggerFactory.getLogger(ComplexityPipeline.class);

    private final SourceFrontend frontend;
    private final FunctionLocator functionLocator;
    private final ComplexityCalculator complexityCalculator;
    private final String unitName;
    private final Path outputFile;

    public ComplexityPipeline(final ConfigurationManager config) {
        this(new JavaParserFrontend(config.getLanguageLevel(), config.isWrapBareMembers()),
                new FunctionLocator(), new ComplexityCalculator(),
                config.getUnitName(), config.getOutputFile());
    }

    public ComplexityPipeline(final SourceFrontend frontend, final FunctionLocator functionLocator,
                              final ComplexityCalculator complexityCalculator, final String unitName, final Path outputFile) {
        this.frontend = frontend;
        this.functionLocator = functionLocator;
        this.complexityCalculator = complexityCalculator;
        this.unitName = unitName;
        this.outputFile = outputFile;
    }

    /**
     * Runs the whole analysis. The report is truncated before parsing starts, so a parse
     * failure leaves it empty.
     *
     * @param source full text of the unit
     * @return the records written, in report order
     * @throws SourceParseException if the unit cannot be parsed
     * @throws IOException if the report cannot be written
     */
    public List<ComplexityRecord> run(final String source) throws SourceParseException, IOException {
        try (ComplexityReportWriter writer = ComplexityReportWriter.open(outputFile)) {
            return analyzeInto(writer, source);
        }
    }

    /**
     * Same as {@link #run(String)}, reading the unit as UTF-8 only after the report has been
     * truncated, so a failed read leaves no stale records behind.
     *
     * @param input stream holding the full text of the unit
     * @return the records written, in report order
     * @throws SourceParseException if the unit cannot be parsed
     * @throws IOException if the input cannot be read or the report cannot be written
     */
    public List<ComplexityRecord> run(final InputStream input) throws SourceParseException, IOException {
        try (ComplexityReportWriter writer = ComplexityReportWriter.open(outputFile)) {
            final String source = new String(input.readAllBytes(), StandardCharsets.UTF_8);
            return analyzeInto(writer, source);
        }
    }

    private List<ComplexityRecord> analyzeInto(final ComplexityReportWriter writer, final String source)
            throws SourceParseException, IOException {
        final SyntaxTree tree = frontend.parse(unitName, source);
        final List<SyntaxNode> functions = functionLocator.findFunctions(tree.root());
        log.debug("Found {} functions in {}", functions.size(), tree.unitName());

        final List<ComplexityRecord> records = new ArrayList<>();
        for (final SyntaxNode function : functions) {
            final ComplexityRecord record = analyze(function);
            writer.append(record);
            records.add(record);
        }
        log.info("Wrote {} complexity records for {} to {}", records.size(), unitName, outputFile);
        return records;
    }

    ComplexityRecord analyze(final SyntaxNode function) {
        final int complexity = complexityCalculator.calculate(function);
        final ComplexityRecord record = new ComplexityRecord(function.location().line(), function.spelling(), complexity);
        LoggingUtils.debugIfEnabled(log, "Computed {}", record);
        return record;
    }
}
