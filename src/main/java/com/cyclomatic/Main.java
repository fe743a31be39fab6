package com.cyclomatic;

import com.cyclomatic.connectors.SourceParseException;
import com.cyclomatic.model.ComplexityRecord;
import com.cyclomatic.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads one Java unit from standard input and writes its per-function cyclomatic
 * complexity to the configured report file.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PARSE_FAILURE = 1;
    static final int EXIT_IO_FAILURE = 2;

    private static final String MDC_UNIT = "unit";

    public static void main(final String[] args) {
        final int status = run(new ConfigurationManager(), System.in);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(final ConfigurationManager config, final InputStream input) {
        final String unitName = config.getUnitName();
        MDC.put(MDC_UNIT, unitName);
        try {
            log.debug("Reading source from standard input...");
            final List<ComplexityRecord> records = new ComplexityPipeline(config).run(input);
            if (log.isInfoEnabled()) {
                final int maxComplexity = records.stream().mapToInt(ComplexityRecord::complexity).max().orElse(0);
                log.info("Analysed {} functions, highest complexity {}", records.size(), maxComplexity);
            }
            return EXIT_OK;
        } catch (final SourceParseException e) {
            log.error("Error: Unable to parse translation unit {}.", e.getUnitName());
            for (final String problem : e.getProblems()) {
                log.error("  {}", problem);
            }
            return EXIT_PARSE_FAILURE;
        } catch (final IOException e) {
            log.error(ExceptionUtils.createErrorMessage("Complexity report", unitName, e), e);
            return EXIT_IO_FAILURE;
        } finally {
            MDC.clear();
        }
    }
}
