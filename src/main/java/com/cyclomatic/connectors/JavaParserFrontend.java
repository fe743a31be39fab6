package com.cyclomatic.connectors;

import com.cyclomatic.model.SyntaxTree;
import com.cyclomatic.util.LoggingUtils;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link SourceFrontend} backed by JavaParser.
 * Optionally retries text that is not a compilation unit as the body of a synthetic class,
 * so a blob of loose method definitions can still be analysed.
 */
public class JavaParserFrontend implements SourceFrontend {
    private static final Logger log = LoggerFactory.getLogger(JavaParserFrontend.class);

    static final String WRAPPER_CLASS_NAME = "UnitWrapper";
    // The opening stays on line 1 so every wrapped declaration keeps its original line.
    private static final String WRAPPER_PREFIX = "class " + WRAPPER_CLASS_NAME + " { ";
    private static final String WRAPPER_SUFFIX = "\n}";

    private final ParserConfiguration.LanguageLevel languageLevel;
    private final boolean wrapBareMembers;

    public JavaParserFrontend(final ParserConfiguration.LanguageLevel languageLevel, final boolean wrapBareMembers) {
        this.languageLevel = languageLevel;
        this.wrapBareMembers = wrapBareMembers;
    }

    @Override
    public SyntaxTree parse(final String unitName, final String content) throws SourceParseException {
        LoggingUtils.debugIfEnabled(log, "Parsing {} ({} chars) at language level {}", unitName, content.length(), languageLevel);
        final ParseResult<CompilationUnit> result = newParser().parse(content);
        final Optional<CompilationUnit> unit = successfulUnit(result);
        if (unit.isPresent()) {
            return new SyntaxTree(unitName, new JavaParserNode(unit.get()));
        }

        if (wrapBareMembers) {
            log.debug("{} is not a compilation unit, retrying as class body", unitName);
            final Optional<CompilationUnit> wrapped = successfulUnit(newParser().parse(WRAPPER_PREFIX + content + WRAPPER_SUFFIX));
            if (wrapped.isPresent()) {
                return new SyntaxTree(unitName, new JavaParserNode(wrapped.get(), WRAPPER_PREFIX.length()));
            }
        }

        throw new SourceParseException(unitName, describe(result.getProblems()));
    }

    private JavaParser newParser() {
        final ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(languageLevel)
                .setStoreTokens(true);
        return new JavaParser(configuration);
    }

    private static Optional<CompilationUnit> successfulUnit(final ParseResult<CompilationUnit> result) {
        return result.isSuccessful() ? result.getResult() : Optional.empty();
    }

    private static List<String> describe(final List<Problem> problems) {
        return problems.stream()
                .map(Problem::getVerboseMessage)
                .collect(Collectors.toList());
    }
}
