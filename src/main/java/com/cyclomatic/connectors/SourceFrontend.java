package com.cyclomatic.connectors;

import com.cyclomatic.model.SyntaxTree;

/**
 * Turns the text of one unit into a traversable tree of {@link com.cyclomatic.model.SyntaxNode}s.
 */
public interface SourceFrontend {

    /**
     * @param unitName name the unit is reported under; the text is never read from it
     * @param content full source text
     * @return the parsed tree
     * @throws SourceParseException if no tree can be produced from the text
     */
    SyntaxTree parse(String unitName, String content) throws SourceParseException;
}
