package com.quarry.ast;

/**
 * Turns document text into a parse tree.
 *
 * <p>The grammar lives outside this library; callers plug in a parser when they
 * create a {@link com.quarry.translator.Translator}. Implementations report syntax
 * errors in the returned document and must not throw for malformed input.
 */
@FunctionalInterface
public interface DocumentParser {

    /**
     * Parses one document.
     *
     * @param url the document URL, used for diagnostic locations
     * @param text the document text
     * @return the parse tree
     */
    ParsedDocument parse(String url, String text);
}
