package com.quarry.runtime;

import java.io.IOException;

/**
 * Reads the text of documents named in {@code import} statements.
 */
@FunctionalInterface
public interface URLReader {

    /**
     * Reads a document.
     *
     * @param url the document URL
     * @return the document text
     * @throws IOException if the document cannot be read
     */
    String readURL(String url) throws IOException;
}
