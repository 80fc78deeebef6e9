package com.quarry.translator;

import com.quarry.ast.ParsedDocument;
import com.quarry.model.TableSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything known about one translation: the document being translated and
 * the external data supplied for it so far.
 *
 * <p>States are immutable. {@link Translator#update} returns a new state; the
 * caller threads it through the translate/update loop. Documents are stored
 * parsed, so supplying more data never parses a document twice.
 */
public final class TranslatorState {

    private final String rootUrl;
    private final Map<String, ParsedDocument> documents;
    private final Map<String, String> urlErrors;
    private final Map<String, TableSchema> tables;
    private final Map<String, String> tableErrors;
    private final Map<String, TableSchema> sqlSchemas;
    private final Map<String, String> sqlErrors;

    private TranslatorState(String rootUrl,
                            Map<String, ParsedDocument> documents,
                            Map<String, String> urlErrors,
                            Map<String, TableSchema> tables,
                            Map<String, String> tableErrors,
                            Map<String, TableSchema> sqlSchemas,
                            Map<String, String> sqlErrors) {
        this.rootUrl = rootUrl;
        this.documents = Collections.unmodifiableMap(documents);
        this.urlErrors = Collections.unmodifiableMap(urlErrors);
        this.tables = Collections.unmodifiableMap(tables);
        this.tableErrors = Collections.unmodifiableMap(tableErrors);
        this.sqlSchemas = Collections.unmodifiableMap(sqlSchemas);
        this.sqlErrors = Collections.unmodifiableMap(sqlErrors);
    }

    /**
     * Creates the state of a translation of the document at {@code rootUrl}.
     * Its text is requested by the first translate call.
     *
     * @param rootUrl the document URL
     * @return a state with no data
     */
    public static TranslatorState forUrl(String rootUrl) {
        Objects.requireNonNull(rootUrl, "rootUrl must not be null");
        return new TranslatorState(rootUrl, new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>(),
            new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    public String rootUrl() {
        return rootUrl;
    }

    public Map<String, ParsedDocument> documents() {
        return documents;
    }

    public ParsedDocument document(String url) {
        return documents.get(url);
    }

    public Map<String, String> urlErrors() {
        return urlErrors;
    }

    public Map<String, TableSchema> tables() {
        return tables;
    }

    public Map<String, String> tableErrors() {
        return tableErrors;
    }

    public Map<String, TableSchema> sqlSchemas() {
        return sqlSchemas;
    }

    public Map<String, String> sqlErrors() {
        return sqlErrors;
    }

    /**
     * Returns whether a URL has been supplied, with text or with an error.
     */
    boolean isKnownUrl(String url) {
        return documents.containsKey(url) || urlErrors.containsKey(url);
    }

    boolean isKnownTable(String key) {
        return tables.containsKey(key) || tableErrors.containsKey(key);
    }

    boolean isKnownSqlBlock(String name) {
        return sqlSchemas.containsKey(name) || sqlErrors.containsKey(name);
    }

    /**
     * Returns a copy of this state with more data. Data for a resource that is
     * already known is ignored.
     */
    TranslatorState with(Map<String, ParsedDocument> newDocuments, UpdateData data) {
        Map<String, ParsedDocument> nextDocuments = new LinkedHashMap<>(documents);
        Map<String, String> nextUrlErrors = new LinkedHashMap<>(urlErrors);
        newDocuments.forEach((url, document) -> {
            if (!isKnownUrl(url)) {
                nextDocuments.put(url, document);
            }
        });
        data.urlErrors().forEach((url, error) -> {
            if (!isKnownUrl(url) && !nextDocuments.containsKey(url)) {
                nextUrlErrors.put(url, error);
            }
        });

        Map<String, TableSchema> nextTables = new LinkedHashMap<>(tables);
        Map<String, String> nextTableErrors = new LinkedHashMap<>(tableErrors);
        data.tables().forEach((key, schema) -> {
            if (!isKnownTable(key)) {
                nextTables.put(key, schema);
            }
        });
        data.tableErrors().forEach((key, error) -> {
            if (!isKnownTable(key) && !nextTables.containsKey(key)) {
                nextTableErrors.put(key, error);
            }
        });

        Map<String, TableSchema> nextSqlSchemas = new LinkedHashMap<>(sqlSchemas);
        Map<String, String> nextSqlErrors = new LinkedHashMap<>(sqlErrors);
        data.sqlSchemas().forEach((name, schema) -> {
            if (!isKnownSqlBlock(name)) {
                nextSqlSchemas.put(name, schema);
            }
        });
        data.sqlErrors().forEach((name, error) -> {
            if (!isKnownSqlBlock(name) && !nextSqlSchemas.containsKey(name)) {
                nextSqlErrors.put(name, error);
            }
        });
        return new TranslatorState(rootUrl, nextDocuments, nextUrlErrors, nextTables, nextTableErrors,
            nextSqlSchemas, nextSqlErrors);
    }

    @Override
    public String toString() {
        return "TranslatorState(" + rootUrl + ", documents=" + documents.keySet()
            + ", tables=" + tables.keySet() + ", sqlBlocks=" + sqlSchemas.keySet() + ")";
    }
}
