package com.quarry.model;

import com.quarry.diagnostic.Diagnostic;
import com.quarry.diagnostic.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The compiled contents of a document: named sources, named queries, SQL blocks
 * and anonymous queries, plus the diagnostics reported while building them.
 *
 * <p>A model is immutable. Entities whose definition failed are not present, but
 * their names are remembered as invalid so that references to them are
 * suppressed rather than reported as unknown names.
 */
public final class ModelDef {

    public static final ModelDef EMPTY = new Builder().build();

    private final String url;
    private final Map<String, SourceDef> sources;
    private final Map<String, QueryDef> queries;
    private final Map<String, SqlBlockDef> sqlBlocks;
    private final Map<String, TableSchema> tables;
    private final List<QueryDef> anonymousQueries;
    private final Map<Integer, Diagnostic> anonymousFailures;
    private final Map<String, Diagnostic> invalid;
    private final List<Diagnostic> diagnostics;

    private ModelDef(Builder builder) {
        this.url = builder.url;
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sources));
        this.queries = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queries));
        this.sqlBlocks = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sqlBlocks));
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tables));
        this.anonymousQueries = Collections.unmodifiableList(new ArrayList<>(builder.anonymousQueries));
        this.anonymousFailures = Collections.unmodifiableMap(new LinkedHashMap<>(builder.anonymousFailures));
        this.invalid = Collections.unmodifiableMap(new LinkedHashMap<>(builder.invalid));
        this.diagnostics = List.copyOf(builder.diagnostics);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the URL of the document the model was translated from.
     *
     * @return the root document URL, or null for a model built by hand
     */
    public String url() {
        return url;
    }

    /**
     * Returns the start of the root document, for diagnostics that belong to the
     * model as a whole.
     *
     * @return line 1, column 1 of the root document
     */
    public Location documentStart() {
        return url != null ? new Location(url, 1, 1) : Location.UNKNOWN;
    }

    public SourceDef source(String name) {
        return sources.get(name);
    }

    public QueryDef query(String name) {
        return queries.get(name);
    }

    public SqlBlockDef sqlBlock(String name) {
        return sqlBlocks.get(name);
    }

    /**
     * Returns the schema of a table the model was built against.
     *
     * @param key the table key, {@code connection:path} or {@code path}
     * @return the schema, or null
     */
    public TableSchema table(String key) {
        return tables.get(key);
    }

    public Map<String, TableSchema> tables() {
        return tables;
    }

    public Map<String, SourceDef> sources() {
        return sources;
    }

    public Map<String, QueryDef> queries() {
        return queries;
    }

    public Map<String, SqlBlockDef> sqlBlocks() {
        return sqlBlocks;
    }

    /**
     * Returns the anonymous queries in document order. An entry is null when that
     * query failed to build.
     *
     * @return the anonymous queries
     */
    public List<QueryDef> anonymousQueries() {
        return anonymousQueries;
    }

    /**
     * Returns the diagnostic that made an anonymous query fail.
     *
     * @param index the position of the query among the anonymous queries
     * @return the cause, or null if the query is valid
     */
    public Diagnostic anonymousFailure(int index) {
        return anonymousFailures.get(index);
    }

    /**
     * Returns whether a name belongs to an entity that failed to build.
     *
     * @param name the entity name
     * @return true if the entity is invalid
     */
    public boolean isInvalid(String name) {
        return invalid.containsKey(name);
    }

    /**
     * Returns the diagnostic explaining why an entity is invalid. For an entity
     * that failed only because it depends on another invalid entity, this is the
     * root cause.
     *
     * @param name the entity name
     * @return the cause, or null if the entity is not invalid
     */
    public Diagnostic invalidReason(String name) {
        return invalid.get(name);
    }

    public Set<String> invalidNames() {
        return invalid.keySet();
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    @Override
    public String toString() {
        return "ModelDef(sources=" + sources.keySet() + ", queries=" + queries.keySet() +
            ", sqlBlocks=" + sqlBlocks.keySet() + ", runs=" + anonymousQueries.size() +
            ", diagnostics=" + diagnostics.size() + ")";
    }

    /**
     * Mutable accumulator used while a document is translated.
     */
    public static final class Builder {

        private final Map<String, SourceDef> sources = new LinkedHashMap<>();
        private final Map<String, QueryDef> queries = new LinkedHashMap<>();
        private final Map<String, SqlBlockDef> sqlBlocks = new LinkedHashMap<>();
        private final Map<String, TableSchema> tables = new LinkedHashMap<>();
        private final List<QueryDef> anonymousQueries = new ArrayList<>();
        private final Map<Integer, Diagnostic> anonymousFailures = new LinkedHashMap<>();
        private final Map<String, Diagnostic> invalid = new LinkedHashMap<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private String url;

        private Builder() {}

        public Builder url(String documentUrl) {
            this.url = documentUrl;
            return this;
        }

        /**
         * Returns whether a name is already taken by any entity, valid or not.
         *
         * @param name the name
         * @return true if taken
         */
        public boolean isDefined(String name) {
            return sources.containsKey(name) || queries.containsKey(name) ||
                sqlBlocks.containsKey(name) || invalid.containsKey(name);
        }

        public Builder addSource(String name, SourceDef source) {
            sources.put(name, source);
            return this;
        }

        public Builder addQuery(String name, QueryDef query) {
            queries.put(name, query);
            return this;
        }

        public Builder addSqlBlock(String name, SqlBlockDef block) {
            sqlBlocks.put(name, block);
            return this;
        }

        public Builder addTable(String key, TableSchema schema) {
            tables.put(key, schema);
            return this;
        }

        public Builder addAnonymousQuery(QueryDef query) {
            anonymousQueries.add(query);
            return this;
        }

        /**
         * Records an anonymous query that failed to build.
         *
         * @param cause the diagnostic that made it fail
         * @return this builder
         */
        public Builder addFailedAnonymousQuery(Diagnostic cause) {
            anonymousFailures.put(anonymousQueries.size(), Objects.requireNonNull(cause, "cause must not be null"));
            anonymousQueries.add(null);
            return this;
        }

        public Builder markInvalid(String name, Diagnostic cause) {
            invalid.put(name, Objects.requireNonNull(cause, "cause must not be null"));
            return this;
        }

        public Builder addDiagnostic(Diagnostic diagnostic) {
            diagnostics.add(diagnostic);
            return this;
        }

        public Builder addDiagnostics(List<Diagnostic> more) {
            diagnostics.addAll(more);
            return this;
        }

        public SourceDef source(String name) {
            return sources.get(name);
        }

        public QueryDef query(String name) {
            return queries.get(name);
        }

        public SqlBlockDef sqlBlock(String name) {
            return sqlBlocks.get(name);
        }

        public TableSchema table(String key) {
            return tables.get(key);
        }

        public boolean isInvalid(String name) {
            return invalid.containsKey(name);
        }

        public Diagnostic invalidReason(String name) {
            return invalid.get(name);
        }

        public ModelDef build() {
            return new ModelDef(this);
        }
    }
}
