package com.quarry.translator;

import com.quarry.model.TableSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * External data supplied to a translation with {@link Translator#update}: document
 * texts, table schemas and SQL block schemas, or the reason one of them could
 * not be obtained.
 */
public final class UpdateData {

    private final Map<String, String> urls;
    private final Map<String, String> urlErrors;
    private final Map<String, TableSchema> tables;
    private final Map<String, String> tableErrors;
    private final Map<String, TableSchema> sqlSchemas;
    private final Map<String, String> sqlErrors;

    private UpdateData(Builder builder) {
        this.urls = Collections.unmodifiableMap(new LinkedHashMap<>(builder.urls));
        this.urlErrors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.urlErrors));
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tables));
        this.tableErrors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tableErrors));
        this.sqlSchemas = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sqlSchemas));
        this.sqlErrors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sqlErrors));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, String> urls() {
        return urls;
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

    public boolean isEmpty() {
        return urls.isEmpty() && urlErrors.isEmpty() && tables.isEmpty() && tableErrors.isEmpty()
            && sqlSchemas.isEmpty() && sqlErrors.isEmpty();
    }

    /**
     * Collects update data.
     */
    public static final class Builder {
        private final Map<String, String> urls = new LinkedHashMap<>();
        private final Map<String, String> urlErrors = new LinkedHashMap<>();
        private final Map<String, TableSchema> tables = new LinkedHashMap<>();
        private final Map<String, String> tableErrors = new LinkedHashMap<>();
        private final Map<String, TableSchema> sqlSchemas = new LinkedHashMap<>();
        private final Map<String, String> sqlErrors = new LinkedHashMap<>();

        private Builder() {}

        public Builder url(String url, String text) {
            urls.put(Objects.requireNonNull(url, "url must not be null"),
                Objects.requireNonNull(text, "text must not be null"));
            return this;
        }

        public Builder urlError(String url, String message) {
            urlErrors.put(Objects.requireNonNull(url, "url must not be null"), String.valueOf(message));
            return this;
        }

        public Builder table(String key, TableSchema schema) {
            tables.put(Objects.requireNonNull(key, "key must not be null"),
                Objects.requireNonNull(schema, "schema must not be null"));
            return this;
        }

        public Builder tables(Map<String, TableSchema> schemas) {
            schemas.forEach(this::table);
            return this;
        }

        public Builder tableError(String key, String message) {
            tableErrors.put(Objects.requireNonNull(key, "key must not be null"), String.valueOf(message));
            return this;
        }

        public Builder sqlSchema(String blockName, TableSchema schema) {
            sqlSchemas.put(Objects.requireNonNull(blockName, "blockName must not be null"),
                Objects.requireNonNull(schema, "schema must not be null"));
            return this;
        }

        public Builder sqlError(String blockName, String message) {
            sqlErrors.put(Objects.requireNonNull(blockName, "blockName must not be null"), String.valueOf(message));
            return this;
        }

        public UpdateData build() {
            return new UpdateData(this);
        }
    }
}
