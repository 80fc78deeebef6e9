package com.quarry.translator;

import com.quarry.diagnostic.Diagnostic;
import com.quarry.model.ModelDef;
import com.quarry.model.QueryDef;
import com.quarry.model.SourceDef;
import com.quarry.model.SqlBlockDef;
import com.quarry.model.TableSchema;

import java.util.Objects;

/**
 * The model-level names a source or query can refer to.
 *
 * <p>During translation this is the model being built; when an ad-hoc query is
 * compiled it is a finished {@link ModelDef}.
 */
public interface ModelScope {

    SourceDef source(String name);

    QueryDef query(String name);

    SqlBlockDef sqlBlock(String name);

    /**
     * Returns the schema of a table.
     *
     * @param key {@code connection:path}, or the path for the default connection
     * @return the schema, or null if it is not known
     */
    TableSchema table(String key);

    /**
     * Returns why the schema of a table could not be read.
     *
     * @param key the table key
     * @return the reported failure, or null
     */
    default String tableFailure(String key) {
        return null;
    }

    boolean isInvalid(String name);

    Diagnostic invalidReason(String name);

    /**
     * Returns the scope of a finished model.
     *
     * @param model the model
     * @return a read-only scope
     */
    static ModelScope of(ModelDef model) {
        Objects.requireNonNull(model, "model must not be null");
        return new ModelScope() {
            @Override
            public SourceDef source(String name) {
                return model.source(name);
            }

            @Override
            public QueryDef query(String name) {
                return model.query(name);
            }

            @Override
            public SqlBlockDef sqlBlock(String name) {
                return model.sqlBlock(name);
            }

            @Override
            public TableSchema table(String key) {
                return model.table(key);
            }

            @Override
            public boolean isInvalid(String name) {
                return model.isInvalid(name);
            }

            @Override
            public Diagnostic invalidReason(String name) {
                return model.invalidReason(name);
            }
        };
    }
}
