package com.quarry.translator;

import com.quarry.model.ModelDef;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * How far translation of a document got with the data supplied so far.
 */
public sealed interface TranslationPhase {

    /** Imported documents must be read before anything else can be done. */
    record AwaitingImports(Set<String> urls) implements TranslationPhase {
        public AwaitingImports {
            urls = Collections.unmodifiableSet(new LinkedHashSet<>(urls));
        }
    }

    /** Every document is read; table and SQL block schemas are missing. */
    record AwaitingSchemas(Set<String> tables, List<SqlBlockRequest> sqlBlocks) implements TranslationPhase {
        public AwaitingSchemas {
            tables = Collections.unmodifiableSet(new LinkedHashSet<>(tables));
            sqlBlocks = List.copyOf(sqlBlocks);
        }
    }

    /** No more data is needed; the model is complete, possibly with diagnostics. */
    record Done(ModelDef model) implements TranslationPhase {
        public Done {
            Objects.requireNonNull(model, "model must not be null");
        }
    }
}
