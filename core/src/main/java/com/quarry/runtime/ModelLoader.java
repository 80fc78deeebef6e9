package com.quarry.runtime;

import com.quarry.compiler.CompiledQuery;
import com.quarry.compiler.QueryCompiler;
import com.quarry.config.CompilerSettings;
import com.quarry.diagnostic.Diagnostic;
import com.quarry.diagnostic.DiagnosticKind;
import com.quarry.diagnostic.Location;
import com.quarry.model.ModelDef;
import com.quarry.model.QueryRef;
import com.quarry.model.TableSchema;
import com.quarry.translator.SqlBlockRequest;
import com.quarry.translator.TranslateResult;
import com.quarry.translator.TranslationPhase;
import com.quarry.translator.Translator;
import com.quarry.translator.TranslatorState;
import com.quarry.translator.UpdateData;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drives the translate/update loop of a {@link Translator}, fetching what it
 * asks for from a {@link URLReader} and a {@link SchemaProvider}.
 *
 * <p>Fetch failures are handed to the translator as errors, which turns them
 * into diagnostics of the model; loading itself never throws for them.
 */
public class ModelLoader {
    private static final Logger logger = LoggerFactory.getLogger(ModelLoader.class);

    private final Translator translator;
    private final URLReader urlReader;
    private final SchemaProvider schemaProvider;
    private final CompilerSettings settings;

    public ModelLoader(Translator translator, URLReader urlReader, SchemaProvider schemaProvider) {
        this(translator, urlReader, schemaProvider, CompilerSettings.fromSystemProperties());
    }

    public ModelLoader(Translator translator, URLReader urlReader, SchemaProvider schemaProvider,
                       CompilerSettings settings) {
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
        this.urlReader = Objects.requireNonNull(urlReader, "urlReader must not be null");
        this.schemaProvider = Objects.requireNonNull(schemaProvider, "schemaProvider must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Translates a document and everything it depends on.
     *
     * @param url the document URL
     * @return the final result, or a result with an internal-error diagnostic if
     *         translation did not finish within the configured number of rounds
     */
    public TranslateResult load(String url) {
        TranslatorState state = TranslatorState.forUrl(url);
        TranslateResult result = translator.translate(state);
        int rounds = 0;
        while (!result.isFinal()) {
            if (++rounds > settings.maxTranslateRounds()) {
                logger.warn("Translation of {} did not finish after {} rounds", url, settings.maxTranslateRounds());
                List<Diagnostic> diagnostics = new ArrayList<>(result.diagnostics());
                diagnostics.add(new Diagnostic(DiagnosticKind.INTERNAL_ERROR,
                    "Translation did not finish after " + settings.maxTranslateRounds() + " rounds",
                    new Location(url, 1, 1)));
                return new TranslateResult(result.phase(), diagnostics);
            }
            state = translator.update(state, fetch(result));
            result = translator.translate(state);
        }
        return result;
    }

    /**
     * Loads a document and compiles one of its queries with the configured dialect.
     *
     * @param url the document URL
     * @param ref the query
     * @return the compiled query; a failure if the model could not be loaded
     */
    public CompiledQuery compile(String url, QueryRef ref) {
        TranslateResult result = load(url);
        ModelDef model = result.model();
        if (model == null) {
            return CompiledQuery.failure(result.diagnostics().get(result.diagnostics().size() - 1));
        }
        return new QueryCompiler(settings).compileQuery(model, ref);
    }

    private UpdateData fetch(TranslateResult result) {
        UpdateData.Builder data = UpdateData.builder();
        TranslationPhase phase = result.phase();
        if (phase instanceof TranslationPhase.AwaitingImports imports) {
            for (String url : imports.urls()) {
                try {
                    data.url(url, urlReader.readURL(url));
                } catch (IOException e) {
                    logger.debug("Cannot read {}: {}", url, e.getMessage());
                    data.urlError(url, e.getMessage());
                }
            }
        } else if (phase instanceof TranslationPhase.AwaitingSchemas schemas) {
            fetchTables(schemas, data);
            for (SqlBlockRequest block : schemas.sqlBlocks()) {
                try {
                    data.sqlSchema(block.name(), schemaProvider.getSchemaForSqlBlock(block));
                } catch (IOException e) {
                    logger.debug("Cannot describe SQL block {}: {}", block.name(), e.getMessage());
                    data.sqlError(block.name(), e.getMessage());
                }
            }
        }
        return data.build();
    }

    private void fetchTables(TranslationPhase.AwaitingSchemas schemas, UpdateData.Builder data) {
        if (schemas.tables().isEmpty()) {
            return;
        }
        try {
            TableSchemas found = schemaProvider.getSchemaForTables(schemas.tables());
            for (String key : schemas.tables()) {
                TableSchema schema = found.schemas().get(key);
                if (schema != null) {
                    data.table(key, schema);
                } else {
                    data.tableError(key, found.errors().getOrDefault(key, "table not found"));
                }
            }
        } catch (IOException e) {
            logger.debug("Cannot read table schemas {}: {}", schemas.tables(), e.getMessage());
            for (String key : schemas.tables()) {
                data.tableError(key, e.getMessage());
            }
        }
    }
}
