package com.quarry.test;

import com.quarry.compiler.CompiledQuery;
import com.quarry.compiler.QueryCompiler;
import com.quarry.config.CompilerSettings;
import com.quarry.dialect.Dialects;
import com.quarry.model.ModelDef;
import com.quarry.model.QueryRef;
import com.quarry.runtime.JdbcSchemaProvider;
import com.quarry.runtime.ModelLoader;
import com.quarry.translator.TranslateResult;
import com.quarry.translator.Translator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Base class for tests that load models against, and run compiled SQL on, an
 * in-memory DuckDB database.
 *
 * <p>Rows are returned with integral numbers as {@code Long}, other numbers as
 * {@code Double} and dates as their ISO text, so that expectations do not
 * depend on the exact JDBC types DuckDB reports.
 */
public abstract class DuckDBTestBase extends TestBase {

    protected Connection connection;
    protected FixtureParser parser;

    @BeforeEach
    void openDatabase() throws SQLException {
        connection = DriverManager.getConnection("jdbc:duckdb:");
        parser = new FixtureParser();
    }

    @AfterEach
    void closeDatabase() throws SQLException {
        if (connection != null) {
            connection.close();
        }
    }

    /**
     * Creates the airports, flights and carriers tables.
     *
     * <pre>
     *   airports: SFO, LAX, SAN in CA; SEA in WA; JFK, LGA in NY (both New York)
     *   flights:  SFO x3, LAX x1, SEA x1, JFK x2; none from SAN or LGA
     *   carriers: AA American, UA United, AS Alaska
     * </pre>
     */
    protected void createAviationTables() throws SQLException {
        execute(
            "CREATE TABLE airports (code VARCHAR, state VARCHAR, city VARCHAR, elevation INTEGER)",
            "INSERT INTO airports VALUES ('SFO', 'CA', 'San Francisco', 13), ('LAX', 'CA', 'Los Angeles', 125),"
                + " ('SAN', 'CA', 'San Diego', 17), ('SEA', 'WA', 'Seattle', 433),"
                + " ('JFK', 'NY', 'New York', 13), ('LGA', 'NY', 'New York', 21)",
            "CREATE TABLE flights (id INTEGER, origin VARCHAR, carrier VARCHAR, distance INTEGER, dep_date DATE)",
            "INSERT INTO flights VALUES (1, 'SFO', 'AA', 300, DATE '2023-01-05'),"
                + " (2, 'SFO', 'UA', 400, DATE '2023-01-20'), (3, 'LAX', 'AA', 2500, DATE '2023-02-03'),"
                + " (4, 'SEA', 'AS', 700, DATE '2023-02-14'), (5, 'JFK', 'AA', 2500, DATE '2023-03-01'),"
                + " (6, 'JFK', 'UA', 1000, DATE '2023-03-15'), (7, 'SFO', 'AA', 300, DATE '2024-01-02')",
            "CREATE TABLE carriers (code VARCHAR, name VARCHAR)",
            "INSERT INTO carriers VALUES ('AA', 'American'), ('UA', 'United'), ('AS', 'Alaska')");
    }

    protected void execute(String... statements) throws SQLException {
        try (java.sql.Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
        }
    }

    protected List<List<Object>> rows(String sql) throws SQLException {
        List<List<Object>> rows = new ArrayList<>();
        try (java.sql.Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(sql)) {
            int columns = rs.getMetaData().getColumnCount();
            while (rs.next()) {
                List<Object> row = new ArrayList<>();
                for (int i = 1; i <= columns; i++) {
                    row.add(normalize(rs.getObject(i)));
                }
                rows.add(row);
            }
        }
        logData("Rows", rows);
        return rows;
    }

    protected static List<Object> row(Object... values) {
        return Arrays.asList(values);
    }

    private static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isFinite(d) && new BigDecimal(number.toString()).stripTrailingZeros().scale() <= 0) {
                return number.longValue();
            }
            return d;
        }
        return value.toString();
    }

    // ==================== Models ====================

    protected ModelLoader loader() {
        return new ModelLoader(new Translator(parser), parser.reader(), new JdbcSchemaProvider(connection),
            CompilerSettings.defaults());
    }

    /**
     * Loads a one-document model whose tables live in the test database.
     */
    protected ModelDef loadModel(com.quarry.ast.Statement... statements) {
        parser.document(Ast.URL, statements);
        TranslateResult result = loader().load(Ast.URL);
        assertThat(result.isFinal()).isTrue();
        logData("Diagnostics", result.diagnostics());
        return result.model();
    }

    protected CompiledQuery compile(ModelDef model, QueryRef ref) {
        CompiledQuery compiled = new QueryCompiler().compileQuery(model, ref, Dialects.get("duckdb"));
        logData("SQL", compiled.sql());
        return compiled;
    }

    /**
     * Compiles a named query, checks that compilation succeeded and runs the SQL.
     */
    protected List<List<Object>> run(ModelDef model, String queryName) throws SQLException {
        CompiledQuery compiled = compile(model, QueryRef.named(queryName));
        assertThat(compiled.isSuccess()).as("compiling %s: %s", queryName, compiled.diagnostics()).isTrue();
        return rows(compiled.sql());
    }
}
