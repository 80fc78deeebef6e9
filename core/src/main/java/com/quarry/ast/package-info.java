/**
 * Parse tree consumed by the translator.
 *
 * <p>The parser for the modeling language is an external collaborator. It hands the
 * translator one {@link com.quarry.ast.Statement} list per document, built from the
 * tagged unions in this package: one record variant per grammar alternative. Every
 * node carries the {@link com.quarry.diagnostic.Location} it was parsed from, so
 * that diagnostics can point back into the document.
 */
package com.quarry.ast;
