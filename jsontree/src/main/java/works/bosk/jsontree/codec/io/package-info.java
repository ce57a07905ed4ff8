/**
 * Character-at-a-time access to JSON text.
 * The main abstraction is {@link works.bosk.jsontree.codec.io.CharCursor},
 * which offers one character of lookahead and keeps track of the line and column
 * of that character for error reporting.
 * It knows nothing about JSON syntax;
 * use {@link works.bosk.jsontree.codec.Parser} for that.
 */
package works.bosk.jsontree.codec.io;
