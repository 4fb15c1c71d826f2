package com.raditha.typebench.extraction;

/**
 * One Python statement line after joining continuations and removing comments.
 *
 * @param lineNumber 1-based physical line where the statement starts
 * @param indent     indentation width of that physical line (tabs expand to 8)
 * @param text       statement text without leading indentation
 */
record LogicalLine(int lineNumber, int indent, String text) {
}
