package com.raditha.typebench.extraction;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Python source into logical lines.
 * <p>
 * Physical lines are joined while a bracket is open or after a backslash
 * continuation. Comments are dropped. String literals, including triple-quoted
 * docstrings spanning several lines, are kept verbatim but never scanned for
 * comments, brackets or line ends. Blank and comment-only lines produce nothing.
 */
public class PythonSourceReader {

    private static final int TAB_WIDTH = 8;

    /**
     * Read the logical lines of a source file.
     */
    List<LogicalLine> read(String source) {
        List<LogicalLine> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        int physicalLine = 1;
        int startLine = 1;
        int indent = 0;
        boolean atLineStart = true;

        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (atLineStart) {
                int width = 0;
                int j = i;
                while (j < source.length() && (source.charAt(j) == ' ' || source.charAt(j) == '\t'
                        || source.charAt(j) == '\f')) {
                    width = source.charAt(j) == '\t' ? (width / TAB_WIDTH + 1) * TAB_WIDTH : width + 1;
                    j++;
                }
                indent = width;
                startLine = physicalLine;
                atLineStart = false;
                i = j;
                continue;
            }
            if (c == '#') {
                while (i < source.length() && source.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '\'' || c == '"') {
                int end = TopLevelSplitter.skipString(source, i);
                String literal = source.substring(i, end + 1);
                physicalLine += countNewlines(literal);
                current.append(literal.replace("\r", "").replace('\n', ' '));
                i = end + 1;
            } else if (c == '\\' && i + 1 < source.length() && isLineEnd(source, i + 1)) {
                i = skipLineEnd(source, i + 1);
                physicalLine++;
                current.append(' ');
            } else if (c == '\n' || c == '\r') {
                i = skipLineEnd(source, i);
                physicalLine++;
                if (depth > 0) {
                    current.append(' ');
                } else {
                    emit(lines, current, startLine, indent);
                    atLineStart = true;
                }
            } else {
                if (c == '(' || c == '[' || c == '{') {
                    depth++;
                } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                    depth--;
                }
                current.append(c);
                i++;
            }
        }
        emit(lines, current, startLine, indent);
        return lines;
    }

    private static void emit(List<LogicalLine> lines, StringBuilder current, int startLine, int indent) {
        String text = current.toString().strip();
        if (!text.isEmpty()) {
            lines.add(new LogicalLine(startLine, indent, text));
        }
        current.setLength(0);
    }

    private static boolean isLineEnd(String source, int i) {
        char c = source.charAt(i);
        return c == '\n' || c == '\r';
    }

    private static int skipLineEnd(String source, int i) {
        if (source.charAt(i) == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') {
            return i + 2;
        }
        return i + 1;
    }

    private static int countNewlines(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
