package com.raditha.typebench.extraction;

import java.util.ArrayList;
import java.util.List;

/**
 * Bracket- and string-aware scanning of a single logical Python line.
 * "Top level" means outside any string literal and outside (), [] and {}.
 */
final class TopLevelSplitter {

    private TopLevelSplitter() {
    }

    /**
     * Split on a delimiter that appears at top level.
     */
    static List<String> split(String text, char delimiter) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipString(text, i);
            } else if (isOpen(c)) {
                depth++;
            } else if (isClose(c)) {
                depth--;
            } else if (c == delimiter && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    /**
     * First top-level occurrence of {@code target} at or after {@code from}, or -1.
     */
    static int indexOf(String text, char target, int from) {
        int depth = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipString(text, i);
            } else if (c == target && depth == 0) {
                return i;
            } else if (isOpen(c)) {
                depth++;
            } else if (isClose(c)) {
                depth--;
            }
        }
        return -1;
    }

    /**
     * First top-level plain assignment {@code =}, skipping {@code ==}, {@code !=},
     * {@code <=}, {@code >=}, {@code :=} and augmented assignments. Returns -1 if none.
     */
    static int indexOfAssignment(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipString(text, i);
            } else if (isOpen(c)) {
                depth++;
            } else if (isClose(c)) {
                depth--;
            } else if (c == '=' && depth == 0) {
                char before = i > 0 ? text.charAt(i - 1) : ' ';
                char after = i + 1 < text.length() ? text.charAt(i + 1) : ' ';
                if (after == '=') {
                    i++;
                } else if ("=!<>:+-*/%&|^@".indexOf(before) < 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Index of the bracket closing the one at {@code openIndex}, or -1 if unbalanced.
     */
    static int matchingClose(String text, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipString(text, i);
            } else if (isOpen(c)) {
                depth++;
            } else if (isClose(c)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Index of the closing quote of the string starting at {@code start}
     * (single or triple quoted). An unterminated single-quoted string ends before
     * the line break; an unterminated triple-quoted one runs to the end of the text.
     */
    static int skipString(String text, int start) {
        char quote = text.charAt(start);
        boolean triple = text.startsWith(String.valueOf(quote).repeat(3), start);
        int i = start + (triple ? 3 : 1);
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '\n' && !triple) {
                return i - 1;
            }
            if (c == quote) {
                if (!triple) {
                    return i;
                }
                if (text.startsWith(String.valueOf(quote).repeat(3), i)) {
                    return i + 2;
                }
            }
            i++;
        }
        return text.length() - 1;
    }

    private static boolean isOpen(char c) {
        return c == '(' || c == '[' || c == '{';
    }

    private static boolean isClose(char c) {
        return c == ')' || c == ']' || c == '}';
    }
}
