package com.formshift.core.parsing;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical helpers for C-family source text. Aware of string and character literals
 * (regular and verbatim) so that delimiters inside them are never treated as code.
 */
final class SourceText {

    private SourceText() {}

    /** Removes line and block comments, keeping newlines so line numbers stay valid. */
    static String stripComments(String source) {
        StringBuilder out = new StringBuilder(source.length());
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            if (c == '"' || c == '\'') {
                int end = literalEnd(source, i);
                out.append(source, i, end);
                i = end;
            } else if (c == '/' && i + 1 < n && source.charAt(i + 1) == '/') {
                while (i < n && source.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '/' && i + 1 < n && source.charAt(i + 1) == '*') {
                i += 2;
                while (i < n && !(source.charAt(i) == '*' && i + 1 < n && source.charAt(i + 1) == '/')) {
                    if (source.charAt(i) == '\n') {
                        out.append('\n');
                    }
                    i++;
                }
                i = Math.min(n, i + 2);
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Text between the brace at {@code openBrace} and its matching close brace,
     * or {@code null} if it is never closed.
     */
    static String blockBody(String code, int openBrace) {
        int depth = 0;
        int i = openBrace;
        while (i < code.length()) {
            char c = code.charAt(i);
            if (c == '"' || c == '\'') {
                i = literalEnd(code, i);
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return code.substring(openBrace + 1, i);
                }
            }
            i++;
        }
        return null;
    }

    /** Splits a block into trimmed statements on top-level semicolons. */
    static List<String> statements(String body) {
        List<String> result = new ArrayList<>();
        int depth = 0;
        int start = 0;
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '"' || c == '\'') {
                i = literalEnd(body, i);
                continue;
            }
            if (c == '(' || c == '{' || c == '[') {
                depth++;
            } else if (c == ')' || c == '}' || c == ']') {
                depth--;
            } else if (c == ';' && depth == 0) {
                addTrimmed(result, body.substring(start, i));
                start = i + 1;
            }
            i++;
        }
        addTrimmed(result, body.substring(start));
        return result;
    }

    /** Splits an argument list on top-level commas. */
    static List<String> splitArguments(String args) {
        List<String> result = new ArrayList<>();
        int depth = 0;
        int start = 0;
        int i = 0;
        while (i < args.length()) {
            char c = args.charAt(i);
            if (c == '"' || c == '\'') {
                i = literalEnd(args, i);
                continue;
            }
            if (c == '(' || c == '{' || c == '[') {
                depth++;
            } else if (c == ')' || c == '}' || c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                addTrimmed(result, args.substring(start, i));
                start = i + 1;
            }
            i++;
        }
        addTrimmed(result, args.substring(start));
        return result;
    }

    /**
     * Index of the first top-level occurrence of an assignment operator, or -1.
     * For {@code "="} the comparison operators {@code ==}, {@code !=}, {@code <=}, {@code >=}
     * and compound assignments are skipped.
     */
    static int topLevelOperator(String statement, String op) {
        int depth = 0;
        int i = 0;
        while (i < statement.length()) {
            char c = statement.charAt(i);
            if (c == '"' || c == '\'') {
                i = literalEnd(statement, i);
                continue;
            }
            if (c == '(' || c == '{' || c == '[') {
                depth++;
            } else if (c == ')' || c == '}' || c == ']') {
                depth--;
            } else if (depth == 0 && statement.startsWith(op, i)) {
                if (!"=".equals(op) || isPlainAssignment(statement, i)) {
                    return i;
                }
                i++;
            }
            i++;
        }
        return -1;
    }

    static int lineOf(String code, int index) {
        int line = 1;
        for (int i = 0; i < index && i < code.length(); i++) {
            if (code.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static boolean isPlainAssignment(String s, int i) {
        char before = i > 0 ? s.charAt(i - 1) : ' ';
        char after = i + 1 < s.length() ? s.charAt(i + 1) : ' ';
        return after != '=' && "=!<>+-*/%&|^?".indexOf(before) < 0;
    }

    /** Index just past the literal starting at {@code start}. */
    private static int literalEnd(String s, int start) {
        char quote = s.charAt(start);
        boolean verbatim = quote == '"' && start > 0 && s.charAt(start - 1) == '@';
        int i = start + 1;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (verbatim) {
                if (c == '"') {
                    if (i + 1 < s.length() && s.charAt(i + 1) == '"') {
                        i += 2;
                        continue;
                    }
                    return i + 1;
                }
            } else if (c == '\\') {
                i += 2;
                continue;
            } else if (c == quote || c == '\n') {
                return i + 1;
            }
            i++;
        }
        return s.length();
    }

    private static void addTrimmed(List<String> target, String text) {
        String t = text.trim();
        if (!t.isEmpty()) {
            target.add(t);
        }
    }
}
