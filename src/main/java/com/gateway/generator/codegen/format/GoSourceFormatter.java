package com.gateway.generator.codegen.format;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import com.gateway.generator.codegen.exception.GenerationException;

/**
 * Lexical checker and whitespace normalizer for generated Go files.
 *
 * Checks that the file opens with a package clause, that brackets balance
 * outside of literals and comments, and that every literal and block comment
 * is terminated. Normalization converts line endings to LF, strips trailing
 * whitespace, collapses runs of blank lines and ends the file with exactly
 * one newline. Lines inside raw string literals are left untouched.
 */
public class GoSourceFormatter implements SourceFormatter {

    private enum State { CODE, LINE_COMMENT, BLOCK_COMMENT, STRING, RAW_STRING, RUNE }

    @Override
    public String format(String raw) {
        String source = raw.replace("\r\n", "\n").replace('\r', '\n');
        Set<Integer> rawStringLines = check(raw, source);
        return normalize(source, rawStringLines);
    }

    /**
     * @return indices of lines whose terminating newline lies inside a raw string
     */
    private Set<Integer> check(String raw, String source) {
        Set<Integer> rawStringLines = new HashSet<>();
        Deque<Character> brackets = new ArrayDeque<>();
        Deque<Integer> bracketLines = new ArrayDeque<>();
        State state = State.CODE;
        boolean packageSeen = false;
        int line = 1;
        int literalStart = 0;

        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            char next = i + 1 < source.length() ? source.charAt(i + 1) : '\0';
            if (c == '\n') {
                if (state == State.RAW_STRING) {
                    rawStringLines.add(line - 1);
                } else if (state == State.STRING || state == State.RUNE) {
                    throw invalid(raw, literalStart, "newline in literal");
                } else if (state == State.LINE_COMMENT) {
                    state = State.CODE;
                }
                line++;
                continue;
            }
            switch (state) {
                case LINE_COMMENT -> { }
                case BLOCK_COMMENT -> {
                    if (c == '*' && next == '/') {
                        state = State.CODE;
                        i++;
                    }
                }
                case STRING, RUNE -> {
                    char quote = state == State.STRING ? '"' : '\'';
                    if (c == '\\' && next != '\n') {
                        i++;
                    } else if (c == quote) {
                        state = State.CODE;
                    }
                }
                case RAW_STRING -> {
                    if (c == '`') {
                        state = State.CODE;
                    }
                }
                case CODE -> {
                    if (c == '/' && next == '/') {
                        state = State.LINE_COMMENT;
                        i++;
                    } else if (c == '/' && next == '*') {
                        state = State.BLOCK_COMMENT;
                        literalStart = line;
                        i++;
                    } else if (c == '"' || c == '`' || c == '\'') {
                        if (!packageSeen) {
                            throw invalid(raw, line, "expected 'package' clause");
                        }
                        state = c == '"' ? State.STRING : c == '`' ? State.RAW_STRING : State.RUNE;
                        literalStart = line;
                    } else if (!packageSeen && !Character.isWhitespace(c)) {
                        if (!source.startsWith("package", i) || i + 7 >= source.length()
                                || !Character.isWhitespace(source.charAt(i + 7))) {
                            throw invalid(raw, line, "expected 'package' clause");
                        }
                        int end = packageNameEnd(source, i + 7);
                        if (end < 0) {
                            throw invalid(raw, line, "expected package name");
                        }
                        packageSeen = true;
                        i = end - 1;
                    } else if (c == '(' || c == '[' || c == '{') {
                        brackets.push(c);
                        bracketLines.push(line);
                    } else if (c == ')' || c == ']' || c == '}') {
                        if (brackets.isEmpty()) {
                            throw invalid(raw, line, "unexpected '" + c + "'");
                        }
                        char open = brackets.pop();
                        bracketLines.pop();
                        if (closerOf(open) != c) {
                            throw invalid(raw, line, "expected '" + closerOf(open) + "', found '" + c + "'");
                        }
                    }
                }
                default -> throw new IllegalStateException("unhandled state " + state);
            }
        }

        switch (state) {
            case BLOCK_COMMENT -> throw invalid(raw, literalStart, "comment not terminated");
            case STRING, RUNE, RAW_STRING -> throw invalid(raw, literalStart, "literal not terminated");
            default -> { }
        }
        if (!packageSeen) {
            throw invalid(raw, line, "expected 'package' clause");
        }
        if (!brackets.isEmpty()) {
            throw invalid(raw, bracketLines.peek(), "unclosed '" + brackets.peek() + "'");
        }
        return rawStringLines;
    }

    private static String normalize(String source, Set<Integer> rawStringLines) {
        String[] lines = source.split("\n", -1);
        StringBuilder out = new StringBuilder(source.length());
        boolean previousBlank = true;
        for (int i = 0; i < lines.length; i++) {
            String text = lines[i];
            if (rawStringLines.contains(i)) {
                out.append(text).append('\n');
                previousBlank = false;
                continue;
            }
            String trimmed = stripTrailing(text);
            if (trimmed.isEmpty()) {
                if (!previousBlank) {
                    out.append('\n');
                }
                previousBlank = true;
                continue;
            }
            out.append(trimmed).append('\n');
            previousBlank = false;
        }
        while (out.length() > 1 && out.charAt(out.length() - 1) == '\n' && out.charAt(out.length() - 2) == '\n') {
            out.setLength(out.length() - 1);
        }
        return out.toString();
    }

    private static String stripTrailing(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\t')) {
            end--;
        }
        return text.substring(0, end);
    }

    /**
     * @return index just past the identifier following {@code from} on the same line, or -1 if there is none
     */
    private static int packageNameEnd(String source, int from) {
        int i = from;
        while (i < source.length() && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
            i++;
        }
        if (i >= source.length() || !isIdentifierStart(source.charAt(i))) {
            return -1;
        }
        while (i < source.length() && (isIdentifierStart(source.charAt(i)) || Character.isDigit(source.charAt(i)))) {
            i++;
        }
        return i;
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static char closerOf(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
    }

    private static GenerationException invalid(String raw, int line, String detail) {
        return new GenerationException(GenerationException.Reason.INVALID_SYNTAX,
                String.format("%d: %s: %s", line, detail, raw));
    }
}
