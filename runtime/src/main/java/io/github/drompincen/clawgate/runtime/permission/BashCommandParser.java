package io.github.drompincen.clawgate.runtime.permission;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shell-aware helpers for reasoning about Bash commands before they run. Only
 * splits and strips text; nothing here evaluates or expands the command.
 */
public final class BashCommandParser {

    private static final Pattern ENV_ASSIGNMENT = Pattern.compile("^([a-zA-Z_][a-zA-Z0-9_]*)=");

    private BashCommandParser() {
    }

    /**
     * Splits a compound command on {@code && || |& ; | &} and unquoted newlines into
     * simple commands. Quotes, backslash escapes and parenthesised subshells are
     * respected; a part that is a whole subshell is split recursively.
     */
    public static List<String> split(String command) {
        if (command == null || command.isBlank()) return List.of();

        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;
        boolean escaped = false;
        int parenLevel = 0;
        List<int[]> cuts = new ArrayList<>();

        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            char next = i + 1 < command.length() ? command.charAt(i + 1) : '\0';
            char prev = i > 0 ? command.charAt(i - 1) : '\0';

            if (escaped) {
                escaped = false;
                continue;
            }
            if (c == '\\') {
                escaped = true;
                continue;
            }
            if (c == '\'' && !inDoubleQuote) {
                inSingleQuote = !inSingleQuote;
                continue;
            }
            if (c == '"' && !inSingleQuote) {
                inDoubleQuote = !inDoubleQuote;
                continue;
            }
            if (inSingleQuote || inDoubleQuote) continue;
            if (c == '(') {
                parenLevel++;
                continue;
            }
            if (c == ')') {
                parenLevel--;
                continue;
            }
            if (parenLevel > 0) continue;

            int opLength = operatorLength(c, next, prev);
            if (opLength > 0) {
                cuts.add(new int[]{i, i + opLength});
                i += opLength - 1;
            }
        }

        List<String> parts = new ArrayList<>();
        int last = 0;
        for (int[] cut : cuts) {
            String part = command.substring(last, cut[0]).trim();
            if (!part.isEmpty()) parts.add(part);
            last = cut[1];
        }
        String tail = command.substring(last).trim();
        if (!tail.isEmpty()) parts.add(tail);

        List<String> result = new ArrayList<>();
        for (String part : parts) {
            String stripped = normalize(part);
            if (stripped.length() >= 2 && stripped.startsWith("(") && stripped.endsWith(")")) {
                String inner = stripped.substring(1, stripped.length() - 1).trim();
                if (!inner.isEmpty()) result.addAll(split(inner));
            } else {
                result.add(part);
            }
        }
        return result;
    }

    private static int operatorLength(char c, char next, char prev) {
        // part of a redirection such as 2>&1, &>file or >|file
        if ((c == '&' || c == '|') && (prev == '>' || prev == '<')) return 0;
        if (c == '\n') return 1;
        if (c == '\r' && next == '\n') return 2;
        if (c == '&' && next == '&') return 2;
        if (c == '|' && (next == '|' || next == '&')) return 2;
        if (c == ';' || c == '|') return 1;
        if (c == '&' && next != '>') return 1;
        return 0;
    }

    /** Removes leading inline assignments: {@code FOO=1 BAR="a b" npm test} becomes {@code npm test}. */
    public static String stripEnvVars(String command) {
        String result = command == null ? "" : command.trim();
        while (true) {
            Matcher m = ENV_ASSIGNMENT.matcher(result);
            if (!m.find()) break;

            int valueStart = m.end();
            int valueEnd;
            if (valueStart < result.length() && result.charAt(valueStart) == '\'') {
                int close = result.indexOf('\'', valueStart + 1);
                if (close < 0) break;
                valueEnd = close + 1;
            } else if (valueStart < result.length() && result.charAt(valueStart) == '"') {
                valueEnd = closingDoubleQuote(result, valueStart + 1);
                if (valueEnd < 0) break;
            } else {
                valueEnd = firstWhitespace(result);
                if (valueEnd < 0) return "";
            }
            result = result.substring(valueEnd).trim();
        }
        return result;
    }

    private static int closingDoubleQuote(String s, int from) {
        boolean escaped = false;
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                return i + 1;
            }
        }
        return -1;
    }

    private static int firstWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return i;
        }
        return -1;
    }

    /**
     * Removes redirections and their targets ({@code > out.txt}, {@code 2>&1}, {@code << EOF})
     * and collapses unquoted whitespace to single spaces.
     */
    public static String stripRedirections(String command) {
        if (command == null) return "";
        StringBuilder result = new StringBuilder();
        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;
        boolean escaped = false;

        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);

            if (escaped) {
                result.append(c);
                escaped = false;
                continue;
            }
            if (c == '\\') {
                result.append(c);
                escaped = true;
                continue;
            }
            if (c == '\'' && !inDoubleQuote) {
                inSingleQuote = !inSingleQuote;
                result.append(c);
                continue;
            }
            if (c == '"' && !inSingleQuote) {
                inDoubleQuote = !inDoubleQuote;
                result.append(c);
                continue;
            }
            if (inSingleQuote || inDoubleQuote) {
                result.append(c);
                continue;
            }
            if (Character.isWhitespace(c)) {
                if (result.length() > 0 && !Character.isWhitespace(result.charAt(result.length() - 1))) {
                    result.append(' ');
                }
                continue;
            }
            if (c == '>' || c == '<') {
                // fd prefix such as 2> or &>
                int len = result.length();
                if (len > 0 && isFdPrefix(result.charAt(len - 1))
                        && (len == 1 || Character.isWhitespace(result.charAt(len - 2)))) {
                    result.setLength(len - 1);
                }
                int end = i + 1;
                if (end < command.length() && command.charAt(end) == c) {
                    end++;
                    if (c == '<' && end < command.length() && command.charAt(end) == '-') end++;
                } else if (end < command.length()
                        && (command.charAt(end) == '&' || (c == '>' && command.charAt(end) == '|'))) {
                    end++;
                }
                while (end < command.length() && Character.isWhitespace(command.charAt(end))) end++;
                end = skipWord(command, end);
                i = end - 1;
                if (result.length() > 0 && !Character.isWhitespace(result.charAt(result.length() - 1))) {
                    result.append(' ');
                }
                continue;
            }
            result.append(c);
        }
        return result.toString().trim();
    }

    private static boolean isFdPrefix(char c) {
        return Character.isDigit(c) || c == '&';
    }

    private static int skipWord(String s, int from) {
        boolean escaped = false;
        boolean inSingle = false;
        boolean inDouble = false;
        int end = from;
        while (end < s.length()) {
            char c = s.charAt(end);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (!inSingle && !inDouble && Character.isWhitespace(c)) {
                break;
            }
            end++;
        }
        return end;
    }

    /** A simple command with env assignments and redirections removed. */
    public static String normalize(String simpleCommand) {
        return stripRedirections(stripEnvVars(simpleCommand));
    }

    /**
     * Whitespace tokenization that keeps quoted text together and drops the quote
     * characters: {@code ls "my dir" -la} gives {@code [ls, my dir, -la]}.
     */
    public static List<String> tokenize(String command) {
        List<String> tokens = new ArrayList<>();
        if (command == null) return tokens;
        StringBuilder current = new StringBuilder();
        boolean inSingle = false;
        boolean inDouble = false;
        boolean inToken = false;
        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
                inToken = true;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
                inToken = true;
            } else if (Character.isWhitespace(c) && !inSingle && !inDouble) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (inToken) tokens.add(current.toString());
        return tokens;
    }

    /**
     * True when the command contains {@code $(...)}, backtick or process substitution
     * ({@code <(...)} and {@code >(...)}).
     */
    public static boolean hasCommandSubstitution(String command) {
        return command != null
                && (command.contains("$(") || command.indexOf('`') >= 0
                        || command.contains("<(") || command.contains(">("));
    }
}
