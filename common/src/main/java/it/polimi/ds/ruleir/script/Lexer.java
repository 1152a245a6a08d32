package it.polimi.ds.ruleir.script;

import it.polimi.ds.ruleir.tree.Span;
import org.jetbrains.annotations.Unmodifiable;
import org.jspecify.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits predicate-language text into tokens, producing {@code INDENT}/{@code DEDENT} tokens for block structure.
 * <p>
 * Newlines inside brackets and after a backslash continuation do not end the logical line. Comments are skipped.
 */
public final class Lexer {

    private static final int TAB_SIZE = 8;

    private static final Set<String> THREE_CHAR_OPERATORS = Set.of("**=", "//=", ">>=", "<<=", "...");
    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
            "**", "//", "<<", ">>", "<=", ">=", "==", "!=", "->", ":=",
            "+=", "-=", "*=", "/=", "%=", "@=", "&=", "|=", "^=");
    private static final String ONE_CHAR_OPERATORS = "+-*/%@&|^~<>()[]{},:.;=";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();

    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int bracketDepth = 0;
    private boolean atLineStart = true;

    private Lexer(String source) {
        this.source = source;
        this.indents.push(0);
    }

    public static @Unmodifiable List<Token> tokenize(String source) throws ScriptSyntaxException {
        return new Lexer(source).tokenize();
    }

    /**
     * Removes every {@code #} comment from the given text, leaving string literals untouched, and trims the result.
     * Text which is not valid is handled on a best-effort basis: an unterminated string keeps the rest of the text.
     *
     * @param source text to strip
     * @return the text without comments
     */
    public static String stripComments(String source) {
        final StringBuilder sb = new StringBuilder(source.length());
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '#') {
                while (i < source.length() && source.charAt(i) != '\n' && source.charAt(i) != '\r')
                    i++;
                // Drop the whitespace that was separating the comment from the code
                int end = sb.length();
                while (end > 0 && (sb.charAt(end - 1) == ' ' || sb.charAt(end - 1) == '\t'))
                    end--;
                sb.setLength(end);
                continue;
            }

            if (c == '\'' || c == '"') {
                int end = skipString(source, i);
                sb.append(source, i, end);
                i = end;
                continue;
            }

            sb.append(c);
            i++;
        }
        return sb.toString().strip();
    }

    private static int skipString(String source, int start) {
        final char quote = source.charAt(start);
        final boolean triple = source.startsWith(String.valueOf(quote).repeat(3), start);
        int i = start + (triple ? 3 : 1);
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }

            if (c == quote) {
                if (!triple)
                    return i + 1;
                if (source.startsWith(String.valueOf(quote).repeat(3), i))
                    return i + 3;
            } else if (!triple && (c == '\n' || c == '\r')) {
                return i;
            }
            i++;
        }
        return source.length();
    }

    private @Unmodifiable List<Token> tokenize() throws ScriptSyntaxException {
        while (current < source.length()) {
            if (atLineStart && bracketDepth == 0) {
                readIndentation();
                continue;
            }

            scanToken();
        }

        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE)
            addToken(TokenType.NEWLINE, "", current, current);
        while (indents.peek() > 0) {
            indents.pop();
            addToken(TokenType.DEDENT, "", current, current);
        }
        addToken(TokenType.END, "", current, current);
        return List.copyOf(tokens);
    }

    private void readIndentation() throws ScriptSyntaxException {
        int start = current;
        int width = 0;
        while (current < source.length()) {
            char c = source.charAt(current);
            if (c == ' ')
                width++;
            else if (c == '\t')
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            else if (c != '\f')
                break;
            current++;
        }

        if (current >= source.length())
            return;

        char c = source.charAt(current);
        if (c == '#') {
            skipComment();
            return;
        }
        if (c == '\n' || c == '\r') {
            // Blank line, no logical line to start
            consumeNewline();
            return;
        }
        if (c == '\\' && isNewlineAt(current + 1)) {
            current++;
            consumeNewline();
            atLineStart = false;
            return;
        }

        atLineStart = false;
        int indent = indents.peek();
        if (width > indent) {
            indents.push(width);
            addToken(TokenType.INDENT, "", start, current);
        } else if (width < indent) {
            while (width < indents.peek()) {
                indents.pop();
                addToken(TokenType.DEDENT, "", current, current);
            }
            if (width != indents.peek())
                throw error("Unindent does not match any outer indentation level", current);
        }
    }

    private void scanToken() throws ScriptSyntaxException {
        final int start = current;
        final char c = source.charAt(current);

        if (c == ' ' || c == '\t' || c == '\f') {
            current++;
            return;
        }

        if (c == '#') {
            skipComment();
            return;
        }

        if (c == '\\') {
            if (!isNewlineAt(current + 1))
                throw error("Unexpected character after line continuation", current);
            current++;
            consumeNewline();
            return;
        }

        if (c == '\n' || c == '\r') {
            if (bracketDepth > 0) {
                consumeNewline();
                return;
            }
            consumeNewline();
            addToken(TokenType.NEWLINE, "\n", start, start + 1);
            atLineStart = true;
            return;
        }

        if (Character.isJavaIdentifierStart(c) && c != '$') {
            identifierOrString();
            return;
        }

        if (isDigit(c) || (c == '.' && current + 1 < source.length() && isDigit(source.charAt(current + 1)))) {
            number();
            return;
        }

        if (c == '\'' || c == '"') {
            string(start, "");
            return;
        }

        operator();
    }

    private void identifierOrString() throws ScriptSyntaxException {
        final int start = current;
        while (current < source.length()
                && Character.isJavaIdentifierPart(source.charAt(current))
                && source.charAt(current) != '$')
            current++;

        final String text = source.substring(start, current);
        if (current < source.length() && (source.charAt(current) == '\'' || source.charAt(current) == '"')) {
            final String prefix = text.toLowerCase(Locale.ROOT);
            if (Set.of("r", "u", "b", "f", "br", "rb", "fr", "rf").contains(prefix)) {
                string(start, prefix);
                return;
            }
        }

        addToken(TokenType.NAME, text, start, current);
    }

    private void number() throws ScriptSyntaxException {
        final int start = current;
        final char first = source.charAt(current);
        if (first == '0' && current + 1 < source.length() && "xXoObB".indexOf(source.charAt(current + 1)) >= 0) {
            final int radix = switch (Character.toLowerCase(source.charAt(current + 1))) {
                case 'x' -> 16;
                case 'o' -> 8;
                default -> 2;
            };
            current += 2;
            while (current < source.length()
                    && (Character.isLetterOrDigit(source.charAt(current)) || source.charAt(current) == '_'))
                current++;

            final String digits = source.substring(start + 2, current).replace("_", "");
            try {
                addValueToken(TokenType.NUMBER, narrow(new BigInteger(digits, radix)), start, current);
            } catch (NumberFormatException ex) {
                throw error("Invalid number literal " + source.substring(start, current), start);
            }
            return;
        }

        boolean isFloat = false;
        readDigits();
        if (current < source.length() && source.charAt(current) == '.') {
            isFloat = true;
            current++;
            readDigits();
        }
        if (current < source.length() && (source.charAt(current) == 'e' || source.charAt(current) == 'E')) {
            isFloat = true;
            current++;
            if (current < source.length() && (source.charAt(current) == '+' || source.charAt(current) == '-'))
                current++;
            readDigits();
        }
        if (current < source.length() && (source.charAt(current) == 'j' || source.charAt(current) == 'J'))
            throw error("Complex number literals are not supported", start);
        if (current < source.length() && Character.isJavaIdentifierStart(source.charAt(current)))
            throw error("Invalid number literal " + source.substring(start, current + 1), start);

        final String text = source.substring(start, current).replace("_", "");
        try {
            addValueToken(TokenType.NUMBER, isFloat ? Double.valueOf(text) : narrow(new BigInteger(text)), start, current);
        } catch (NumberFormatException ex) {
            throw error("Invalid number literal " + source.substring(start, current), start);
        }
    }

    private void readDigits() {
        while (current < source.length() && (isDigit(source.charAt(current)) || source.charAt(current) == '_'))
            current++;
    }

    static Number narrow(BigInteger value) {
        if (value.bitLength() < Integer.SIZE)
            return value.intValue();
        if (value.bitLength() < Long.SIZE)
            return value.longValue();
        return value;
    }

    private void string(int start, String prefix) throws ScriptSyntaxException {
        if (prefix.contains("f"))
            throw error("f-strings are not supported", start);
        final boolean raw = prefix.contains("r");

        final char quote = source.charAt(current);
        final String tripleQuote = String.valueOf(quote).repeat(3);
        final boolean triple = source.startsWith(tripleQuote, current);
        current += triple ? 3 : 1;

        final StringBuilder value = new StringBuilder();
        while (true) {
            if (current >= source.length())
                throw error("Unterminated string literal", start);

            char c = source.charAt(current);
            if (c == quote && (!triple || source.startsWith(tripleQuote, current))) {
                current += triple ? 3 : 1;
                break;
            }

            if (c == '\n' || c == '\r') {
                if (!triple)
                    throw error("Unterminated string literal", start);
                int newlineStart = current;
                consumeNewline();
                value.append(source, newlineStart, current);
                continue;
            }

            if (c == '\\') {
                if (current + 1 >= source.length())
                    throw error("Unterminated string literal", start);
                if (raw) {
                    // Raw strings keep the backslash, but it still prevents the quote from terminating
                    value.append(c).append(source.charAt(current + 1));
                    if (isNewlineAt(current + 1)) {
                        current++;
                        consumeNewline();
                    } else {
                        current += 2;
                    }
                    continue;
                }
                escape(value);
                continue;
            }

            value.append(c);
            current++;
        }

        addValueToken(TokenType.STRING, value.toString(), start, current);
    }

    private void escape(StringBuilder value) throws ScriptSyntaxException {
        final int start = current;
        final char c = source.charAt(current + 1);
        current += 2;
        switch (c) {
            case '\n', '\r' -> {
                current--;
                consumeNewline();
            }
            case '\\', '\'', '"' -> value.append(c);
            case 'n' -> value.append('\n');
            case 't' -> value.append('\t');
            case 'r' -> value.append('\r');
            case 'a' -> value.append('\u0007');
            case 'b' -> value.append('\b');
            case 'f' -> value.append('\f');
            case 'v' -> value.append('\u000B');
            case 'x' -> value.appendCodePoint(readHex(2, start));
            case 'u' -> value.appendCodePoint(readHex(4, start));
            case 'U' -> value.appendCodePoint(readHex(8, start));
            default -> {
                if (c >= '0' && c <= '7') {
                    int codePoint = c - '0';
                    for (int i = 0; i < 2 && current < source.length()
                            && source.charAt(current) >= '0' && source.charAt(current) <= '7'; i++)
                        codePoint = codePoint * 8 + (source.charAt(current++) - '0');
                    value.appendCodePoint(codePoint);
                } else {
                    // Unknown escapes are kept as they are
                    value.append('\\').append(c);
                }
            }
        }
    }

    private int readHex(int digits, int escapeStart) throws ScriptSyntaxException {
        if (current + digits > source.length())
            throw error("Truncated escape sequence", escapeStart);
        try {
            int codePoint = Integer.parseInt(source.substring(current, current + digits), 16);
            current += digits;
            if (!Character.isValidCodePoint(codePoint))
                throw error("Invalid escape sequence", escapeStart);
            return codePoint;
        } catch (NumberFormatException ex) {
            throw error("Invalid escape sequence", escapeStart);
        }
    }

    private void operator() throws ScriptSyntaxException {
        final int start = current;
        String op = null;
        if (current + 3 <= source.length() && THREE_CHAR_OPERATORS.contains(source.substring(current, current + 3)))
            op = source.substring(current, current + 3);
        else if (current + 2 <= source.length() && TWO_CHAR_OPERATORS.contains(source.substring(current, current + 2)))
            op = source.substring(current, current + 2);
        else if (ONE_CHAR_OPERATORS.indexOf(source.charAt(current)) >= 0)
            op = String.valueOf(source.charAt(current));

        if (op == null)
            throw error("Unexpected character '" + source.charAt(current) + "'", current);

        current += op.length();
        switch (op) {
            case "(", "[", "{" -> bracketDepth++;
            case ")", "]", "}" -> {
                if (bracketDepth == 0)
                    throw error("Unmatched '" + op + "'", start);
                bracketDepth--;
            }
            default -> {
            }
        }
        addToken(TokenType.OPERATOR, op, start, current);
    }

    private void skipComment() {
        while (current < source.length() && source.charAt(current) != '\n' && source.charAt(current) != '\r')
            current++;
    }

    private boolean isNewlineAt(int index) {
        return index < source.length() && (source.charAt(index) == '\n' || source.charAt(index) == '\r');
    }

    private void consumeNewline() {
        if (source.charAt(current) == '\r' && current + 1 < source.length() && source.charAt(current + 1) == '\n')
            current++;
        current++;
        line++;
        lineStart = current;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private void addToken(TokenType type, String text, int start, int end) {
        addToken(type, text, null, start, end);
    }

    private void addValueToken(TokenType type, Object value, int start, int end) {
        addToken(type, source.substring(start, end), value, start, end);
    }

    private void addToken(TokenType type, String text, @Nullable Object value, int start, int end) {
        tokens.add(new Token(type, text, value, spanOf(start, end)));
    }

    private Span spanOf(int start, int end) {
        // Tokens never start before the current line, except multi-line strings which are reported at their start
        int tokenLine = line;
        int tokenLineStart = lineStart;
        if (start < lineStart) {
            tokenLine = line - (int) source.substring(start, lineStart).chars().filter(ch -> ch == '\n').count();
            int lastNewline = source.lastIndexOf('\n', start - 1);
            tokenLineStart = lastNewline + 1;
        }
        return new Span(tokenLine, start - tokenLineStart, start, end);
    }

    private ScriptSyntaxException error(String message, int position) {
        return new ScriptSyntaxException(message, line, Math.max(0, position - lineStart));
    }
}
