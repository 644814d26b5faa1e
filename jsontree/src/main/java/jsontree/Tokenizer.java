package jsontree;

import static jsontree.JsonException.SyntaxException.Reason.END_OF_INPUT;
import static jsontree.JsonException.SyntaxException.Reason.INVALID_HEX_DIGIT;
import static jsontree.JsonException.SyntaxException.Reason.INVALID_SURROGATE_PAIR;
import static jsontree.JsonException.SyntaxException.Reason.UNEXPECTED_CHARACTER;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Objects;
import jsontree.JsonException.SyntaxException;
import org.jspecify.annotations.Nullable;

/**
 * Splits a character stream into {@link Token}s, one at a time.
 *
 * <p> The tokenizer only classifies characters; it does not check that a number is well-formed
 * or that a keyword is one of {@code true}, {@code false} and {@code null}. After the input is
 * exhausted every call to {@link #next()} returns {@link Token.End}.
 *
 * @author Freeman
 * @since 0.1.0
 */
public final class Tokenizer {

    private final Reader reader;
    private long offset;
    private int pushback = -1;

    public Tokenizer(Reader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    /**
     * @return the next token, {@link Token.End} at end of input
     * @throws SyntaxException      on a lexical error
     * @throws UncheckedIOException if the underlying reader fails
     */
    public Token next() {
        int c = read();
        while (isWhitespace(c)) c = read();
        if (c < 0) return new Token.End(offset);

        long start = offset - 1;
        if (isDigit(c) || c == '-' || c == '.') return readNumber(c, start);
        if (c == '"') return readString(start);
        if (isDelimiter(c)) return new Token.Delimiter((char) c, start);
        if (isLower(c)) return readKeyword(c, start);
        throw error(
                UNEXPECTED_CHARACTER,
                start,
                String.valueOf((char) c),
                "unexpected character '%c' at position %d",
                (char) c,
                start);
    }

    /**
     * @return number of UTF-16 code units consumed so far
     */
    public long offset() {
        return offset;
    }

    // ============================================================
    // Token scanners
    // ============================================================

    private Token readNumber(int first, long start) {
        var sb = new StringBuilder().append((char) first);
        int c = read();
        while (isNumberChar(c)) {
            sb.append((char) c);
            c = read();
        }
        unread(c);
        return new Token.NumberLiteral(sb.toString(), start);
    }

    private Token readKeyword(int first, long start) {
        var sb = new StringBuilder().append((char) first);
        int c = read();
        while (isLower(c)) {
            sb.append((char) c);
            c = read();
        }
        unread(c);
        return new Token.Keyword(sb.toString(), start);
    }

    private Token readString(long start) {
        var sb = new StringBuilder();
        while (true) {
            int c = read();
            if (c < 0) throw endOfInput(start);
            if (c == '"') return new Token.StringLiteral(sb.toString(), start);
            if (c != '\\') {
                sb.append((char) c);
                continue;
            }
            long escapeAt = offset - 1;
            int e = read();
            switch (e) {
                case -1 -> throw endOfInput(start);
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'x' -> sb.append((char) readHex(2, start));
                case 'u' -> appendUnicodeEscape(sb, escapeAt, start);
                // \" \\ \/ and any other escaped character stand for themselves
                default -> sb.append((char) e);
            }
        }
    }

    private void appendUnicodeEscape(StringBuilder sb, long escapeAt, long start) {
        char unit = (char) readHex(4, start);
        if (Character.isHighSurrogate(unit)) {
            int backslash = read();
            int u = backslash == '\\' ? read() : -1;
            if (u != 'u') throw invalidSurrogatePair(escapeAt);
            char low = (char) readHex(4, start);
            if (!Character.isLowSurrogate(low)) throw invalidSurrogatePair(escapeAt);
            sb.appendCodePoint(Character.toCodePoint(unit, low));
        } else if (Character.isLowSurrogate(unit)) {
            throw invalidSurrogatePair(escapeAt);
        } else {
            sb.append(unit);
        }
    }

    private int readHex(int digits, long start) {
        int value = 0;
        for (int k = 0; k < digits; k++) {
            int c = read();
            if (c < 0) throw endOfInput(start);
            int v = hexVal(c);
            if (v < 0) {
                long at = offset - 1;
                throw error(
                        INVALID_HEX_DIGIT,
                        at,
                        String.valueOf((char) c),
                        "invalid hexadecimal digit '%c' at position %d",
                        (char) c,
                        at);
            }
            value = (value << 4) | v;
        }
        return value;
    }

    // ============================================================
    // Character source
    // ============================================================

    private int read() {
        int c;
        if (pushback >= 0) {
            c = pushback;
            pushback = -1;
        } else {
            try {
                c = reader.read();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        if (c >= 0) offset++;
        return c;
    }

    private void unread(int c) {
        if (c < 0) return;
        pushback = c;
        offset--;
    }

    // ============================================================
    // Helpers
    // ============================================================

    private static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNumberChar(int c) {
        return isDigit(c) || c == '+' || c == '-' || c == '.' || c == 'e' || c == 'E';
    }

    private static boolean isLower(int c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isDelimiter(int c) {
        return c == '{' || c == '}' || c == '[' || c == ']' || c == ',' || c == ':';
    }

    private static int hexVal(int c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'a' && c <= 'f') return 10 + (c - 'a');
        if (c >= 'A' && c <= 'F') return 10 + (c - 'A');
        return -1;
    }

    private SyntaxException endOfInput(long start) {
        return error(END_OF_INPUT, offset, null, "unterminated string starting at position %d", start);
    }

    private static SyntaxException invalidSurrogatePair(long at) {
        return error(INVALID_SURROGATE_PAIR, at, null, "invalid surrogate pair at position %d", at);
    }

    private static SyntaxException error(
            SyntaxException.Reason reason, long at, @Nullable String token, String format, Object... args) {
        return new SyntaxException(reason, String.format(format, args), at, token);
    }
}
