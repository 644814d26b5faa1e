package jsontree;

import static jsontree.JsonException.SyntaxException.Reason.COLON_EXPECTED;
import static jsontree.JsonException.SyntaxException.Reason.END_OF_INPUT;
import static jsontree.JsonException.SyntaxException.Reason.MALFORMED_NUMBER;
import static jsontree.JsonException.SyntaxException.Reason.NESTING_TOO_DEEP;
import static jsontree.JsonException.SyntaxException.Reason.OBJECT_KEY_EXPECTED;
import static jsontree.JsonException.SyntaxException.Reason.UNDEFINED_KEYWORD;
import static jsontree.JsonException.SyntaxException.Reason.UNEXPECTED_TOKEN;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Objects;
import jsontree.JsonException.SyntaxException;
import lombok.Builder;
import org.jspecify.annotations.Nullable;

/**
 * Recursive-descent JSON parser producing {@link Node} trees.
 *
 * <p> A parser reads one top-level value per call, so a stream of concatenated documents is consumed by
 * calling {@link #parseNext()} until it returns {@code null}. A single trailing comma is accepted before
 * {@code ]} and {@code }}.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * JsonParser parser = JsonParser.builder()
 *         .reader(new StringReader("{\"a\": [1, 2, 3,]}"))
 *         .maxDepth(64)
 *         .build();
 * Node node = parser.parse();
 * }</pre>
 *
 * @author Freeman
 * @since 0.1.0
 */
public final class JsonParser {

    public static final int DEFAULT_MAX_DEPTH = 1000;

    private final Tokenizer tokenizer;
    private final int maxDepth;

    /**
     * @param reader   character source, buffered if it is not already
     * @param maxDepth maximum nesting of arrays and objects, {@link #DEFAULT_MAX_DEPTH} if not positive
     */
    @Builder
    private JsonParser(Reader reader, int maxDepth) {
        Objects.requireNonNull(reader, "reader");
        var source = reader instanceof BufferedReader || reader instanceof StringReader
                ? reader
                : new BufferedReader(reader);
        this.tokenizer = new Tokenizer(source);
        this.maxDepth = maxDepth > 0 ? maxDepth : DEFAULT_MAX_DEPTH;
    }

    public static JsonParser of(Reader reader) {
        return builder().reader(reader).build();
    }

    public static JsonParser of(String json) {
        return of(new StringReader(json));
    }

    /**
     * Parse exactly one value.
     *
     * @return parsed node
     * @throws SyntaxException if the input is malformed or holds no value
     */
    public Node parse() {
        Token token = tokenizer.next();
        return parseValue(token, 0);
    }

    /**
     * Parse the next value of a multi-document stream.
     *
     * @return parsed node, or {@code null} if the input is exhausted before a value starts
     * @throws SyntaxException if the input is malformed
     */
    public @Nullable Node parseNext() {
        Token token = tokenizer.next();
        if (token instanceof Token.End) return null;
        return parseValue(token, 0);
    }

    private Node parseValue(Token token, int depth) {
        if (token instanceof Token.NumberLiteral n) return parseNumber(n);
        if (token instanceof Token.StringLiteral s) return new StringNode(s.text());
        if (token instanceof Token.Keyword k) return parseKeyword(k);
        if (isDelimiter(token, '{')) return parseObject(token, depth + 1);
        if (isDelimiter(token, '[')) return parseArray(token, depth + 1);
        throw unexpected(token);
    }

    private ArrayNode parseArray(Token open, int depth) {
        checkDepth(open, depth);
        var elements = new ArrayList<Node>();
        Token token = tokenizer.next();
        while (!isDelimiter(token, ']')) {
            elements.add(parseValue(token, depth));
            token = tokenizer.next();
            if (isDelimiter(token, ']')) break;
            if (!isDelimiter(token, ',')) throw unexpected(token);
            token = tokenizer.next();
        }
        return new ArrayNode(elements);
    }

    private ObjectNode parseObject(Token open, int depth) {
        checkDepth(open, depth);
        var fields = new LinkedHashMap<String, Node>();
        Token token = tokenizer.next();
        while (!isDelimiter(token, '}')) {
            if (token instanceof Token.End) throw unexpected(token);
            if (!(token instanceof Token.StringLiteral key)) {
                throw error(OBJECT_KEY_EXPECTED, token, "object key expected at position %d: '%s'");
            }
            Token colon = tokenizer.next();
            if (!isDelimiter(colon, ':')) {
                if (colon instanceof Token.End) throw unexpected(colon);
                throw error(COLON_EXPECTED, colon, "colon expected at position %d: '%s'");
            }
            // last occurrence of a key wins, first occurrence keeps its position
            fields.put(key.text(), parseValue(tokenizer.next(), depth));
            token = tokenizer.next();
            if (isDelimiter(token, '}')) break;
            if (!isDelimiter(token, ',')) throw unexpected(token);
            token = tokenizer.next();
        }
        return new ObjectNode(fields);
    }

    private static NumberNode parseNumber(Token.NumberLiteral token) {
        try {
            return new NumberNode(new BigDecimal(token.text()));
        } catch (NumberFormatException e) {
            throw new SyntaxException(
                    MALFORMED_NUMBER,
                    String.format("malformed number at position %d: '%s'", token.offset(), token.text()),
                    token.offset(),
                    token.text(),
                    e);
        }
    }

    private static Node parseKeyword(Token.Keyword token) {
        return switch (token.text()) {
            case "true" -> BooleanNode.TRUE;
            case "false" -> BooleanNode.FALSE;
            case "null" -> NullNode.INSTANCE;
            default -> throw new SyntaxException(
                    UNDEFINED_KEYWORD,
                    String.format("undefined keyword '%s' at position %d", token.text(), token.offset()),
                    token.offset(),
                    token.text());
        };
    }

    private void checkDepth(Token open, int depth) {
        if (depth > maxDepth) {
            throw new SyntaxException(
                    NESTING_TOO_DEEP,
                    String.format("nesting deeper than %d at position %d", maxDepth, open.offset()),
                    open.offset(),
                    open.text());
        }
    }

    private static boolean isDelimiter(Token token, char ch) {
        return token instanceof Token.Delimiter d && d.ch() == ch;
    }

    private static SyntaxException unexpected(Token token) {
        if (token instanceof Token.End) {
            return new SyntaxException(
                    END_OF_INPUT,
                    String.format("unexpected end of input at position %d", token.offset()),
                    token.offset(),
                    null);
        }
        return error(UNEXPECTED_TOKEN, token, "unexpected token at position %d: '%s'");
    }

    private static SyntaxException error(SyntaxException.Reason reason, Token token, String format) {
        return new SyntaxException(
                reason, String.format(format, token.offset(), token.text()), token.offset(), token.text());
    }
}
