package jsontree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import jsontree.JsonException.SyntaxException;
import org.junit.jupiter.api.Test;

class TokenizerTest {

    private static List<Token> tokenize(String json) {
        var tokenizer = new Tokenizer(new StringReader(json));
        var tokens = new ArrayList<Token>();
        Token token;
        do {
            token = tokenizer.next();
            tokens.add(token);
        } while (!(token instanceof Token.End));
        return tokens;
    }

    @Test
    void tokensWithOffsets() {
        assertThat(tokenize("{\"a\": [1, -2.5e3, true]}"))
                .containsExactly(
                        new Token.Delimiter('{', 0),
                        new Token.StringLiteral("a", 1),
                        new Token.Delimiter(':', 4),
                        new Token.Delimiter('[', 6),
                        new Token.NumberLiteral("1", 7),
                        new Token.Delimiter(',', 8),
                        new Token.NumberLiteral("-2.5e3", 10),
                        new Token.Delimiter(',', 16),
                        new Token.Keyword("true", 18),
                        new Token.Delimiter(']', 22),
                        new Token.Delimiter('}', 23),
                        new Token.End(24));
    }

    @Test
    void endIsSticky() {
        var tokenizer = new Tokenizer(new StringReader("  \n"));
        assertThat(tokenizer.next()).isEqualTo(new Token.End(3));
        assertThat(tokenizer.next()).isEqualTo(new Token.End(3));
    }

    @Test
    void classifiesWithoutValidating() {
        // malformed numbers and unknown keywords are left to the parser
        assertThat(tokenize("1.2.3 nul"))
                .containsExactly(
                        new Token.NumberLiteral("1.2.3", 0), new Token.Keyword("nul", 6), new Token.End(9));
    }

    @Test
    void escapes() {
        // @spotless:off
        var table = new Object[][] {
                {"\"plain\"", "plain"},
                {"\"a\\nb\\tc\"", "a\nb\tc"},
                {"\"\\b\\f\\r\"", "\b\f\r"},
                {"\"\\\"\\\\\\/\"", "\"\\/"},
                {"\"\\x41\\x7a\"", "Az"},
                {"\"\\u00e9\"", "é"},
                {"\"\\uD834\\uDD1E\"", "\uD834\uDD1E"},
                // unknown escapes stand for themselves
                {"\"\\q\"", "q"},
        };
        // @spotless:on

        assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
            var row = table[i];
            var input = (String) row[0];
            var expected = (String) row[1];
            var token = new Tokenizer(new StringReader(input)).next();
            assertThat(token).as("Case %d: input=%s", i, input).isInstanceOf(Token.StringLiteral.class);
            assertThat(token.text()).as("Case %d: input=%s", i, input).isEqualTo(expected);
        }));
    }

    @Test
    void errors() {
        // @spotless:off
        var table = new Object[][] {
                // input, reason, offset, token
                {"@", SyntaxException.Reason.UNEXPECTED_CHARACTER, 0L, "@"},
                {"  ~", SyntaxException.Reason.UNEXPECTED_CHARACTER, 2L, "~"},
                {"TRUE", SyntaxException.Reason.UNEXPECTED_CHARACTER, 0L, "T"},
                {"\"\\u12G4\"", SyntaxException.Reason.INVALID_HEX_DIGIT, 5L, "G"},
                {"\"\\xZ0\"", SyntaxException.Reason.INVALID_HEX_DIGIT, 3L, "Z"},
                {"\"\\uD834x\"", SyntaxException.Reason.INVALID_SURROGATE_PAIR, 1L, null},
                {"\"\\uD834\\u0041\"", SyntaxException.Reason.INVALID_SURROGATE_PAIR, 1L, null},
                {"\"\\uDD1E\"", SyntaxException.Reason.INVALID_SURROGATE_PAIR, 1L, null},
                {"\"abc", SyntaxException.Reason.END_OF_INPUT, 4L, null},
                {"\"abc\\", SyntaxException.Reason.END_OF_INPUT, 5L, null},
        };
        // @spotless:on

        assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
            var row = table[i];
            var input = (String) row[0];
            var tokenizer = new Tokenizer(new StringReader(input));
            assertThatThrownBy(tokenizer::next)
                    .as("Case %d: input=%s", i, input)
                    .isInstanceOfSatisfying(SyntaxException.class, e -> {
                        assertThat(e.getReason()).isEqualTo(row[1]);
                        assertThat(e.getOffset()).isEqualTo(row[2]);
                        assertThat(e.getToken()).isEqualTo(row[3]);
                    });
        }));
    }

    @Test
    void errorMessageNamesCharacterAndPosition() {
        var tokenizer = new Tokenizer(new StringReader("[1, #]"));
        tokenizer.next();
        tokenizer.next();
        tokenizer.next();
        assertThatThrownBy(tokenizer::next)
                .isInstanceOf(SyntaxException.class)
                .hasMessage("unexpected character '#' at position 4");
    }
}
