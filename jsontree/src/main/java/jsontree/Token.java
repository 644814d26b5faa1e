package jsontree;

/**
 * Lexical token produced by {@link Tokenizer}.
 *
 * <p> Every token remembers the offset of its first character, counted in UTF-16 code units.
 *
 * @author Freeman
 * @since 0.1.0
 */
public sealed interface Token
        permits Token.Delimiter, Token.StringLiteral, Token.NumberLiteral, Token.Keyword, Token.End {

    /**
     * @return token text, unescaped for string literals
     */
    String text();

    long offset();

    /**
     * One of {@code { } [ ] , :}.
     */
    record Delimiter(char ch, long offset) implements Token {
        @Override
        public String text() {
            return String.valueOf(ch);
        }
    }

    record StringLiteral(String text, long offset) implements Token {}

    /**
     * Raw number text, validated by the parser.
     */
    record NumberLiteral(String text, long offset) implements Token {}

    /**
     * A run of lowercase letters; only {@code true}, {@code false} and {@code null} are accepted by the parser.
     */
    record Keyword(String text, long offset) implements Token {}

    record End(long offset) implements Token {
        @Override
        public String text() {
            return "";
        }
    }
}
