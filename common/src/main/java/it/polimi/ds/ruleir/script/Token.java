package it.polimi.ds.ruleir.script;

import it.polimi.ds.ruleir.tree.Span;
import org.jspecify.annotations.Nullable;

/**
 * @param type token type
 * @param text the raw source text of the token
 * @param value the decoded value of {@link TokenType#NUMBER} and {@link TokenType#STRING} tokens
 * @param span location
 */
public record Token(TokenType type, String text, @Nullable Object value, Span span) {

    public boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isOperator(String op) {
        return is(TokenType.OPERATOR, op);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenType.NAME, keyword);
    }
}
