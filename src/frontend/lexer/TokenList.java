package frontend.lexer;

import exception.SyntaxException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 词法分析的结果, 末尾总是一个 EOF token
 * 语法分析通过游标逐个消费
 */
public class TokenList {
    private final ArrayList<Token> tokens = new ArrayList<>();
    private int index = 0;

    public void append(Token token) {
        tokens.add(token);
    }

    public List<Token> getTokens() {
        return Collections.unmodifiableList(tokens);
    }

    public int size() {
        return tokens.size();
    }

    public boolean hasNext() {
        return index < tokens.size() && !get().isOf(TokenType.EOF);
    }

    public Token get() {
        return ahead(0);
    }

    public Token ahead(int count) {
        // 越过 EOF 时停在 EOF 上
        return tokens.get(Math.min(index + count, tokens.size() - 1));
    }

    public Token consume() {
        Token token = get();
        if (!token.isOf(TokenType.EOF)) {
            index++;
        }
        return token;
    }

    // Usage: tokenList.consumeExpected("expected ';' after print", TokenType.SEMI)
    public Token consumeExpected(String expected, TokenType... types) throws SyntaxException {
        Token token = get();
        if (token.isOf(types)) {
            return consume();
        }
        throw new SyntaxException(token, expected);
    }
}
