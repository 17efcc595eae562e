package frontend.lexer;

import java.util.Arrays;

public class Token {
    private final TokenType type;
    private final String content;
    private final int line; // 1-based
    private final int col;  // 1-based

    public Token(final TokenType type, final String content, final int line, final int col) {
        assert type != null;
        assert content != null;
        this.type = type;
        this.content = content;
        this.line = line;
        this.col = col;
    }

    public TokenType getType() {
        return this.type;
    }

    public String getContent() {
        return this.content;
    }

    public int getLine() {
        return line;
    }

    public int getCol() {
        return col;
    }

    public TokenType.Category getCategory() {
        return type.getCategory();
    }

    public boolean isOf(TokenType... types) {
        return Arrays.asList(types).contains(type);
    }

    @Override
    public String toString() {
        return "<" + type + " " + content + " @" + line + ":" + col + ">";
    }
}
