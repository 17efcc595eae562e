package frontend.lexer;

import exception.LexicalException;

import static frontend.lexer.TokenType.*;

/**
 * 手写状态机词法分析器
 * 一个实例只对应一段源码, 不可重入; 新的源码需要新的实例
 */
public class Lexer {
    private final String src;
    private int pos = 0;
    private int line = 1;
    private int col = 1;
    private boolean done = false;

    public Lexer(String src) {
        assert src != null;
        this.src = src;
    }

    private char peek(int k) {
        int p = pos + k;
        return p < src.length() ? src.charAt(p) : '\0';
    }

    private boolean atEnd() {
        return pos >= src.length();
    }

    private char getc() {
        char c = src.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private boolean isDigital(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    // 跳过空白与 // 单行注释
    private void skipBlank() {
        while (!atEnd()) {
            char c = peek(0);
            if (isSpace(c)) {
                getc();
            } else if (c == '/' && peek(1) == '/') {
                while (!atEnd() && peek(0) != '\n') {
                    getc();
                }
            } else {
                return;
            }
        }
    }

    public TokenList lex() throws LexicalException {
        if (done) {
            throw new IllegalStateException("Lexer is single-use, create a new one for new source");
        }
        done = true;
        TokenList tokenList = new TokenList();
        while (true) {
            skipBlank();
            int startLine = line;
            int startCol = col;
            if (atEnd()) {
                tokenList.append(new Token(EOF, "EOF", startLine, startCol));
                return tokenList;
            }
            char c = peek(0);
            StringBuilder stringBuilder = new StringBuilder();
            if (isLetter(c)) {
                while (!atEnd() && (isLetter(peek(0)) || isDigital(peek(0)))) {
                    stringBuilder.append(getc());
                }
                String word = stringBuilder.toString();
                tokenList.append(new Token(TokenType.ofWord(word), word, startLine, startCol));
            } else if (isDigital(c)) {
                while (!atEnd() && isDigital(peek(0))) {
                    stringBuilder.append(getc());
                }
                tokenList.append(new Token(NUMBER, stringBuilder.toString(), startLine, startCol));
            } else {
                TokenType type = switch (c) {
                    case '+' -> ADD;
                    case '-' -> SUB;
                    case '*' -> MUL;
                    case '/' -> DIV;
                    case '=' -> ASSIGN;
                    case ';' -> SEMI;
                    case '(' -> LPARENT;
                    case ')' -> RPARENT;
                    default -> throw new LexicalException(startLine, startCol, c);
                };
                getc();
                tokenList.append(new Token(type, type.getText(), startLine, startCol));
            }
        }
    }
}
