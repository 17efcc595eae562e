package exception;

import frontend.lexer.Token;

/**
 * 语法分析阶段的异常, 位置取自出错的 token
 */
public class SyntaxException extends CompileException {
    public SyntaxException(Token token, String message) {
        super(token.getLine(), token.getCol(), token.getContent(), message);
    }

    @Override
    public String getKind() {
        return "SyntaxError";
    }
}
