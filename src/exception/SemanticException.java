package exception;

import frontend.lexer.Token;

/**
 * 中端异常: 重复声明, 未声明即使用
 */
public class SemanticException extends CompileException {
    public SemanticException(Token ident, String message) {
        super(ident.getLine(), ident.getCol(), ident.getContent(), message);
    }

    @Override
    public String getKind() {
        return "SemanticError";
    }
}
