package exception;

/**
 * 词法分析阶段的异常: 遇到无法识别的字符
 */
public class LexicalException extends CompileException {
    public LexicalException(int line, int col, char c) {
        super(line, col, String.valueOf(c), "unexpected character '" + c + "'");
    }

    @Override
    public String getKind() {
        return "LexicalError";
    }
}
