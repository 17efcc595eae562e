package exception;

/**
 * 编译期可报告给用户的错误, 携带出错位置
 * 每次编译至多产生一个, 第一个错误即终止编译
 */
public abstract class CompileException extends Exception {
    private final int line;
    private final int col;
    private final String lexeme;

    protected CompileException(int line, int col, String lexeme, String message) {
        super(message);
        this.line = line;
        this.col = col;
        this.lexeme = lexeme;
    }

    // LexicalError, SyntaxError, SemanticError
    public abstract String getKind();

    public int getLine() {
        return line;
    }

    public int getCol() {
        return col;
    }

    public String getLexeme() {
        return lexeme;
    }

    /**
     * 诊断行: {@code <ErrorKind> at <line>:<col> near '<lexeme>': <message>}
     */
    public String diagnostic() {
        return getKind() + " at " + line + ":" + col + " near '" + lexeme + "': " + getMessage();
    }

    @Override
    public String toString() {
        return diagnostic();
    }
}
