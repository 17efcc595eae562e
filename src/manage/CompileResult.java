package manage;

import exception.CompileException;
import frontend.lexer.TokenList;
import frontend.semantic.symbol.SymTable;
import ir.IR;

import java.util.Optional;

/**
 * 一次编译的结果: 成功时三段报告齐全, 失败时只含失败阶段之前的段落和一条诊断
 */
public class CompileResult {
    public static final int EXIT_OK = 0;
    public static final int EXIT_COMPILE_ERROR = 1;

    private final TokenList tokenList;
    private final SymTable symTable;
    private final IR ir;
    private final CompileException error;

    private final String tokens;
    private final String symbolTable;
    private final String tac;

    CompileResult(TokenList tokenList, SymTable symTable, IR ir, CompileException error) {
        this.tokenList = tokenList;
        this.symTable = symTable;
        this.ir = ir;
        this.error = error;
        this.tokens = tokenList == null ? "" : Report.tokens(tokenList.getTokens());
        this.symbolTable = symTable == null ? "" : Report.symbolTable(symTable);
        this.tac = ir == null ? "" : Report.tac(ir);
    }

    public boolean isOk() {
        return error == null;
    }

    public int getExitCode() {
        return isOk() ? EXIT_OK : EXIT_COMPILE_ERROR;
    }

    public Optional<CompileException> getError() {
        return Optional.ofNullable(error);
    }

    // 标准输出的完整文本
    public String getStdout() {
        return tokens + symbolTable + tac;
    }

    // 错误通道的完整文本, 成功时为空
    public String getStderr() {
        return error == null ? "" : error.diagnostic() + "\n";
    }

    public String getTokens() {
        return tokens;
    }

    public String getSymbolTable() {
        return symbolTable;
    }

    public String getTac() {
        return tac;
    }

    public TokenList getTokenList() {
        return tokenList;
    }

    public SymTable getSymTable() {
        return symTable;
    }

    public IR getIr() {
        return ir;
    }
}
