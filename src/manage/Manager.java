package manage;

import exception.CompileException;
import frontend.lexer.Lexer;
import frontend.lexer.TokenList;
import frontend.semantic.Checker;
import frontend.semantic.symbol.SymTable;
import frontend.syntax.Ast;
import frontend.syntax.Parser;
import ir.IR;
import ir.TacGenerator;

import java.io.PrintStream;

/**
 * 串联四个阶段: 词法 -> 语法 -> 语义 -> 三地址码
 * 每次 compile 都使用全新的各阶段实例, 不同编译之间没有共享状态, 可并发调用
 */
public class Manager {
    private final boolean verbose;
    private final PrintStream trace;

    public Manager() {
        this(false, System.err);
    }

    public Manager(boolean verbose, PrintStream trace) {
        this.verbose = verbose;
        this.trace = trace;
    }

    private void trace(String format, Object... args) {
        if (verbose) {
            trace.println("[trace] " + String.format(format, args));
        }
    }

    public CompileResult compile(String source) {
        TokenList tokenList = null;
        SymTable symTable = null;
        try {
            tokenList = new Lexer(source).lex();
            trace("lexer: %d tokens", tokenList.size() - 1);
            Ast ast = new Parser(tokenList).parseAst();
            trace("parser: %d statements", ast.getStmts().size());
            symTable = new Checker().check(ast);
            trace("checker: %d symbols", symTable.size());
            IR ir = new TacGenerator().generate(ast);
            trace("tac: %d instructions, %d temporaries", ir.getInstrs().size(), ir.getTempCnt());
            return new CompileResult(tokenList, symTable, ir, null);
        } catch (CompileException e) {
            trace("abort: %s", e.getKind());
            return new CompileResult(tokenList, symTable, null, e);
        }
    }
}
