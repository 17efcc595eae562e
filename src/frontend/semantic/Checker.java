package frontend.semantic;

import exception.SemanticException;
import frontend.semantic.symbol.SymTable;
import frontend.semantic.symbol.Symbol;
import frontend.syntax.Ast;
import frontend.syntax.Ast.*;

/**
 * 遍历语法树, 检查声明与使用, 建立符号表
 * 单遍, 按源码顺序; 第一个错误即终止
 */
public class Checker implements Ast.StmtVisitor<Void, SemanticException>, Ast.ExpVisitor<Void, SemanticException> {
    private final SymTable symTable = new SymTable(); // 本次编译的符号表
    private boolean visited = false;

    public SymTable check(Ast ast) throws SemanticException {
        if (visited) {
            throw new IllegalStateException("Checker is single-use");
        }
        visited = true;
        for (Stmt stmt : ast.getStmts()) {
            stmt.accept(this);
        }
        return symTable;
    }

    @Override
    public Void visitDecl(Decl decl) throws SemanticException {
        String name = decl.getName();
        if (symTable.contains(name)) {
            throw new SemanticException(decl.getIdent(), "duplicate declaration of '" + name + "'");
        }
        symTable.add(new Symbol(name, Symbol.Type.INT));
        return null;
    }

    @Override
    public Void visitAssign(Assign assign) throws SemanticException {
        String name = assign.getName();
        if (!symTable.contains(name)) {
            throw new SemanticException(assign.getIdent(), "assignment to undeclared variable '" + name + "'");
        }
        assign.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitPrint(Print print) throws SemanticException {
        print.getExp().accept(this);
        return null;
    }

    @Override
    public Void visitNumber(Ast.Number number) {
        return null;
    }

    @Override
    public Void visitVar(Var var) throws SemanticException {
        if (!symTable.contains(var.getName())) {
            throw new SemanticException(var.getIdent(), "variable '" + var.getName() + "' used before declaration");
        }
        return null;
    }

    // 只有 int 一种类型, 运算本身不会出现类型错误
    @Override
    public Void visitUnaryExp(UnaryExp exp) throws SemanticException {
        exp.getOperand().accept(this);
        return null;
    }

    @Override
    public Void visitBinaryExp(BinaryExp exp) throws SemanticException {
        exp.getLeft().accept(this);
        exp.getRight().accept(this);
        return null;
    }
}
