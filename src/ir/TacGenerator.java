package ir;

import frontend.lexer.TokenType;
import frontend.syntax.Ast;

/**
 * 遍历已通过语义检查的语法树, 生成三地址码
 * 不再重复检查, 遇到语言之外的运算符视为内部错误
 */
public class TacGenerator implements Ast.StmtVisitor<Void, RuntimeException>, Ast.ExpVisitor<String, RuntimeException> {
    private IR ir;

    public IR generate(Ast ast) {
        // 每次生成重新计数临时变量
        ir = new IR();
        for (Ast.Stmt stmt : ast.getStmts()) {
            stmt.accept(this);
        }
        return ir;
    }

    @Override
    public Void visitDecl(Ast.Decl decl) {
        return null;
    }

    @Override
    public Void visitAssign(Ast.Assign assign) {
        String r = assign.getRight().accept(this);
        ir.add(new Instr.Move(assign.getName(), r));
        return null;
    }

    @Override
    public Void visitPrint(Ast.Print print) {
        String x = print.getExp().accept(this);
        ir.add(new Instr.Print(x));
        return null;
    }

    // 常量原样传播, 不分配临时变量
    @Override
    public String visitNumber(Ast.Number number) {
        return number.getText();
    }

    @Override
    public String visitVar(Ast.Var var) {
        return var.getName();
    }

    @Override
    public String visitUnaryExp(Ast.UnaryExp exp) {
        String r = exp.getOperand().accept(this);
        TokenType op = exp.getOp().getType();
        return switch (op) {
            case ADD -> r;
            case SUB -> {
                String t = ir.newTemp();
                ir.add(new Instr.Alu(t, Instr.Alu.Op.SUB, "0", r));
                yield t;
            }
            default -> throw new AssertionError("Bad unary op " + exp.getOp());
        };
    }

    @Override
    public String visitBinaryExp(Ast.BinaryExp exp) {
        String l = exp.getLeft().accept(this);
        String r = exp.getRight().accept(this);
        String t = ir.newTemp();
        ir.add(new Instr.Alu(t, Instr.Alu.Op.of(exp.getOp().getContent()), l, r));
        return t;
    }
}
