package frontend.syntax;

import frontend.lexer.Token;
import frontend.lexer.TokenType;

import java.util.List;

/**
 * 所有的语法树节点
 * 语法树构造后只读, 每个节点独占其子树
 */
public class Ast {

    private final List<Stmt> stmts;

    // 访问语句的各个变体, 新增变体时所有 pass 都必须实现
    public interface StmtVisitor<R, E extends Exception> {
        R visitDecl(Decl decl) throws E;

        R visitAssign(Assign assign) throws E;

        R visitPrint(Print print) throws E;
    }

    public interface ExpVisitor<R, E extends Exception> {
        R visitNumber(Number number) throws E;

        R visitVar(Var var) throws E;

        R visitUnaryExp(UnaryExp exp) throws E;

        R visitBinaryExp(BinaryExp exp) throws E;
    }

    // Stmt -> Decl | Assign | Print
    public sealed interface Stmt permits Decl, Assign, Print {
        <R, E extends Exception> R accept(StmtVisitor<R, E> visitor) throws E;
    }

    // Decl -> 'int' Ident ';'
    public static final class Decl implements Stmt {

        private final Token ident;

        public Decl(Token ident) {
            assert ident != null;
            this.ident = ident;
        }

        public Token getIdent() {
            return this.ident;
        }

        public String getName() {
            return this.ident.getContent();
        }

        @Override
        public <R, E extends Exception> R accept(StmtVisitor<R, E> visitor) throws E {
            return visitor.visitDecl(this);
        }
    }

    // Assign -> Ident '=' Exp ';'
    public static final class Assign implements Stmt {

        private final Token ident;
        private final Exp right;

        public Assign(Token ident, Exp right) {
            assert ident != null;
            assert right != null;
            this.ident = ident;
            this.right = right;
        }

        public Token getIdent() {
            return this.ident;
        }

        public String getName() {
            return this.ident.getContent();
        }

        public Exp getRight() {
            return this.right;
        }

        @Override
        public <R, E extends Exception> R accept(StmtVisitor<R, E> visitor) throws E {
            return visitor.visitAssign(this);
        }
    }

    // Print -> 'print' Exp ';'
    public static final class Print implements Stmt {

        private final Token keyword;
        private final Exp exp;

        public Print(Token keyword, Exp exp) {
            assert keyword != null;
            assert exp != null;
            this.keyword = keyword;
            this.exp = exp;
        }

        public Token getKeyword() {
            return this.keyword;
        }

        public Exp getExp() {
            return this.exp;
        }

        @Override
        public <R, E extends Exception> R accept(StmtVisitor<R, E> visitor) throws E {
            return visitor.visitPrint(this);
        }
    }

    // Exp -> Number | Var | UnaryExp | BinaryExp
    public sealed interface Exp permits Number, Var, UnaryExp, BinaryExp {
        <R, E extends Exception> R accept(ExpVisitor<R, E> visitor) throws E;
    }

    // Number, kept as source text
    public static final class Number implements Exp {

        private final Token number;

        public Number(Token number) {
            assert number != null && number.isOf(TokenType.NUMBER);
            this.number = number;
        }

        public Token getNumber() {
            return this.number;
        }

        public String getText() {
            return this.number.getContent();
        }

        @Override
        public <R, E extends Exception> R accept(ExpVisitor<R, E> visitor) throws E {
            return visitor.visitNumber(this);
        }

        @Override
        public String toString() {
            return getText();
        }
    }

    // Var -> Ident
    public static final class Var implements Exp {

        private final Token ident;

        public Var(Token ident) {
            assert ident != null && ident.isOf(TokenType.IDENT);
            this.ident = ident;
        }

        public Token getIdent() {
            return this.ident;
        }

        public String getName() {
            return this.ident.getContent();
        }

        @Override
        public <R, E extends Exception> R accept(ExpVisitor<R, E> visitor) throws E {
            return visitor.visitVar(this);
        }

        @Override
        public String toString() {
            return getName();
        }
    }

    // UnaryExp -> ('+' | '-') Exp
    public static final class UnaryExp implements Exp {

        private final Token op;
        private final Exp operand;

        public UnaryExp(Token op, Exp operand) {
            assert op != null;
            assert operand != null;
            this.op = op;
            this.operand = operand;
        }

        public Token getOp() {
            return this.op;
        }

        public Exp getOperand() {
            return this.operand;
        }

        @Override
        public <R, E extends Exception> R accept(ExpVisitor<R, E> visitor) throws E {
            return visitor.visitUnaryExp(this);
        }

        @Override
        public String toString() {
            return "(" + op.getContent() + operand + ")";
        }
    }

    // BinaryExp -> Exp Op Exp
    public static final class BinaryExp implements Exp {

        private final Exp left;
        private final Token op;
        private final Exp right;

        public BinaryExp(Exp left, Token op, Exp right) {
            assert left != null;
            assert op != null;
            assert right != null;
            this.left = left;
            this.op = op;
            this.right = right;
        }

        public Exp getLeft() {
            return this.left;
        }

        public Token getOp() {
            return this.op;
        }

        public Exp getRight() {
            return this.right;
        }

        @Override
        public <R, E extends Exception> R accept(ExpVisitor<R, E> visitor) throws E {
            return visitor.visitBinaryExp(this);
        }

        @Override
        public String toString() {
            return "(" + left + " " + op.getContent() + " " + right + ")";
        }
    }

    public Ast(List<Stmt> stmts) {
        assert stmts != null;
        this.stmts = List.copyOf(stmts);
    }

    public List<Stmt> getStmts() {
        return this.stmts;
    }

}
