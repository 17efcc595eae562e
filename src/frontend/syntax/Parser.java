package frontend.syntax;

import exception.SyntaxException;
import frontend.lexer.Token;
import frontend.lexer.TokenList;
import frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * 递归下降语法分析器
 * <pre>
 * Program     := (Decl | Stmt)* EOF
 * Decl        := 'int' Ident ';'
 * Stmt        := Ident '=' Exp ';' | 'print' Exp ';'
 * Exp         := Term (('+'|'-') Term)*
 * Term        := Unary (('*'|'/') Unary)*
 * Unary       := ('+'|'-') Unary | Primary
 * Primary     := Number | Ident | '(' Exp ')'
 * </pre>
 * 遇到第一个错误即抛出, 不做恢复
 */
public class Parser {
    private final TokenList tokenList;

    public Parser(TokenList tokenList) {
        this.tokenList = tokenList;
    }

    public Ast parseAst() throws SyntaxException {
        ArrayList<Ast.Stmt> stmts = new ArrayList<>();
        while (tokenList.hasNext()) {
            Token token = tokenList.get();
            switch (token.getType()) {
                case INT -> stmts.add(parseDecl());
                case IDENT -> stmts.add(parseAssign());
                case PRINT -> stmts.add(parsePrint());
                default -> throw new SyntaxException(token,
                        "expected 'int' declaration or a statement (assignment/print)");
            }
        }
        tokenList.consumeExpected("expected end of input", TokenType.EOF);
        return new Ast(stmts);
    }

    private Ast.Decl parseDecl() throws SyntaxException {
        tokenList.consumeExpected("expected 'int'", TokenType.INT);
        Token ident = tokenList.consumeExpected("expected identifier after 'int'", TokenType.IDENT);
        tokenList.consumeExpected("expected ';' after declaration", TokenType.SEMI);
        return new Ast.Decl(ident);
    }

    private Ast.Assign parseAssign() throws SyntaxException {
        Token ident = tokenList.consumeExpected("expected identifier", TokenType.IDENT);
        tokenList.consumeExpected("expected '=' in assignment", TokenType.ASSIGN);
        Ast.Exp right = parseAddExp();
        tokenList.consumeExpected("expected ';' after assignment", TokenType.SEMI);
        return new Ast.Assign(ident, right);
    }

    private Ast.Print parsePrint() throws SyntaxException {
        Token keyword = tokenList.consumeExpected("expected 'print'", TokenType.PRINT);
        Ast.Exp exp = parseAddExp();
        tokenList.consumeExpected("expected ';' after print", TokenType.SEMI);
        return new Ast.Print(keyword, exp);
    }

    // 二元表达式的种类, 优先级从低到高
    private enum BinaryExpType {
        ADD(TokenType.ADD, TokenType.SUB),
        MUL(TokenType.MUL, TokenType.DIV),
        ;

        private final List<TokenType> types;

        BinaryExpType(TokenType... types) {
            this.types = List.of(types);
        }

        public boolean contains(TokenType type) {
            return types.contains(type);
        }
    }

    // 解析二元表达式的下一层表达式
    private Ast.Exp parseSubBinaryExp(BinaryExpType expType) throws SyntaxException {
        return switch (expType) {
            case ADD -> parseBinaryExp(BinaryExpType.MUL);
            case MUL -> parseUnaryExp();
        };
    }

    // 解析二元表达式, 同一层次内左结合
    private Ast.Exp parseBinaryExp(BinaryExpType expType) throws SyntaxException {
        Ast.Exp left = parseSubBinaryExp(expType);
        while (expType.contains(tokenList.get().getType())) {
            Token op = tokenList.consume(); // 取得当前层次的运算符
            Ast.Exp right = parseSubBinaryExp(expType);
            left = new Ast.BinaryExp(left, op, right);
        }
        return left;
    }

    private Ast.Exp parseUnaryExp() throws SyntaxException {
        if (tokenList.get().isOf(TokenType.ADD, TokenType.SUB)) {
            Token op = tokenList.consume();
            return new Ast.UnaryExp(op, parseUnaryExp());
        }
        return parsePrimary();
    }

    private Ast.Exp parsePrimary() throws SyntaxException {
        Token temp = tokenList.get();
        if (temp.isOf(TokenType.NUMBER)) {
            return new Ast.Number(tokenList.consume());
        } else if (temp.isOf(TokenType.IDENT)) {
            return new Ast.Var(tokenList.consume());
        } else if (temp.isOf(TokenType.LPARENT)) {
            tokenList.consume();
            Ast.Exp exp = parseAddExp();
            tokenList.consumeExpected("expected ')' to close '('", TokenType.RPARENT);
            return exp;
        }
        throw new SyntaxException(temp, "expected number, identifier or '(' expression ')'");
    }

    private Ast.Exp parseAddExp() throws SyntaxException {
        return parseBinaryExp(BinaryExpType.ADD);
    }
}
