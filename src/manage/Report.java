package manage;

import frontend.lexer.Token;
import frontend.lexer.TokenType;
import frontend.semantic.symbol.SymTable;
import frontend.semantic.symbol.Symbol;
import ir.IR;

import java.util.List;

/**
 * 输出报告的三段, 每段一行标题, 末尾一个空行
 * 外部宿主按标题原文切分输出, 标题文本与顺序不可改动
 */
public final class Report {
    public static final String TOKENS_HEADER = "TOKENS:";
    public static final String SYMBOL_TABLE_HEADER = "SYMBOL TABLE:";
    public static final String TAC_HEADER = "INTERMEDIATE CODE (TAC):";

    private static final int LEXEME_WIDTH = 10;
    private static final int NAME_WIDTH = 9;

    private Report() {
    }

    public static String tokens(List<Token> tokens) {
        StringBuilder sb = new StringBuilder(TOKENS_HEADER).append('\n');
        for (Token token : tokens) {
            if (token.isOf(TokenType.EOF)) {
                break;
            }
            sb.append(String.format("%-" + LEXEME_WIDTH + "s %s", token.getContent(), token.getCategory()))
                    .append('\n');
        }
        return sb.append('\n').toString();
    }

    public static String symbolTable(SymTable symTable) {
        StringBuilder sb = new StringBuilder(SYMBOL_TABLE_HEADER).append('\n');
        sb.append(row("Name", "Type"));
        for (Symbol symbol : symTable.getDeclOrder()) {
            sb.append(row(symbol.getName(), symbol.getType().getName()));
        }
        return sb.append('\n').toString();
    }

    public static String tac(IR ir) {
        StringBuilder sb = new StringBuilder(TAC_HEADER).append('\n');
        for (String line : ir.output()) {
            sb.append(line).append('\n');
        }
        return sb.append('\n').toString();
    }

    private static String row(String name, String type) {
        return String.format("%-" + NAME_WIDTH + "s %s", name, type) + "\n";
    }
}
