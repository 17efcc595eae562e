package frontend.lexer;

public enum TokenType {
    // keyword
    INT("int", Category.KEYWORD),
    PRINT("print", Category.KEYWORD),
    // ident
    IDENT(null, Category.IDENTIFIER),
    // int const, decimal only, leading zeros allowed
    NUMBER(null, Category.NUMBER),
    // operator (single char)
    ADD("+", Category.OPERATOR),
    SUB("-", Category.OPERATOR),
    MUL("*", Category.OPERATOR),
    DIV("/", Category.OPERATOR),
    ASSIGN("=", Category.OPERATOR),
    // punctuation
    SEMI(";", Category.SYMBOL),
    LPARENT("(", Category.SYMBOL),
    RPARENT(")", Category.SYMBOL),
    // end of input
    EOF(null, Category.EOF),
    ;

    /**
     * 词法报告中输出的类别名
     */
    public enum Category {
        KEYWORD, IDENTIFIER, NUMBER, OPERATOR, SYMBOL, EOF
    }

    private final String text;  // fixed spelling, null for IDENT / NUMBER / EOF
    private final Category category;

    TokenType(final String text, final Category category) {
        this.text = text;
        this.category = category;
    }

    public String getText() {
        return text;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isKeyword() {
        return category == Category.KEYWORD;
    }

    // 关键字精确匹配(区分大小写), 否则为标识符
    public static TokenType ofWord(String word) {
        return switch (word) {
            case "int" -> INT;
            case "print" -> PRINT;
            default -> IDENT;
        };
    }
}
