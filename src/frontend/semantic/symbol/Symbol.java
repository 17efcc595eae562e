package frontend.semantic.symbol;

/**
 * 符号表中的一条符号信息
 */
public class Symbol {

    // 语言中唯一的类型
    public enum Type {
        INT("int");

        private final String name;

        Type(final String name) {
            this.name = name;
        }

        public String getName() {
            return this.name;
        }

        @Override
        public String toString() {
            return this.name;
        }
    }

    private final String name; // 变量名称
    private final Type type; // 变量类型

    public Symbol(final String name, final Type type) {
        assert name != null;
        assert type != null;
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return this.name;
    }

    public Type getType() {
        return this.type;
    }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
