package ir;

/**
 * 三地址码的一条指令, 文本形式即 toString()
 * 操作数为字面量, 变量名或临时变量 t&lt;N&gt;
 */
public abstract class Instr {

    // <name> = <operand>
    public static class Move extends Instr {
        private final String dst;
        private final String src;

        public Move(String dst, String src) {
            this.dst = dst;
            this.src = src;
        }

        public String getDst() {
            return dst;
        }

        public String getSrc() {
            return src;
        }

        @Override
        public String toString() {
            return dst + " = " + src;
        }
    }

    // 二元算术运算: <temp> = <operand> <op> <operand>
    public static class Alu extends Instr {

        public enum Op {
            ADD("+"), SUB("-"), MUL("*"), DIV("/");
            private final String name;

            private Op(final String name) {
                this.name = name;
            }

            public String getName() {
                return this.name;
            }

            public static Op of(String text) {
                for (Op op : values()) {
                    if (op.name.equals(text)) {
                        return op;
                    }
                }
                throw new AssertionError("Bad Alu Op " + text);
            }
        }

        private final String dst;
        private final Op op;
        private final String rVal1;
        private final String rVal2;

        public Alu(String dst, Op op, String rVal1, String rVal2) {
            this.dst = dst;
            this.op = op;
            this.rVal1 = rVal1;
            this.rVal2 = rVal2;
        }

        public String getDst() {
            return dst;
        }

        public Op getOp() {
            return this.op;
        }

        public String getRVal1() {
            return rVal1;
        }

        public String getRVal2() {
            return rVal2;
        }

        @Override
        public String toString() {
            return dst + " = " + rVal1 + " " + op.getName() + " " + rVal2;
        }
    }

    // print <operand>
    public static class Print extends Instr {
        private final String operand;

        public Print(String operand) {
            this.operand = operand;
        }

        public String getOperand() {
            return operand;
        }

        @Override
        public String toString() {
            return "print " + operand;
        }
    }
}
