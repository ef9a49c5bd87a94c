package cosynth.ast.expr;

public record BinaryExpr(
        Expr left,
        Operator op,
        Expr right
) implements Expr {

    public enum Operator {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"),
        SHL("<<"), SHR(">>"),
        BIT_AND("&"), BIT_OR("|"), BIT_XOR("^"),
        EQ("=="), NE("!="), LT("<"), GT(">"), LE("<="), GE(">="),
        AND("&&"), OR("||");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isComparison() {
            return this == EQ || this == NE || this == LT || this == GT || this == LE || this == GE;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }
}
