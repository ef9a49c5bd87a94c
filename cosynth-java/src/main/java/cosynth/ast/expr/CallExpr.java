package cosynth.ast.expr;

import java.util.List;

public record CallExpr(
        Expr callee,
        List<Argument> args
) implements Expr {

    public enum ArgKind { POSITIONAL, KEYWORD, SPREAD, KEYWORD_SPREAD }

    public record Argument(ArgKind kind, String keyword, Expr value) {
        public static Argument positional(Expr value) {
            return new Argument(ArgKind.POSITIONAL, null, value);
        }

        public static Argument keyword(String name, Expr value) {
            return new Argument(ArgKind.KEYWORD, name, value);
        }
    }
}
