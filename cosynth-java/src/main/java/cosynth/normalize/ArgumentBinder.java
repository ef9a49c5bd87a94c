package cosynth.normalize;

import cosynth.ast.decl.FunctionDecl;
import cosynth.ast.expr.Expr;
import cosynth.diag.CompileException;
import cosynth.diag.ErrorKind;
import cosynth.diag.Location;
import cosynth.model.ConstantValue;
import cosynth.model.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Matches call-site arguments to a function's parameters.
 */
final class ArgumentBinder {
    private ArgumentBinder() {}

    /**
     * @param defaults evaluates a parameter default; defaults live in the design scope
     * @return parameter name to bound value, in parameter order
     */
    static Map<String, Value> bind(FunctionDecl fn, CallArguments args, Function<Expr, Value> defaults, Location at) {
        Map<String, Value> bound = new LinkedHashMap<>();
        Map<String, Value> keywords = new LinkedHashMap<>(args.keywords());
        List<Value> positional = args.positional();
        int next = 0;

        for (FunctionDecl.Param p : fn.params()) {
            switch (p.kind()) {
                case POSITIONAL -> {
                    if (next < positional.size()) {
                        if (keywords.containsKey(p.name())) {
                            throw arity(at, fn.name() + "() got multiple values for '" + p.name() + "'");
                        }
                        bound.put(p.name(), positional.get(next++));
                    } else if (keywords.containsKey(p.name())) {
                        bound.put(p.name(), keywords.remove(p.name()));
                    } else if (p.defaultValue() != null) {
                        bound.put(p.name(), defaults.apply(p.defaultValue()));
                    } else {
                        throw arity(at, fn.name() + "() missing argument '" + p.name() + "'");
                    }
                }
                case REST -> {
                    bound.put(p.name(), new ConstantValue.ListValue(positional.subList(next, positional.size())));
                    next = positional.size();
                }
                case KEYWORD_REST -> {
                    bound.put(p.name(), new ConstantValue.DictValue(keywords));
                    keywords.clear();
                }
            }
        }

        if (next < positional.size()) {
            throw arity(at, fn.name() + "() takes " + next + " positional arguments, got " + positional.size());
        }
        if (!keywords.isEmpty()) {
            throw arity(at, fn.name() + "() got unexpected keyword arguments " + keywords.keySet());
        }
        return bound;
    }

    private static CompileException arity(Location at, String message) {
        return new CompileException(ErrorKind.UNSUPPORTED_CONSTRUCT, at, message);
    }
}
