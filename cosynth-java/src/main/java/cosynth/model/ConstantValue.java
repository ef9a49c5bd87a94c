package cosynth.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import cosynth.ast.decl.FunctionDecl;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compile-time world. Constants drive branch selection, loop unrolling and
 * inlining; they never become storage themselves.
 */
public sealed interface ConstantValue extends Value
        permits ConstantValue.IntValue, ConstantValue.BoolValue, ConstantValue.StringValue,
        ConstantValue.ListValue, ConstantValue.DictValue, ConstantValue.FunctionValue,
        ConstantValue.BuiltinValue, ConstantValue.NoneValue {

    record IntValue(long value) implements ConstantValue {
        @Override
        public String toString() { return Long.toString(value); }
    }

    record BoolValue(boolean value) implements ConstantValue {
        public static final BoolValue TRUE = new BoolValue(true);
        public static final BoolValue FALSE = new BoolValue(false);

        public static BoolValue of(boolean v) { return v ? TRUE : FALSE; }

        @Override
        public String toString() { return Boolean.toString(value); }
    }

    record StringValue(String value) implements ConstantValue {
        @Override
        public String toString() { return "\"" + value + "\""; }
    }

    /** Fixed-size container; elements may be storage objects. */
    record ListValue(List<Value> elements) implements ConstantValue {
        public ListValue {
            elements = ImmutableList.copyOf(elements);
        }

        public int size() { return elements.size(); }

        @Override
        public String toString() {
            return elements.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /** Keyword-rest container collected by a {@code **name} parameter. */
    record DictValue(Map<String, Value> entries) implements ConstantValue {
        public DictValue {
            entries = ImmutableMap.copyOf(entries);
        }
    }

    record FunctionValue(FunctionDecl decl) implements ConstantValue {
        @Override
        public String toString() { return (decl.coroutine() ? "async fn " : "fn ") + decl.name(); }
    }

    record BuiltinValue(Builtin builtin) implements ConstantValue {
        @Override
        public String toString() { return builtin.label(); }
    }

    record NoneValue() implements ConstantValue {
        public static final NoneValue INSTANCE = new NoneValue();

        @Override
        public String toString() { return "none"; }
    }

    static IntValue of(long v) {
        return new IntValue(v);
    }

    static BoolValue of(boolean v) {
        return BoolValue.of(v);
    }
}
