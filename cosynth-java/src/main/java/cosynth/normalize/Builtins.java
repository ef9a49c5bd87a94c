package cosynth.normalize;

import com.google.common.collect.ImmutableList;
import cosynth.diag.CompileException;
import cosynth.diag.ErrorKind;
import cosynth.diag.Location;
import cosynth.model.Builtin;
import cosynth.model.ConstantValue;
import cosynth.model.ConstantValue.IntValue;
import cosynth.model.ConstantValue.ListValue;
import cosynth.model.StorageObject;
import cosynth.model.Value;

import java.util.List;

/**
 * Compile-time builtins. All of them produce constants, so they may be used
 * anywhere a constant is required.
 */
final class Builtins {
    private Builtins() {}

    static ConstantValue apply(Builtin builtin, CallArguments args, int maxUnroll, Location at) {
        if (!args.keywords().isEmpty()) {
            throw unsupported(at, builtin.label() + "() takes no keyword arguments");
        }
        List<Value> a = args.positional();
        switch (builtin) {
            case RANGE:
                return range(a, maxUnroll, at);
            case LEN:
                arity(builtin, a, 1, 1, at);
                return len(a.get(0), at);
            case ENUMERATE:
                arity(builtin, a, 1, 2, at);
                return enumerate(list(builtin, a.get(0), at), a.size() == 2 ? integer(builtin, a.get(1), at) : 0);
            case ZIP:
                return zip(builtin, a, at);
            default:
                throw new IllegalStateException("Unknown builtin " + builtin);
        }
    }

    private static ListValue range(List<Value> a, int maxUnroll, Location at) {
        arity(Builtin.RANGE, a, 1, 3, at);
        long start = 0;
        long stop;
        long step = 1;
        if (a.size() == 1) {
            stop = integer(Builtin.RANGE, a.get(0), at);
        } else {
            start = integer(Builtin.RANGE, a.get(0), at);
            stop = integer(Builtin.RANGE, a.get(1), at);
            if (a.size() == 3) step = integer(Builtin.RANGE, a.get(2), at);
        }
        if (step == 0) throw unsupported(at, "range() step must not be zero");
        return ints(start, stop, step, maxUnroll, at);
    }

    /** Integers from start towards stop, stop excluded. Fails past {@code limit} elements. */
    static ListValue ints(long start, long stop, long step, int limit, Location at) {
        // counted unsigned so that wide bounds cannot overflow
        long count = 0;
        if (step > 0 && start < stop) {
            count = Long.divideUnsigned(stop - start - 1, step) + 1;
        } else if (step < 0 && start > stop) {
            count = Long.divideUnsigned(start - stop - 1, -step) + 1;
        }
        if (Long.compareUnsigned(count, limit) > 0) {
            throw unsupported(at, "Range from " + start + " to " + stop + " step " + step + " has "
                    + Long.toUnsignedString(count) + " elements, more than max-unroll " + limit);
        }
        ImmutableList.Builder<Value> out = ImmutableList.builder();
        for (long k = 0; k < count; k++) out.add(ConstantValue.of(start + k * step));
        return new ListValue(out.build());
    }

    private static ConstantValue len(Value v, Location at) {
        if (v instanceof ListValue l) return ConstantValue.of(l.size());
        if (v instanceof ConstantValue.StringValue s) return ConstantValue.of(s.value().length());
        if (v instanceof ConstantValue.DictValue d) return ConstantValue.of(d.entries().size());
        // width of a vector-typed storage object
        if (v instanceof StorageObject o && o.type().width() > 0) return ConstantValue.of(o.type().width());
        throw unsupported(at, "len() is not applicable to " + v);
    }

    private static ListValue enumerate(ListValue list, long start) {
        ImmutableList.Builder<Value> out = ImmutableList.builder();
        long i = start;
        for (Value e : list.elements()) {
            out.add(new ListValue(List.of(ConstantValue.of(i++), e)));
        }
        return new ListValue(out.build());
    }

    private static ListValue zip(Builtin builtin, List<Value> a, Location at) {
        if (a.isEmpty()) return new ListValue(List.of());
        int n = Integer.MAX_VALUE;
        ImmutableList.Builder<ListValue> lists = ImmutableList.builder();
        for (Value v : a) {
            ListValue l = list(builtin, v, at);
            n = Math.min(n, l.size());
            lists.add(l);
        }
        List<ListValue> all = lists.build();
        ImmutableList.Builder<Value> out = ImmutableList.builder();
        for (int i = 0; i < n; i++) {
            ImmutableList.Builder<Value> row = ImmutableList.builder();
            for (ListValue l : all) row.add(l.elements().get(i));
            out.add(new ListValue(row.build()));
        }
        return new ListValue(out.build());
    }

    private static void arity(Builtin b, List<Value> a, int min, int max, Location at) {
        if (a.size() < min || a.size() > max) {
            throw unsupported(at, b.label() + "() takes " + (min == max ? min : min + " to " + max)
                    + " arguments, got " + a.size());
        }
    }

    private static long integer(Builtin b, Value v, Location at) {
        if (v instanceof IntValue i) return i.value();
        throw unsupported(at, b.label() + "() expects a constant integer, got " + v);
    }

    private static ListValue list(Builtin b, Value v, Location at) {
        if (v instanceof ListValue l) return l;
        throw unsupported(at, b.label() + "() expects a compile-time list, got " + v);
    }

    private static CompileException unsupported(Location at, String message) {
        return new CompileException(ErrorKind.UNSUPPORTED_CONSTRUCT, at, message);
    }
}
