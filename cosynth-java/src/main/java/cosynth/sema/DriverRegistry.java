package cosynth.sema;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import cosynth.model.Signal;

import java.util.Collection;
import java.util.Set;

/**
 * Drivers of every signal, over all committed contexts. A signal may be
 * driven by at most one context.
 */
public final class DriverRegistry {
    private final SetMultimap<Signal, String> drivers = LinkedHashMultimap.create();

    public void commit(ContextRecord ctx) {
        for (Signal s : ctx.drivers().keySet()) {
            drivers.put(s, ctx.name());
        }
    }

    public Set<String> driversOf(Signal s) {
        return drivers.get(s);
    }

    /** Signals driven by two or more contexts, with those contexts. */
    public ImmutableMap<Signal, Collection<String>> conflicts() {
        ImmutableMap.Builder<Signal, Collection<String>> out = ImmutableMap.builder();
        for (Signal s : drivers.keySet()) {
            Set<String> ctxs = drivers.get(s);
            if (ctxs.size() > 1) out.put(s, Set.copyOf(ctxs));
        }
        return out.build();
    }
}
