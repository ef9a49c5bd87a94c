package cosynth.normalize;

import com.google.common.collect.ImmutableList;
import cosynth.diag.Location;
import cosynth.ir.IrStmt;
import cosynth.model.Clock;
import cosynth.model.ContextKind;
import cosynth.model.Reset;
import cosynth.model.Temporary;
import cosynth.model.Variable;

import java.util.List;

/**
 * One context after normalization: a flat statement sequence plus the
 * process-local storage it introduced.
 */
public record NormalizedContext(
        String name,
        ContextKind kind,
        Clock clock,             // null: unclocked
        Reset reset,             // null: no reset
        List<IrStmt> body,
        List<Variable> variables,
        List<Temporary> temporaries,
        Location loc
) {
    public NormalizedContext {
        body = ImmutableList.copyOf(body);
        variables = ImmutableList.copyOf(variables);
        temporaries = ImmutableList.copyOf(temporaries);
    }
}
