package cosynth.fsm;

import com.google.common.collect.ImmutableList;
import cosynth.ir.IrExpr;
import cosynth.ir.IrStmt;

import java.util.List;

public final class StateGraph {
    private final String context;
    private final List<State> states;
    private final List<Transition> transitions;

    public StateGraph(String context, List<State> states) {
        this.context = context;
        this.states = ImmutableList.copyOf(states);
        ImmutableList.Builder<Transition> out = ImmutableList.builder();
        for (State s : this.states) {
            collect(s.id(), IrExpr.ALWAYS, s.body(), out);
        }
        this.transitions = out.build();
    }

    private static void collect(int from, IrExpr guard, List<IrStmt> body, ImmutableList.Builder<Transition> out) {
        for (IrStmt s : body) {
            if (s instanceof IrStmt.Goto g) {
                out.add(new Transition(from, guard, g.target()));
            } else if (s instanceof IrStmt.If i) {
                collect(from, IrExpr.and(guard, i.condition()), i.thenBranch(), out);
                collect(from, IrExpr.and(guard, IrExpr.not(i.condition())), i.elseBranch(), out);
            }
        }
    }

    public String context() {
        return context;
    }

    public List<State> states() {
        return states;
    }

    public State initial() {
        return states.get(0);
    }

    public State state(int id) {
        return states.get(id);
    }

    public int size() {
        return states.size();
    }

    public boolean isSingleState() {
        return states.size() == 1;
    }

    /** Transitions in discovery order; holds are implicit. */
    public List<Transition> transitions() {
        return transitions;
    }

    public List<Transition> transitionsFrom(int id) {
        return transitions.stream().filter(t -> t.from() == id).collect(ImmutableList.toImmutableList());
    }

    public List<List<IrStmt>> bodies() {
        return states.stream().map(State::body).collect(ImmutableList.toImmutableList());
    }
}
