package cosynth.fsm;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.common.flogger.LazyArgs;
import cosynth.diag.CompileException;
import cosynth.diag.ErrorKind;
import cosynth.diag.Location;
import cosynth.ir.IrExpr;
import cosynth.ir.IrPrinter;
import cosynth.ir.IrStmt;
import cosynth.ir.IrWalker;
import cosynth.settings.CompilerSettings;
import cosynth.settings.Configuration;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds an explicit state machine from a sequential context body.
 *
 * <p>Generation is continuation-based: a state is identified by the IR
 * position it resumes at (and whether it is the waiting half of an await),
 * and its body is everything executed from there until the next transition.
 * Code reachable from several positions is duplicated into each state.
 *
 * <p>Within one state's generation, a loop head entered on the current path
 * is <em>fresh</em>: reaching the end of its body again must take a transition
 * so every iteration costs at least one cycle.
 */
public final class StateMachineSynthesizer {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private record Key(Cursor cursor, boolean waiting) {}

    private final int maxStates;

    private final Map<Key, Integer> ids = new HashMap<>();
    private final List<Key> keys = new ArrayList<>();
    private final Deque<Integer> pending = new ArrayDeque<>();
    private String context;

    public StateMachineSynthesizer(Configuration config) {
        this.maxStates = config.get(CompilerSettings.maxStates);
    }

    public StateGraph synthesize(String context, List<IrStmt> body, Location loc) {
        this.context = context;
        ids.clear();
        keys.clear();
        pending.clear();

        // the body restarts once it completes
        List<IrStmt> root = ImmutableList.of(new IrStmt.While(IrExpr.ALWAYS, body, loc));
        stateFor(Cursor.root(root), false, loc);

        List<State> states = new ArrayList<>();
        while (!pending.isEmpty()) {
            int id = pending.poll();
            Key key = keys.get(id);
            List<IrStmt> out = new ArrayList<>();
            if (key.waiting()) {
                waitingBody(key.cursor(), out, loc);
            } else {
                Cursor c = key.cursor();
                if (c.current() instanceof IrStmt.While) {
                    head(c, out, new HashSet<>());
                } else {
                    run(c, out, new HashSet<>());
                }
            }
            states.add(new State(id, out, key.waiting(), key.cursor().current().loc()));
        }

        StateGraph graph = new StateGraph(context, states);
        logger.atFine().log("%s: %d states\n%s", context, graph.size(), LazyArgs.lazy(() -> describe(graph)));
        return graph;
    }

    private int stateFor(Cursor cursor, boolean waiting, Location at) {
        Key key = new Key(waiting ? cursor : cursor.canonical(), waiting);
        Integer id = ids.get(key);
        if (id != null) return id;
        if (keys.size() >= maxStates) {
            throw new CompileException(ErrorKind.UNBOUNDED_DUPLICATION, at,
                    "State machine of '" + context + "' exceeds " + maxStates + " states");
        }
        int fresh = keys.size();
        ids.put(key, fresh);
        keys.add(key);
        pending.add(fresh);
        return fresh;
    }

    /** Emits from {@code c} until every path has taken a transition. */
    private void run(Cursor c, List<IrStmt> out, Set<Cursor> fresh) {
        while (true) {
            if (c.atEnd()) {
                switch (c.kind()) {
                    case BRANCH -> {
                        c = c.parent().next();
                        continue;
                    }
                    case LOOP -> {
                        Cursor loop = c.parent();
                        if (fresh.contains(loop)) {
                            out.add(new IrStmt.Goto(stateFor(loop, false, loop.current().loc())));
                        } else {
                            head(loop, out, fresh);
                        }
                        return;
                    }
                    case ROOT -> throw new IllegalStateException("Fell off the end of the root body");
                }
            }

            IrStmt s = c.current();
            if (s instanceof IrStmt.While) {
                out.add(new IrStmt.Goto(stateFor(c, false, s.loc())));
                return;
            }
            if (s instanceof IrStmt.Await a) {
                await(c, a, out);
                return;
            }
            if (s instanceof IrStmt.If i && hasControl(i)) {
                List<IrStmt> thenOut = new ArrayList<>();
                run(c.enterBranch(i.thenBranch()), thenOut, new HashSet<>(fresh));
                List<IrStmt> elseOut = new ArrayList<>();
                run(c.enterBranch(i.elseBranch()), elseOut, new HashSet<>(fresh));
                out.add(new IrStmt.If(i.condition(), thenOut, elseOut, i.loc()));
                return;
            }
            if (s instanceof IrStmt.Break) {
                // normal loop exit, without re-testing the head
                run(c.enclosingLoop().next(), out, fresh);
                return;
            }
            if (s instanceof IrStmt.Continue) {
                Cursor loop = c.enclosingLoop();
                if (fresh.contains(loop)) {
                    throw new CompileException(ErrorKind.UNBOUNDED_DUPLICATION, s.loc(),
                            "'continue' reaches its loop head without passing a suspension point");
                }
                head(loop, out, fresh);
                return;
            }
            out.add(s);
            c = c.next();
        }
    }

    /** Loop head code: {@code if cond { body } else { after loop }}. */
    private void head(Cursor loop, List<IrStmt> out, Set<Cursor> fresh) {
        IrStmt.While w = (IrStmt.While) loop.current();
        Set<Cursor> entered = new HashSet<>(fresh);
        entered.add(loop);
        if (IrExpr.isConstTrue(w.condition())) {
            run(loop.enterLoop(), out, entered);
            return;
        }
        List<IrStmt> body = new ArrayList<>();
        run(loop.enterLoop(), body, new HashSet<>(entered));
        List<IrStmt> after = new ArrayList<>();
        run(loop.next(), after, entered);
        out.add(new IrStmt.If(w.condition(), body, after, w.loc()));
    }

    private void await(Cursor c, IrStmt.Await a, List<IrStmt> out) {
        IrExpr cond = a.condition();
        if (IrExpr.isConstTrue(cond)) {
            out.add(new IrStmt.Goto(stateFor(c.next(), false, a.loc())));
        } else if (IrExpr.isConstFalse(cond)) {
            out.add(new IrStmt.Goto(stateFor(c, true, a.loc())));
        } else {
            int next = stateFor(c.next(), false, a.loc());
            int wait = stateFor(c, true, a.loc());
            out.add(new IrStmt.If(cond, List.of(new IrStmt.Goto(next)), List.of(new IrStmt.Goto(wait)), a.loc()));
        }
    }

    /** The waiting half of an await: leave once the condition holds, hold otherwise. */
    private void waitingBody(Cursor c, List<IrStmt> out, Location loc) {
        IrStmt.Await a = (IrStmt.Await) c.current();
        if (IrExpr.isConstFalse(a.condition())) return;
        int next = stateFor(c.next(), false, loc);
        out.add(new IrStmt.If(a.condition(), List.of(new IrStmt.Goto(next)), List.of(), a.loc()));
    }

    private static boolean hasControl(IrStmt.If i) {
        boolean[] found = {false};
        IrWalker.statements(List.of(i), s -> {
            if (s instanceof IrStmt.Await || s instanceof IrStmt.While
                    || s instanceof IrStmt.Break || s instanceof IrStmt.Continue) {
                found[0] = true;
            }
        });
        return found[0];
    }

    private static String describe(StateGraph graph) {
        StringBuilder sb = new StringBuilder();
        for (State s : graph.states()) {
            sb.append("state ").append(s.id()).append(s.waiting() ? " (waiting)" : "").append(":\n");
            sb.append(IrPrinter.print(s.body()));
        }
        return sb.toString();
    }
}
