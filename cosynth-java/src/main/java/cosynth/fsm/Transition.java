package cosynth.fsm;

import cosynth.ir.IrExpr;

/** A guarded edge; {@link IrExpr#ALWAYS} when unconditional. */
public record Transition(int from, IrExpr guard, int to) {}
