package cosynth.sema;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Block scopes of one body (a context or one inlined call), stacked over the
 * design scope.
 */
public final class SymbolTable {
    private final Deque<Scope> scopes = new ArrayDeque<>();

    public SymbolTable(Scope root) {
        scopes.push(new Scope(root));
    }

    public void push() { scopes.push(new Scope(scopes.peek())); }
    public void pop() { scopes.pop(); }

    public void define(Binding b) { scopes.peek().define(b); }

    public Binding lookup(String name) {
        return scopes.peek().lookup(name);
    }
}
