package cosynth.ast;

import cosynth.ast.decl.*;

import java.util.List;

public record DesignUnit(
        String name,
        List<PortDecl> ports,
        List<SignalDecl> signals,
        List<ConstDecl> constants,
        List<FunctionDecl> functions,
        List<ContextDecl> contexts
) {}
