package cosynth.sema;

public enum BindingKind { SIGNAL, PORT, VARIABLE, TEMPORARY, CONSTANT }
