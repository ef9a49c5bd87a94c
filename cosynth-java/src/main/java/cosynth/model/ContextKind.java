package cosynth.model;

public enum ContextKind { CONCURRENT, SEQUENTIAL }
