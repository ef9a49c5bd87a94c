package cosynth.model;

public record Reset(Signal signal, boolean async, boolean activeLow) {}
