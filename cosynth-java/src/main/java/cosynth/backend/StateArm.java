package cosynth.backend;

public record StateArm(int state, Runnable body) {}
