package cosynth.sema;

import cosynth.diag.Location;
import cosynth.model.Value;

public record Binding(String name, Value value, BindingKind kind, Location loc) {}
