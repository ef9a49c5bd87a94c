package cosynth.normalize;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import cosynth.model.Value;

import java.util.List;
import java.util.Map;

/** Call-site arguments after {@code *list} and {@code **dict} expansion. */
record CallArguments(List<Value> positional, Map<String, Value> keywords) {
    CallArguments {
        positional = ImmutableList.copyOf(positional);
        keywords = ImmutableMap.copyOf(keywords);
    }
}
