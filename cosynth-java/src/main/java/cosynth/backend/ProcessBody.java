package cosynth.backend;

import com.google.common.collect.ImmutableList;
import cosynth.model.StorageObject;

import java.util.List;

/**
 * @param locals process-local variables and named temporaries
 * @param reset  emits the reset assignments; null when the process has no reset
 * @param body   emits the statements run on every active clock edge
 */
public record ProcessBody(List<StorageObject> locals, Runnable reset, Runnable body) {
    public ProcessBody {
        locals = ImmutableList.copyOf(locals);
    }
}
