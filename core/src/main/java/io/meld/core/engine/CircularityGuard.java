package io.meld.core.engine;

import io.meld.core.error.CircularImportException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-flight import/embed stack. A file that is entered again while still on the stack is a cycle.
 *
 * <p>
 * Callers pair {@link #beginImport} with {@link #endImport} in a {@code try/finally} around any
 * recursive parse and interpret. One guard belongs to one root run; it is not safe to share
 * between concurrent interpretations.
 */
public final class CircularityGuard {

    private static final Logger LOG = LoggerFactory.getLogger(CircularityGuard.class);

    private final List<String> stack = new ArrayList<>();

    /**
     * Pushes {@code id}.
     *
     * @throws CircularImportException with the chain {@code [...stack, id]} if {@code id} is already
     *     on the stack; nothing is pushed in that case
     */
    public void beginImport(String id) {
        if (stack.contains(id)) {
            List<String> chain = new ArrayList<>(stack);
            chain.add(id);
            throw new CircularImportException(chain);
        }
        stack.add(id);
        LOG.debug("Begin import {} (depth {})", id, stack.size());
    }

    /** Removes the last occurrence of {@code id}; no-op if absent. */
    public void endImport(String id) {
        int index = stack.lastIndexOf(id);
        if (index >= 0) {
            stack.remove(index);
            LOG.debug("End import {} (depth {})", id, stack.size());
        }
    }

    public boolean isInStack(String id) {
        return stack.contains(id);
    }

    /** Snapshot of the stack, outermost first. */
    public List<String> getImportStack() {
        return List.copyOf(stack);
    }

    public void reset() {
        stack.clear();
    }
}
