package hrl.java.store;

import java.util.List;

/**
 * Ordered, at-least-once feed of item mutations.
 */
public interface ChangeStream {

    /**
     * Returns up to {@code maxEvents} pending events, oldest first. Never blocks.
     */
    List<ChangeEvent> poll(int maxEvents);
}
