package io.imagededup.action;

import java.io.IOException;

/**
 * Something a strategy needs prepared before its first action and released
 * after its last one.
 *
 * <p>{@link #setup()} is called at most once per run, before any
 * {@link ResolutionStrategy#execute}. If it succeeds, {@link #teardown()} is
 * called exactly once after all actions, whether they failed or not.</p>
 */
public interface ActionResource {

    void setup() throws IOException;

    void teardown() throws IOException;
}
