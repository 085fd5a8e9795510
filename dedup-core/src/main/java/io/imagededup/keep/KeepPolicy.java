package io.imagededup.keep;

import io.imagededup.ActionDecision;

import java.nio.file.Path;
import java.util.List;

/**
 * Decides which member of a duplicate group survives.
 *
 * <p>For n >= 2 paths the decision keeps exactly one and removes the other n-1,
 * each exactly once. An empty input gives {@link ActionDecision#empty()}, a
 * single path is kept with nothing to remove.</p>
 */
@FunctionalInterface
public interface KeepPolicy {

    ActionDecision decide(List<Path> paths);
}
