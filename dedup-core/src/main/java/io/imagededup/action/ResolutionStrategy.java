package io.imagededup.action;

import java.io.IOException;

/**
 * What to do with a duplicate once the keeper is chosen.
 */
public interface ResolutionStrategy {

    /**
     * Handles one duplicate.
     *
     * @param keep The file that stays
     * @param remove The duplicate to resolve
     * @throws IOException if the action failed for this pair only
     */
    void execute(ImageFile keep, ImageFile remove) throws IOException;

    /**
     * Returns the resource bracketing all {@link #execute} calls of a run,
     * or {@code null} if the strategy needs none.
     */
    ActionResource getResources();
}
