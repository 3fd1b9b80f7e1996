package org.stianloader.jarresolver.deploy;

import org.jetbrains.annotations.NotNull;
import org.stianloader.jarresolver.Dependency;

/**
 * Decides whether a differing version of an artifact that is already present in a destination directory
 * may be replaced.
 */
@FunctionalInterface
public interface OverwriteConfirmation {

    /**
     * Asks whether the deployed copy of an artifact may be replaced by another version.
     *
     * @param oldDependency The version that is present in the destination directory. It is not bound to any repository.
     * @param newDependency The version that should be deployed
     * @return True to delete all other versions and deploy the new one, false to leave the directory untouched
     */
    boolean confirm(@NotNull Dependency oldDependency, @NotNull Dependency newDependency);
}
