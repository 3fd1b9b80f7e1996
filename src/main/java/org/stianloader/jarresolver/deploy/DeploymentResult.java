package org.stianloader.jarresolver.deploy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The changes that {@link ArtifactDeployer#copyDependencies(java.util.Map, Path, OverwriteConfirmation)}
 * made to a destination directory.
 */
public class DeploymentResult {

    @NotNull
    private final List<@NotNull Path> copied = new ArrayList<>();
    @NotNull
    private final List<@NotNull String> declined = new ArrayList<>();
    @NotNull
    private final List<@NotNull Path> removed = new ArrayList<>();
    @NotNull
    private final List<@NotNull Path> upToDate = new ArrayList<>();

    void addCopied(@NotNull Path path) {
        this.copied.add(path);
    }

    void addDeclined(@NotNull String resolvedKey) {
        this.declined.add(resolvedKey);
    }

    void addRemoved(@NotNull Path path) {
        this.removed.add(path);
    }

    void addUpToDate(@NotNull Path path) {
        this.upToDate.add(path);
    }

    /**
     * The files that were written to the destination directory.
     *
     * @return The copied files
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull Path> getCopied() {
        return Collections.unmodifiableList(this.copied);
    }

    /**
     * The artifacts that were not deployed because replacing the already deployed version was declined.
     *
     * @return The keys of the artifacts with the versions that would have been deployed
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getDeclined() {
        return Collections.unmodifiableList(this.declined);
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull Path> getRemoved() {
        return Collections.unmodifiableList(this.removed);
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull Path> getUpToDate() {
        return Collections.unmodifiableList(this.upToDate);
    }

    @Override
    public String toString() {
        return "DeploymentResult[copied=" + this.copied + ", removed=" + this.removed + ", upToDate=" + this.upToDate + ", declined=" + this.declined + "]";
    }
}
