package org.stianloader.jarresolver.repo;

import java.nio.file.Files;
import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.jarresolver.Dependency;

/**
 * The kinds of artifact files that may back a dependency, in the order in which they are looked up.
 */
public enum Packaging {

    AAR(".aar", ".aar"),
    JAR(".jar", ".jar"),
    /**
     * An android library shipped as sources. It is deployed under the ".aar" extension.
     */
    SRCAAR(".srcaar", ".aar");

    /**
     * Obtains the artifact file of the {@link Dependency#getBestVersion() best version} of a dependency.
     *
     * @param dependency The bound dependency
     * @return The first existing artifact file, or null if the dependency is unbound or no file exists
     */
    @Nullable
    public static Path locate(@NotNull Dependency dependency) {
        Packaging packaging = Packaging.locatePackaging(dependency);
        if (packaging == null) {
            return null;
        }
        return packaging.getSourceFile(dependency);
    }

    @Nullable
    public static Packaging locatePackaging(@NotNull Dependency dependency) {
        Path dir = dependency.getBestVersionPath();
        if (dir == null) {
            return null;
        }
        for (Packaging packaging : Packaging.values()) {
            if (Files.isRegularFile(packaging.getSourceFile(dependency))) {
                return packaging;
            }
        }
        return null;
    }

    @NotNull
    private final String deployedExtension;
    @NotNull
    private final String extension;

    private Packaging(@NotNull String extension, @NotNull String deployedExtension) {
        this.extension = extension;
        this.deployedExtension = deployedExtension;
    }

    @NotNull
    public String getDeployedExtension() {
        return this.deployedExtension;
    }

    @NotNull
    public String getExtension() {
        return this.extension;
    }

    /**
     * Obtains the file name the artifact would have within the repository, regardless of whether it exists.
     *
     * @param dependency The bound dependency
     * @return The path of the artifact file
     * @throws IllegalStateException If the dependency has no best version
     */
    @NotNull
    public Path getSourceFile(@NotNull Dependency dependency) {
        Path dir = dependency.getBestVersionPath();
        if (dir == null) {
            throw new IllegalStateException("Dependency " + dependency + " is not bound to a concrete version");
        }
        return dir.resolve(dependency.getArtifact() + '-' + dependency.getBestVersion() + this.extension);
    }
}
