package org.stianloader.jarresolver.deploy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.jarresolver.Dependency;
import org.stianloader.jarresolver.ResolutionException;
import org.stianloader.jarresolver.internal.FileUtil;
import org.stianloader.jarresolver.logging.LoggingAdapter;
import org.stianloader.jarresolver.repo.Packaging;
import org.stianloader.jarresolver.version.VersionSpec;

/**
 * Copies resolved artifacts into a destination directory, making sure that the directory holds at most one
 * version of every artifact.
 *
 * <p>Deployed artifacts are named "artifact-version.extension". Unpacked copies, which are directories
 * named "artifact-version", are recognised too. Copying is incremental: an artifact that is already
 * present in the same version is only replaced if the repository holds a newer file. Modification times are
 * compared at millisecond precision. A copy of the same version with another packaging is removed without asking.
 */
public class ArtifactDeployer {

    @NotNull
    private static final Pattern VERSION_PREFIX = Pattern.compile("^([0-9.]+)");

    @Nullable
    static String extractVersion(@NotNull String artifact, @NotNull Path entry) {
        String name = entry.getFileName().toString();
        if (!Files.isDirectory(entry)) {
            name = FileUtil.stripExtension(name);
        }
        String prefix = artifact + '-';
        if (!name.startsWith(prefix)) {
            return null;
        }
        Matcher matcher = ArtifactDeployer.VERSION_PREFIX.matcher(name.substring(prefix.length()));
        if (!matcher.find()) {
            return null;
        }
        String version = matcher.group(1);
        while (version.endsWith(".")) {
            version = version.substring(0, version.length() - 1);
        }
        return version.isEmpty() ? null : version;
    }

    @NotNull
    private final LoggingAdapter logger;

    public ArtifactDeployer() {
        this(LoggingAdapter.getDefaultLogger());
    }

    public ArtifactDeployer(@NotNull LoggingAdapter logger) {
        this.logger = Objects.requireNonNull(logger, "logger may not be null");
    }

    /**
     * Copies the best version of every passed dependency into a destination directory.
     *
     * @param candidates The resolved dependencies, as returned by {@link org.stianloader.jarresolver.ResolutionEngine}
     * @param destDir The directory to deploy to. It is created if it does not exist
     * @param confirmer Asked before other versions of an artifact are removed, null to always remove them
     * @return The changes made to the directory
     * @throws ResolutionException If the artifact file of a candidate no longer exists
     * @throws UncheckedIOException If the directory could not be read or written
     */
    @NotNull
    public DeploymentResult copyDependencies(@NotNull Map<@NotNull String, @NotNull Dependency> candidates, @NotNull Path destDir, @Nullable OverwriteConfirmation confirmer) {
        DeploymentResult result = new DeploymentResult();
        try {
            Files.createDirectories(destDir);
            for (Dependency candidate : candidates.values()) {
                this.deploy(candidate, destDir, confirmer, result);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to deploy artifacts to " + destDir, e);
        }
        return result;
    }

    private void deploy(@NotNull Dependency candidate, @NotNull Path destDir, @Nullable OverwriteConfirmation confirmer, @NotNull DeploymentResult result) throws IOException {
        String best = candidate.getBestVersion();
        if (best == null) {
            throw new ResolutionException("Dependency " + candidate + " was not resolved to a concrete version");
        }

        Packaging packaging = Packaging.locatePackaging(candidate);
        if (packaging == null) {
            throw new ResolutionException("Cannot find the artifact file of " + candidate.getResolvedKey() + " in " + candidate.getBestVersionPath());
        }
        Path source = packaging.getSourceFile(candidate);
        Path destination = destDir.resolve(candidate.getArtifact() + '-' + best + packaging.getDeployedExtension());
        Path unpacked = destDir.resolve(candidate.getArtifact() + '-' + best);

        List<Path> conflicting = new ArrayList<>();
        List<Path> stale = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(destDir, candidate.getArtifact() + "-*")) {
            for (Path entry : ds) {
                String version = ArtifactDeployer.extractVersion(candidate.getArtifact(), entry);
                if (version == null) {
                    continue;
                }
                if (VersionSpec.compare(version, best) != 0) {
                    conflicting.add(entry);
                    continue;
                }
                String name = entry.getFileName().toString();
                if (!name.equals(destination.getFileName().toString()) && !name.equals(unpacked.getFileName().toString())) {
                    // Same version, other packaging
                    stale.add(entry);
                }
            }
        }
        Collections.sort(conflicting);
        Collections.sort(stale);

        if (!conflicting.isEmpty()) {
            String deployedVersion = Objects.requireNonNull(ArtifactDeployer.extractVersion(candidate.getArtifact(), conflicting.get(0)));
            Dependency deployed = new Dependency(candidate.getGroup(), candidate.getArtifact(), deployedVersion);
            if (confirmer != null && !confirmer.confirm(deployed, candidate)) {
                this.logger.info(ArtifactDeployer.class, "Keeping {} in {}, not deploying {}", deployed.getKey(), destDir, candidate.getResolvedKey());
                result.addDeclined(Objects.requireNonNull(candidate.getResolvedKey()));
                return;
            }
            for (Path entry : conflicting) {
                this.logger.debug(ArtifactDeployer.class, "Removing {}", entry);
                FileUtil.delete(entry);
                result.addRemoved(entry);
            }
        }
        for (Path entry : stale) {
            this.logger.debug(ArtifactDeployer.class, "Removing {}, it is packaged differently than {}", entry, destination);
            FileUtil.delete(entry);
            result.addRemoved(entry);
        }

        Path existing = null;
        if (Files.exists(destination)) {
            existing = destination;
        } else if (Files.isDirectory(unpacked)) {
            existing = unpacked;
        }

        if (existing != null) {
            // Copies do not keep sub-millisecond modification times on every platform
            long sourceTime = Files.getLastModifiedTime(source).toMillis();
            long existingTime = Files.getLastModifiedTime(existing).toMillis();
            if (sourceTime <= existingTime) {
                result.addUpToDate(existing);
                return;
            }
            this.logger.debug(ArtifactDeployer.class, "{} is outdated, replacing it", existing);
            FileUtil.delete(existing);
        }

        this.logger.debug(ArtifactDeployer.class, "Copying {} to {}", source, destination);
        Files.copy(source, destination, StandardCopyOption.COPY_ATTRIBUTES, StandardCopyOption.REPLACE_EXISTING);
        result.addCopied(destination);
    }
}
