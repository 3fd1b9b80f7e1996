package org.stianloader.jarresolver.repo;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import javax.xml.parsers.ParserConfigurationException;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.jarresolver.ConfigurationException;
import org.stianloader.jarresolver.Dependency;
import org.stianloader.jarresolver.GAV;
import org.stianloader.jarresolver.internal.ConfusedResolverException;
import org.stianloader.jarresolver.internal.meta.PackageManifest;
import org.stianloader.jarresolver.internal.meta.PackageManifest.SkippedRecord;
import org.stianloader.jarresolver.internal.meta.VersionCatalogue;
import org.stianloader.jarresolver.logging.LoggingAdapter;
import org.xml.sax.SAXException;

/**
 * Looks up installed artifacts within an ordered list of local maven repositories.
 *
 * <p>Repository roots are plain paths, optionally starting with the {@link #SDK_TOKEN} which refers
 * to the SDK directory. Unless configured otherwise, the SDK directory is read from the
 * {@value #SDK_ENVIRONMENT_VARIABLE} environment variable at the time the root is needed.
 * The roots are searched in the order they were added in, the default SDK repositories always come first.
 */
public class RepositoryScanner {

    @NotNull
    public static final String SDK_ENVIRONMENT_VARIABLE = "ANDROID_HOME";

    @NotNull
    public static final String SDK_TOKEN = "$SDK";

    @NotNull
    public static final List<@NotNull String> DEFAULT_REPOSITORIES = Collections.unmodifiableList(List.of(
            RepositoryScanner.SDK_TOKEN + "/extras/android/m2repository",
            RepositoryScanner.SDK_TOKEN + "/extras/google/m2repository"));

    @NotNull
    private Function<@NotNull String, @Nullable String> environment = System::getenv;

    /**
     * Whether to pretend that dependencies with the "test" scope do not exist when reading
     * the transitive dependencies of an artifact.
     */
    public boolean ignoreTestDependencies = true;

    /**
     * Whether to pretend that dependencies marked as "optional" do not exist when reading
     * the transitive dependencies of an artifact. This mirrors standard maven behaviour.
     */
    public boolean ignoreOptionalDependencies = true;

    @NotNull
    private final LoggingAdapter logger;
    @NotNull
    private final List<@NotNull String> repositories = new ArrayList<>(RepositoryScanner.DEFAULT_REPOSITORIES);
    @Nullable
    private final Path sdkPath;

    public RepositoryScanner(@Nullable Path sdkPath) {
        this(sdkPath, LoggingAdapter.getDefaultLogger());
    }

    public RepositoryScanner(@Nullable Path sdkPath, @NotNull LoggingAdapter logger) {
        this.sdkPath = sdkPath;
        this.logger = Objects.requireNonNull(logger, "logger may not be null");
    }

    /**
     * Appends a repository root to the list of searched roots. Roots that are already known are ignored.
     *
     * @param root The root, which may start with {@link #SDK_TOKEN}
     * @return The current instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", value = "null -> fail; !null -> this")
    public RepositoryScanner addRepository(@NotNull String root) {
        Objects.requireNonNull(root, "root may not be null");
        if (!this.repositories.contains(root)) {
            this.repositories.add(root);
        }
        return this;
    }

    /**
     * Binds a dependency to the first repository root that holds an artifact file for a version acceptable to it.
     * The passed dependency is modified in place.
     *
     * @param dependency The dependency to look up
     * @return The passed dependency if a candidate was found, null otherwise
     * @throws ConfigurationException If a root refers to the SDK but the SDK path is not known
     */
    @Nullable
    public Dependency findCandidate(@NotNull Dependency dependency) {
        for (String repository : this.repositories) {
            Path root = this.resolveRoot(repository);
            if (!Files.isDirectory(root)) {
                this.logger.warn(RepositoryScanner.class, "Repository {} does not exist, skipping", root);
                continue;
            }

            Path artifactDir = root.resolve(dependency.getGroup().replace('.', '/')).resolve(dependency.getArtifact());
            Path metadata = artifactDir.resolve("maven-metadata.xml");
            if (!Files.isRegularFile(metadata)) {
                continue;
            }

            VersionCatalogue catalogue;
            try (InputStream is = Files.newInputStream(metadata)) {
                catalogue = new VersionCatalogue(is);
            } catch (IOException | SAXException | ParserConfigurationException | ConfusedResolverException e) {
                this.logger.warn(RepositoryScanner.class, "Unable to read {}, treating it as absent", metadata, e);
                continue;
            }

            dependency.bindRepository(root);
            for (String version : catalogue.getVersions()) {
                dependency.addVersion(version);
            }

            if (this.verifyBestVersion(dependency)) {
                this.logger.debug(RepositoryScanner.class, "Found {} in {}", dependency.getResolvedKey(), root);
                return dependency;
            }
        }
        return null;
    }

    /**
     * Evicts possible versions of a bound dependency, newest first, until the best version has an artifact file.
     *
     * @param dependency The bound dependency
     * @return True if the best version that remains has an artifact file, false if no possible version is left
     */
    public boolean verifyBestVersion(@NotNull Dependency dependency) {
        String best;
        while ((best = dependency.getBestVersion()) != null) {
            if (Packaging.locatePackaging(dependency) != null) {
                return true;
            }
            this.logger.debug(RepositoryScanner.class, "No artifact file for {}:{} in {}, evicting", dependency.getVersionlessKey(), best, dependency.getRepoPath());
            dependency.removePossibleVersion(best);
        }
        return false;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getRepositories() {
        return Collections.unmodifiableList(this.repositories);
    }

    /**
     * Obtains the artifact file of the best version of a bound dependency.
     *
     * @param dependency The dependency
     * @return The artifact file, or null if none exists
     */
    @Nullable
    public Path locateArtifact(@NotNull Dependency dependency) {
        return Packaging.locate(dependency);
    }

    /**
     * Reads the dependencies declared by the POM of the best version of a bound dependency.
     *
     * @param dependency The bound dependency
     * @return The declared dependencies, with their requested version constraints
     */
    @NotNull
    public List<@NotNull GAV> readManifest(@NotNull Dependency dependency) {
        Path dir = dependency.getBestVersionPath();
        String best = dependency.getBestVersion();
        if (dir == null || best == null) {
            throw new IllegalStateException("Dependency " + dependency + " is not bound to a concrete version");
        }

        Path pom = dir.resolve(dependency.getArtifact() + '-' + best + ".pom");
        if (!Files.isRegularFile(pom)) {
            this.logger.warn(RepositoryScanner.class, "No POM found for {}, assuming it has no dependencies", dependency.getResolvedKey());
            return Collections.emptyList();
        }

        PackageManifest manifest;
        GAV owner = new GAV(dependency.getGroup(), dependency.getArtifact(), best);
        try (InputStream is = Files.newInputStream(pom)) {
            manifest = new PackageManifest(is, owner, this.ignoreTestDependencies, this.ignoreOptionalDependencies);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + pom, e);
        } catch (SAXException | ParserConfigurationException e) {
            this.logger.warn(RepositoryScanner.class, "Malformed POM {}, assuming it has no dependencies", pom, e);
            return Collections.emptyList();
        }

        for (SkippedRecord skipped : manifest.getSkipped()) {
            this.logger.warn(RepositoryScanner.class, "Ignoring dependency {}:{} declared by {}: {}", skipped.group(), skipped.artifact(), owner, skipped.reason());
        }
        return manifest.getDependencies();
    }

    /**
     * Converts a repository root as registered into a concrete path by substituting the {@link #SDK_TOKEN}.
     *
     * @param root The root as registered
     * @return The path of the root
     * @throws ConfigurationException If the root refers to the SDK but the SDK path is not known
     */
    @NotNull
    public Path resolveRoot(@NotNull String root) {
        if (!root.startsWith(RepositoryScanner.SDK_TOKEN)) {
            return Paths.get(root);
        }
        Path sdk = this.sdkPath;
        if (sdk == null) {
            String env = this.environment.apply(RepositoryScanner.SDK_ENVIRONMENT_VARIABLE);
            if (env == null || env.isBlank()) {
                throw new ConfigurationException("The SDK path is not set, so the repository \"" + root + "\" cannot be located. "
                        + "Pass the SDK path explicitly or point the " + RepositoryScanner.SDK_ENVIRONMENT_VARIABLE
                        + " environment variable at the SDK installation directory.");
            }
            sdk = Paths.get(env);
        }
        String remainder = root.substring(RepositoryScanner.SDK_TOKEN.length());
        while (remainder.startsWith("/") || remainder.startsWith("\\")) {
            remainder = remainder.substring(1);
        }
        return remainder.isEmpty() ? sdk : sdk.resolve(remainder);
    }

    /**
     * Replaces the source of environment variables, which defaults to {@link System#getenv(String)}.
     *
     * @param environment The lookup function
     * @return The current instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", value = "null -> fail; !null -> this")
    public RepositoryScanner setEnvironment(@NotNull Function<@NotNull String, @Nullable String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment may not be null");
        return this;
    }
}
