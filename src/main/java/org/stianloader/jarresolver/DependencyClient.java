package org.stianloader.jarresolver;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.jarresolver.deploy.ArtifactDeployer;
import org.stianloader.jarresolver.deploy.DeploymentResult;
import org.stianloader.jarresolver.deploy.OverwriteConfirmation;
import org.stianloader.jarresolver.logging.LoggingAdapter;
import org.stianloader.jarresolver.repo.RepositoryScanner;
import org.stianloader.jarresolver.settings.ClientDependencyStore;

/**
 * The entry point for a single client of jarresolver.
 *
 * <p>A client declares the artifacts it needs through {@link #dependOn(String, String, String)}. These declarations
 * are persisted in the settings directory, so that resolution always takes every client that shares the
 * settings directory into account, even those that are not loaded within the current process.
 *
 * <pre>{@code
 * DependencyClient client = DependencyClient.register("mylibrary", sdkPath, null, settingsDir);
 * client.dependOn("com.google.android.gms", "play-services-base", "9.4+");
 * Map<String, Dependency> resolved = client.resolveDependencies(true);
 * client.copyDependencies(resolved, pluginsDir);
 * }</pre>
 */
public class DependencyClient {

    /**
     * Registers a client.
     *
     * @param clientName The name of the client, which must be usable as a part of a file name
     * @param sdkPath The path of the SDK, or null to read it from the {@value RepositoryScanner#SDK_ENVIRONMENT_VARIABLE} environment variable
     * @param extraRepositories Repository roots to search in addition to the SDK repositories, may be null
     * @param settingsDir The directory in which the dependencies of all clients are stored
     * @return The client, with the dependencies it declared beforehand already loaded
     * @throws IllegalArgumentException If the client name is not a valid file name component
     */
    @NotNull
    public static DependencyClient register(@NotNull String clientName, @Nullable Path sdkPath, @Nullable Collection<@NotNull String> extraRepositories, @NotNull Path settingsDir) {
        return DependencyClient.register(clientName, sdkPath, extraRepositories, settingsDir, LoggingAdapter.getDefaultLogger());
    }

    @NotNull
    public static DependencyClient register(@NotNull String clientName, @Nullable Path sdkPath, @Nullable Collection<@NotNull String> extraRepositories,
            @NotNull Path settingsDir, @NotNull LoggingAdapter logger) {
        ClientDependencyStore.validateClientName(Objects.requireNonNull(clientName, "clientName may not be null"));
        RepositoryScanner scanner = new RepositoryScanner(sdkPath, logger);
        if (extraRepositories != null) {
            extraRepositories.forEach(scanner::addRepository);
        }
        DependencyClient client = new DependencyClient(clientName, scanner, new ClientDependencyStore(settingsDir, logger), logger);
        for (Dependency dependency : client.store.load(clientName)) {
            client.dependencies.put(dependency.getKey(), dependency);
            client.addRepositories(dependency);
        }
        return client;
    }

    @NotNull
    private final String clientName;
    @NotNull
    private final Map<@NotNull String, @NotNull Dependency> dependencies = new LinkedHashMap<>();
    @NotNull
    private final LoggingAdapter logger;
    @NotNull
    private final RepositoryScanner scanner;
    @NotNull
    private final ClientDependencyStore store;

    private DependencyClient(@NotNull String clientName, @NotNull RepositoryScanner scanner, @NotNull ClientDependencyStore store, @NotNull LoggingAdapter logger) {
        this.clientName = clientName;
        this.scanner = scanner;
        this.store = store;
        this.logger = logger;
    }

    private void addRepositories(@NotNull Dependency dependency) {
        List<String> repositories = dependency.getRepositories();
        if (repositories != null) {
            repositories.forEach(this.scanner::addRepository);
        }
    }

    /**
     * Removes all dependencies declared by this client, including its file in the settings directory.
     */
    @Contract(mutates = "this")
    public void clearDependencies() {
        this.dependencies.clear();
        this.store.delete(this.clientName);
    }

    /**
     * Copies the resolved artifacts to a directory, replacing other versions of the same artifacts without asking.
     *
     * @param resolved The resolved dependencies, as returned by {@link #resolveDependencies(boolean)}
     * @param destDir The directory to copy to
     * @return The changes made to the directory
     */
    @NotNull
    public DeploymentResult copyDependencies(@NotNull Map<@NotNull String, @NotNull Dependency> resolved, @NotNull Path destDir) {
        return this.copyDependencies(resolved, destDir, null);
    }

    @NotNull
    public DeploymentResult copyDependencies(@NotNull Map<@NotNull String, @NotNull Dependency> resolved, @NotNull Path destDir, @Nullable OverwriteConfirmation confirmer) {
        return new ArtifactDeployer(this.logger).copyDependencies(resolved, destDir, confirmer);
    }

    @NotNull
    @Contract(mutates = "this", value = "_, _, _ -> this")
    public DependencyClient dependOn(@NotNull String group, @NotNull String artifact, @NotNull String version) {
        return this.dependOn(group, artifact, version, null, null);
    }

    /**
     * Declares a dependency of this client and persists it. A dependency with the same group, artifact and
     * version constraint that was declared beforehand is replaced. No repository is consulted at this point.
     *
     * @param group The group of the artifact
     * @param artifact The id of the artifact
     * @param version The version constraint, for example "9.4+"
     * @param packageIds The SDK packages that contain the artifact, may be null
     * @param repositories Further repository roots to search, may be null
     * @return The current instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", value = "_, _, _, _, _ -> this")
    public DependencyClient dependOn(@NotNull String group, @NotNull String artifact, @NotNull String version,
            @Nullable Collection<@NotNull String> packageIds, @Nullable Collection<@NotNull String> repositories) {
        Dependency dependency = new Dependency(group, artifact, version, packageIds, repositories);
        this.dependencies.put(dependency.getKey(), dependency);
        this.addRepositories(dependency);
        this.store.persist(this.clientName, this.dependencies.values());
        return this;
    }

    @NotNull
    @Contract(pure = true)
    public String getClientName() {
        return this.clientName;
    }

    /**
     * Obtains the dependencies declared by this client, in declaration order.
     *
     * @return The declared dependencies
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull Dependency> getDependencies() {
        return Collections.unmodifiableList(new ArrayList<>(this.dependencies.values()));
    }

    @NotNull
    @Contract(pure = true)
    public RepositoryScanner getScanner() {
        return this.scanner;
    }

    /**
     * Reads the persisted dependencies and binds each of them to an installed artifact.
     *
     * @param allClients Whether the dependencies of all clients should be read, or only those of this client
     * @param keepMissing Whether dependencies without installed artifact should be returned unbound instead of failing
     * @return The dependencies, keyed by the name of the client that declared them
     * @throws ResolutionException If a dependency has no installed artifact and {@code keepMissing} is not set
     */
    @NotNull
    public Map<@NotNull String, @NotNull List<@NotNull Dependency>> loadDependencies(boolean allClients, boolean keepMissing) {
        Map<@NotNull String, @NotNull List<@NotNull Dependency>> declared;
        if (allClients) {
            declared = this.store.loadAll();
        } else {
            declared = new LinkedHashMap<>();
            declared.put(this.clientName, this.store.load(this.clientName));
        }

        for (Map.Entry<String, List<Dependency>> client : declared.entrySet()) {
            for (Dependency dependency : client.getValue()) {
                this.addRepositories(dependency);
            }
        }

        for (Map.Entry<String, List<Dependency>> client : declared.entrySet()) {
            for (Dependency dependency : client.getValue()) {
                if (this.scanner.findCandidate(dependency) != null) {
                    continue;
                }
                if (!keepMissing) {
                    throw new ResolutionException("Cannot find candidate artifact for " + dependency.getKey());
                }
                this.logger.debug(DependencyClient.class, "No installed artifact for {} declared by client {}", dependency.getKey(), client.getKey());
            }
        }
        return declared;
    }

    /**
     * Deletes the persisted dependencies of every client, not only those of this client.
     * The dependencies of this client are forgotten as well.
     */
    @Contract(mutates = "this")
    public void resetDependencies() {
        this.store.deleteAll();
        this.dependencies.clear();
    }

    /**
     * Resolves the dependencies of all clients sharing the settings directory of this client.
     *
     * @param useLatest Whether version conflicts that cannot be reconciled should be settled by choosing the newer version
     * @return The chosen dependency for every artifact, keyed by its versionless key
     * @throws ResolutionException If resolution failed
     * @throws ConfigurationException If the SDK path is required but not set
     */
    @NotNull
    public Map<@NotNull String, @NotNull Dependency> resolveDependencies(boolean useLatest) {
        Map<String, List<Dependency>> declared = this.loadDependencies(true, true);
        return new ResolutionEngine(this.scanner, this.logger).resolve(declared, useLatest);
    }
}
