package org.stianloader.jarresolver;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.jarresolver.version.VersionSpec;

/**
 * A dependency on an artifact, as requested by a client or by the POM of another artifact.
 *
 * <p>Besides the requested constraint, a dependency tracks the state of its resolution: the repository
 * root it is bound to and the versions that are still considered possible within that root.
 * The {@link #getBestVersion() best version} is always the newest possible version.
 * Versions that turned out to lack an artifact file are {@link #removePossibleVersion(String) evicted}
 * and are not added again as long as the dependency stays bound to the same root.
 *
 * <p>Instances are mutable and not thread safe. They are compared by identity.
 */
public class Dependency {

    @NotNull
    private final String artifact;
    @NotNull
    private final Set<@NotNull String> evictedVersions = new TreeSet<>(VersionSpec.COMPARATOR);
    @NotNull
    private final String group;
    @Nullable
    private final List<@NotNull String> packageIds;
    @NotNull
    private final NavigableSet<@NotNull String> possibleVersions = new TreeSet<>(VersionSpec.COMPARATOR);
    @NotNull
    private final Set<@NotNull VersionSpec> refinements = new LinkedHashSet<>();
    @Nullable
    private Path repoPath;
    @Nullable
    private final List<@NotNull String> repositories;
    @NotNull
    private final VersionSpec spec;
    @NotNull
    private final String version;

    public Dependency(@NotNull String group, @NotNull String artifact, @NotNull String version) {
        this(group, artifact, version, null, null);
    }

    public Dependency(@NotNull String group, @NotNull String artifact, @NotNull String version,
            @Nullable Collection<@NotNull String> packageIds, @Nullable Collection<@NotNull String> repositories) {
        this.group = Objects.requireNonNull(group, "group may not be null");
        this.artifact = Objects.requireNonNull(artifact, "artifact may not be null");
        this.version = Objects.requireNonNull(version, "version may not be null");
        this.spec = VersionSpec.parse(version);
        this.packageIds = packageIds == null ? null : Collections.unmodifiableList(new ArrayList<>(packageIds));
        this.repositories = repositories == null ? null : Collections.unmodifiableList(new ArrayList<>(repositories));
    }

    /**
     * Registers a version that is listed by the repository metadata. The version is only
     * retained if it is acceptable to this dependency and if it was not evicted beforehand.
     * Dependencies on {@link VersionSpec#LATEST} retain every version.
     *
     * @param version The concrete version
     */
    @Contract(mutates = "this")
    public void addVersion(@NotNull String version) {
        if (this.evictedVersions.contains(version)) {
            return;
        }
        if (this.spec.isLatest() || this.isAcceptableVersion(version)) {
            this.possibleVersions.add(version);
        }
    }

    /**
     * Binds the dependency to a repository root. If the dependency was bound to another root beforehand,
     * all known possible and evicted versions are discarded, as they describe the contents of the other root.
     *
     * @param root The repository root
     */
    @Contract(mutates = "this")
    public void bindRepository(@NotNull Path root) {
        if (!root.equals(this.repoPath)) {
            this.possibleVersions.clear();
            this.evictedVersions.clear();
        }
        this.repoPath = root;
    }

    @NotNull
    @Contract(pure = true)
    public String getArtifact() {
        return this.artifact;
    }

    @Nullable
    @Contract(pure = true)
    public String getBestVersion() {
        if (this.possibleVersions.isEmpty()) {
            return null;
        }
        return this.possibleVersions.last();
    }

    /**
     * Obtains the directory where the files of the {@link #getBestVersion() best version} are located.
     *
     * @return The directory, or null if the dependency is not bound or has no possible versions
     */
    @Nullable
    @Contract(pure = true)
    public Path getBestVersionPath() {
        Path root = this.repoPath;
        String best = this.getBestVersion();
        if (root == null || best == null) {
            return null;
        }
        return root.resolve(this.group.replace('.', '/')).resolve(this.artifact).resolve(best);
    }

    @NotNull
    @Contract(pure = true)
    public String getGroup() {
        return this.group;
    }

    /**
     * The key of the dependency as requested, that is group, artifact and the version constraint.
     *
     * @return The key, for example "com.example:foo:1.2+"
     */
    @NotNull
    @Contract(pure = true)
    public String getKey() {
        return this.group + ':' + this.artifact + ':' + this.version;
    }

    @Nullable
    @Contract(pure = true)
    public List<@NotNull String> getPackageIds() {
        return this.packageIds;
    }

    @NotNull
    @Contract(pure = true)
    public NavigableSet<@NotNull String> getPossibleVersions() {
        return Collections.unmodifiableNavigableSet(this.possibleVersions);
    }

    @Nullable
    @Contract(pure = true)
    public Path getRepoPath() {
        return this.repoPath;
    }

    @Nullable
    @Contract(pure = true)
    public List<@NotNull String> getRepositories() {
        return this.repositories;
    }

    /**
     * The key of the concrete artifact this dependency currently resolves to.
     *
     * @return The key with the best version, or null if there is no possible version
     */
    @Nullable
    @Contract(pure = true)
    public String getResolvedKey() {
        String best = this.getBestVersion();
        if (best == null) {
            return null;
        }
        return this.group + ':' + this.artifact + ':' + best;
    }

    @NotNull
    @Contract(pure = true)
    public VersionSpec getSpec() {
        return this.spec;
    }

    @NotNull
    @Contract(pure = true)
    public String getVersion() {
        return this.version;
    }

    @NotNull
    @Contract(pure = true)
    public String getVersionlessKey() {
        return this.group + ':' + this.artifact;
    }

    @Contract(pure = true)
    public boolean hasPossibleVersions() {
        return !this.possibleVersions.isEmpty();
    }

    @Contract(pure = true)
    public boolean isAcceptableVersion(@NotNull String version) {
        if (this.spec.isLatest()) {
            return this.spec.isSatisfiedBy(version, this.possibleVersions);
        }
        if (!this.spec.isSatisfiedBy(version)) {
            return false;
        }
        for (VersionSpec refinement : this.refinements) {
            if (!refinement.isSatisfiedBy(version)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether this dependency resolves to a newer version than another dependency.
     * Unbound dependencies fall back to their requested version, an unbound dependency on
     * {@link VersionSpec#LATEST} is newer than anything else.
     *
     * @param other The dependency to compare against
     * @return True if this dependency is strictly newer
     */
    @Contract(pure = true)
    public boolean isNewer(@NotNull Dependency other) {
        String mine = this.getComparableVersion();
        String theirs = other.getComparableVersion();
        if (mine == null) {
            return theirs != null;
        } else if (theirs == null) {
            return false;
        }
        return VersionSpec.compare(mine, theirs) > 0;
    }

    @Nullable
    private String getComparableVersion() {
        String best = this.getBestVersion();
        if (best != null) {
            return best;
        } else if (this.spec.isLatest()) {
            return null;
        }
        return this.spec.getBaseVersion();
    }

    /**
     * Narrows an open-ended dependency so that it only resolves to versions that another dependency on
     * the same artifact accepts, too. Nothing is changed if no possible version would remain.
     *
     * @param other The dependency whose constraint should be honoured
     * @return True if the range was narrowed and still contains at least one possible version
     */
    @Contract(mutates = "this")
    public boolean refineVersionRange(@NotNull Dependency other) {
        return this.refineVersionRange(other, (dependency) -> true);
    }

    /**
     * Narrows an open-ended dependency like {@link #refineVersionRange(Dependency)} does, but additionally
     * requires the narrowed dependency to pass a check, usually whether its new best version has an artifact file.
     * The check may {@link #removePossibleVersion(String) evict} versions. If it fails, the possible versions and
     * refinements are restored, minus the versions evicted in the meantime.
     *
     * @param other The dependency whose constraint should be honoured
     * @param verifier The check the narrowed dependency must pass
     * @return True if the range was narrowed and the narrowed dependency passed the check
     */
    @Contract(mutates = "this")
    public boolean refineVersionRange(@NotNull Dependency other, @NotNull Predicate<@NotNull Dependency> verifier) {
        if (!this.spec.isOpenEnded()) {
            return false;
        }

        List<@NotNull String> narrowed = new ArrayList<>();
        for (String possible : this.possibleVersions) {
            if (other.isAcceptableVersion(possible)) {
                narrowed.add(possible);
            }
        }
        if (narrowed.isEmpty()) {
            return false;
        }

        List<@NotNull String> previousVersions = new ArrayList<>(this.possibleVersions);
        List<@NotNull VersionSpec> previousRefinements = new ArrayList<>(this.refinements);

        this.possibleVersions.retainAll(narrowed);
        if (other.spec.isLatest()) {
            this.refinements.add(VersionSpec.parse(Objects.requireNonNull(other.getBestVersion())));
        } else {
            this.refinements.add(other.spec);
            this.refinements.addAll(other.refinements);
        }

        if (verifier.test(this) && this.hasPossibleVersions()) {
            return true;
        }

        this.refinements.clear();
        this.refinements.addAll(previousRefinements);
        for (String version : previousVersions) {
            if (!this.evictedVersions.contains(version)) {
                this.possibleVersions.add(version);
            }
        }
        return false;
    }

    /**
     * Evicts a version, usually because no artifact file exists for it.
     *
     * @param version The version to evict
     */
    @Contract(mutates = "this")
    public void removePossibleVersion(@NotNull String version) {
        this.possibleVersions.remove(version);
        this.evictedVersions.add(version);
    }

    @Override
    @NotNull
    public String toString() {
        StringBuilder builder = new StringBuilder(this.getKey());
        if (!this.refinements.isEmpty()) {
            builder.append(" narrowed by ").append(this.refinements);
        }
        String best = this.getBestVersion();
        if (best != null) {
            builder.append(" (best ").append(best).append(')');
        }
        return builder.toString();
    }
}
