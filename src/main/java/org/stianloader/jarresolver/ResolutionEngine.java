package org.stianloader.jarresolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.jarresolver.logging.LoggingAdapter;
import org.stianloader.jarresolver.repo.RepositoryScanner;

/**
 * Computes a single version for every artifact that is required by a set of clients, either directly or transitively.
 *
 * <p>The engine works through a queue of requested dependencies in passes. The first dependency that is encountered
 * for an artifact becomes its candidate. Every further request for the same artifact is checked against the candidate:
 * if the candidate already satisfies it, nothing needs to be done. Otherwise the engine attempts to narrow the
 * open-ended side of the conflict so that both requests are satisfied, in which case all requests for the artifact
 * are checked again in the next pass. If that is not possible either, the newer dependency wins when
 * {@code useLatest} is set, otherwise resolution fails.
 *
 * <p>Once an artifact has a candidate, the dependencies declared by its POM are queued too. This happens at most once
 * for every concrete version, so cyclic dependency graphs terminate. When the candidate of an artifact moves to another
 * version, the requests that were queued for the previous version are withdrawn again.
 *
 * <p>An engine holds no state between calls to {@link #resolve(Map, boolean)}, however the passed
 * {@link Dependency} instances are bound and narrowed in place.
 */
public class ResolutionEngine {

    /**
     * The amount of passes after which the engine assumes that it will never reach a fixed point.
     */
    public static final int MAX_PASSES = 1000;

    @NotNull
    private static final String CLIENT_PREFIX = "client ";

    private static final class State {
        @NotNull
        private final Map<@NotNull String, @NotNull Dependency> candidates = new LinkedHashMap<>();
        /**
         * The requests queued by expanding a resolved key, so that they can be withdrawn once the key is no longer selected.
         */
        @NotNull
        private final Map<@NotNull String, @NotNull List<@NotNull Dependency>> contributions = new HashMap<>();
        @NotNull
        private final Set<@NotNull String> expanded = new HashSet<>();
        @NotNull
        private Map<@NotNull String, @NotNull Dependency> pending = new LinkedHashMap<>();
        @NotNull
        private final Map<@NotNull String, @NotNull Map<@NotNull String, @NotNull Dependency>> requests = new HashMap<>();
        /**
         * Clients and resolved keys per request key.
         */
        @NotNull
        private final Map<@NotNull String, @NotNull Set<@NotNull String>> requestedBy = new HashMap<>();
        @NotNull
        private final Map<@NotNull String, @NotNull Set<@NotNull String>> requesters = new HashMap<>();
        @NotNull
        private final Set<@NotNull String> warned = new HashSet<>();

        private void addRequester(@NotNull String versionlessKey, @NotNull String requester) {
            this.requesters.computeIfAbsent(versionlessKey, (key) -> new LinkedHashSet<>()).add(requester);
        }

        private void addRequestedBy(@NotNull String key, @NotNull String requester) {
            this.requestedBy.computeIfAbsent(key, (k) -> new LinkedHashSet<>()).add(requester);
        }

        @NotNull
        private Map<@NotNull String, @NotNull Dependency> getRequests(@NotNull String versionlessKey) {
            return this.requests.computeIfAbsent(versionlessKey, (key) -> new LinkedHashMap<>());
        }
    }

    @NotNull
    private final LoggingAdapter logger;
    @NotNull
    private final RepositoryScanner scanner;

    public ResolutionEngine(@NotNull RepositoryScanner scanner) {
        this(scanner, LoggingAdapter.getDefaultLogger());
    }

    public ResolutionEngine(@NotNull RepositoryScanner scanner, @NotNull LoggingAdapter logger) {
        this.scanner = Objects.requireNonNull(scanner, "scanner may not be null");
        this.logger = Objects.requireNonNull(logger, "logger may not be null");
    }

    private void bind(@NotNull Dependency dependency, @NotNull String requestedAs) {
        if (!dependency.hasPossibleVersions() && this.scanner.findCandidate(dependency) == null) {
            throw new ResolutionException("Cannot find candidate artifact for " + requestedAs);
        }
    }

    @NotNull
    private List<@NotNull String> describeRequesters(@NotNull State state, @NotNull String versionlessKey) {
        List<@NotNull String> chains = new ArrayList<>();
        Set<@NotNull String> visited = new HashSet<>();
        visited.add(versionlessKey);
        this.describeRequesters(state, versionlessKey, "", visited, chains);
        return chains;
    }

    private void describeRequesters(@NotNull State state, @NotNull String versionlessKey, @NotNull String suffix,
            @NotNull Set<@NotNull String> visited, @NotNull List<@NotNull String> out) {
        Set<@NotNull String> direct = state.requesters.get(versionlessKey);
        if (direct == null) {
            return;
        }
        for (String requester : direct) {
            String chain = requester + suffix;
            if (requester.startsWith(ResolutionEngine.CLIENT_PREFIX)) {
                out.add(chain);
                continue;
            }
            String parent = requester.substring(0, requester.lastIndexOf(':'));
            if (!visited.add(parent)) {
                // Cyclic dependency
                out.add(chain);
                continue;
            }
            this.describeRequesters(state, parent, " -> " + chain, visited, out);
            visited.remove(parent);
        }
    }

    private void expand(@NotNull State state, @NotNull Dependency candidate) {
        String resolvedKey = Objects.requireNonNull(candidate.getResolvedKey());
        if (!state.expanded.add(resolvedKey)) {
            return;
        }

        for (GAV gav : this.scanner.readManifest(candidate)) {
            Dependency transitive = new Dependency(gav.group(), gav.artifact(), gav.version());
            String versionlessKey = transitive.getVersionlessKey();
            state.addRequester(versionlessKey, resolvedKey);

            Map<String, Dependency> requests = state.getRequests(versionlessKey);
            Dependency request = requests.get(transitive.getKey());
            if (request == null) {
                this.bind(transitive, gav.toString());
                this.logger.debug(ResolutionEngine.class, "{} depends on {}", resolvedKey, transitive);
                requests.put(transitive.getKey(), transitive);
                state.pending.putIfAbsent(transitive.getKey(), transitive);
                request = transitive;
            }
            state.addRequestedBy(request.getKey(), resolvedKey);
            state.contributions.computeIfAbsent(resolvedKey, (key) -> new ArrayList<>()).add(request);
        }
    }

    private void process(@NotNull State state, @NotNull Dependency entry, boolean useLatest) {
        String versionlessKey = entry.getVersionlessKey();
        if (state.getRequests(versionlessKey).get(entry.getKey()) != entry) {
            // Withdrawn earlier in this pass
            return;
        }

        Dependency candidate = state.candidates.get(versionlessKey);
        if (candidate == null) {
            this.bind(entry, entry.getKey());
            this.logger.debug(ResolutionEngine.class, "Selected {} as the candidate for {}", entry, versionlessKey);
            state.candidates.put(versionlessKey, entry);
            return;
        }

        if (candidate == entry) {
            return;
        }

        String candidateVersion = Objects.requireNonNull(candidate.getBestVersion(), "candidate without version");
        if (entry.isAcceptableVersion(candidateVersion)) {
            String entryVersion = entry.getBestVersion();
            if (entryVersion != null && entry.isNewer(candidate) && this.isAcceptedByAll(state, versionlessKey, entryVersion)) {
                this.logger.debug(ResolutionEngine.class, "Upgrading {} to {}", candidate, entry);
                this.select(state, versionlessKey, candidate.getResolvedKey(), entry);
            }
            return;
        }

        String previousKey = candidate.getResolvedKey();
        if (candidate.refineVersionRange(entry, this.scanner::verifyBestVersion)) {
            this.logger.debug(ResolutionEngine.class, "Narrowed {} to satisfy {}", candidate, entry.getKey());
            this.select(state, versionlessKey, previousKey, candidate);
            this.requeueAll(state, versionlessKey);
            return;
        } else if (entry.refineVersionRange(candidate, this.scanner::verifyBestVersion)) {
            this.logger.debug(ResolutionEngine.class, "Narrowed {} to satisfy {}", entry, candidate.getKey());
            this.select(state, versionlessKey, previousKey, entry);
            this.requeueAll(state, versionlessKey);
            return;
        }

        if (!useLatest) {
            throw new ResolutionException("Cannot resolve " + entry + " and " + candidate);
        }

        Dependency winner = entry.isNewer(candidate) ? entry : candidate;
        Dependency loser = winner == entry ? candidate : entry;
        this.bind(winner, winner.getKey());
        this.select(state, versionlessKey, previousKey, winner);
        if (state.warned.add(versionlessKey)) {
            this.logger.warn(ResolutionEngine.class, "Incompatible versions requested for {}: {} conflicts with {}. Using {} as it is the newer version. Requested by {}",
                    versionlessKey, loser.getKey(), winner.getKey(), winner.getResolvedKey(), this.describeRequesters(state, versionlessKey));
        }
    }

    private boolean isAcceptedByAll(@NotNull State state, @NotNull String versionlessKey, @NotNull String version) {
        for (Dependency request : state.getRequests(versionlessKey).values()) {
            if (!request.isAcceptableVersion(version)) {
                return false;
            }
        }
        return true;
    }

    private void requeueAll(@NotNull State state, @NotNull String versionlessKey) {
        for (Dependency request : state.getRequests(versionlessKey).values()) {
            state.pending.putIfAbsent(request.getKey(), request);
        }
    }

    private void select(@NotNull State state, @NotNull String versionlessKey, @Nullable String previousKey, @NotNull Dependency candidate) {
        state.candidates.put(versionlessKey, candidate);
        if (previousKey != null && !previousKey.equals(candidate.getResolvedKey())) {
            this.withdraw(state, previousKey);
        }
    }

    /**
     * Withdraws the requests that were queued by expanding a resolved key which is no longer selected.
     * A request stays as long as another client or resolved key still asks for it. An artifact that loses
     * all of its requests loses its candidate, and the requests of that candidate are withdrawn in turn.
     */
    private void withdraw(@NotNull State state, @NotNull String resolvedKey) {
        if (!state.expanded.remove(resolvedKey)) {
            return;
        }
        List<@NotNull Dependency> contributed = state.contributions.remove(resolvedKey);
        if (contributed == null) {
            return;
        }

        for (Dependency request : contributed) {
            String versionlessKey = request.getVersionlessKey();
            Set<@NotNull String> requesters = state.requesters.get(versionlessKey);
            if (requesters != null) {
                requesters.remove(resolvedKey);
            }
            Set<@NotNull String> requestedBy = state.requestedBy.get(request.getKey());
            if (requestedBy == null || !requestedBy.remove(resolvedKey) || !requestedBy.isEmpty()) {
                continue;
            }

            this.logger.debug(ResolutionEngine.class, "Withdrawing {} as {} is no longer selected", request.getKey(), resolvedKey);
            state.requestedBy.remove(request.getKey());
            Map<String, Dependency> requests = state.getRequests(versionlessKey);
            requests.remove(request.getKey());
            state.pending.remove(request.getKey());

            if (state.candidates.get(versionlessKey) != request) {
                continue;
            }
            String candidateKey = request.getResolvedKey();
            Dependency replacement = null;
            if (requests.isEmpty()) {
                state.candidates.remove(versionlessKey);
            } else {
                replacement = requests.values().iterator().next();
                state.candidates.put(versionlessKey, replacement);
                this.requeueAll(state, versionlessKey);
            }
            if (candidateKey != null && (replacement == null || !candidateKey.equals(replacement.getResolvedKey()))) {
                this.withdraw(state, candidateKey);
            }
        }
    }

    /**
     * Resolves the dependencies declared by a set of clients.
     *
     * @param declaredByClient The dependencies declared by every client, keyed by the name of the client
     * @param useLatest Whether conflicts that cannot be reconciled should be settled by choosing the newer version
     * @return The chosen dependency for every artifact, keyed by its {@link Dependency#getVersionlessKey() versionless key}
     * @throws ResolutionException If an artifact cannot be found, or versions conflict and {@code useLatest} is not set
     */
    @NotNull
    public Map<@NotNull String, @NotNull Dependency> resolve(@NotNull Map<@NotNull String, @NotNull List<@NotNull Dependency>> declaredByClient, boolean useLatest) {
        State state = new State();

        for (Map.Entry<String, List<Dependency>> client : declaredByClient.entrySet()) {
            for (Dependency dependency : client.getValue()) {
                state.addRequester(dependency.getVersionlessKey(), ResolutionEngine.CLIENT_PREFIX + client.getKey());
                state.addRequestedBy(dependency.getKey(), ResolutionEngine.CLIENT_PREFIX + client.getKey());
                Map<String, Dependency> requests = state.getRequests(dependency.getVersionlessKey());
                if (requests.containsKey(dependency.getKey())) {
                    continue;
                }
                this.bind(dependency, dependency.getKey());
                requests.put(dependency.getKey(), dependency);
                state.pending.put(dependency.getKey(), dependency);
            }
        }

        int pass = 0;
        while (!state.pending.isEmpty()) {
            if (++pass > ResolutionEngine.MAX_PASSES) {
                throw new IllegalStateException("Resolution did not settle after " + ResolutionEngine.MAX_PASSES + " passes. Remaining: " + state.pending.keySet());
            }
            this.logger.debug(ResolutionEngine.class, "Resolution pass {}: {} entries", pass, state.pending.size());

            Map<String, Dependency> work = state.pending;
            state.pending = new LinkedHashMap<>();
            for (Dependency entry : work.values()) {
                this.process(state, entry, useLatest);
            }

            for (Dependency candidate : new ArrayList<>(state.candidates.values())) {
                this.expand(state, candidate);
            }
        }

        return Collections.unmodifiableMap(new LinkedHashMap<>(state.candidates));
    }
}
