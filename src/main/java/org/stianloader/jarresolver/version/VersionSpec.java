package org.stianloader.jarresolver.version;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A version constraint as it is written by a client or within a POM.
 *
 * <p>Three forms exist:
 * <ul>
 * <li>An exact version such as "1.0". Trailing zeros are implied, so "1.0" also matches "1.0.0".</li>
 * <li>An open-ended version such as "1.2.3+". It accepts the given version or any newer version
 * that shares the same prefix, that is every component except the last one. "1.2.3+" therefore
 * accepts "1.2.3" or "1.2.4" but not "1.3". "0+" (or a bare "+") accepts any version.
 * "1.2.+" keeps all listed components as the prefix and accepts any "1.2.x".</li>
 * <li>The literal {@link #LATEST_TOKEN}, which only accepts the single greatest version that is known to be
 * available. As with the RELEASE sentinel of maven, the case of the characters matters.</li>
 * </ul>
 *
 * <p>Components are compared numerically if both sides are numeric, lexically if both are not. A
 * component that is not numeric is always older than a numeric one. No version string is rejected
 * for being malformed; it merely sorts low.
 */
public final class VersionSpec {

    @NotNull
    public static final String LATEST_TOKEN = "LATEST";

    @NotNull
    public static final Comparator<@NotNull String> COMPARATOR = VersionSpec::compare;

    @NotNull
    public static final VersionSpec LATEST = new VersionSpec(VersionSpec.LATEST_TOKEN, Collections.emptyList(), false, true, 0);

    @NotNull
    private static final String IMPLIED_COMPONENT = "0";

    public static int compare(@NotNull String a, @NotNull String b) {
        List<@NotNull String> left = VersionSpec.split(a);
        List<@NotNull String> right = VersionSpec.split(b);
        int length = Math.max(left.size(), right.size());
        for (int i = 0; i < length; i++) {
            int cmp = VersionSpec.compareComponent(VersionSpec.component(left, i), VersionSpec.component(right, i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static int compareComponent(@NotNull String a, @NotNull String b) {
        boolean numericA = VersionSpec.isNumeric(a);
        boolean numericB = VersionSpec.isNumeric(b);
        if (numericA && numericB) {
            String strippedA = VersionSpec.stripLeadingZeros(a);
            String strippedB = VersionSpec.stripLeadingZeros(b);
            if (strippedA.length() != strippedB.length()) {
                return Integer.compare(strippedA.length(), strippedB.length());
            }
            return Integer.signum(strippedA.compareTo(strippedB));
        } else if (numericA) {
            return 1;
        } else if (numericB) {
            return -1;
        }
        return Integer.signum(a.compareTo(b));
    }

    @NotNull
    private static String component(@NotNull List<@NotNull String> components, int index) {
        if (index < components.size()) {
            return components.get(index);
        }
        return VersionSpec.IMPLIED_COMPONENT;
    }

    private static boolean isNumeric(@NotNull String component) {
        if (component.isEmpty()) {
            return false;
        }
        for (int i = 0; i < component.length(); i++) {
            char c = component.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    @NotNull
    private static String stripLeadingZeros(@NotNull String numeric) {
        int start = 0;
        while (start < numeric.length() - 1 && numeric.charAt(start) == '0') {
            start++;
        }
        return numeric.substring(start);
    }

    @NotNull
    private static List<@NotNull String> split(@NotNull String version) {
        if (version.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(version.split("\\.", -1));
    }

    @NotNull
    public static VersionSpec parse(@NotNull String text) {
        String trimmed = text.trim();
        if (trimmed.equals(VersionSpec.LATEST_TOKEN)) {
            return VersionSpec.LATEST;
        }

        if (!trimmed.endsWith("+")) {
            List<@NotNull String> components = VersionSpec.split(trimmed);
            return new VersionSpec(trimmed, components, false, false, components.size());
        }

        String base = trimmed.substring(0, trimmed.length() - 1);
        boolean dottedWildcard = base.endsWith(".");
        if (dottedWildcard) {
            base = base.substring(0, base.length() - 1);
        }
        List<@NotNull String> components = VersionSpec.split(base);
        int prefixLength = dottedWildcard ? components.size() : Math.max(0, components.size() - 1);
        return new VersionSpec(trimmed, components, true, false, prefixLength);
    }

    /**
     * Convenience shortcut for <code>VersionSpec.parse(constraint).isSatisfiedBy(candidate)</code>.
     *
     * @param constraint The constraint, as written by the requester
     * @param candidate The concrete version to test
     * @return True if the candidate satisfies the constraint
     */
    public static boolean satisfies(@NotNull String constraint, @NotNull String candidate) {
        return VersionSpec.parse(constraint).isSatisfiedBy(candidate);
    }

    @NotNull
    private final List<@NotNull String> components;
    private final boolean latest;
    private final boolean openEnded;
    @NotNull
    private final String originText;
    private final int prefixLength;

    private VersionSpec(@NotNull String originText, @NotNull List<@NotNull String> components, boolean openEnded, boolean latest, int prefixLength) {
        this.originText = originText;
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
        this.openEnded = openEnded;
        this.latest = latest;
        this.prefixLength = prefixLength;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof VersionSpec) {
            return ((VersionSpec) obj).originText.equals(this.originText);
        }
        return false;
    }

    /**
     * Obtains the version the constraint is anchored to, that is the constraint without the
     * trailing '+'. Empty for {@link #LATEST} and for a bare "+".
     *
     * @return The base version string
     */
    @NotNull
    @Contract(pure = true)
    public String getBaseVersion() {
        return String.join(".", this.components);
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getComponents() {
        return this.components;
    }

    @NotNull
    @Contract(pure = true)
    public String getOriginText() {
        return this.originText;
    }

    @Override
    public int hashCode() {
        return this.originText.hashCode();
    }

    @Contract(pure = true)
    public boolean isLatest() {
        return this.latest;
    }

    @Contract(pure = true)
    public boolean isOpenEnded() {
        return this.openEnded;
    }

    /**
     * Checks whether a concrete version satisfies this constraint.
     *
     * <p>{@link #LATEST} admits every version here, as whether a version is the latest one can only be
     * told with the knowledge of all available versions. Use {@link #isSatisfiedBy(String, Collection)}
     * for that.
     *
     * @param candidate The concrete version
     * @return True if the version is accepted
     */
    @Contract(pure = true)
    public boolean isSatisfiedBy(@NotNull String candidate) {
        if (this.latest) {
            return true;
        }
        String base = this.getBaseVersion();
        if (!this.openEnded) {
            return VersionSpec.compare(candidate, base) == 0;
        }

        List<@NotNull String> candidateComponents = VersionSpec.split(candidate);
        for (int i = 0; i < this.prefixLength; i++) {
            if (VersionSpec.compareComponent(VersionSpec.component(candidateComponents, i), this.components.get(i)) != 0) {
                return false;
            }
        }
        return VersionSpec.compare(candidate, base) >= 0;
    }

    @Contract(pure = true)
    public boolean isSatisfiedBy(@NotNull String candidate, @NotNull Collection<@NotNull String> available) {
        if (!this.latest) {
            return this.isSatisfiedBy(candidate);
        }
        String newest = this.selectFrom(available);
        return newest != null && VersionSpec.compare(newest, candidate) == 0;
    }

    /**
     * Selects the newest version out of a collection of available versions that satisfies this constraint.
     *
     * @param available The versions to choose from
     * @return The newest matching version, or null if none matches
     */
    @Nullable
    @Contract(pure = true)
    public String selectFrom(@NotNull Collection<@NotNull String> available) {
        String selected = null;
        for (String version : available) {
            if (this.isSatisfiedBy(version) && (selected == null || VersionSpec.compare(version, selected) > 0)) {
                selected = version;
            }
        }
        return selected;
    }

    @Override
    @NotNull
    public String toString() {
        return Objects.requireNonNull(this.originText);
    }
}
