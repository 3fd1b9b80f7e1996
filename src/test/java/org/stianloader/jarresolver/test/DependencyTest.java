package org.stianloader.jarresolver.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Objects;

import org.junit.jupiter.api.Test;
import org.stianloader.jarresolver.Dependency;

public class DependencyTest {

    private static Dependency bound(String version, String... available) {
        Dependency dependency = new Dependency("com.example", "lib", version);
        dependency.bindRepository(Paths.get("repo"));
        for (String v : available) {
            dependency.addVersion(v);
        }
        return dependency;
    }

    @Test
    public void testKeys() {
        Dependency dependency = DependencyTest.bound("1.2+", "1.2.0", "1.2.5");
        assertEquals("com.example:lib:1.2+", dependency.getKey());
        assertEquals("com.example:lib", dependency.getVersionlessKey());
        assertEquals("com.example:lib:1.2.5", dependency.getResolvedKey());
        assertEquals(Paths.get("repo", "com", "example", "lib", "1.2.5"), dependency.getBestVersionPath());
    }

    @Test
    public void testAddVersionFilters() {
        Dependency dependency = DependencyTest.bound("1.2.3+", "1.2.2", "1.2.3", "1.3.0", "1.2.10");
        assertEquals(Arrays.asList("1.2.3", "1.2.10"), new ArrayList<>(dependency.getPossibleVersions()));
        assertEquals("1.2.10", dependency.getBestVersion());

        Dependency latest = DependencyTest.bound("LATEST", "1.0", "3.0", "2.0");
        assertEquals(3, latest.getPossibleVersions().size());
        assertEquals("3.0", latest.getBestVersion());
        assertTrue(latest.isAcceptableVersion("3.0"));
        assertFalse(latest.isAcceptableVersion("2.0"));
    }

    @Test
    public void testEviction() {
        Dependency dependency = DependencyTest.bound("1+", "1.0", "1.1");
        dependency.removePossibleVersion("1.1");
        assertEquals("1.0", dependency.getBestVersion());
        dependency.addVersion("1.1");
        assertEquals("1.0", dependency.getBestVersion());

        // Eviction is scoped to the bound root
        dependency.bindRepository(Paths.get("other"));
        assertFalse(dependency.hasPossibleVersions());
        dependency.addVersion("1.1");
        assertEquals("1.1", dependency.getBestVersion());
    }

    @Test
    public void testRemovingOnlyVersion() {
        Dependency dependency = DependencyTest.bound("1.0", "1.0");
        assertTrue(dependency.hasPossibleVersions());
        dependency.removePossibleVersion("1.0");
        assertFalse(dependency.hasPossibleVersions());
        assertNull(dependency.getBestVersionPath());
    }

    @Test
    public void testRebindingSameRootKeepsState() {
        Dependency dependency = DependencyTest.bound("1+", "1.0", "1.1");
        dependency.bindRepository(Paths.get("repo"));
        assertEquals("1.1", dependency.getBestVersion());
    }

    @Test
    public void testUnbound() {
        Dependency dependency = new Dependency("com.example", "lib", "1.0");
        assertNull(dependency.getBestVersion());
        assertNull(dependency.getBestVersionPath());
        assertNull(dependency.getResolvedKey());
        assertNull(dependency.getRepoPath());
        assertFalse(dependency.hasPossibleVersions());
    }

    @Test
    public void testRefinement() {
        Dependency open = DependencyTest.bound("1.0+", "1.0.0", "1.0.5", "1.0.9");
        Dependency exact = DependencyTest.bound("1.0.5", "1.0.0", "1.0.5", "1.0.9");

        assertFalse(exact.refineVersionRange(open));
        assertTrue(open.refineVersionRange(exact));
        assertEquals("1.0.5", open.getBestVersion());
        assertFalse(open.isAcceptableVersion("1.0.9"));
        assertTrue(open.isAcceptableVersion("1.0.5"));

        // Refinements are remembered when versions are added again
        open.addVersion("1.0.9");
        assertEquals("1.0.5", open.getBestVersion());
    }

    @Test
    public void testFailedRefinementLeavesStateUntouched() {
        Dependency open = DependencyTest.bound("1.0+", "1.0.0", "1.0.5");
        Dependency other = DependencyTest.bound("2.0", "2.0");
        assertFalse(open.refineVersionRange(other));
        assertEquals(Arrays.asList("1.0.0", "1.0.5"), new ArrayList<>(open.getPossibleVersions()));
        assertTrue(open.isAcceptableVersion("1.0.5"));
    }

    @Test
    public void testRefinementByLatest() {
        Dependency open = DependencyTest.bound("1+", "1.0", "1.5", "1.7");
        Dependency latest = DependencyTest.bound("LATEST", "1.0", "1.5");
        assertTrue(open.refineVersionRange(latest));
        assertEquals("1.5", open.getBestVersion());
        assertFalse(open.isAcceptableVersion("1.7"));
    }

    @Test
    public void testNewer() {
        Dependency older = DependencyTest.bound("1.0", "1.0");
        Dependency newer = DependencyTest.bound("2.0", "2.0");
        assertTrue(newer.isNewer(older));
        assertFalse(older.isNewer(newer));
        assertFalse(older.isNewer(older));

        assertTrue(new Dependency("com.example", "lib", "3.0").isNewer(newer));
        assertTrue(new Dependency("com.example", "lib", "LATEST").isNewer(newer));
        assertFalse(newer.isNewer(new Dependency("com.example", "lib", "LATEST")));
    }

    @Test
    public void testRefinementRolledBackWhenCheckFails() {
        Dependency open = DependencyTest.bound("1+", "1.0", "1.5", "1.7");
        Dependency exact = DependencyTest.bound("1.5", "1.5");

        assertFalse(open.refineVersionRange(exact, (dependency) -> {
            dependency.removePossibleVersion(Objects.requireNonNull(dependency.getBestVersion()));
            return dependency.hasPossibleVersions();
        }));
        assertEquals(Arrays.asList("1.0", "1.7"), new ArrayList<>(open.getPossibleVersions()));
        assertEquals("1.7", open.getBestVersion());
        assertTrue(open.isAcceptableVersion("1.7"));

        assertTrue(open.refineVersionRange(DependencyTest.bound("1.0", "1.0"), (dependency) -> true));
        assertEquals("1.0", open.getBestVersion());
    }
}
