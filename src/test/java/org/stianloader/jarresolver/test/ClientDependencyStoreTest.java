package org.stianloader.jarresolver.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.jarresolver.Dependency;
import org.stianloader.jarresolver.settings.ClientDependencyStore;

public class ClientDependencyStoreTest {

    @TempDir
    Path settings;

    @Test
    public void testRoundTrip() {
        ClientDependencyStore store = new ClientDependencyStore(this.settings, new RecordingLogger());
        store.persist("ads", Arrays.asList(
                new Dependency("com.google.android.gms", "play-services-ads", "9.4+", Arrays.asList("extra-google-m2repository"), null),
                new Dependency("com.android.support", "support-v4", "LATEST", null, Arrays.asList("/opt/repo", "$SDK/extras/custom")),
                new Dependency("com.example", "lib", "1.2.3")));

        assertTrue(Files.isRegularFile(this.settings.resolve("JarResolverDependenciesads.xml")));

        List<Dependency> loaded = store.load("ads");
        assertEquals(3, loaded.size());
        assertEquals("com.google.android.gms:play-services-ads:9.4+", loaded.get(0).getKey());
        assertEquals(Arrays.asList("extra-google-m2repository"), loaded.get(0).getPackageIds());
        assertNull(loaded.get(0).getRepositories());
        assertEquals("LATEST", loaded.get(1).getVersion());
        assertTrue(loaded.get(1).getSpec().isLatest());
        assertEquals(Arrays.asList("/opt/repo", "$SDK/extras/custom"), loaded.get(1).getRepositories());
        assertEquals("com.example:lib:1.2.3", loaded.get(2).getKey());
        assertFalse(loaded.get(2).hasPossibleVersions());
    }

    @Test
    public void testMissingFile() {
        ClientDependencyStore store = new ClientDependencyStore(this.settings.resolve("absent"), new RecordingLogger());
        assertTrue(store.load("nobody").isEmpty());
        assertTrue(store.loadAll().isEmpty());
        store.delete("nobody");
    }

    @Test
    public void testLoadAllAndDelete() {
        ClientDependencyStore store = new ClientDependencyStore(this.settings, new RecordingLogger());
        store.persist("zeta", Arrays.asList(new Dependency("com.example", "z", "1.0")));
        store.persist("alpha", Arrays.asList(new Dependency("com.example", "a", "1.0")));

        Map<String, List<Dependency>> all = store.loadAll();
        assertEquals(Arrays.asList("alpha", "zeta"), Arrays.asList(all.keySet().toArray()));
        assertEquals("com.example:z:1.0", all.get("zeta").get(0).getKey());

        store.delete("zeta");
        assertEquals(Arrays.asList("alpha"), store.listClients());
        store.deleteAll();
        assertTrue(store.listClients().isEmpty());
    }

    @Test
    public void testIncompleteRecordsAreSkipped() throws IOException {
        Files.write(this.settings.resolve("JarResolverDependenciesbroken.xml"), String.join("\n",
                "<dependencies>",
                "  <dependency><groupId>com.example</groupId><artifactId>lib</artifactId></dependency>",
                "  <dependency><groupId>com.example</groupId><artifactId>ok</artifactId><version>2.0+</version></dependency>",
                "</dependencies>").getBytes(StandardCharsets.UTF_8));

        RecordingLogger logger = new RecordingLogger();
        List<Dependency> loaded = new ClientDependencyStore(this.settings, logger).load("broken");
        assertEquals(1, loaded.size());
        assertEquals("com.example:ok:2.0+", loaded.get(0).getKey());
        assertEquals(1, logger.warnings.size());
    }

    @Test
    public void testMalformedFile() throws IOException {
        Files.write(this.settings.resolve("JarResolverDependenciesbroken.xml"), "<dependencies>".getBytes(StandardCharsets.UTF_8));
        ClientDependencyStore store = new ClientDependencyStore(this.settings, new RecordingLogger());
        assertThrows(IllegalStateException.class, () -> store.load("broken"));
    }

    @Test
    public void testClientNameValidation() {
        ClientDependencyStore.validateClientName("my-plugin_1.0");
        assertThrows(IllegalArgumentException.class, () -> ClientDependencyStore.validateClientName(""));
        assertThrows(IllegalArgumentException.class, () -> ClientDependencyStore.validateClientName(".."));
        assertThrows(IllegalArgumentException.class, () -> ClientDependencyStore.validateClientName("a/b"));
        assertThrows(IllegalArgumentException.class, () -> ClientDependencyStore.validateClientName("a\\b"));
        assertThrows(IllegalArgumentException.class, () -> ClientDependencyStore.validateClientName("a:b"));
    }

    @Test
    public void testVersionWhitespaceIsKept() {
        ClientDependencyStore store = new ClientDependencyStore(this.settings, new RecordingLogger());
        store.persist("spaced", Arrays.asList(new Dependency("com.example", "lib", " 2.0+ ")));

        List<Dependency> loaded = store.load("spaced");
        assertEquals(1, loaded.size());
        assertEquals(" 2.0+ ", loaded.get(0).getVersion());
        assertTrue(loaded.get(0).getSpec().isOpenEnded());
    }
}
