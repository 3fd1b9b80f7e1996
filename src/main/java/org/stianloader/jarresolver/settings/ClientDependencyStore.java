package org.stianloader.jarresolver.settings;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.DocumentHelper;
import org.dom4j.Element;
import org.dom4j.io.OutputFormat;
import org.dom4j.io.SAXReader;
import org.dom4j.io.XMLWriter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.jarresolver.Dependency;
import org.stianloader.jarresolver.logging.LoggingAdapter;
import org.xml.sax.SAXException;

/**
 * Persists the dependencies declared by every client in a settings directory, one file per client.
 *
 * <p>The files are named "JarResolverDependencies&lt;client&gt;.xml" and contain a "dependencies" element holding
 * one "dependency" element per declared dependency. Its children are "groupId", "artifactId", "version"
 * (the constraint as it was declared) and optionally "packageIds" and "repositories", each a space separated list.
 */
public class ClientDependencyStore {

    @NotNull
    public static final String FILE_PREFIX = "JarResolverDependencies";

    @NotNull
    public static final String FILE_SUFFIX = ".xml";

    @NotNull
    private static List<@NotNull String> splitList(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.asList(text.trim().split("\\s+"));
    }

    /**
     * Checks whether a client name can be used as a part of a file name.
     *
     * @param clientName The name to check
     * @throws IllegalArgumentException If the name is empty or contains characters that are not permitted in file names
     */
    public static void validateClientName(@NotNull String clientName) {
        if (clientName.isEmpty() || clientName.equals(".") || clientName.equals("..")) {
            throw new IllegalArgumentException("Invalid client name: \"" + clientName + "\"");
        }
        for (int i = 0; i < clientName.length(); i++) {
            char c = clientName.charAt(i);
            if (c < 0x20 || "/\\:*?\"<>|".indexOf(c) != -1) {
                throw new IllegalArgumentException("The client name \"" + clientName + "\" contains the character '" + c + "' which may not be used in file names");
            }
        }
    }

    @NotNull
    private final LoggingAdapter logger;
    @NotNull
    private final Path settingsDir;

    public ClientDependencyStore(@NotNull Path settingsDir) {
        this(settingsDir, LoggingAdapter.getDefaultLogger());
    }

    public ClientDependencyStore(@NotNull Path settingsDir, @NotNull LoggingAdapter logger) {
        this.settingsDir = Objects.requireNonNull(settingsDir, "settingsDir may not be null");
        this.logger = Objects.requireNonNull(logger, "logger may not be null");
    }

    /**
     * Deletes the file of a client. Nothing happens if the client has no file.
     *
     * @param clientName The name of the client
     */
    public void delete(@NotNull String clientName) {
        try {
            Files.deleteIfExists(this.getFile(clientName));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to delete the dependencies of client " + clientName, e);
        }
    }

    /**
     * Deletes the files of all clients.
     */
    public void deleteAll() {
        for (String client : this.listClients()) {
            this.delete(client);
        }
    }

    @NotNull
    public Path getFile(@NotNull String clientName) {
        ClientDependencyStore.validateClientName(clientName);
        return this.settingsDir.resolve(ClientDependencyStore.FILE_PREFIX + clientName + ClientDependencyStore.FILE_SUFFIX);
    }

    @NotNull
    public Path getSettingsDirectory() {
        return this.settingsDir;
    }

    /**
     * Obtains the names of all clients that have a file within the settings directory.
     *
     * @return The client names, in alphabetical order
     */
    @NotNull
    public List<@NotNull String> listClients() {
        List<@NotNull String> clients = new ArrayList<>();
        if (!Files.isDirectory(this.settingsDir)) {
            return clients;
        }
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(this.settingsDir, ClientDependencyStore.FILE_PREFIX + "*" + ClientDependencyStore.FILE_SUFFIX)) {
            for (Path file : ds) {
                String name = file.getFileName().toString();
                String client = name.substring(ClientDependencyStore.FILE_PREFIX.length(), name.length() - ClientDependencyStore.FILE_SUFFIX.length());
                if (!client.isEmpty()) {
                    clients.add(client);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list the settings directory " + this.settingsDir, e);
        }
        Collections.sort(clients);
        return clients;
    }

    /**
     * Reads the dependencies of a client. The returned dependencies are not bound to any repository.
     *
     * @param clientName The name of the client
     * @return The dependencies in the order they were declared in, empty if the client has no file
     */
    @NotNull
    public List<@NotNull Dependency> load(@NotNull String clientName) {
        Path file = this.getFile(clientName);
        List<@NotNull Dependency> dependencies = new ArrayList<>();
        if (!Files.isRegularFile(file)) {
            return dependencies;
        }

        Document xmlDoc;
        try (InputStream is = Files.newInputStream(file)) {
            SAXReader reader = new SAXReader();
            reader.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            reader.setFeature("http://xml.org/sax/features/external-general-entities", false);
            reader.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            xmlDoc = reader.read(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + file, e);
        } catch (DocumentException | SAXException e) {
            throw new IllegalStateException("The dependency file " + file + " of client " + clientName + " is malformed", e);
        }

        for (Element element : xmlDoc.getRootElement().elements("dependency")) {
            String group = element.elementTextTrim("groupId");
            String artifact = element.elementTextTrim("artifactId");
            // The version is kept verbatim, constraint strings may contain whitespace
            String version = element.elementText("version");
            if (group == null || group.isEmpty() || artifact == null || artifact.isEmpty() || version == null || version.trim().isEmpty()) {
                this.logger.warn(ClientDependencyStore.class, "Skipping incomplete dependency record {}:{}:{} in {}", group, artifact, version, file);
                continue;
            }
            List<String> packageIds = element.element("packageIds") == null ? null : ClientDependencyStore.splitList(element.elementText("packageIds"));
            List<String> repositories = element.element("repositories") == null ? null : ClientDependencyStore.splitList(element.elementText("repositories"));
            dependencies.add(new Dependency(group, artifact, version, packageIds, repositories));
        }
        return dependencies;
    }

    /**
     * Reads the dependencies of all clients.
     *
     * @return The dependencies of every client that has a file, keyed and sorted by client name
     */
    @NotNull
    public Map<@NotNull String, @NotNull List<@NotNull Dependency>> loadAll() {
        Map<@NotNull String, @NotNull List<@NotNull Dependency>> all = new TreeMap<>();
        for (String client : this.listClients()) {
            all.put(client, this.load(client));
        }
        return all;
    }

    /**
     * Replaces the file of a client with the given dependencies.
     *
     * @param clientName The name of the client
     * @param dependencies The dependencies declared by the client
     */
    public void persist(@NotNull String clientName, @NotNull Collection<@NotNull Dependency> dependencies) {
        Path file = this.getFile(clientName);
        Document xmlDoc = DocumentHelper.createDocument();
        Element root = xmlDoc.addElement("dependencies");
        for (Dependency dependency : dependencies) {
            Element element = root.addElement("dependency");
            element.addElement("groupId").setText(dependency.getGroup());
            element.addElement("artifactId").setText(dependency.getArtifact());
            element.addElement("version").setText(dependency.getVersion());
            List<String> packageIds = dependency.getPackageIds();
            if (packageIds != null) {
                element.addElement("packageIds").setText(String.join(" ", packageIds));
            }
            List<String> repositories = dependency.getRepositories();
            if (repositories != null) {
                element.addElement("repositories").setText(String.join(" ", repositories));
            }
        }

        try {
            Files.createDirectories(this.settingsDir);
            try (OutputStream os = Files.newOutputStream(file)) {
                OutputFormat format = OutputFormat.createPrettyPrint();
                format.setTrimText(false);
                XMLWriter writer = new XMLWriter(os, format);
                writer.write(xmlDoc);
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write " + file, e);
        }
        this.logger.debug(ClientDependencyStore.class, "Persisted {} dependencies of client {} to {}", dependencies.size(), clientName, file);
    }
}
