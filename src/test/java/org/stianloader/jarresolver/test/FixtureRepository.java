package org.stianloader.jarresolver.test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lays out a local maven repository on disk, as it is found within the SDK.
 */
public class FixtureRepository {

    public static FixtureRepository sdk(Path sdk) {
        return new FixtureRepository(sdk.resolve("extras/google/m2repository"));
    }

    private final Path root;

    public FixtureRepository(Path root) {
        this.root = root;
    }

    public Path artifactDir(String group, String artifact) {
        return this.root.resolve(group.replace('.', '/')).resolve(artifact);
    }

    /**
     * Writes the metadata listing the given versions and an artifact file with the given extension for every version.
     */
    public FixtureRepository artifact(String group, String artifact, String extension, String... versions) {
        this.metadata(group, artifact, versions);
        for (String version : versions) {
            this.file(group, artifact, version, extension, group + ":" + artifact + ":" + version);
        }
        return this;
    }

    public Path file(String group, String artifact, String version, String extension, String contents) {
        Path file = this.artifactDir(group, artifact).resolve(version).resolve(artifact + "-" + version + extension);
        this.write(file, contents);
        return file;
    }

    public FixtureRepository metadata(String group, String artifact, String... versions) {
        StringBuilder xml = new StringBuilder();
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<metadata>\n");
        xml.append("  <groupId>").append(group).append("</groupId>\n");
        xml.append("  <artifactId>").append(artifact).append("</artifactId>\n");
        xml.append("  <versioning>\n");
        if (versions.length != 0) {
            xml.append("    <release>").append(versions[versions.length - 1]).append("</release>\n");
        }
        xml.append("    <versions>\n");
        for (String version : versions) {
            xml.append("      <version>").append(version).append("</version>\n");
        }
        xml.append("    </versions>\n  </versioning>\n</metadata>\n");
        this.write(this.artifactDir(group, artifact).resolve("maven-metadata.xml"), xml.toString());
        return this;
    }

    /**
     * Writes the POM of an artifact version.
     *
     * @param dependencies The dependencies in the form "group:artifact:version"
     */
    public FixtureRepository pom(String group, String artifact, String version, String... dependencies) {
        StringBuilder xml = new StringBuilder();
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<project>\n");
        xml.append("  <modelVersion>4.0.0</modelVersion>\n");
        xml.append("  <groupId>").append(group).append("</groupId>\n");
        xml.append("  <artifactId>").append(artifact).append("</artifactId>\n");
        xml.append("  <version>").append(version).append("</version>\n");
        xml.append("  <dependencies>\n");
        for (String dependency : dependencies) {
            String[] parts = dependency.split(":");
            xml.append("    <dependency>\n");
            xml.append("      <groupId>").append(parts[0]).append("</groupId>\n");
            xml.append("      <artifactId>").append(parts[1]).append("</artifactId>\n");
            xml.append("      <version>").append(parts[2]).append("</version>\n");
            xml.append("    </dependency>\n");
        }
        xml.append("  </dependencies>\n</project>\n");
        return this.rawPom(group, artifact, version, xml.toString());
    }

    public FixtureRepository rawPom(String group, String artifact, String version, String xml) {
        this.write(this.artifactDir(group, artifact).resolve(version).resolve(artifact + "-" + version + ".pom"), xml);
        return this;
    }

    public Path getRoot() {
        return this.root;
    }

    private void write(Path file, String contents) {
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, contents.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
