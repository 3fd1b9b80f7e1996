package org.stianloader.jarresolver.internal.meta;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.xml.parsers.ParserConfigurationException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.jarresolver.GAV;
import org.stianloader.jarresolver.internal.XMLUtil;
import org.stianloader.jarresolver.internal.XMLUtil.ChildElementIterable;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

/**
 * The dependency records declared by the POM of a single artifact version.
 *
 * <p>Placeholders in the form of "${property}" are expanded using the properties block of the POM,
 * the top-level values of the project element (available as "project.x", "pom.x" and "x") and the
 * coordinates of the artifact the POM belongs to. Parent POMs and dependency management are not
 * consulted, local SDK repositories do not make use of them.
 */
public class PackageManifest {

    /**
     * A dependency record that could not be turned into a {@link GAV}, as kept for diagnostic purposes.
     */
    public static final record SkippedRecord(@Nullable String group, @Nullable String artifact, @NotNull String reason) {
    }

    @NotNull
    private static String applyPlaceholders(@NotNull String string, int startIndex, @NotNull Map<String, String> placeholders) {
        int indexStart = string.indexOf("${", startIndex);
        if (indexStart == -1) {
            return string;
        }
        int indexEnd = string.indexOf('}', indexStart);
        if (indexEnd == -1) {
            return string;
        }
        String property = string.substring(indexStart + 2, indexEnd);
        String replacement = placeholders.get(property);
        if (replacement == null) {
            return PackageManifest.applyPlaceholders(string, indexEnd, placeholders);
        }
        String replaced = string.substring(0, indexStart) + replacement + string.substring(indexEnd + 1);
        return PackageManifest.applyPlaceholders(replaced, indexStart + replacement.length(), placeholders);
    }

    @Nullable
    private static String applyPlaceholders(@Nullable String string, @NotNull Map<String, String> placeholders) {
        if (string == null) {
            return null;
        }
        return PackageManifest.applyPlaceholders(string, 0, placeholders);
    }

    private static void extractProperties(@NotNull Element project, @NotNull GAV owner, @NotNull Map<String, String> out) {
        for (Element elem : new ChildElementIterable(project)) {
            if (XMLUtil.getChildElements(elem).isEmpty()) {
                String text = elem.getTextContent().trim();
                out.put("project." + elem.getTagName(), text);
                out.put("pom." + elem.getTagName(), text);
                out.put(elem.getTagName(), text);
            }
        }
        Element properties = XMLUtil.optElement(project, "properties");
        if (properties != null) {
            for (Element prop : new ChildElementIterable(properties)) {
                out.put(prop.getTagName(), prop.getTextContent().trim());
            }
        }

        out.put("project.groupId", owner.group());
        out.put("project.artifactId", owner.artifact());
        out.put("project.version", owner.version());
        out.put("pom.groupId", owner.group());
        out.put("pom.version", owner.version());
        out.put("groupId", owner.group());
        out.put("version", owner.version());
    }

    @NotNull
    private final List<@NotNull GAV> dependencies = new ArrayList<>();
    @NotNull
    private final List<@NotNull SkippedRecord> skipped = new ArrayList<>();

    /**
     * Reads a POM.
     *
     * @param is The stream to read the POM from. It is not closed by this constructor
     * @param owner The coordinates of the artifact the POM describes, with the concrete version
     * @param ignoreTestDependencies Whether dependencies with the "test" scope should be skipped
     * @param ignoreOptionalDependencies Whether dependencies marked as optional should be skipped
     * @throws SAXException If the POM is not well-formed
     * @throws IOException If the POM could not be read
     * @throws ParserConfigurationException If the XML parser could not be set up
     */
    public PackageManifest(@NotNull InputStream is, @NotNull GAV owner, boolean ignoreTestDependencies, boolean ignoreOptionalDependencies) throws SAXException, IOException, ParserConfigurationException {
        Document xmlDoc = XMLUtil.parse(is);
        Element project = xmlDoc.getDocumentElement();

        Map<String, String> placeholders = new HashMap<>();
        PackageManifest.extractProperties(project, owner, placeholders);

        Element deps = XMLUtil.optElement(project, "dependencies");
        if (deps == null) {
            return;
        }

        for (Element dependency : new ChildElementIterable(deps)) {
            if (!dependency.getTagName().equals("dependency")) {
                continue;
            }
            String group = PackageManifest.applyPlaceholders(XMLUtil.elementText(dependency, "groupId"), placeholders);
            String artifactId = PackageManifest.applyPlaceholders(XMLUtil.elementText(dependency, "artifactId"), placeholders);
            String version = PackageManifest.applyPlaceholders(XMLUtil.elementText(dependency, "version"), placeholders);
            String scope = PackageManifest.applyPlaceholders(XMLUtil.elementText(dependency, "scope"), placeholders);
            String optional = PackageManifest.applyPlaceholders(XMLUtil.elementText(dependency, "optional"), placeholders);

            if (ignoreTestDependencies && "test".equalsIgnoreCase(scope)) {
                continue;
            }
            if (ignoreOptionalDependencies && "true".equalsIgnoreCase(optional)) {
                continue;
            }

            if (group == null || group.isEmpty() || artifactId == null || artifactId.isEmpty()) {
                this.skipped.add(new SkippedRecord(group, artifactId, "groupId or artifactId missing"));
            } else if (version == null || version.isEmpty()) {
                this.skipped.add(new SkippedRecord(group, artifactId, "version missing"));
            } else if (version.contains("${")) {
                this.skipped.add(new SkippedRecord(group, artifactId, "unresolved placeholder in version " + version));
            } else {
                this.dependencies.add(new GAV(group, artifactId, version));
            }
        }
    }

    @NotNull
    public List<@NotNull GAV> getDependencies() {
        return Collections.unmodifiableList(this.dependencies);
    }

    @NotNull
    public List<@NotNull SkippedRecord> getSkipped() {
        return Collections.unmodifiableList(this.skipped);
    }
}
