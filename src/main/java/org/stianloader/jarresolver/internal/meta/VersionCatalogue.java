package org.stianloader.jarresolver.internal.meta;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.xml.parsers.ParserConfigurationException;

import org.jetbrains.annotations.NotNull;
import org.stianloader.jarresolver.internal.ConfusedResolverException;
import org.stianloader.jarresolver.internal.XMLUtil;
import org.stianloader.jarresolver.internal.XMLUtil.ChildElementIterable;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

/**
 * The versions of an artifact as listed by the A-level maven-metadata.xml of a repository.
 * Versions are kept verbatim and in file order, as the version text is needed to locate the files
 * of the version on disk.
 */
public class VersionCatalogue {

    @NotNull
    private final List<@NotNull String> versions = new ArrayList<>();

    public VersionCatalogue(@NotNull InputStream is) throws SAXException, IOException, ParserConfigurationException {
        Document xmlDoc = XMLUtil.parse(is);
        Element metadata = xmlDoc.getDocumentElement();

        Element versioning = XMLUtil.optElement(metadata, "versioning");
        if (versioning == null) {
            throw new ConfusedResolverException("Data did not contain a valid maven-metadata.xml file: The versioning element is absent.");
        }

        // The latest and release elements are not consulted, LATEST is settled against the listed versions
        Element versionsElement = XMLUtil.optElement(versioning, "versions");
        if (versionsElement == null) {
            throw new ConfusedResolverException("Data did not contain a valid maven-metadata.xml file that lists the versions of an artifact.");
        }

        for (Element element : new ChildElementIterable(versionsElement)) {
            if (element.getTagName().equalsIgnoreCase("version")) {
                String version = element.getTextContent().trim();
                if (!version.isEmpty()) {
                    this.versions.add(version);
                }
            }
        }
    }

    @NotNull
    public List<@NotNull String> getVersions() {
        return Collections.unmodifiableList(this.versions);
    }
}
