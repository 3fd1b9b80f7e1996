package org.stianloader.jarresolver.internal;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

public class XMLUtil {

    public static class ChildElementIterable implements Iterable<@NotNull Element> {

        @NotNull
        private final Element parent;

        public ChildElementIterable(@NotNull Element parent) {
            this.parent = Objects.requireNonNull(parent, "parent may not be null");
        }

        @Override
        public Iterator<@NotNull Element> iterator() {
            return new ElementNodeListIterator(this.parent.getChildNodes());
        }
    }

    private static class ElementNodeListIterator implements Iterator<@NotNull Element> {
        private int i = 0;
        @NotNull
        private final NodeList nodeList;

        public ElementNodeListIterator(@NotNull NodeList list) {
            this.nodeList = list;
        }

        @Override
        public boolean hasNext() {
            while (this.i < this.nodeList.getLength()) {
                if (this.nodeList.item(this.i) instanceof Element) {
                    return true;
                }
                this.i++;
            }
            return false;
        }

        @Override
        @NotNull
        public Element next() {
            if (!this.hasNext()) {
                throw new NoSuchElementException("Iterator exausted: i = " + this.i + ", len = " + this.nodeList.getLength());
            }
            return (Element) this.nodeList.item(this.i++);
        }
    }

    /**
     * Obtains the trimmed text of the first direct child element with the given name.
     *
     * @param parent The parent element
     * @param name The tag name of the child element
     * @return The text of the child, or null if there is no such child
     */
    @Nullable
    public static String elementText(@NotNull Element parent, @NotNull String name) {
        Element e = XMLUtil.optElement(parent, name);
        if (e == null) {
            return null;
        }
        return e.getTextContent().trim();
    }

    @NotNull
    public static List<@NotNull Element> getChildElements(@NotNull Element parent) {
        List<@NotNull Element> collected = new ArrayList<>();
        for (Element child : new ChildElementIterable(parent)) {
            collected.add(child);
        }
        return collected;
    }

    @Nullable
    public static Element optElement(@NotNull Element parent, @NotNull String name) {
        for (Element e : new ChildElementIterable(parent)) {
            if (e.getTagName().equals(name)) {
                return e;
            }
        }
        return null;
    }

    /**
     * Parses a document with external entities disabled, the way metadata and POM files are read throughout jarresolver.
     * The stream is not closed by this method.
     *
     * @param is The stream to read from
     * @return The parsed and normalized document
     * @throws IOException If the stream could not be read
     * @throws SAXException If the stream does not hold well-formed XML
     * @throws ParserConfigurationException If the parser could not be configured securely
     */
    @NotNull
    public static Document parse(@NotNull InputStream is) throws IOException, SAXException, ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        Document xmlDoc = factory.newDocumentBuilder().parse(is);
        xmlDoc.getDocumentElement().normalize();
        return xmlDoc;
    }
}
