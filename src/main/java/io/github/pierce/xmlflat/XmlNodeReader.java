package io.github.pierce.xmlflat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Parses XML into an {@link XmlNode} tree with a StAX stream reader.
 *
 * <p>DTDs and external entities are never resolved. The tree is assembled
 * with an explicit stack, so document depth is bounded by heap rather than
 * by the call stack. Tags and attribute names are taken as written,
 * prefixes included; attributes keep document order.</p>
 */
public final class XmlNodeReader {

    private static final Logger LOG = LoggerFactory.getLogger(XmlNodeReader.class);

    private static final XMLInputFactory FACTORY = newFactory();

    private XmlNodeReader() {
        // Utility class should not be instantiated
    }

    public static XmlNode read(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new XmlReadException("string", "document is empty", null);
        }
        String content = xml.startsWith("\uFEFF") ? xml.substring(1) : xml;
        try (Reader reader = new StringReader(content)) {
            return parse(FACTORY.createXMLStreamReader(reader), "string");
        } catch (XMLStreamException | IOException e) {
            throw new XmlReadException("string", e.getMessage(), e);
        }
    }

    public static XmlNode read(InputStream in) {
        try {
            return parse(FACTORY.createXMLStreamReader(in), "stream");
        } catch (XMLStreamException e) {
            throw new XmlReadException("stream", e.getMessage(), e);
        }
    }

    public static XmlNode read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            XmlNode root = parse(FACTORY.createXMLStreamReader(in), path.toString());
            LOG.info("Successfully parsed XML file: {}", path);
            return root;
        } catch (XMLStreamException | IOException e) {
            throw new XmlReadException(path.toString(), e.getMessage(), e);
        }
    }

    private static XMLInputFactory newFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
        return factory;
    }

    private static XmlNode parse(XMLStreamReader reader, String description) throws XMLStreamException {
        Deque<Frame> stack = new ArrayDeque<>();
        XmlNode root = null;
        try {
            while (reader.hasNext()) {
                int event = reader.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT -> {
                        if (!stack.isEmpty()) {
                            stack.peek().sawChild = true;
                        }
                        stack.push(new Frame(reader));
                    }
                    case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE -> {
                        Frame current = stack.peek();
                        if (current != null && !current.sawChild) {
                            current.text.append(reader.getText());
                        }
                    }
                    case XMLStreamConstants.END_ELEMENT -> {
                        Frame finished = stack.pop();
                        XmlNode node = finished.build();
                        if (stack.isEmpty()) {
                            root = node;
                        } else {
                            stack.peek().builder.child(node);
                        }
                    }
                    default -> {
                        // comments, processing instructions and the document end carry no data
                    }
                }
            }
        } finally {
            reader.close();
        }
        if (root == null) {
            throw new XmlReadException(description, "document has no root element", null);
        }
        return root;
    }

    /**
     * An element whose end tag has not been reached yet.
     */
    private static final class Frame {
        private final XmlNode.Builder builder;
        private final StringBuilder text = new StringBuilder();
        private boolean sawChild;

        Frame(XMLStreamReader reader) {
            this.builder = XmlNode.builder(qualifiedName(reader.getPrefix(), reader.getLocalName()));
            for (int i = 0; i < reader.getAttributeCount(); i++) {
                String name = qualifiedName(reader.getAttributePrefix(i), reader.getAttributeLocalName(i));
                builder.attribute(name, reader.getAttributeValue(i));
            }
        }

        XmlNode build() {
            return builder.text(text.toString()).build();
        }

        private static String qualifiedName(String prefix, String localName) {
            if (prefix == null || prefix.isEmpty() || localName.startsWith(prefix + ":")) {
                return localName;
            }
            return prefix + ":" + localName;
        }
    }
}
