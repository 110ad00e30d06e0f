package ai.pipestream.frames.feed;

import ai.pipestream.frames.exception.FeedException;
import org.jboss.logging.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses product feeds (Atom with Google Merchant extensions, or RSS items).
 * <p>
 * A document that is not well-formed XML fails as a whole with a
 * {@link FeedException}. Individual entries missing a product id or image link
 * are reported as {@link ParseOutcome.Skipped} and parsing continues.
 * Unknown elements are ignored. DTDs and external entities are refused.
 */
public class FeedParser {

    private static final Logger LOG = Logger.getLogger(FeedParser.class);

    public static final String ATOM_NS = "http://www.w3.org/2005/Atom";
    public static final String GOOGLE_NS = "http://base.google.com/ns/1.0";

    private static final String[] ATTRIBUTE_NAMES = {"title", "link", "price", "brand", "description"};

    public FeedParseResult parse(byte[] document) {
        if (document == null || document.length == 0) {
            throw new FeedException("feed document is empty");
        }

        Document doc;
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            doc = builder.parse(new ByteArrayInputStream(document));
        } catch (SAXException e) {
            throw new FeedException("feed is not well-formed XML: " + e.getMessage(), e);
        } catch (IOException | ParserConfigurationException e) {
            throw new FeedException("feed could not be read: " + e.getMessage(), e);
        }

        List<Element> entries = findEntries(doc);
        List<ParseOutcome> outcomes = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            outcomes.add(parseEntry(i, entries.get(i)));
        }

        FeedParseResult result = new FeedParseResult(outcomes);
        LOG.infof("Parsed feed: entries=%d, products=%d, skipped=%d",
                entries.size(), result.products().size(), result.skipped().size());
        return result;
    }

    private ParseOutcome parseEntry(int position, Element entry) {
        String productId = childText(entry, "id");
        String imageUrl = childText(entry, "image_link");

        if (productId == null && imageUrl == null) {
            return skip(position, "missing product id and image link");
        }
        if (productId == null) {
            return skip(position, "missing product id");
        }
        if (imageUrl == null) {
            return skip(position, "missing image link for product " + productId);
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        for (String name : ATTRIBUTE_NAMES) {
            String value = "link".equals(name) ? linkValue(entry) : childText(entry, name);
            if (value != null) {
                attributes.put(name, value);
            }
        }
        return new ParseOutcome.Parsed(new ProductRecord(position, productId, imageUrl, attributes));
    }

    private static ParseOutcome skip(int position, String reason) {
        LOG.debugf("Skipping feed entry %d: %s", position, reason);
        return new ParseOutcome.Skipped(position, reason);
    }

    private static List<Element> findEntries(Document doc) {
        List<Element> entries = elements(doc.getElementsByTagNameNS(ATOM_NS, "entry"));
        if (entries.isEmpty()) {
            entries = elements(doc.getElementsByTagNameNS("*", "entry"));
        }
        if (entries.isEmpty()) {
            entries = elements(doc.getElementsByTagNameNS("*", "item"));
        }
        return entries;
    }

    /**
     * Text of the first direct child with the given local name. The Google
     * namespace wins over Atom or no namespace, since an Atom {@code id} is
     * often a URI while {@code g:id} is the product id.
     */
    private static String childText(Element parent, String localName) {
        String fallback = null;
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() != Node.ELEMENT_NODE || !localName.equals(localNameOf(node))) {
                continue;
            }
            String text = trimToNull(node.getTextContent());
            if (text == null) {
                continue;
            }
            if (GOOGLE_NS.equals(node.getNamespaceURI())) {
                return text;
            }
            if (fallback == null) {
                fallback = text;
            }
        }
        return fallback;
    }

    private static String linkValue(Element entry) {
        for (Node node = entry.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && "link".equals(localNameOf(node))) {
                String href = trimToNull(((Element) node).getAttribute("href"));
                if (href != null) {
                    return href;
                }
                String text = trimToNull(node.getTextContent());
                if (text != null) {
                    return text;
                }
            }
        }
        return null;
    }

    private static String localNameOf(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private static List<Element> elements(NodeList nodes) {
        List<Element> list = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            list.add((Element) nodes.item(i));
        }
        return list;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }
}
