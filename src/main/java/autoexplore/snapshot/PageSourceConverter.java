package autoexplore.snapshot;

import autoexplore.model.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a WebDriver / Appium page-source XML document into the
 * {@link SnapshotNode} shape consumed by {@link SnapshotParser}.
 *
 * <h3>Attribute mapping</h3>
 * <table>
 *   <tr><th>Platform</th><th>XML attribute</th><th>Snapshot attribute</th></tr>
 *   <tr><td>Android (UiAutomator2)</td><td>content-desc</td><td>accessibilityText</td></tr>
 *   <tr><td>iOS (XCUITest)</td><td>label</td><td>text</td></tr>
 *   <tr><td>iOS (XCUITest)</td><td>name</td><td>accessibilityText</td></tr>
 *   <tr><td>iOS (XCUITest)</td><td>accessible</td><td>clickable</td></tr>
 * </table>
 * Every other attribute is copied as-is; the tag name fills {@code class} when
 * the element carries none. iOS bounds are synthesised from x/y/width/height.
 */
public class PageSourceConverter {

    private static final Logger log = LoggerFactory.getLogger(PageSourceConverter.class);

    private final Platform platform;

    public PageSourceConverter(Platform platform) {
        this.platform = platform;
    }

    /**
     * @param xml page source as returned by {@code WebDriver.getPageSource()}
     * @throws SnapshotUnavailableException if the source is blank or not well-formed XML
     */
    public SnapshotNode convert(String xml) throws SnapshotUnavailableException {
        if (xml == null || xml.isBlank()) {
            throw new SnapshotUnavailableException("Page source is empty");
        }
        Document doc;
        try {
            doc = newBuilder().parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | IOException e) {
            throw new SnapshotUnavailableException("Page source is not well-formed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new SnapshotUnavailableException("XML parser unavailable: " + e.getMessage(), e);
        }
        SnapshotNode root = toNode(doc.getDocumentElement());
        log.debug("Converted {} page source to snapshot", platform.wireName());
        return root;
    }

    private SnapshotNode toNode(Node element) {
        Map<String, String> attrs = new LinkedHashMap<>();
        NamedNodeMap raw = element.getAttributes();
        for (int i = 0; i < raw.getLength(); i++) {
            Node a = raw.item(i);
            attrs.put(a.getNodeName(), a.getNodeValue());
        }
        Map<String, String> mapped = platform == Platform.IOS ? mapIos(attrs) : mapAndroid(attrs);
        mapped.putIfAbsent(SnapshotParser.ATTR_CLASS, element.getNodeName());

        List<SnapshotNode> children = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node child = nodes.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                children.add(toNode(child));
            }
        }
        return SnapshotNode.tree(mapped, children);
    }

    private static Map<String, String> mapAndroid(Map<String, String> attrs) {
        Map<String, String> out = new LinkedHashMap<>(attrs);
        String desc = out.remove("content-desc");
        if (desc != null) {
            out.put(SnapshotParser.ATTR_ACCESSIBILITY, desc);
        }
        return out;
    }

    private static Map<String, String> mapIos(Map<String, String> attrs) {
        Map<String, String> out = new LinkedHashMap<>(attrs);
        String label = out.remove("label");
        if (label != null) out.put(SnapshotParser.ATTR_TEXT, label);
        String name = out.remove("name");
        if (name != null) out.put(SnapshotParser.ATTR_ACCESSIBILITY, name);
        String accessible = out.remove("accessible");
        if (accessible != null) out.put(SnapshotParser.ATTR_CLICKABLE, accessible);
        String type = out.remove("type");
        if (type != null) out.put(SnapshotParser.ATTR_CLASS, type);

        String x = attrs.get("x"), y = attrs.get("y"), w = attrs.get("width"), h = attrs.get("height");
        if (x != null && y != null && w != null && h != null) {
            try {
                int left = Integer.parseInt(x), top = Integer.parseInt(y);
                int right = left + Integer.parseInt(w), bottom = top + Integer.parseInt(h);
                out.put(SnapshotParser.ATTR_BOUNDS, "[" + left + "," + top + "][" + right + "," + bottom + "]");
            } catch (NumberFormatException e) {
                log.debug("Non-numeric iOS frame x={} y={} w={} h={}", x, y, w, h);
            }
        }
        return out;
    }

    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setExpandEntityReferences(false);
        return factory.newDocumentBuilder();
    }
}
