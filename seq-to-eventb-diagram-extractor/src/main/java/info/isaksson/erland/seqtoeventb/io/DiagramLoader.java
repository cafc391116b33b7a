package info.isaksson.erland.seqtoeventb.io;

import info.isaksson.erland.seqtoeventb.model.Box;
import info.isaksson.erland.seqtoeventb.model.DiagramDocument;
import info.isaksson.erland.seqtoeventb.model.DiagramNode;
import info.isaksson.erland.seqtoeventb.model.Point;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads a draw.io / diagrams.net document into a {@link DiagramDocument}.
 *
 * <p>Both the plain form ({@code <diagram><mxGraphModel>...}) and the compressed form
 * ({@code <diagram>BASE64</diagram>}) are supported. If the compressed payload cannot be decoded
 * the outer tree is used as-is and {@link DiagramDocument#decodeProblem} explains why.</p>
 */
public final class DiagramLoader {

    /**
     * Loads a document from disk. The parser sees the raw bytes, so a byte order mark and the
     * {@code encoding} declaration are honored.
     */
    public DiagramDocument load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        Path name = path.getFileName();
        String fileName = name == null ? null : name.toString();
        Document outer;
        try (InputStream in = Files.newInputStream(path)) {
            outer = parse(new InputSource(in), describe(fileName));
        }
        return fromOuter(outer, fileName);
    }

    public DiagramDocument loadFromString(String xml, String fileName) throws DecodeException {
        if (xml == null) throw new IllegalArgumentException("xml must not be null");
        return fromOuter(parse(xml, describe(fileName)), fileName);
    }

    private static String describe(String fileName) {
        return "diagram document" + (fileName == null ? "" : " " + fileName);
    }

    private DiagramDocument fromOuter(Document outer, String fileName) {
        Element root = outer.getDocumentElement();

        List<String> diagramNames = new ArrayList<>();
        Element payloadHolder = null;
        NodeList diagrams = outer.getElementsByTagName("diagram");
        for (int i = 0; i < diagrams.getLength(); i++) {
            Element d = (Element) diagrams.item(i);
            String name = d.getAttribute("name");
            if (!name.isBlank()) diagramNames.add(name);
            if (payloadHolder == null && isPayload(d)) payloadHolder = d;
        }

        String rootName = root.getAttribute("name");

        if (payloadHolder != null) {
            try {
                String decoded = PayloadDecoder.decode(payloadHolder.getTextContent());
                Document inner = parse(decoded, "embedded payload");
                return new DiagramDocument(fileName, diagramNames, rootName, readCells(inner), true, null);
            } catch (IllegalArgumentException | DecodeException e) {
                String problem = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                return new DiagramDocument(fileName, diagramNames, rootName, readCells(outer), false, problem);
            }
        }
        return new DiagramDocument(fileName, diagramNames, rootName, readCells(outer), false, null);
    }

    /** A {@code <diagram>} without element children but with text holds a compressed page. */
    private static boolean isPayload(Element diagram) {
        NodeList children = diagram.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i).getNodeType() == Node.ELEMENT_NODE) return false;
        }
        String text = diagram.getTextContent();
        return text != null && !text.isBlank();
    }

    private static Document parse(String xml, String what) throws DecodeException {
        return parse(new InputSource(new StringReader(xml)), what);
    }

    private static Document parse(InputSource source, String what) throws DecodeException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(source);
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new DecodeException("Could not parse " + what + ": " + e.getMessage(), e);
        }
    }

    private static List<DiagramNode> readCells(Document doc) {
        List<DiagramNode> out = new ArrayList<>();
        NodeList all = doc.getElementsByTagName("*");
        for (int i = 0; i < all.getLength(); i++) {
            Element el = (Element) all.item(i);
            String tag = el.getTagName();
            if ("mxCell".equals(tag)) {
                if (isWrapper(el.getParentNode())) continue; // handled with its wrapper
                if (!el.hasAttribute("id")) continue;
                out.add(toNode(el.getAttribute("id"), tag, el.getAttribute("value"), el));
            } else if (isWrapper(el)) {
                Element cell = firstChild(el, "mxCell");
                if (cell == null || !el.hasAttribute("id")) continue;
                out.add(toNode(el.getAttribute("id"), tag, el.getAttribute("label"), cell));
            }
        }
        return out;
    }

    private static boolean isWrapper(Node n) {
        if (!(n instanceof Element)) return false;
        String tag = ((Element) n).getTagName();
        return "UserObject".equals(tag) || "object".equals(tag);
    }

    private static DiagramNode toNode(String id, String tag, String value, Element cell) {
        Element geom = firstChild(cell, "mxGeometry");
        Box box = Box.ZERO;
        Point source = null;
        Point target = null;
        List<Point> waypoints = new ArrayList<>();
        if (geom != null) {
            box = new Box(num(geom, "x"), num(geom, "y"), num(geom, "width"), num(geom, "height"));
            NodeList children = geom.getChildNodes();
            for (int i = 0; i < children.getLength(); i++) {
                if (!(children.item(i) instanceof Element)) continue;
                Element c = (Element) children.item(i);
                if ("mxPoint".equals(c.getTagName())) {
                    String as = c.getAttribute("as");
                    if ("sourcePoint".equals(as)) source = point(c);
                    else if ("targetPoint".equals(as)) target = point(c);
                } else if ("Array".equals(c.getTagName()) && "points".equals(c.getAttribute("as"))) {
                    NodeList pts = c.getElementsByTagName("mxPoint");
                    for (int j = 0; j < pts.getLength(); j++) {
                        waypoints.add(point((Element) pts.item(j)));
                    }
                }
            }
        }
        return new DiagramNode(
                id,
                tag,
                value,
                cell.getAttribute("style"),
                box,
                cell.getAttribute("parent"),
                "1".equals(cell.getAttribute("edge")),
                "1".equals(cell.getAttribute("vertex")),
                cell.getAttribute("source"),
                cell.getAttribute("target"),
                source,
                target,
                waypoints
        );
    }

    private static Element firstChild(Element parent, String tag) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node c = children.item(i);
            if (c instanceof Element && tag.equals(((Element) c).getTagName())) return (Element) c;
        }
        return null;
    }

    private static Point point(Element el) {
        return new Point(num(el, "x"), num(el, "y"));
    }

    /** Missing or malformed numbers read as 0, matching draw.io's own defaults. */
    private static double num(Element el, String attr) {
        String v = el.getAttribute(attr);
        if (v == null || v.isBlank()) return 0;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
