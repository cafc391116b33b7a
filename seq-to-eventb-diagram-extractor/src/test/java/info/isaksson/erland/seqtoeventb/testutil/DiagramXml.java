package info.isaksson.erland.seqtoeventb.testutil;

import java.util.Locale;

/**
 * Builds small draw.io documents for tests. Cells are emitted in call order under the default
 * layer {@code 1}.
 */
public final class DiagramXml {

    private final StringBuilder cells = new StringBuilder();

    public static DiagramXml diagram() {
        return new DiagramXml();
    }

    /** Lifeline 80 wide and 400 tall, so its center is {@code x + 40}. */
    public DiagramXml lifeline(String id, String label, double x) {
        return vertex(id, "1", label, "shape=umlLifeline;perimeter=lifelinePerimeter;whiteSpace=wrap;", x, 0, 80, 400);
    }

    public DiagramXml frame(String id, String label, double x, double y, double w, double h) {
        return vertex(id, "1", label, "shape=umlFrame;whiteSpace=wrap;html=1;", x, y, w, h);
    }

    public DiagramXml text(String id, String parent, String label, double x, double y) {
        return vertex(id, parent, label, "text;html=1;", x, y, 60, 20);
    }

    public DiagramXml vertex(String id, String parent, String label, String style,
                             double x, double y, double w, double h) {
        cells.append(String.format(Locale.ROOT,
                "<mxCell id=\"%s\" value=\"%s\" style=\"%s\" vertex=\"1\" parent=\"%s\">"
                        + "<mxGeometry x=\"%s\" y=\"%s\" width=\"%s\" height=\"%s\" as=\"geometry\"/></mxCell>\n",
                id, esc(label), style, parent, num(x), num(y), num(w), num(h)));
        return this;
    }

    /** Edge between two cells with explicit endpoint points at the given height. */
    public DiagramXml message(String id, String label, String source, String target,
                              double sourceX, double targetX, double y) {
        cells.append(String.format(Locale.ROOT,
                "<mxCell id=\"%s\" value=\"%s\" style=\"html=1;endArrow=block;\" edge=\"1\" parent=\"1\"%s%s>"
                        + "<mxGeometry relative=\"1\" as=\"geometry\">"
                        + "<mxPoint x=\"%s\" y=\"%s\" as=\"sourcePoint\"/>"
                        + "<mxPoint x=\"%s\" y=\"%s\" as=\"targetPoint\"/>"
                        + "</mxGeometry></mxCell>\n",
                id, esc(label), attr("source", source), attr("target", target),
                num(sourceX), num(y), num(targetX), num(y)));
        return this;
    }

    /** Free-floating edge with only endpoint points, no attached cells. */
    public DiagramXml floatingMessage(String id, String label, double sourceX, double targetX, double y) {
        return message(id, label, null, null, sourceX, targetX, y);
    }

    public String graphModel() {
        return "<mxGraphModel><root>\n"
                + "<mxCell id=\"0\"/>\n"
                + "<mxCell id=\"1\" parent=\"0\"/>\n"
                + cells
                + "</root></mxGraphModel>";
    }

    public String build(String pageName) {
        return "<mxfile host=\"test\">\n"
                + "<diagram id=\"d1\" name=\"" + esc(pageName) + "\">"
                + graphModel()
                + "</diagram>\n</mxfile>\n";
    }

    private static String attr(String name, String value) {
        return value == null ? "" : " " + name + "=\"" + value + "\"";
    }

    private static String num(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }

    private static String esc(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;").replace("\"", "&quot;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
