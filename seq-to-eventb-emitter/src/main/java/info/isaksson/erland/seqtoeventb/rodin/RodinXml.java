package info.isaksson.erland.seqtoeventb.rodin;

final class RodinXml {

    static final String PROLOG = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"no\"?>\n";

    private RodinXml() {}

    static String escapeAttr(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;")
                .replace("\"", "&quot;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\n", "&#10;");
    }

    /** {@code <name a1="v1" a2="v2"/>} with attributes given as alternating key/value pairs. */
    static String element(String name, boolean close, String... attrs) {
        StringBuilder sb = new StringBuilder("<").append(name);
        for (int i = 0; i + 1 < attrs.length; i += 2) {
            sb.append(' ').append(attrs[i]).append("=\"").append(escapeAttr(attrs[i + 1])).append('"');
        }
        sb.append(close ? "/>\n" : ">\n");
        return sb.toString();
    }
}
