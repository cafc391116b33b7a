package info.isaksson.erland.seqtoeventb.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * draw.io stores rich labels as HTML fragments. We only need the visible text.
 */
public final class MarkupText {

    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern BREAK = Pattern.compile("(?i)<br\\s*/?>|</div>|</p>");
    private static final Pattern WS = Pattern.compile("\\s+");
    private static final Pattern NUMERIC = Pattern.compile("&#(?:([xX])([0-9A-Fa-f]{1,6})|([0-9]{1,7}));");

    private MarkupText() {}

    public static String strip(String raw) {
        if (raw == null || raw.isEmpty()) return "";
        String s = BREAK.matcher(raw).replaceAll(" ");
        s = TAG.matcher(s).replaceAll("");
        s = decodeEntities(s);
        return WS.matcher(s).replaceAll(" ").trim();
    }

    static String decodeEntities(String s) {
        if (s.indexOf('&') < 0) return s;
        // &amp; last so "&amp;lt;" stays "&lt;"
        s = s.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'");
        s = decodeNumeric(s);
        return s.replace("&amp;", "&");
    }

    /** {@code &#60;} and {@code &#x3C;}; out-of-range code points are left as written. */
    private static String decodeNumeric(String s) {
        Matcher m = NUMERIC.matcher(s);
        if (!m.find()) return s;
        StringBuilder sb = new StringBuilder(s.length());
        int last = 0;
        do {
            int cp = m.group(1) != null ? Integer.parseInt(m.group(2), 16) : Integer.parseInt(m.group(3));
            sb.append(s, last, m.start());
            if (Character.isValidCodePoint(cp) && cp != 0) {
                sb.appendCodePoint(cp == 0xA0 ? ' ' : cp);
            } else {
                sb.append(m.group());
            }
            last = m.end();
        } while (m.find());
        sb.append(s, last, s.length());
        return sb.toString();
    }
}
