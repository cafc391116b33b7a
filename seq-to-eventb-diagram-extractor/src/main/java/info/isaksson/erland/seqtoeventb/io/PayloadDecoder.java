package info.isaksson.erland.seqtoeventb.io;

import java.io.ByteArrayOutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Decodes the compressed page payload draw.io writes inside {@code <diagram>}:
 * base64, then raw deflate, then percent-encoding.
 */
public final class PayloadDecoder {

    private PayloadDecoder() {}

    /**
     * @throws IllegalArgumentException if any stage fails (bad base64, bad deflate stream,
     *         bad percent escape)
     */
    public static String decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("empty payload");
        }
        byte[] compressed = Base64.getMimeDecoder().decode(payload.trim());
        String inflated = inflate(compressed);
        return URLDecoder.decode(inflated, StandardCharsets.UTF_8);
    }

    private static String inflate(byte[] compressed) {
        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, compressed.length * 4));
            byte[] buf = new byte[4096];
            while (!inflater.finished()) {
                int n = inflater.inflate(buf);
                if (n > 0) {
                    out.write(buf, 0, n);
                    continue;
                }
                if (inflater.needsDictionary()) throw new IllegalArgumentException("payload needs a preset dictionary");
                // no progress: truncated input
                break;
            }
            if (out.size() == 0) throw new IllegalArgumentException("payload inflated to nothing");
            return out.toString(StandardCharsets.UTF_8);
        } catch (DataFormatException e) {
            throw new IllegalArgumentException("payload is not a deflate stream: " + e.getMessage(), e);
        } finally {
            inflater.end();
        }
    }
}
