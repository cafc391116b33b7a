package info.isaksson.erland.seqtoeventb.io;

import info.isaksson.erland.seqtoeventb.model.DiagramDocument;
import info.isaksson.erland.seqtoeventb.model.DiagramNode;
import info.isaksson.erland.seqtoeventb.testutil.DiagramXml;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.zip.Deflater;

import static org.junit.jupiter.api.Assertions.*;

public class DiagramLoaderTest {

    private final DiagramLoader loader = new DiagramLoader();

    @Test
    void readsPlainDocumentFromFile() throws Exception {
        String xml = DiagramXml.diagram()
                .lifeline("a", "user:User", 60)
                .lifeline("b", "Server", 260)
                .message("m1", "login(user)", "a", "b", 100, 300, 40)
                .build("Login");
        Path dir = Files.createTempDirectory("s2e-loader-");
        Path file = dir.resolve("login.drawio");
        Files.writeString(file, xml, StandardCharsets.UTF_8);

        DiagramDocument doc = loader.load(file);

        assertEquals("login.drawio", doc.fileName);
        assertEquals(List.of("Login"), doc.diagramNames);
        assertFalse(doc.decodedPayload);
        assertNull(doc.decodeProblem);
        assertEquals(5, doc.size());

        DiagramNode a = doc.node("a");
        assertTrue(a.vertex);
        assertEquals("user:User", a.label);
        assertEquals(60.0, a.geometry.x);
        assertEquals("1", a.parentId);

        DiagramNode m1 = doc.node("m1");
        assertTrue(m1.edge);
        assertEquals("a", m1.sourceId);
        assertEquals("b", m1.targetId);
        assertEquals(40.0, m1.sourcePoint.y);
        assertEquals(300.0, m1.targetPoint.x);
    }

    @Test
    void honorsByteOrderMark() throws Exception {
        String xml = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" + DiagramXml.diagram()
                .lifeline("a", "Kassa", 60)
                .build("Kassa");
        byte[] body = xml.getBytes(StandardCharsets.UTF_8);
        byte[] withBom = new byte[body.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(body, 0, withBom, 3, body.length);
        Path file = Files.createTempDirectory("s2e-loader-bom-").resolve("bom.drawio");
        Files.write(file, withBom);

        DiagramDocument doc = loader.load(file);

        assertEquals(List.of("Kassa"), doc.diagramNames);
        assertEquals("Kassa", doc.node("a").label);
    }

    @Test
    void honorsDeclaredEncoding() throws Exception {
        String xml = "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?>\n" + DiagramXml.diagram()
                .lifeline("a", "Kund", 60)
                .lifeline("b", "Växel", 260)
                .build("Översikt");
        Path file = Files.createTempDirectory("s2e-loader-latin1-").resolve("latin1.drawio");
        Files.write(file, xml.getBytes(StandardCharsets.ISO_8859_1));

        DiagramDocument doc = loader.load(file);

        assertEquals(List.of("Översikt"), doc.diagramNames);
        assertEquals("Växel", doc.node("b").label);
    }

    @Test
    void nonAsciiUtf8WithoutDeclaration() throws Exception {
        String xml = DiagramXml.diagram()
                .lifeline("a", "ผู้ใช้", 60)
                .build("ระบบ");
        Path file = Files.createTempDirectory("s2e-loader-utf8-").resolve("thai.drawio");
        Files.writeString(file, xml, StandardCharsets.UTF_8);

        DiagramDocument doc = loader.load(file);

        assertEquals(List.of("ระบบ"), doc.diagramNames);
        assertEquals("ผู้ใช้", doc.node("a").label);
    }

    @Test
    void malformedFileIsFatal() throws Exception {
        Path file = Files.createTempDirectory("s2e-loader-bad-").resolve("bad.drawio");
        Files.writeString(file, "<mxfile><diagram>", StandardCharsets.UTF_8);

        DecodeException e = assertThrows(DecodeException.class, () -> loader.load(file));
        assertTrue(e.getMessage().contains("bad.drawio"), e.getMessage());
    }

    @Test
    void decodesCompressedPayload() throws Exception {
        String inner = DiagramXml.diagram()
                .lifeline("a", "Alice", 0)
                .lifeline("b", "Bob", 200)
                .graphModel();
        String xml = "<mxfile><diagram id=\"p\" name=\"Shop\">" + compress(inner) + "</diagram></mxfile>";

        DiagramDocument doc = loader.loadFromString(xml, "shop.drawio");

        assertTrue(doc.decodedPayload);
        assertNull(doc.decodeProblem);
        assertEquals(List.of("Shop"), doc.diagramNames);
        assertEquals("Bob", doc.node("b").label);
    }

    @Test
    void brokenPayloadFallsBackToOuterTree() throws Exception {
        // 0xFF.. is a deflate block with the reserved block type
        String xml = "<mxfile name=\"Outer\"><diagram name=\"Page-1\">////AAAA</diagram></mxfile>";

        DiagramDocument doc = loader.loadFromString(xml, null);

        assertFalse(doc.decodedPayload);
        assertNotNull(doc.decodeProblem);
        assertEquals("Outer", doc.rootName);
        assertEquals(0, doc.size());
    }

    @Test
    void malformedMarkupIsFatal() {
        DecodeException e = assertThrows(DecodeException.class,
                () -> loader.loadFromString("<mxfile><diagram>", "bad.drawio"));
        assertNotNull(e.getCause());
        assertTrue(e.getMessage().contains("bad.drawio"), e.getMessage());
    }

    @Test
    void flattensUserObjectWrappersAndStripsMarkup() throws Exception {
        String xml = "<mxGraphModel><root><mxCell id=\"0\"/><mxCell id=\"1\" parent=\"0\"/>"
                + "<UserObject id=\"u1\" label=\"&lt;b&gt;Shop&lt;/b&gt;&lt;br&gt;Service\">"
                + "<mxCell style=\"shape=umlLifeline;\" vertex=\"1\" parent=\"1\">"
                + "<mxGeometry x=\"10\" width=\"100\" height=\"300\" as=\"geometry\"/></mxCell></UserObject>"
                + "</root></mxGraphModel>";

        DiagramDocument doc = loader.loadFromString(xml, null);

        assertEquals(3, doc.size());
        DiagramNode u = doc.node("u1");
        assertEquals("UserObject", u.tag);
        assertEquals("Shop Service", u.label);
        assertEquals(0.0, u.geometry.y);
        assertEquals(100.0, u.geometry.width);
    }

    private static String compress(String xml) {
        byte[] encoded = URLEncoder.encode(xml, StandardCharsets.UTF_8).getBytes(StandardCharsets.UTF_8);
        Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, true);
        deflater.setInput(encoded);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[1024];
        while (!deflater.finished()) {
            int n = deflater.deflate(buf);
            out.write(buf, 0, n);
        }
        deflater.end();
        return Base64.getEncoder().encodeToString(out.toByteArray());
    }
}
