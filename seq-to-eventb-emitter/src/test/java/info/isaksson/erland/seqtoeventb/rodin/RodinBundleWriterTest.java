package info.isaksson.erland.seqtoeventb.rodin;

import info.isaksson.erland.seqtoeventb.emitter.FormalModel;
import info.isaksson.erland.seqtoeventb.emitter.FormalModelSynthesizer;
import info.isaksson.erland.seqtoeventb.eventb.EventBTextWriter;
import info.isaksson.erland.seqtoeventb.ir.IrGuardMode;
import info.isaksson.erland.seqtoeventb.ir.IrGuardVariable;
import info.isaksson.erland.seqtoeventb.ir.IrInteraction;
import info.isaksson.erland.seqtoeventb.ir.IrMessageFlow;
import info.isaksson.erland.seqtoeventb.ir.IrScope;
import info.isaksson.erland.seqtoeventb.ir.IrScopeKind;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;

public class RodinBundleWriterTest {

    private static FormalModel model() {
        IrInteraction ir = new IrInteraction("1", "Shop", List.of(),
                List.of(new IrScope("l", IrScopeKind.LOOP, 1, 0, 0, 100, 100, "n < 3")),
                List.of(new IrMessageFlow(1, "order", "item", "Customer", "Shop", 20, "l", null),
                        new IrMessageFlow(2, "confirm", null, "Shop", "Customer", 40, null, null)),
                List.of(new IrGuardVariable("n", IrGuardMode.DEFAULT, "0")));
        return new FormalModelSynthesizer().synthesize(ir, 1);
    }

    @Test
    void bundleHasAllRodinFilesInOrder() throws Exception {
        FormalModel model = model();
        Path zip = Files.createTempDirectory("s2e-rodin-").resolve("shop.zip");

        RodinBundleWriter.write(model, zip);

        List<String> names = new ArrayList<>();
        String readable = null;
        try (ZipInputStream in = new ZipInputStream(Files.newInputStream(zip), StandardCharsets.UTF_8)) {
            ZipEntry e;
            while ((e = in.getNextEntry()) != null) {
                names.add(e.getName());
                if (e.getName().endsWith(".txt")) readable = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        assertEquals(List.of(
                "ShopContext.buc",
                "ShopContext.bcc",
                "ShopInteractionMachine_1.bum",
                "ShopInteractionMachine_1.bpo",
                "ShopInteractionMachine_1.bps",
                "Shop.bpr",
                "Shop_readable.txt"), names);
        assertEquals(EventBTextWriter.write(model), readable);
    }

    @Test
    void machineFileCarriesEscapedGuardsAndAllEvents() throws Exception {
        Document bum = parse(RodinBundleWriter.entries(model()).get("ShopInteractionMachine_1.bum"));

        assertEquals("org.eventb.core.machineFile", bum.getDocumentElement().getTagName());
        assertEquals(8, bum.getElementsByTagName("org.eventb.core.variable").getLength());
        assertEquals(8, bum.getElementsByTagName("org.eventb.core.invariant").getLength());

        NodeList events = bum.getElementsByTagName("org.eventb.core.event");
        assertEquals(5, events.getLength());
        Element sendOrder = (Element) events.item(1);
        assertEquals("sendorder_1_loop1", sendOrder.getAttribute("org.eventb.core.label"));

        NodeList guards = sendOrder.getElementsByTagName("org.eventb.core.guard");
        Element last = (Element) guards.item(guards.getLength() - 1);
        assertEquals("n < 3", last.getAttribute("org.eventb.core.predicate"));

        Element sees = (Element) bum.getElementsByTagName("org.eventb.core.seesContext").item(0);
        assertEquals("ShopContext", sees.getAttribute("org.eventb.core.target"));
    }

    @Test
    void contextFileDeclaresSetsConstantsAndAxioms() throws Exception {
        Map<String, String> entries = RodinBundleWriter.entries(model());
        Document buc = parse(entries.get("ShopContext.buc"));

        assertEquals(3, buc.getElementsByTagName("org.eventb.core.carrierSet").getLength());
        // Customer, Shop, order_1, confirm_2, item
        assertEquals(5, buc.getElementsByTagName("org.eventb.core.constant").getLength());
        Element axm1 = (Element) buc.getElementsByTagName("org.eventb.core.axiom").item(0);
        assertEquals("Objects = { Customer, Shop }", axm1.getAttribute("org.eventb.core.predicate"));
    }

    @Test
    void sameModelSameBytes() throws Exception {
        ByteArrayOutputStream a = new ByteArrayOutputStream();
        ByteArrayOutputStream b = new ByteArrayOutputStream();
        RodinBundleWriter.write(model(), a);
        RodinBundleWriter.write(model(), b);
        assertArrayEquals(a.toByteArray(), b.toByteArray());
    }

    private static Document parse(String xml) throws Exception {
        return DocumentBuilderFactory.newInstance().newDocumentBuilder()
                .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }
}
