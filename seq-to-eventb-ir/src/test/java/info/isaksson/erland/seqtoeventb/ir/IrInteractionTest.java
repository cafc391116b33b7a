package info.isaksson.erland.seqtoeventb.ir;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IrInteractionTest {

    @Test
    void defaultsApplyToMissingValues() {
        IrInteraction ir = new IrInteraction(null, " ", null, null, null, null);
        assertEquals("1", ir.schemaVersion);
        assertEquals("System", ir.baseName);
        assertTrue(ir.lifelines.isEmpty());
        assertTrue(ir.findScope(null).isEmpty());
    }

    @Test
    void flowIdentityAndReceiverPlaceholder() {
        IrMessageFlow f = new IrMessageFlow(3, "pay", "", "Shop", null, 120, null, "e1");
        assertEquals("pay_3", f.instanceId());
        assertNull(f.data);
        assertEquals(IrMessageFlow.UNKNOWN_PARTICIPANT, f.receiver);
        assertEquals("pay_1", f.withOrdinal(1).instanceId());
        assertEquals("s1", f.withScope("s1").scopeId);
    }

    @Test
    void scopeSuffixAndVerticalSpan() {
        IrScope s = new IrScope("f", IrScopeKind.PARALLEL, 2, 0, 60, 100, 60, "");
        assertEquals("_par2", s.suffix());
        assertNull(s.guard);
        assertTrue(s.spansVertically(60));
        assertTrue(s.spansVertically(120));
        assertFalse(s.spansVertically(121));

        IrInteraction ir = new IrInteraction("1", "X", List.of(), List.of(s), List.of(), List.of());
        assertSame(s, ir.findScope("f").orElseThrow());
    }

    @Test
    void keywordsParseInBothForms() {
        assertEquals(IrScopeKind.OPTIONAL, IrScopeKind.fromKeyword("OPT"));
        assertEquals(IrScopeKind.ALTERNATIVE, IrScopeKind.fromKeyword("alternative"));
        assertEquals(IrScopeKind.PARALLEL, IrScopeKind.fromKeyword("par"));
        assertNull(IrScopeKind.fromKeyword("critical"));
    }
}
