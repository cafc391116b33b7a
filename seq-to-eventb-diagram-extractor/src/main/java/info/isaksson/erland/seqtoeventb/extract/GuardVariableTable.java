package info.isaksson.erland.seqtoeventb.extract;

import info.isaksson.erland.seqtoeventb.ir.IrGuardMode;
import info.isaksson.erland.seqtoeventb.ir.IrGuardVariable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Guard variables by name. Each name is classified once; later mentions never change it.
 */
final class GuardVariableTable {

    private final Map<String, IrGuardVariable> byName = new LinkedHashMap<>();

    /** @return whether {@code name} was new and is now registered */
    boolean tryRegister(String name, IrGuardMode mode, String initialValue) {
        if (byName.containsKey(name)) return false;
        byName.put(name, new IrGuardVariable(name, mode, initialValue));
        return true;
    }

    boolean contains(String name) {
        return byName.containsKey(name);
    }

    /** Sorted by name. */
    List<IrGuardVariable> toList() {
        List<IrGuardVariable> out = new ArrayList<>(byName.values());
        out.sort(Comparator.comparing(v -> v.name));
        return out;
    }
}
