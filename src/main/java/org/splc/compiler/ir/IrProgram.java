package org.splc.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An instruction stream together with the routine templates its calls refer to.
 */
public record IrProgram(String programName, List<IrItem> items, Map<String, IrRoutine> routines) {

    public IrProgram {
        items = List.copyOf(items);
        routines = Collections.unmodifiableMap(new LinkedHashMap<>(routines));
    }

    public IrProgram withItems(List<IrItem> newItems) {
        return new IrProgram(programName, newItems, routines);
    }
}
