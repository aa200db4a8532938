package org.splc.compiler.backend.link;

import org.splc.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable context for the linking phase.
 */
public final class LinkingContext {

    /**
     * A jump whose label is not in the label table.
     */
    public record UnresolvedReference(int address, String labelName, SourceInfo source) {}

    private int currentAddress;
    private int resolvedCount;
    private final List<UnresolvedReference> unresolved = new ArrayList<>();

    /**
     * @param address The address of the instruction being linked.
     */
    public void moveTo(int address) { this.currentAddress = address; }

    public void recordResolved() { resolvedCount++; }

    public int resolvedCount() { return resolvedCount; }

    public void recordUnresolved(String labelName, SourceInfo source) {
        unresolved.add(new UnresolvedReference(currentAddress, labelName, source));
    }

    /**
     * @return The unresolved references in address order.
     */
    public List<UnresolvedReference> unresolved() { return Collections.unmodifiableList(unresolved); }
}
