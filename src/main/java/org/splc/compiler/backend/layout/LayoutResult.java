package org.splc.compiler.backend.layout;

import org.splc.compiler.api.SourceInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of the layout phase: placed instructions and the label table.
 *
 * @param placed The instructions in stream order with their addresses.
 * @param labelToAddress A map from label names to the address of their marker.
 * @param sourceMap A map from address to source information.
 */
public record LayoutResult(
        List<PlacedItem> placed,
        Map<String, Integer> labelToAddress,
        Map<Integer, SourceInfo> sourceMap
) {
    public LayoutResult {
        placed = List.copyOf(placed);
        labelToAddress = Collections.unmodifiableMap(new LinkedHashMap<>(labelToAddress));
        sourceMap = Collections.unmodifiableMap(new LinkedHashMap<>(sourceMap));
    }

    /**
     * @param newPlaced Rewritten instructions at the same addresses.
     * @return A copy of this result with the given instructions.
     */
    public LayoutResult withPlaced(List<PlacedItem> newPlaced) {
        return new LayoutResult(newPlaced, labelToAddress, sourceMap);
    }
}
