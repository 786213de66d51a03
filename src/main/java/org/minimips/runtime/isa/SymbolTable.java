package org.minimips.runtime.isa;

import java.util.Map;
import java.util.Optional;

/**
 * The label tables visible to the instruction decoders.
 *
 * @param labels Text labels mapped to instruction indices.
 * @param dataAddresses Data labels mapped to addresses.
 */
public record SymbolTable(Map<String, Integer> labels, Map<String, Integer> dataAddresses) {

    public SymbolTable {
        labels = Map.copyOf(labels);
        dataAddresses = Map.copyOf(dataAddresses);
    }

    /**
     * Looks up a text label.
     * @param name The label name.
     * @return The instruction index, or empty if undefined.
     */
    public Optional<Integer> findLabel(String name) {
        return Optional.ofNullable(labels.get(name));
    }

    /**
     * Looks up a data label.
     * @param name The label name.
     * @return The address, or empty if undefined.
     */
    public Optional<Integer> findDataAddress(String name) {
        return Optional.ofNullable(dataAddresses.get(name));
    }
}
