package org.carball.fathom.model.symbol;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Number of distinct bindings resolving to each code object, keyed by identity,
 * with the first name seen for each object kept for diagnostics.
 */
public class BindingMultiplicity {

    private final Map<CodeObject, Integer> occurrences = new IdentityHashMap<>();
    private final Map<CodeObject, String> representativeNames = new IdentityHashMap<>();

    public void record(SymbolBinding binding) {
        occurrences.merge(binding.code(), 1, Integer::sum);
        representativeNames.putIfAbsent(binding.code(), binding.qualifiedName());
    }

    public int occurrencesOf(CodeObject code) {
        return occurrences.getOrDefault(code, 0);
    }

    public String representativeName(CodeObject code) {
        return representativeNames.get(code);
    }

    public int distinctCodeObjects() {
        return occurrences.size();
    }
}
