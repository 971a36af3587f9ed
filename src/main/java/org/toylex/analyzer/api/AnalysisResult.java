package org.toylex.analyzer.api;

import org.toylex.analyzer.pif.PifEntry;

import java.util.List;
import java.util.Optional;

/**
 * The result of analyzing one source: the symbol table and the program internal form.
 * <p>
 * Every PIF index is a position in {@code symbolTableEntries} of this same result and is
 * meaningless for any other result.
 *
 * @param sourceName The logical name of the analyzed source.
 * @param symbolTableEntries The distinct identifiers and constants in ascending lexicographic order.
 * @param pif One entry per lexeme, in source order.
 */
public record AnalysisResult(String sourceName, List<String> symbolTableEntries, List<PifEntry> pif) {

    public AnalysisResult {
        symbolTableEntries = List.copyOf(symbolTableEntries);
        pif = List.copyOf(pif);
    }

    /**
     * Resolves the symbol an entry refers to.
     * @param entry An entry of this result.
     * @return The symbol text, or empty for reserved entries.
     */
    public Optional<String> symbolOf(PifEntry entry) {
        if (!entry.refersToSymbol()) {
            return Optional.empty();
        }
        return Optional.of(symbolTableEntries.get((int) entry.index()));
    }
}
