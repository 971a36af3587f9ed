package org.toylex.analyzer.pif;

import org.toylex.analyzer.diagnostics.AnalyzerLogger;
import org.toylex.analyzer.lexer.ClassifiedToken;
import org.toylex.analyzer.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the program internal form from classified tokens.
 * <p>
 * The build runs in two passes. The first pass inserts every identifier and constant into a fresh
 * {@link SymbolTable} and remembers the node id for each token position. The second pass runs once
 * the table is final: a single in-order traversal yields the rank of every node, and each
 * remembered node id is replaced by that rank. Indices therefore always match the final
 * lexicographic order, whatever the insertion order was.
 */
public class PifBuilder {

    private static final int RESERVED = -1;

    /**
     * Builds the symbol table and program internal form for the given tokens.
     * @param tokens The classified tokens in source order.
     * @return The final symbol table together with the entries.
     */
    public ProgramInternalForm build(List<ClassifiedToken> tokens) {
        SymbolTable symbolTable = new SymbolTable();

        // Pass 1: collect node ids.
        int[] slots = new int[tokens.size()];
        for (int i = 0; i < tokens.size(); i++) {
            ClassifiedToken token = tokens.get(i);
            slots[i] = token.hasValue() ? symbolTable.insert(token.value()) : RESERVED;
        }

        // Pass 2: resolve ranks against the final table.
        int[] ranks = symbolTable.finalRanks();
        List<PifEntry> entries = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            ClassifiedToken token = tokens.get(i);
            entries.add(slots[i] == RESERVED
                    ? PifEntry.reserved(token.kind())
                    : new PifEntry(token.kind(), ranks[slots[i]]));
        }

        AnalyzerLogger.debug("PIF: " + entries.size() + " entries, " + symbolTable.size() + " symbols");
        return new ProgramInternalForm(symbolTable, entries);
    }
}
