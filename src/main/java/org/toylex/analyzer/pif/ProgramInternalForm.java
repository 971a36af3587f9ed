package org.toylex.analyzer.pif;

import org.toylex.analyzer.symbols.SymbolTable;

import java.util.List;

/**
 * The output of the {@link PifBuilder}: the final symbol table and the entries that refer to it.
 *
 * @param symbolTable The symbol table in its final state.
 * @param entries One entry per token, in source order.
 */
public record ProgramInternalForm(SymbolTable symbolTable, List<PifEntry> entries) {

    public ProgramInternalForm {
        entries = List.copyOf(entries);
    }
}
