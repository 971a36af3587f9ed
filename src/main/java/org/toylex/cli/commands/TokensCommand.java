package org.toylex.cli.commands;

import org.toylex.analyzer.lexer.TokenCatalog;
import org.toylex.analyzer.lexer.TokenKind;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "tokens", description = "Lists the token codes used in the program internal form.")
public class TokensCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        for (TokenKind kind : TokenCatalog.allKinds()) {
            String label = kind.isSymbolic() ? kind.name().toLowerCase(Locale.ROOT) : kind.lexeme();
            out.println(kind.code() + " " + label);
        }
        out.flush();
        return 0;
    }
}
