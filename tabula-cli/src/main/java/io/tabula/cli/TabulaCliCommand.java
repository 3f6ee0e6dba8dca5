package io.tabula.cli;

import picocli.CommandLine.Command;

@Command(name = "tabula", mixinStandardHelpOptions = true, description = "Tabula conversational data analysis")
public final class TabulaCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
