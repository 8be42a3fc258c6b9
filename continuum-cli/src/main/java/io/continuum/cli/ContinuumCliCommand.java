package io.continuum.cli;

import picocli.CommandLine.Command;

@Command(name = "continuum", mixinStandardHelpOptions = true, description = "Session and memory runtime for a conversational assistant")
public final class ContinuumCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
