package io.kairos.cli;

import picocli.CommandLine.Command;

@Command(name = "kairos", mixinStandardHelpOptions = true, description = "Kairos durable job scheduler")
public final class KairosCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
