package io.kairos.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Run the scheduler daemon with its HTTP gateway")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--port", description = "Gateway port (defaults to gateway.port from config)")
    Integer port;

    @Option(names = "--follow", description = "Print job events as they happen")
    boolean follow;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.serveRunner().run(port, follow);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
