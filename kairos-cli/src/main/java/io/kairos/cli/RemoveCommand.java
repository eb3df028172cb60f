package io.kairos.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(name = "remove", aliases = "rm", description = "Remove a job")
public final class RemoveCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    GatewayOption gateway;

    @Parameters(index = "0", description = "Job id")
    String id;

    public RemoveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (OpenRegistry open = context.registries().open(gateway.url)) {
            open.registry().removeJob(id);
            System.out.println("Removed job " + id);
            return 0;
        } catch (Exception e) {
            System.err.println("Remove failed: " + e.getMessage());
            return 1;
        }
    }
}
