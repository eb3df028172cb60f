package io.kairos.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(name = "show", description = "Show one job")
public final class ShowCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    GatewayOption gateway;

    @Parameters(index = "0", description = "Job id")
    String id;

    public ShowCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (OpenRegistry open = context.registries().open(gateway.url)) {
            System.out.println(JobFormatter.details(open.registry().getJob(id)));
            return 0;
        } catch (Exception e) {
            System.err.println("Show failed: " + e.getMessage());
            return 1;
        }
    }
}
