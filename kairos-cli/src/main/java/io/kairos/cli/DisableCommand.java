package io.kairos.cli;

import io.kairos.core.job.Job;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(name = "disable", description = "Disable a job")
public final class DisableCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    GatewayOption gateway;

    @Parameters(index = "0", description = "Job id")
    String id;

    public DisableCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (OpenRegistry open = context.registries().open(gateway.url)) {
            Job job = open.registry().enableJob(id, false);
            System.out.println("Disabled job " + job.name() + " (" + job.id() + "), next run "
                + JobFormatter.time(job.state().nextRunAtMs()));
            return 0;
        } catch (Exception e) {
            System.err.println("Disable failed: " + e.getMessage());
            return 1;
        }
    }
}
