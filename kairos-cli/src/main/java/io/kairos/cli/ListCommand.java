package io.kairos.cli;

import io.kairos.core.job.Job;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "list", description = "List jobs")
public final class ListCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    GatewayOption gateway;

    @Option(names = {"-a", "--all"}, description = "Include disabled jobs")
    boolean all;

    public ListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (OpenRegistry open = context.registries().open(gateway.url)) {
            List<Job> jobs = open.registry().listJobs(all);
            if (jobs.isEmpty()) {
                System.out.println(all ? "No jobs." : "No enabled jobs.");
                return 0;
            }
            jobs.forEach(job -> System.out.println(JobFormatter.summary(job)));
            return 0;
        } catch (Exception e) {
            System.err.println("List failed: " + e.getMessage());
            return 1;
        }
    }
}
