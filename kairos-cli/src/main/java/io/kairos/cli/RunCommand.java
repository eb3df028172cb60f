package io.kairos.cli;

import io.kairos.core.job.Job;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "run", description = "Run a job now and wait for it")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    GatewayOption gateway;

    @Parameters(index = "0", description = "Job id")
    String id;

    @Option(names = {"-f", "--force"}, description = "Run even if the job is disabled")
    boolean force;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (OpenRegistry open = context.registries().open(gateway.url)) {
            Long previousRun = open.registry().getJob(id).state().lastRunAtMs();
            boolean succeeded = open.registry().runJob(id, force);
            Job job = open.registry().getJob(id);
            String label = job.name() + " (" + id + ")";
            if (succeeded) {
                System.out.println("Job " + label + " succeeded");
                if (job.state().lastError() != null) {
                    System.out.println("Warning: " + job.state().lastError());
                }
                return 0;
            }
            if (Objects.equals(previousRun, job.state().lastRunAtMs())) {
                System.err.println("Job " + label + " did not run: disabled or already running");
            } else {
                System.err.println("Job " + label + " failed: " + job.state().lastError());
            }
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Run interrupted");
            return 1;
        } catch (Exception e) {
            System.err.println("Run failed: " + e.getMessage());
            return 1;
        }
    }
}
