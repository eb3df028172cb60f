package io.kairos.cli;

import io.kairos.core.config.ConfigService;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.job.Job;
import io.kairos.core.job.JobPayload;
import io.kairos.core.job.JobSchedule;
import io.kairos.core.job.JobValidationException;
import io.kairos.core.schedule.AtTimeParser;
import java.time.ZoneId;
import java.util.concurrent.Callable;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "add", description = "Add a scheduled job")
public final class AddCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    GatewayOption gateway;

    @Parameters(index = "0", description = "Job name")
    String name;

    @Option(names = {"-m", "--message"}, required = true, description = "Message sent to the agent")
    String message;

    @ArgGroup(exclusive = true, multiplicity = "1")
    Trigger trigger;

    @Option(names = "--tz", description = "IANA zone for --cron and local --at times")
    String tz;

    @Option(names = "--deliver", description = "Deliver the agent response to a channel")
    boolean deliver;

    @Option(names = "--channel", description = "Channel to deliver to, e.g. telegram")
    String channel;

    @Option(names = "--to", description = "Recipient on the channel")
    String to;

    static final class Trigger {
        @Option(names = "--every", description = "Interval in seconds")
        Long everySeconds;

        @Option(names = "--cron", description = "5-field cron expression")
        String cron;

        @Option(names = "--at", description = "One-shot time: ISO instant, 'yyyy-MM-dd HH:mm', 'in 10m', 'tomorrow at 9am'")
        String at;
    }

    public AddCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            JobSchedule schedule = schedule();
            JobPayload payload = new JobPayload(message, deliver, channel, to);
            try (OpenRegistry open = context.registries().open(gateway.url)) {
                Job job = open.registry().addJob(name, schedule, payload);
                System.out.println("Added job " + job.name() + " (" + job.id() + ")");
                System.out.println("Schedule: " + job.schedule().describe());
                System.out.println("Next run: " + JobFormatter.time(job.state().nextRunAtMs()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Add failed: " + e.getMessage());
            return 1;
        }
    }

    private JobSchedule schedule() throws Exception {
        if (trigger.everySeconds != null) {
            try {
                return JobSchedule.every(Math.multiplyExact(trigger.everySeconds, 1000L));
            } catch (ArithmeticException e) {
                throw new JobValidationException("--every is too large: " + trigger.everySeconds + "s");
            }
        }
        if (trigger.cron != null) {
            return JobSchedule.cron(trigger.cron, tz);
        }
        KairosConfig config = context.configService().load(context.configPath());
        ZoneId zone = tz == null || tz.isBlank()
            ? ConfigService.defaultZone(config)
            : ZoneId.of(tz.trim());
        return JobSchedule.at(new AtTimeParser(context.clock(), zone).parse(trigger.at));
    }
}
