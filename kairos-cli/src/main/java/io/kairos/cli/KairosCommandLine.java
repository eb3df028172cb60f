package io.kairos.cli;

import picocli.CommandLine;

/**
 * Assembles the command tree over one {@link CliContext}.
 */
public final class KairosCommandLine {

    private KairosCommandLine() {
    }

    public static CommandLine create(CliContext context) {
        CommandLine commandLine = new CommandLine(new KairosCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("add", new AddCommand(context));
        commandLine.addSubcommand("list", new ListCommand(context));
        commandLine.addSubcommand("show", new ShowCommand(context));
        commandLine.addSubcommand("enable", new EnableCommand(context));
        commandLine.addSubcommand("disable", new DisableCommand(context));
        commandLine.addSubcommand("remove", new RemoveCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));
        return commandLine;
    }
}
