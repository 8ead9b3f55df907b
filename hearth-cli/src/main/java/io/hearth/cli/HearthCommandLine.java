package io.hearth.cli;

import picocli.CommandLine;

public final class HearthCommandLine {

    private HearthCommandLine() {
    }

    public static CommandLine create(CliContext context) {
        CommandLine commandLine = new CommandLine(new HearthCliCommand());
        commandLine.addSubcommand("list", new ListCommand(context));
        commandLine.addSubcommand("show", new ShowCommand(context));
        commandLine.addSubcommand("stats", new StatsCommand(context));
        commandLine.addSubcommand("export", new ExportCommand(context));
        commandLine.addSubcommand("end", new EndCommand(context));
        commandLine.addSubcommand("analytics", new AnalyticsCommand(context));
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("gateway", new GatewayCommand(context));
        commandLine.setExecutionExceptionHandler(new ShortErrorHandler());
        return commandLine;
    }
}
