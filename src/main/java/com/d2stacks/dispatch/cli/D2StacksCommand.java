package com.d2stacks.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for d2stacks.
 * Routes to subcommands managing DHIS2 stacks on a Portainer endpoint.
 */
@Command(
        name = "d2stacks",
        mixinStandardHelpOptions = true,
        version = "d2stacks 0.1.0",
        description = "Manage DHIS2 docker stacks through the Portainer API",
        subcommands = {
                LoginCommand.class,
                ListCommand.class,
                ShowCommand.class,
                CreateCommand.class,
                UpdateCommand.class,
                DeleteCommand.class,
                StartCommand.class,
                StopCommand.class,
                StatsCommand.class,
                ContainersCommand.class,
                MembersCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class D2StacksCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
