package com.d2stacks.dispatch.cli;

import com.d2stacks.portainer.PortainerApiHolder;
import com.d2stacks.portainer.model.Container;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: d2stacks containers [--all]
 * <p>
 * Lists the raw Docker containers of the endpoint with the compose project they belong to.
 */
@Command(name = "containers", mixinStandardHelpOptions = true, description = "List containers on the endpoint")
@Component
public class ContainersCommand implements Callable<Integer> {

    @Option(names = {"--all", "-a"}, description = "Include stopped containers")
    private boolean all;

    @Mixin
    private SessionOptions sessionOptions = new SessionOptions();

    private final CliSession cliSession;
    private final PortainerApiHolder apiHolder;

    public ContainersCommand(CliSession cliSession, PortainerApiHolder apiHolder) {
        this.cliSession = cliSession;
        this.apiHolder = apiHolder;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        return cliSession.open(sessionOptions)
                .flatMap(session -> apiHolder.current().getContainers(all))
                .fold(
                        error -> {
                            ConsoleOutput.error(error);
                            return 1;
                        },
                        containers -> {
                            if (containers.isEmpty()) {
                                ConsoleOutput.info("No containers found.");
                                return 0;
                            }
                            System.out.println();
                            System.out.printf("  %-12s %-10s %-28s %s%n", "ID", "STATE", "PROJECT", "IMAGE");
                            System.out.println("  " + "-".repeat(80));
                            for (var c : containers) {
                                System.out.printf("  %-12s %-10s %-28s %s%n",
                                        ConsoleOutput.truncate(c.id(), 12),
                                        c.state(),
                                        ConsoleOutput.truncate(c.label(Container.COMPOSE_PROJECT_LABEL), 28),
                                        c.image());
                            }
                            return 0;
                        });
    }
}
