package com.d2stacks.dispatch.cli;

import com.d2stacks.core.repository.D2StacksRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: d2stacks stats &lt;stack-id&gt;
 * <p>
 * Prints the Portainer UI pages showing live statistics of each container of the stack.
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show container statistics URLs of a stack")
@Component
public class StatsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Stack ID")
    private int stackId;

    @Mixin
    private SessionOptions sessionOptions = new SessionOptions();

    private final CliSession cliSession;
    private final D2StacksRepository stacksRepository;

    public StatsCommand(CliSession cliSession, D2StacksRepository stacksRepository) {
        this.cliSession = cliSession;
        this.stacksRepository = stacksRepository;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        return cliSession.open(sessionOptions)
                .flatMap(session -> stacksRepository.getById(stackId))
                .map(stacksRepository::getStatsUrls)
                .fold(
                        error -> {
                            ConsoleOutput.error("Stack " + stackId + ": " + error);
                            return 1;
                        },
                        stats -> {
                            System.out.println();
                            System.out.println("  Core:    " + orNone(stats.core()));
                            System.out.println("  DB:      " + orNone(stats.db()));
                            System.out.println("  Gateway: " + orNone(stats.gateway()));
                            return 0;
                        });
    }

    private static String orNone(String url) {
        return url.isEmpty() ? "(no container)" : url;
    }
}
