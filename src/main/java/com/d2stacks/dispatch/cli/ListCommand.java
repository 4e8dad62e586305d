package com.d2stacks.dispatch.cli;

import com.d2stacks.core.repository.D2StacksRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command: d2stacks list
 * <p>
 * Lists the DHIS2 stacks deployed on the session's endpoint.
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List stacks on the endpoint")
@Component
public class ListCommand implements Callable<Integer> {

    @Mixin
    private SessionOptions sessionOptions = new SessionOptions();

    private final CliSession cliSession;
    private final D2StacksRepository stacksRepository;

    public ListCommand(CliSession cliSession, D2StacksRepository stacksRepository) {
        this.cliSession = cliSession;
        this.stacksRepository = stacksRepository;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        return cliSession.open(sessionOptions)
                .flatMap(session -> stacksRepository.get())
                .fold(
                        error -> {
                            ConsoleOutput.error(error);
                            return 1;
                        },
                        stacks -> {
                            if (stacks.isEmpty()) {
                                ConsoleOutput.info("No stacks found.");
                                return 0;
                            }
                            System.out.println();
                            ConsoleOutput.stackHeader();
                            stacks.forEach(ConsoleOutput::stackRow);
                            System.out.println();
                            ConsoleOutput.info(stacks.size() + " stack" + (stacks.size() != 1 ? "s" : ""));
                            return 0;
                        });
    }
}
