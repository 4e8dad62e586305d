package com.d2stacks.dispatch.cli;

import com.d2stacks.core.repository.D2StacksRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: d2stacks stop &lt;stack-id&gt;
 */
@Command(name = "stop", mixinStandardHelpOptions = true, description = "Stop the containers of a stack")
@Component
public class StopCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Stack ID")
    private int stackId;

    @Mixin
    private SessionOptions sessionOptions = new SessionOptions();

    private final CliSession cliSession;
    private final D2StacksRepository stacksRepository;

    public StopCommand(CliSession cliSession, D2StacksRepository stacksRepository) {
        this.cliSession = cliSession;
        this.stacksRepository = stacksRepository;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        return cliSession.open(sessionOptions)
                .flatMap(session -> stacksRepository.getById(stackId))
                .flatMap(stacksRepository::stop)
                .fold(
                        error -> {
                            ConsoleOutput.error("Cannot stop stack " + stackId + ": " + error);
                            return 1;
                        },
                        ok -> {
                            ConsoleOutput.success("Stack " + stackId + " stopped");
                            return 0;
                        });
    }
}
