package com.d2stacks.dispatch.cli;

import com.d2stacks.core.repository.D2StacksRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: d2stacks start &lt;stack-id&gt;
 */
@Command(name = "start", mixinStandardHelpOptions = true, description = "Start the containers of a stack")
@Component
public class StartCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Stack ID")
    private int stackId;

    @Mixin
    private SessionOptions sessionOptions = new SessionOptions();

    private final CliSession cliSession;
    private final D2StacksRepository stacksRepository;

    public StartCommand(CliSession cliSession, D2StacksRepository stacksRepository) {
        this.cliSession = cliSession;
        this.stacksRepository = stacksRepository;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        return cliSession.open(sessionOptions)
                .flatMap(session -> stacksRepository.getById(stackId))
                .flatMap(stacksRepository::start)
                .fold(
                        error -> {
                            ConsoleOutput.error("Cannot start stack " + stackId + ": " + error);
                            return 1;
                        },
                        ok -> {
                            ConsoleOutput.success("Stack " + stackId + " started");
                            return 0;
                        });
    }
}
