package com.d2stacks.dispatch.cli;

import com.d2stacks.core.repository.D2StacksRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: d2stacks delete &lt;stack-id&gt;...
 * <p>
 * Deletes in the given order and stops at the first failure; stacks before the
 * failing one stay deleted.
 */
@Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete one or more stacks")
@Component
public class DeleteCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Stack IDs, deleted in order")
    private List<Integer> stackIds;

    @Mixin
    private SessionOptions sessionOptions = new SessionOptions();

    private final CliSession cliSession;
    private final D2StacksRepository stacksRepository;

    public DeleteCommand(CliSession cliSession, D2StacksRepository stacksRepository) {
        this.cliSession = cliSession;
        this.stacksRepository = stacksRepository;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        return cliSession.open(sessionOptions)
                .flatMap(session -> stacksRepository.delete(stackIds))
                .fold(
                        error -> {
                            ConsoleOutput.error("Delete stopped: " + error);
                            ConsoleOutput.info("Stacks listed before the failing one may already be deleted; run 'list' to check.");
                            return 1;
                        },
                        ok -> {
                            ConsoleOutput.success("Deleted " + stackIds.size() + " stack" + (stackIds.size() != 1 ? "s" : ""));
                            return 0;
                        });
    }
}
