package com.d2stacks.dispatch.cli;

import com.d2stacks.core.model.StackAccess;
import com.d2stacks.core.repository.D2StacksRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: d2stacks update &lt;stack-id&gt; [options]
 * <p>
 * Options left out keep the stack's current value. The permission is always
 * re-applied and replaces the previous one.
 */
@Command(name = "update", mixinStandardHelpOptions = true, description = "Update images, port or access of a stack")
@Component
public class UpdateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Stack ID")
    private int stackId;

    @Option(names = "--data-image", description = "DHIS2 data image")
    private String dataImage;

    @Option(names = "--core-image", description = "DHIS2 core image")
    private String coreImage;

    @Option(names = "--port", description = "Published HTTP port")
    private Integer port;

    @Option(names = "--access", description = "Access scope: ${COMPLETION-CANDIDATES}")
    private StackAccess access;

    @Option(names = "--team", split = ",", description = "Team ids granted access")
    private List<Integer> teamIds;

    @Option(names = "--user", split = ",", description = "User ids granted access")
    private List<Integer> userIds;

    @Mixin
    private SessionOptions sessionOptions = new SessionOptions();

    private final CliSession cliSession;
    private final D2StacksRepository stacksRepository;

    public UpdateCommand(CliSession cliSession, D2StacksRepository stacksRepository) {
        this.cliSession = cliSession;
        this.stacksRepository = stacksRepository;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        return cliSession.open(sessionOptions)
                .flatMap(session -> stacksRepository.getById(stackId))
                .map(stack -> stack.withSettings(
                        dataImage != null ? dataImage : stack.dataImage(),
                        coreImage != null ? coreImage : stack.coreImage(),
                        port != null ? port : stack.port(),
                        access != null ? access : stack.access(),
                        teamIds != null ? teamIds : stack.teamIds(),
                        userIds != null ? userIds : stack.userIds()))
                .flatMap(stacksRepository::update)
                .fold(
                        error -> {
                            ConsoleOutput.error("Cannot update stack " + stackId + ": " + error);
                            return 1;
                        },
                        ok -> {
                            ConsoleOutput.success("Stack " + stackId + " updated");
                            return 0;
                        });
    }
}
