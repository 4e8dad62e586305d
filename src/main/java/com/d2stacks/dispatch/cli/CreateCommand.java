package com.d2stacks.dispatch.cli;

import com.d2stacks.core.model.D2NewStack;
import com.d2stacks.core.model.StackAccess;
import com.d2stacks.core.repository.D2StacksRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: d2stacks create --data-image &lt;image&gt; --core-image &lt;image&gt; --port &lt;port&gt;
 * <p>
 * Deploys a new stack from the configured compose repository, then applies its
 * permission. A stack whose permission could not be applied is still reported as
 * created, with a warning.
 */
@Command(name = "create", mixinStandardHelpOptions = true, description = "Create a stack")
@Component
public class CreateCommand implements Callable<Integer> {

    @Option(names = "--data-image", required = true, description = "DHIS2 data image, e.g. eyeseetea/dhis2-data:2.32-sierra")
    private String dataImage;

    @Option(names = "--core-image", required = true, description = "DHIS2 core image, e.g. eyeseetea/dhis2-core:2.32")
    private String coreImage;

    @Option(names = "--port", required = true, description = "Published HTTP port")
    private int port;

    @Option(names = "--access", defaultValue = "RESTRICTED",
            description = "Access scope: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private StackAccess access;

    @Option(names = "--team", split = ",", description = "Team ids granted access")
    private List<Integer> teamIds = new ArrayList<>();

    @Option(names = "--user", split = ",", description = "User ids granted access")
    private List<Integer> userIds = new ArrayList<>();

    @Mixin
    private SessionOptions sessionOptions = new SessionOptions();

    private final CliSession cliSession;
    private final D2StacksRepository stacksRepository;

    public CreateCommand(CliSession cliSession, D2StacksRepository stacksRepository) {
        this.cliSession = cliSession;
        this.stacksRepository = stacksRepository;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var newStack = new D2NewStack(dataImage, coreImage, port, access, teamIds, userIds);
        return cliSession.open(sessionOptions)
                .flatMap(session -> stacksRepository.create(newStack))
                .fold(
                        error -> {
                            ConsoleOutput.error("Cannot create stack: " + error);
                            return 1;
                        },
                        created -> {
                            ConsoleOutput.success("Stack created for " + dataImage);
                            created.warnings().forEach(ConsoleOutput::warning);
                            return 0;
                        });
    }
}
