package com.d2stacks.dispatch.cli;

import com.d2stacks.core.repository.MembershipRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command: d2stacks members
 * <p>
 * Lists the teams and users that stack permissions can be granted to.
 */
@Command(name = "members", mixinStandardHelpOptions = true, description = "List teams and users")
@Component
public class MembersCommand implements Callable<Integer> {

    @Mixin
    private SessionOptions sessionOptions = new SessionOptions();

    private final CliSession cliSession;
    private final MembershipRepository membershipRepository;

    public MembersCommand(CliSession cliSession, MembershipRepository membershipRepository) {
        this.cliSession = cliSession;
        this.membershipRepository = membershipRepository;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        return cliSession.open(sessionOptions)
                .flatMap(session -> membershipRepository.getMetadata())
                .fold(
                        error -> {
                            ConsoleOutput.error(error);
                            return 1;
                        },
                        metadata -> {
                            System.out.println();
                            System.out.println("TEAMS");
                            metadata.teams().forEach(t -> System.out.printf("  %-6d %s%n", t.id(), t.name()));
                            System.out.println();
                            System.out.println("USERS");
                            metadata.users().forEach(u -> System.out.printf("  %-6d %s%n", u.id(), u.username()));
                            return 0;
                        });
    }
}
