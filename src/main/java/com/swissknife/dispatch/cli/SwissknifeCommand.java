package com.swissknife.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Swissknife.
 * Routes to subcommands: serve, bridge, check, health.
 */
@Command(
        name = "swissknife",
        mixinStandardHelpOptions = true,
        version = "Swissknife 0.1.0",
        description = "Policy-guarded local tool registry and MCP stdio bridge",
        subcommands = {
                ServeCommand.class,
                BridgeCommand.class,
                PolicyCheckCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SwissknifeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
