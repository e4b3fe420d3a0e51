package com.swissknife.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SwissknifeCommand swissknifeCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SwissknifeCommand swissknifeCommand, IFactory factory) {
        this.swissknifeCommand = swissknifeCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // In serve mode the embedded web server keeps the JVM alive; picocli's
        // execute() would return at once and let main() shut the context down.
        if (isServeCommand(args)) {
            return;
        }
        exitCode = new CommandLine(swissknifeCommand, factory).execute(args);
    }

    /**
     * Serve mode is selected by the subcommand position only, so a
     * {@code serve} token inside another command's arguments does not count.
     */
    public static boolean isServeCommand(String... args) {
        return args.length > 0 && "serve".equals(args[0]);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
