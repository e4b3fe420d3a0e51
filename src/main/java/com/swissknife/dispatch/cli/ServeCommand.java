package com.swissknife.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: swissknife serve
 * <p>
 * Starts the HTTP tool registry. The web server is enabled by
 * {@link com.swissknife.SwissknifeApplication#main} detecting "serve" in args,
 * and {@link CliRunner} skips picocli so the server keeps the JVM alive.
 * <p>
 * Configure the port via {@code SERVER_PORT=9000 swissknife serve}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the HTTP tool registry")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8000}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Tool registry listening on port " + port);
        System.out.println();
        System.out.println("  Health:  http://127.0.0.1:" + port + "/health");
        System.out.println("  Tools:   http://127.0.0.1:" + port + "/tools/list");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
