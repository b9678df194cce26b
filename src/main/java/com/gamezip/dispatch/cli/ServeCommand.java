package com.gamezip.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: gamezip serve
 * <p>
 * Starts the archive server. The web server is enabled by
 * {@link com.gamezip.GamezipApplication#main} detecting "serve" in args;
 * {@link CliRunner} then skips picocli and this class only prints the banner
 * once Tomcat is listening.
 * <p>
 * Configure port via: {@code SERVER_PORT=22501 gamezip serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the GameZip HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:22501}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("GameZip server running on port " + port);
        System.out.println();
        System.out.println("  Mounts:  http://localhost:" + port + "/mounts");
        System.out.println("  Health:  http://localhost:" + port + "/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
