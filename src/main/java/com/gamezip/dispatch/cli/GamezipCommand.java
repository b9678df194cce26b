package com.gamezip.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: serve, health, inspect.
 */
@Command(
        name = "gamezip",
        mixinStandardHelpOptions = true,
        version = "gamezip-server 0.1.0",
        description = "Serves legacy web content from mounted ZIP archives",
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                InspectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class GamezipCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
