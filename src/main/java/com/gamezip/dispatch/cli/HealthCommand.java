package com.gamezip.dispatch.cli;

import com.gamezip.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: gamezip health
 * <p>
 * Checks the games directory and the CGI interpreter and prints coloured results.
 * Exits non-zero when a component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check server prerequisites")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean allUp = true;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DISABLED -> ConsoleOutput.info(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: ready to serve");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more components down");
        return 1;
    }
}
