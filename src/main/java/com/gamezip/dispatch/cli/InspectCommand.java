package com.gamezip.dispatch.cli;

import com.gamezip.archive.ArchiveProperties;
import com.gamezip.archive.MountException;
import com.gamezip.archive.ZipManager;
import com.gamezip.core.security.InputValidationException;
import com.gamezip.core.security.PathSecurity;
import com.gamezip.core.security.SecurityViolationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: gamezip inspect &lt;zip&gt; [--pattern REGEX]
 * <p>
 * Mounts an archive from the games directory, lists its entries and unmounts it again.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "List the entries of an archive")
@Component
public class InspectCommand implements Callable<Integer> {

    static final String INSPECT_MOUNT_ID = "cli-inspect";

    @Parameters(index = "0", description = "ZIP file, absolute or relative to the games directory")
    private String zipPath;

    @Option(names = {"-p", "--pattern"}, description = "Case-insensitive regex entries must match")
    private String pattern;

    private final ZipManager zipManager;
    private final ArchiveProperties archiveProperties;

    public InspectCommand(ZipManager zipManager, ArchiveProperties archiveProperties) {
        this.zipManager = zipManager;
        this.archiveProperties = archiveProperties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Path resolved;
        try {
            Path gamesRoot = Path.of(archiveProperties.getGamesPath());
            // relative names are taken from the games directory, not the working directory
            resolved = PathSecurity.resolveInsideRoot(gamesRoot, gamesRoot.resolve(zipPath).toString());
        } catch (SecurityViolationException | InputValidationException | InvalidPathException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        try {
            zipManager.mount(INSPECT_MOUNT_ID, resolved);
        } catch (MountException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        try {
            var files = zipManager.listFiles(INSPECT_MOUNT_ID, pattern);
            System.out.println();
            System.out.println("ARCHIVE " + resolved.getFileName());
            System.out.println("──────────────────────────────────");
            for (String name : files) {
                System.out.println("  " + name);
            }
            System.out.println();
            ConsoleOutput.info(files.size() + " entr" + (files.size() == 1 ? "y" : "ies")
                    + (pattern != null ? " matching " + pattern : ""));
            return 0;
        } finally {
            zipManager.unmount(INSPECT_MOUNT_ID);
        }
    }
}
