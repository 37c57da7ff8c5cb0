package com.wraft.doc.build;

import com.wraft.doc.exception.BuildWorkspaceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Keeps every previous artifact of an instance as {@code history/final-v<N>.pdf}.
 */
@Slf4j
@Component
public class VersionHistoryRotator {

    private static final Pattern VERSION_FILE = Pattern.compile("final-v(\\d+)\\.pdf");

    /**
     * Copies the current {@code final.pdf} to the next free version slot.
     *
     * @return the written history file, empty when there was no artifact to keep
     */
    public Optional<Path> rotate(BuildWorkspace workspace) {
        Path historyDir = workspace.historyDir();
        try {
            Files.createDirectories(historyDir);
        } catch (IOException e) {
            throw new BuildWorkspaceException("History directory could not be created", historyDir, e);
        }

        Path current = workspace.finalFile();
        if (!Files.isRegularFile(current)) {
            log.debug("No previous artifact in {}, nothing to keep", workspace.root());
            return Optional.empty();
        }

        int next = highestVersion(historyDir).orElse(0) + 1;
        Path target = historyDir.resolve("final-v" + next + ".pdf");
        try {
            Files.copy(current, target, StandardCopyOption.COPY_ATTRIBUTES);
        } catch (IOException e) {
            throw new BuildWorkspaceException("Previous artifact could not be kept", target, e);
        }

        log.info("Kept previous artifact of {} as {}", workspace.instanceCode(), target.getFileName());
        return Optional.of(target);
    }

    /**
     * Highest version number present, compared numerically so v10 ranks above v9.
     */
    OptionalInt highestVersion(Path historyDir) {
        try (Stream<Path> files = Files.list(historyDir)) {
            return files
                    .map(p -> VERSION_FILE.matcher(p.getFileName().toString()))
                    .filter(Matcher::matches)
                    .mapToInt(m -> Integer.parseInt(m.group(1)))
                    .max();
        } catch (IOException e) {
            throw new BuildWorkspaceException("History directory could not be listed", historyDir, e);
        }
    }
}
