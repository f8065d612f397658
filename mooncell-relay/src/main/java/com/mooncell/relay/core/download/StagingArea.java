package com.mooncell.relay.core.download;

import com.mooncell.relay.config.RelayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 任务下载过程中的本地临时文件。每个任务一个文件，close 时删除。
 */
@Slf4j
@Component
public class StagingArea {

    private final Path root;

    public StagingArea(RelayProperties properties) {
        this.root = Paths.get(properties.getStagingDir());
    }

    public Staged allocate(String taskId) {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create staging dir " + root, e);
        }
        return new Staged(root.resolve(taskId + ".part"));
    }

    public Path getRoot() {
        return root;
    }

    public static final class Staged implements AutoCloseable {

        private final Path path;

        private Staged(Path path) {
            this.path = path;
        }

        public Path path() {
            return path;
        }

        @Override
        public void close() {
            try {
                if (Files.deleteIfExists(path)) {
                    log.debug("Staged file removed: {}", path);
                }
            } catch (IOException e) {
                log.warn("Failed to remove staged file {}: {}", path, e.getMessage());
            }
        }
    }
}
