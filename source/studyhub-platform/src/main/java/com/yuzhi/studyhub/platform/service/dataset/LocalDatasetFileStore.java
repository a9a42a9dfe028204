package com.yuzhi.studyhub.platform.service.dataset;

import com.yuzhi.studyhub.platform.config.DatasetFileProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalDatasetFileStore implements DatasetFileStore {

    private static final Logger log = LoggerFactory.getLogger(LocalDatasetFileStore.class);

    private final Path root;

    public LocalDatasetFileStore(DatasetFileProperties properties) {
        this.root = Paths.get(properties.getPath()).toAbsolutePath().normalize();
    }

    @Override
    public Optional<Path> resolve(String filename) {
        if (StringUtils.isBlank(filename)) {
            return Optional.empty();
        }
        Path candidate;
        try {
            candidate = root.resolve(filename).normalize();
        } catch (InvalidPathException ex) {
            log.warn("Dataset file name {} is not a valid path: {}", filename, ex.getMessage());
            return Optional.empty();
        }
        if (!candidate.startsWith(root)) {
            log.warn("Dataset file name {} escapes the dataset directory", filename);
            return Optional.empty();
        }
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    @Override
    public Optional<FileMetadata> stat(String filename) {
        Optional<Path> path = resolve(filename);
        if (path.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new FileMetadata(Files.size(path.get()), Files.getLastModifiedTime(path.get()).toInstant()));
        } catch (IOException ex) {
            log.warn("Cannot read metadata of dataset file {}: {}", filename, ex.getMessage());
            return Optional.empty();
        }
    }
}
