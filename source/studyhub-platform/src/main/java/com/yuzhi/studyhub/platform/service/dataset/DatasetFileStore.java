package com.yuzhi.studyhub.platform.service.dataset;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Where dataset files named in {@code fw_psy_dataset_file.filename} are kept.
 */
public interface DatasetFileStore {
    /** Readable file for the name, or empty when it is missing or outside the store. */
    Optional<Path> resolve(String filename);

    Optional<FileMetadata> stat(String filename);

    record FileMetadata(long size, Instant lastModified) {}
}
