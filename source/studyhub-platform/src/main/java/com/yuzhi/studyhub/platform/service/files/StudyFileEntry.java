package com.yuzhi.studyhub.platform.service.files;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/**
 * One node of a study folder listing. Files carry {@code size} and {@code modified}; directories
 * carry {@code children}. {@code path} is relative to the study folder.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StudyFileEntry(String name, String path, String type, Long size, Instant modified, List<StudyFileEntry> children) {
    public static final String FILE = "file";
    public static final String DIRECTORY = "directory";

    public static StudyFileEntry file(String name, String path, long size, Instant modified) {
        return new StudyFileEntry(name, path, FILE, size, modified, null);
    }

    public static StudyFileEntry directory(String name, String path, List<StudyFileEntry> children) {
        return new StudyFileEntry(name, path, DIRECTORY, null, null, List.copyOf(children));
    }
}
