package com.yuzhi.studyhub.platform.service.files;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Where per-study documents are kept, one folder per study with role-named sub-folders.
 */
public interface StudyFileStore {
    /** Recursive listing of the study folder; empty when the folder does not exist. */
    List<StudyFileEntry> list(String studyId);

    /**
     * Readable file for {@code relativePath}, looked up in the study folder first and then in its
     * {@code roleFolder}. Empty when missing or when the path leaves the study folder.
     */
    Optional<Path> resolve(String studyId, String roleFolder, String relativePath);
}
