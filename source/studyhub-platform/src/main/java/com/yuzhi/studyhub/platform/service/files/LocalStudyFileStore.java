package com.yuzhi.studyhub.platform.service.files;

import com.yuzhi.studyhub.platform.config.StudyFileProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalStudyFileStore implements StudyFileStore {

    private static final Logger log = LoggerFactory.getLogger(LocalStudyFileStore.class);

    private final Path root;

    public LocalStudyFileStore(StudyFileProperties properties) {
        this.root = Paths.get(properties.getPath()).toAbsolutePath().normalize();
    }

    @Override
    public List<StudyFileEntry> list(String studyId) {
        Optional<Path> studyDir = studyFolder(studyId);
        if (studyDir.isEmpty() || !Files.isDirectory(studyDir.get())) {
            return List.of();
        }
        try {
            return listDirectory(studyDir.get(), studyDir.get());
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot list files of study " + studyId, ex);
        }
    }

    @Override
    public Optional<Path> resolve(String studyId, String roleFolder, String relativePath) {
        Optional<Path> studyDir = studyFolder(studyId);
        if (studyDir.isEmpty() || StringUtils.isBlank(relativePath)) {
            return Optional.empty();
        }
        Optional<Path> direct = regularFileWithin(studyDir.get(), studyDir.get(), relativePath);
        if (direct.isPresent() || StringUtils.isBlank(roleFolder)) {
            return direct;
        }
        return regularFileWithin(studyDir.get(), studyDir.get().resolve(roleFolder), relativePath);
    }

    private Optional<Path> studyFolder(String studyId) {
        if (StringUtils.isBlank(studyId)) {
            return Optional.empty();
        }
        Path studyDir;
        try {
            studyDir = root.resolve(studyId).normalize();
        } catch (InvalidPathException ex) {
            log.warn("Study id {} is not a valid folder name: {}", studyId, ex.getMessage());
            return Optional.empty();
        }
        if (!studyDir.startsWith(root) || studyDir.equals(root)) {
            log.warn("Study id {} does not name a folder under the study files directory", studyId);
            return Optional.empty();
        }
        return Optional.of(studyDir);
    }

    private Optional<Path> regularFileWithin(Path studyDir, Path base, String relativePath) {
        Path candidate;
        try {
            candidate = base.resolve(relativePath).normalize();
        } catch (InvalidPathException ex) {
            log.warn("Study file name {} is not a valid path: {}", relativePath, ex.getMessage());
            return Optional.empty();
        }
        if (!candidate.startsWith(studyDir)) {
            log.warn("Study file name {} escapes the study folder {}", relativePath, studyDir.getFileName());
            return Optional.empty();
        }
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    private List<StudyFileEntry> listDirectory(Path studyDir, Path dir) throws IOException {
        List<Path> children;
        try (Stream<Path> stream = Files.list(dir)) {
            children = stream.sorted(Comparator.comparing(path -> path.getFileName().toString())).toList();
        }
        List<StudyFileEntry> entries = new ArrayList<>(children.size());
        for (Path child : children) {
            String name = child.getFileName().toString();
            String relative = studyDir.relativize(child).toString();
            BasicFileAttributes attributes = Files.readAttributes(child, BasicFileAttributes.class);
            if (attributes.isDirectory()) {
                entries.add(StudyFileEntry.directory(name, relative, listDirectory(studyDir, child)));
            } else {
                entries.add(StudyFileEntry.file(name, relative, attributes.size(), attributes.lastModifiedTime().toInstant()));
            }
        }
        return entries;
    }
}
