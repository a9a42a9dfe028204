package com.yuzhi.studyhub.platform.service.files;

import com.yuzhi.studyhub.common.error.StudyResourceNotFoundException;
import com.yuzhi.studyhub.common.error.StudyValidationException;
import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.common.security.StudyRole;
import com.yuzhi.studyhub.platform.service.security.AccessGate;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Study documents, gated by study access and by the role folder requested.
 */
@Service
public class StudyFileService {

    private static final Logger log = LoggerFactory.getLogger(StudyFileService.class);

    private final AccessGate accessGate;
    private final StudyFileStore fileStore;

    public StudyFileService(AccessGate accessGate, StudyFileStore fileStore) {
        this.accessGate = accessGate;
        this.fileStore = fileStore;
    }

    /** Listing of the whole study folder; a requested {@code roleFolder} must be open to the caller. */
    public List<StudyFileEntry> listFiles(Caller caller, String studyId, String roleFolder) {
        accessGate.authorizeStudy(caller, studyId, StudyRole.VIEWER);
        if (StringUtils.isNotBlank(roleFolder)) {
            accessGate.authorizeRoleFolder(caller, studyId, roleFolder);
        }
        return fileStore.list(studyId);
    }

    public StudyFileDownload openFile(Caller caller, String studyId, String roleFolder, String filePath) {
        String relativePath = StringUtils.removeStart(StringUtils.trimToEmpty(filePath), "/");
        if (StringUtils.isBlank(roleFolder) || relativePath.isEmpty()) {
            throw new StudyValidationException("Missing role or file path");
        }
        accessGate.authorizeStudy(caller, studyId, StudyRole.VIEWER);
        accessGate.authorizeRoleFolder(caller, studyId, roleFolder);
        Path path = fileStore
            .resolve(studyId, roleFolder, relativePath)
            .orElseThrow(() -> new StudyResourceNotFoundException("File not found"));
        log.info("Caller {} downloading study file {}/{}", caller.id(), studyId, relativePath);
        return new StudyFileDownload(studyId, path.getFileName().toString(), path);
    }
}
