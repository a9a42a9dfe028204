package com.yuzhi.studyhub.platform.web.rest;

import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.platform.security.CallerResolver;
import com.yuzhi.studyhub.platform.security.DownloadLinkVerifier;
import com.yuzhi.studyhub.platform.service.files.StudyFileDownload;
import com.yuzhi.studyhub.platform.service.files.StudyFileEntry;
import com.yuzhi.studyhub.platform.service.files.StudyFileService;
import java.util.List;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/studies/{studyId}/files")
public class StudyFileResource {

    private final StudyFileService studyFileService;
    private final CallerResolver callerResolver;
    private final DownloadLinkVerifier downloadLinkVerifier;

    public StudyFileResource(StudyFileService studyFileService, CallerResolver callerResolver, DownloadLinkVerifier downloadLinkVerifier) {
        this.studyFileService = studyFileService;
        this.callerResolver = callerResolver;
        this.downloadLinkVerifier = downloadLinkVerifier;
    }

    @GetMapping({ "", "/{role}" })
    public ApiResponse<List<StudyFileEntry>> list(@PathVariable String studyId, @PathVariable(value = "role", required = false) String role) {
        return ApiResponses.ok(studyFileService.listFiles(callerResolver.requireCurrentCaller(), studyId, role));
    }

    /**
     * Streams one study file from the study folder or its role folder. Callers without a bearer
     * token may pass a signed link token as {@code ?token=}.
     */
    @GetMapping("/{role}/{*filePath}")
    public ResponseEntity<Resource> download(
        @PathVariable String studyId,
        @PathVariable String role,
        @PathVariable String filePath,
        @RequestParam(value = "token", required = false) String token
    ) {
        Caller caller = callerResolver.currentCaller().orElseGet(() -> downloadLinkVerifier.verify(token));
        StudyFileDownload download = studyFileService.openFile(caller, studyId, role, filePath);
        FileSystemResource resource = new FileSystemResource(download.path());
        return ResponseEntity
            .ok()
            .contentType(MediaTypeFactory.getMediaType(download.filename()).orElse(MediaType.APPLICATION_OCTET_STREAM))
            .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(download.filename()).build().toString())
            .body(resource);
    }
}
