package com.yuzhi.studyhub.platform.web.rest;

import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.platform.security.CallerResolver;
import com.yuzhi.studyhub.platform.security.DownloadLinkVerifier;
import com.yuzhi.studyhub.platform.service.dataset.DatasetDownload;
import com.yuzhi.studyhub.platform.service.dataset.DatasetFileService;
import java.util.List;
import java.util.Map;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/datasets")
public class DatasetResource {

    private final DatasetFileService datasetFileService;
    private final CallerResolver callerResolver;
    private final DownloadLinkVerifier downloadLinkVerifier;

    public DatasetResource(DatasetFileService datasetFileService, CallerResolver callerResolver, DownloadLinkVerifier downloadLinkVerifier) {
        this.datasetFileService = datasetFileService;
        this.callerResolver = callerResolver;
        this.downloadLinkVerifier = downloadLinkVerifier;
    }

    @GetMapping
    public ApiResponse<List<Map<String, Object>>> list() {
        return ApiResponses.ok(datasetFileService.listFiles(callerResolver.requireCurrentCaller()));
    }

    /**
     * Streams one dataset file. Callers without a bearer token may pass a signed link token as
     * {@code ?token=}.
     */
    @GetMapping("/{fileId}")
    public ResponseEntity<Resource> download(@PathVariable String fileId, @RequestParam(value = "token", required = false) String token) {
        Caller caller = callerResolver.currentCaller().orElseGet(() -> downloadLinkVerifier.verify(token));
        DatasetDownload download = datasetFileService.openFile(caller, fileId);
        FileSystemResource resource = new FileSystemResource(download.path());
        return ResponseEntity
            .ok()
            .contentType(MediaType.APPLICATION_OCTET_STREAM)
            .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(download.filename()).build().toString())
            .body(resource);
    }
}
