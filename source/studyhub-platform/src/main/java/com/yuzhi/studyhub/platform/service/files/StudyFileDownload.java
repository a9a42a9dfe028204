package com.yuzhi.studyhub.platform.service.files;

import java.nio.file.Path;

public record StudyFileDownload(String studyId, String filename, Path path) {}
