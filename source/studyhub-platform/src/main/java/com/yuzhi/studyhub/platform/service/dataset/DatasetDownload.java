package com.yuzhi.studyhub.platform.service.dataset;

import java.nio.file.Path;

/** A dataset file the caller may download. */
public record DatasetDownload(String fileId, String filename, Path path) {}
