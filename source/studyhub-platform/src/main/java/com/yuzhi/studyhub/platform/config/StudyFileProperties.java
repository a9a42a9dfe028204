package com.yuzhi.studyhub.platform.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "studyhub.platform.study-files")
public class StudyFileProperties {

    /** Directory holding one sub-directory per study id. */
    private String path = "/var/psytools/study-files/";

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
