package com.yuzhi.studyhub.platform.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "studyhub.platform.datasets")
public class DatasetFileProperties {

    /** Directory dataset file names are resolved against. */
    private String path = "/var/psytools/datasets/";

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
