package com.yuzhi.studyhub.platform;

import com.yuzhi.studyhub.platform.config.AccessPolicyProperties;
import com.yuzhi.studyhub.platform.config.DatasetFileProperties;
import com.yuzhi.studyhub.platform.config.StatusReportProperties;
import com.yuzhi.studyhub.platform.config.StudyFileProperties;
import com.yuzhi.studyhub.platform.config.TokenProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;

@SpringBootApplication
@EnableConfigurationProperties(
    { StatusReportProperties.class, AccessPolicyProperties.class, TokenProperties.class, DatasetFileProperties.class, StudyFileProperties.class }
)
public class StudyhubPlatformApp {

    private static final Logger log = LoggerFactory.getLogger(StudyhubPlatformApp.class);

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(StudyhubPlatformApp.class, args);
        Environment env = context.getEnvironment();
        log.info(
            "\n----------------------------------------------------------\n\t" +
            "Application '{}' is running on port {}\n\t" +
            "Profile(s): \t{}\n" +
            "----------------------------------------------------------",
            env.getProperty("spring.application.name"),
            env.getProperty("server.port", "8080"),
            env.getActiveProfiles().length == 0 ? env.getDefaultProfiles() : env.getActiveProfiles()
        );
    }
}
