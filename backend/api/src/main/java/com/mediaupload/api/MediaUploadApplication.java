package com.mediaupload.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MediaUploadApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaUploadApplication.class, args);
    }
}
