package com.williamcallahan.markdownpreview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MarkdownPreviewApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarkdownPreviewApplication.class, args);
    }

}
