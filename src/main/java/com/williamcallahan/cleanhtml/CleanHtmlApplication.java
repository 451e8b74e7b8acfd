package com.williamcallahan.cleanhtml;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CleanHtmlApplication {

    public static void main(String[] args) {
        SpringApplication.run(CleanHtmlApplication.class, args);
    }

}
