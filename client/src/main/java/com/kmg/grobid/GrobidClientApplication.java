package com.kmg.grobid;

import com.kmg.grobid.config.GrobidProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GrobidProperties.class)
public class GrobidClientApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(GrobidClientApplication.class, args)));
    }
}
