package org.learningjava.photosearch.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.photosearch")
public class PhotoSearchApplication {
    public static void main(String[] args) {
        SpringApplication.run(PhotoSearchApplication.class, args);
    }
}
