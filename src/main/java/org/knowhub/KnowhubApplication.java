package org.knowhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class KnowhubApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowhubApplication.class, args);
    }
}
