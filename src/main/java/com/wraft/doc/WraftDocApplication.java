package com.wraft.doc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class WraftDocApplication {

    public static void main(String[] args) {
        SpringApplication.run(WraftDocApplication.class, args);
    }
}
