package com.zzf.toolhost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ToolHostApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolHostApplication.class, args);
    }
}
