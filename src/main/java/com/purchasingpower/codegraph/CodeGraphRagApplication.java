package com.purchasingpower.codegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class CodeGraphRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeGraphRagApplication.class, args);
    }
}
