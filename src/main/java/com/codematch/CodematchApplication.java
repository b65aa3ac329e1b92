package com.codematch;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class CodematchApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(CodematchApplication.class)
                .properties("spring.main.banner-mode=off")
                .run(args);
    }
}
