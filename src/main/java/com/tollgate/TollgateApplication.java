package com.tollgate;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class TollgateApplication {

    public static void main(String[] args) {
        // Embedded engine: no web server, the host process drives GateRunner.
        new SpringApplicationBuilder(TollgateApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
