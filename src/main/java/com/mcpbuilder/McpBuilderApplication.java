package com.mcpbuilder;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class McpBuilderApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(McpBuilderApplication.class)
                .properties("spring.main.banner-mode=off")
                .run(args);
    }
}
