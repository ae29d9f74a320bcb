package com.work.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口，运行后即可通过 REST 接口体验 bridge 账本能力。
 */
@SpringBootApplication
public class BridgeDemoApplication {

    public static void main(String[] args) {
        SpringApplication.run(BridgeDemoApplication.class, args);
    }
}
