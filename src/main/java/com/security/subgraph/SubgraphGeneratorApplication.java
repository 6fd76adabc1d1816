package com.security.subgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Sysmon 子图生成服务 - SpringBoot启动类
 *
 * @author Security Team
 * @version 1.0.0
 */
@SpringBootApplication
public class SubgraphGeneratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SubgraphGeneratorApplication.class, args);
    }
}
