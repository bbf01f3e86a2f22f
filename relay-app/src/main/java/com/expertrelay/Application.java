package com.expertrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 专家审核问答编排服务启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到 trigger / infrastructure / domain 各模块中的组件。
 * </p>
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
