package com.medqueue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 分诊引擎应用启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到各子模块中的组件。
 * </p>
 *
 * @author medqueue
 * @since 2025-10-12
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
