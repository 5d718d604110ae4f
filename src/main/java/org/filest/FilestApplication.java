package org.filest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FilestApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(FilestApplication.class, args);
    }

    /**
     * 启动前准备 {@code filest.log} 所在目录。
     * <p>
     * 目录取 {@code LOG_PATH}（先系统属性后环境变量），都没有时为 {@code logs}，和 logback-spring.xml 里的取值一致。
     */
    static void ensureLogDirectory() {
        Path logDir = Path.of(firstNonBlank(System.getProperty("LOG_PATH"), System.getenv("LOG_PATH"), "logs"));
        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            // 此时 logback 还没起来
            System.err.println("无法创建日志目录 " + logDir + "：" + e.getMessage());
        }
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return null;
    }
}
