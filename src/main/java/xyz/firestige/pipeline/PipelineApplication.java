package xyz.firestige.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 命令行入口，进程退出码取自运行结局
 */
@SpringBootApplication
public class PipelineApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PipelineApplication.class, args)));
    }
}
