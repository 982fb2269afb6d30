/**
 * 服务注册中心启动类
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 服务注册中心启动类
 * 内存注册表，进程重启后由各服务重新注册
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
public class SvcregServerApplication {

    public static void main(String[] args) {
        try {
            SpringApplication app = new SpringApplication(SvcregServerApplication.class);
            app.setLogStartupInfo(true);
            ConfigurableApplicationContext context = app.run(args);
            log.info("Service Registry running on port {}", context.getEnvironment().getProperty("local.server.port"));
        } catch (Exception e) {
            log.error("Service Registry failed to start", e);
            System.exit(1);
        }
    }
}
