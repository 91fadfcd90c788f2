package com.bit.tpu;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.tpu")
public class TpuClientApplication {
    public static void main(String[] args) {
        SpringApplication.run(TpuClientApplication.class, args);
        log.info("TPU客户端启动完成");
    }
}
