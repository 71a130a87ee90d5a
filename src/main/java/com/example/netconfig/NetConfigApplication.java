package com.example.netconfig;

import com.example.netconfig.config.NetConfigStorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
@EnableConfigurationProperties(NetConfigStorageProperties.class)
public class NetConfigApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetConfigApplication.class, args);
    }

    /** Source of the TSV "Generated" timestamp. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
