package com.civilworks.carbon;

import com.civilworks.carbon.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class CarbonScreenApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CarbonScreenApplication.class, args)));
    }
}
