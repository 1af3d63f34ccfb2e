package com.joshlong.mediaops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.integration.annotation.IntegrationComponentScan;

@IntegrationComponentScan
@EnableConfigurationProperties(MediaOpsProperties.class)
@SpringBootApplication
public class MediaOpsApplication {

	public static void main(String[] args) {
		SpringApplication.run(MediaOpsApplication.class, args);
	}

}
