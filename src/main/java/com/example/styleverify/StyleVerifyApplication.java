package com.example.styleverify;

import com.example.styleverify.config.StyleVerifyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(StyleVerifyProperties.class)
public class StyleVerifyApplication {

	public static void main(String[] args) {
		SpringApplication.run(StyleVerifyApplication.class, args);
	}

}
