package com.example.intake;

import com.example.intake.config.IntakeProperties;
import com.example.intake.config.properties.OcrProperties;
import com.example.intake.config.properties.RegistryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({IntakeProperties.class, OcrProperties.class, RegistryProperties.class})
public class IntakeApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntakeApplication.class, args);
    }

}
