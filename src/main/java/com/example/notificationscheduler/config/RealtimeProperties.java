package com.example.notificationscheduler.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Realtime channel and CORS configuration
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app.realtime")
public class RealtimeProperties {

    @NotBlank
    private String endpoint = "/ws";

    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
}
