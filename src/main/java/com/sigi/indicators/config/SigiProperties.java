package com.sigi.indicators.config;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "sigi")
public class SigiProperties {

    private Cors cors = new Cors();

    @Data
    public static class Cors {

        /** Origins allowed to call the API; "*" while the front end has no fixed domain. */
        @NotEmpty
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
