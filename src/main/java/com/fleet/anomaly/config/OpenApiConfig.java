package com.fleet.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI processAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Process-Count Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Batch detection of devices whose process-count reporting deviates from the fleet.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Submit scan rows via `POST /analysis` (JSON) or `POST /analysis/csv`\n" +
                                "2. Per scan: discrepancy = observed process rows - reported process count\n" +
                                "3. Per device: mean and sample standard deviation of the discrepancy\n" +
                                "4. Isolation Forest scores every device; the top contamination fraction is flagged\n" +
                                "5. Scores are min-max normalized to [0, 1], higher = more anomalous\n\n" +
                                "Devices with a single scan have no standard deviation and are reported as " +
                                "insufficient data unless `missingFeaturePolicy=ZERO_VARIANCE`.\n\n" +
                                "`POST /analysis/series` returns per-device discrepancy series with change points " +
                                "for plotting.")
                        .contact(new Contact().name("Fleet Integrity Team")));
    }
}
