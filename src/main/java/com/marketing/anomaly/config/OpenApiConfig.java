package com.marketing.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI metricAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Metric Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Statistical baselines and anomaly detection for marketing metrics " +
                                "(revenue, views, engagement, conversions, ad spend).\n\n" +
                                "**Pipeline:**\n" +
                                "1. Bucket a metric's recent history into a daily or hourly baseline (cached for 5 minutes)\n" +
                                "2. Score every bucket with the selected detection method\n" +
                                "3. Grade scores into severity tiers: **low** (<2), **medium** (2-3), **high** (3-4), **critical** (>=4)\n" +
                                "4. Turn anomalies at or above a minimum severity into alerts with recommendations\n\n" +
                                "**Detection Methods:**\n" +
                                "- `zscore`: distance from the mean in standard deviations\n" +
                                "- `iqr`: distance beyond Tukey fences, threshold is the fence multiplier\n" +
                                "- `isolation`: modified z-score over the mean absolute deviation from the median\n" +
                                "- `movingaverage`: z-score against the preceding 7 buckets\n\n" +
                                "Baselines flagged `isMock` are synthetic and appear only when a metric has no history yet.")
                        .contact(new Contact().name("Marketing Analytics Team")));
    }
}
