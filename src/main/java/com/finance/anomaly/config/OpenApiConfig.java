package com.finance.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI financeAnomalyDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Finance Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Read-only anomaly and pattern detection over dealer finance submissions.\n\n" +
                                "**Scopes:**\n" +
                                "- `submission` - one submission against its template and the dealer's history\n" +
                                "- `dealer` - a dealer's latest submission, quarter-end behaviour and peer comparison\n" +
                                "- `dealer group` - every dealer of a group plus cross-dealer analysis within the group\n" +
                                "- `global` - distribution, cross-dealer and trend analysis over the last N months\n\n" +
                                "**Finding families:**\n" +
                                "- Statistical anomalies (distribution shape, outliers, trends, year-over-year variance)\n" +
                                "- Patterns (cell correlation, sum/difference relationships, seasonality, group deviation)\n" +
                                "- Time-series ML (spike and change-point detection, k-means clusters, 3-period forecast)\n\n" +
                                "Every response is a detection report: ranked findings plus one outcome per detector " +
                                "(COMPLETED, INSUFFICIENT_DATA, FAILED, CANCELLED). Unknown subjects return 404.")
                        .contact(new Contact().name("Finance Analytics Team")));
    }
}
