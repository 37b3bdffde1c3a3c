package com.dataops.costanomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI costAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Cost Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Flags unusual daily spend on a metered data-warehouse service.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Validate the request (`days` 7-90, `sensitivity` low/medium/high)\n" +
                                "2. Fetch the daily cost series from the cost feed\n" +
                                "3. Run the detector ensemble (global z-score, rolling window, day-of-week)\n" +
                                "4. Drop candidates below the alert threshold and merge same-day findings\n" +
                                "5. Enrich each anomaly with the day's cost breakdown\n" +
                                "6. Summarize and project near-term risk\n" +
                                "7. Optionally dispatch an alert digest\n\n" +
                                "**Severity Bands (deviation from baseline):** LOW <30%, MEDIUM 30-60%, " +
                                "HIGH 60-100%, CRITICAL >=100%\n\n" +
                                "Failures are returned in the same envelope with `success=false` and an `errorType`.")
                        .contact(new Contact().name("Data Platform Operations")));
    }
}
