package com.forrestgump.contactapi.infrastructure.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "aws")
@Validated
public record AwsConfig(
        @NotBlank String region,
        Dynamodb dynamodb
) {
    public AwsConfig {
        if (dynamodb == null) {
            dynamodb = new Dynamodb(null, null);
        }
    }

    public record Dynamodb(
            String tableName,
            String claimsTableName
    ) {
        public Dynamodb {
            if (tableName == null || tableName.isBlank()) {
                tableName = "PortfolioMessages";
            }
            if (claimsTableName == null || claimsTableName.isBlank()) {
                claimsTableName = "PortfolioMessageHashes";
            }
        }
    }
}
