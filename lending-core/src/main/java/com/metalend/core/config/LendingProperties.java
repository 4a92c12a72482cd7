package com.metalend.core.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "metalend")
@Data
@Validated
public class LendingProperties {

    @Valid
    private Security security = new Security();
    @Valid
    private Oracle oracle = new Oracle();
    @Valid
    private Collateral collateral = new Collateral();
    @Valid
    private Pool pool = new Pool();
    @Valid
    private Liquidation liquidation = new Liquidation();
    @Valid
    private Facade facade = new Facade();
    @Valid
    private Events events = new Events();

    @Data
    public static class Security {
        private List<String> admins = new ArrayList<>(List.of("admin"));
        private List<String> priceUpdaters = new ArrayList<>(List.of("price-feed"));

        @NotBlank
        private String poolIdentity = "lending-pool";

        @NotBlank
        private String engineIdentity = "liquidation-engine";
    }

    @Data
    public static class Oracle {
        @NotNull
        private Duration spotValidity = Duration.ofHours(1);

        @DecimalMin(value = "0.0", inclusive = false)
        private BigDecimal maxDeviation = new BigDecimal("0.20");

        @DecimalMin(value = "0.0", inclusive = false)
        private BigDecimal referenceRate = BigDecimal.ONE;

        private List<String> supportedAssetClasses = new ArrayList<>();
    }

    @Data
    public static class Collateral {
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private BigDecimal loanToValueMax = new BigDecimal("0.80");
    }

    @Data
    public static class Pool {
        @DecimalMin("0.0")
        private BigDecimal baseRate = new BigDecimal("0.05");

        @DecimalMin("0.0")
        private BigDecimal slope = new BigDecimal("0.20");

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private BigDecimal reserveFactor = new BigDecimal("0.10");

        @NotNull
        private Duration maxLoanDuration = Duration.ofDays(365);
    }

    @Data
    public static class Liquidation {
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private BigDecimal threshold = new BigDecimal("0.80");

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("0.20")
        private BigDecimal bonusRate = new BigDecimal("0.05");

        @NotNull
        private Duration delay = Duration.ofHours(1);
    }

    @Data
    public static class Facade {
        private List<String> allowedAssetClasses = new ArrayList<>();
    }

    @Data
    public static class Events {
        @Min(1)
        private int journalCapacity = 1000;
    }
}
