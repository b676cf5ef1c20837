package com.flagship.recon_ledger.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Ledger settings (ledger.*).
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * Currency assigned to accounts created without one.
     */
    @NotBlank
    @Pattern(regexp = "^[A-Z]{3}$")
    private String baseCurrency = "USD";

    /**
     * Display rounding tolerance for reports. Posting never uses it.
     */
    @NotNull
    @DecimalMin("0")
    private BigDecimal reportingTolerance = new BigDecimal("0.01");
}
