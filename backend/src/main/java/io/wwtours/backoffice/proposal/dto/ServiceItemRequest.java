package io.wwtours.backoffice.proposal.dto;

import io.wwtours.backoffice.pricing.PriceOverride;
import io.wwtours.backoffice.rate.ServiceCategory;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;

public record ServiceItemRequest(
    @NotNull(message = "serviceCategory is required") ServiceCategory serviceCategory,
    @Size(max = 500) String description,
    LocalDate serviceDate,
    Integer partySize,
    BigDecimal quantity,
    @Size(max = 50) String routeCode,
    BigDecimal flatAmount,
    PriceOverride override) {}
