package io.wwtours.backoffice.proposal.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

public record AddOnRequest(
    @NotBlank(message = "description is required") @Size(max = 500) String description,
    @NotNull(message = "amount is required") @PositiveOrZero BigDecimal amount) {}
