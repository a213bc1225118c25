package io.wwtours.backoffice.pricing;

import io.wwtours.backoffice.rate.DayType;
import io.wwtours.backoffice.rate.ServiceCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Stateless price quotes for a single service item; nothing is stored. */
@RestController
public class PricingController {

  private final PriceCalculationService priceCalculationService;
  private final OverrideResolver overrideResolver;

  public PricingController(
      PriceCalculationService priceCalculationService, OverrideResolver overrideResolver) {
    this.priceCalculationService = priceCalculationService;
    this.overrideResolver = overrideResolver;
  }

  @PostMapping("/api/pricing/quote")
  public ResponseEntity<QuoteResponse> quote(@Valid @RequestBody QuoteRequest request) {
    var quote =
        priceCalculationService.calculatePrice(
            new PricingInput(
                request.serviceCategory(),
                request.serviceDate(),
                request.partySize(),
                request.quantity(),
                request.routeCode(),
                request.flatAmount()));
    var resolved =
        overrideResolver.resolve(quote.calculatedPrice(), request.override(), request.quantity());
    return ResponseEntity.ok(QuoteResponse.from(quote, resolved));
  }

  public record QuoteRequest(
      @NotNull(message = "serviceCategory is required") ServiceCategory serviceCategory,
      LocalDate serviceDate,
      Integer partySize,
      BigDecimal quantity,
      String routeCode,
      BigDecimal flatAmount,
      PriceOverride override) {}

  public record QuoteResponse(
      ServiceCategory serviceCategory,
      BigDecimal calculatedPrice,
      BigDecimal effectivePrice,
      PricingMode pricingMode,
      BigDecimal variance,
      VarianceKind varianceKind,
      DayType dayType,
      String tierLabel,
      BigDecimal billableUnits,
      BigDecimal unitRate,
      String configVersion,
      List<String> warnings) {

    static QuoteResponse from(PriceQuote quote, ResolvedPrice resolved) {
      return new QuoteResponse(
          quote.category(),
          resolved.calculatedPrice(),
          resolved.effectivePrice(),
          resolved.pricingMode(),
          resolved.variance(),
          resolved.varianceKind(),
          quote.dayType(),
          quote.tierLabel(),
          quote.billableUnits(),
          quote.unitRate(),
          quote.configVersion(),
          resolved.warnings());
    }
  }
}
