package io.wwtours.backoffice.rate;

/** Source of the active rate configuration. Read-only from the pricing engine's point of view. */
public interface RateConfigurationStore {

  RateConfiguration current();
}
