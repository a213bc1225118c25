package io.wwtours.backoffice.booking;

import java.util.UUID;

public record BookingReference(UUID bookingId, String bookingNumber) {}
