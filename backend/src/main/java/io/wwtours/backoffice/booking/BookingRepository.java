package io.wwtours.backoffice.booking;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BookingRepository extends JpaRepository<Booking, UUID> {

  Optional<Booking> findBySourceProposalId(UUID sourceProposalId);

  boolean existsByBookingNumber(String bookingNumber);
}
