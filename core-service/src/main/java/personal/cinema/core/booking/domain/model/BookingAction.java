package personal.cinema.core.booking.domain.model;

/**
 * Booking History Action
 */
public enum BookingAction {
    CREATED,
    CONFIRMED,
    CANCELLED,
    EXPIRED,
    REFUNDED
}
