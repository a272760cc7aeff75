package com.reservation.api.exception;

/**
 * Typed rejection raised by the scheduling core. Carries no transport concepts; the API
 * layer maps {@link Category} to a status code.
 */
public class BookingException extends RuntimeException {

    public enum Category {
        NOT_FOUND,
        UNAUTHORIZED,
        VALIDATION_FAILED,
        SLOT_UNAVAILABLE,
        STATE_CONFLICT,
        PERSISTENCE_ERROR
    }

    public enum Reason {
        SERVICE_NOT_FOUND(Category.NOT_FOUND),
        RESERVATION_NOT_FOUND(Category.NOT_FOUND),
        EMPLOYEE_NOT_FOUND(Category.NOT_FOUND),
        COMPANY_NOT_FOUND(Category.NOT_FOUND),
        IDENTITY_NOT_RESOLVED(Category.UNAUTHORIZED),
        ROLE_NOT_PERMITTED(Category.UNAUTHORIZED),
        NOT_OWNER(Category.UNAUTHORIZED),
        VALIDATION_FAILED(Category.VALIDATION_FAILED),
        SLOT_UNAVAILABLE(Category.SLOT_UNAVAILABLE),
        RESERVATION_CLOSED(Category.STATE_CONFLICT),
        INVALID_TRANSITION(Category.STATE_CONFLICT),
        PERSISTENCE_CONFLICT(Category.STATE_CONFLICT),
        PERSISTENCE_ERROR(Category.PERSISTENCE_ERROR);

        private final Category category;

        Reason(Category category) {
            this.category = category;
        }

        public Category getCategory() {
            return category;
        }
    }

    private final Reason reason;

    public BookingException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public BookingException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public Category getCategory() {
        return reason.getCategory();
    }

    public static BookingException notFound(Reason reason, String message) {
        return new BookingException(reason, message);
    }

    public static BookingException validation(String message) {
        return new BookingException(Reason.VALIDATION_FAILED, message);
    }

    public static BookingException slotUnavailable(String message) {
        return new BookingException(Reason.SLOT_UNAVAILABLE, message);
    }
}
