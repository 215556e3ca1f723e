package com.z254.sentinel.guardian.ticket;

/**
 * I/O failure in the ticket store.
 */
public class TicketStoreException extends RuntimeException {

    public TicketStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
