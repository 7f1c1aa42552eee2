package com.questrail.mitm.codec;

/**
 * Indicates that a frame could not be decoded into a message.
 *
 * This typically reflects:
 * <ul>
 *   <li>a missing {@code SEQ}, {@code TS} or {@code DATA} field</li>
 *   <li>fields out of the fixed order</li>
 *   <li>a non-numeric sequence or timestamp</li>
 *   <li>an invalid escape sequence in the payload</li>
 * </ul>
 */
public final class MalformedMessageException extends RuntimeException
{
    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
