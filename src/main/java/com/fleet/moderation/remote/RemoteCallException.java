package com.fleet.moderation.remote;

/**
 * Runtime exception signalling a failed remote call (transport error, missing
 * rights, unknown participant, rate limiting).
 */
public class RemoteCallException extends RuntimeException {

    public RemoteCallException(String message) {
        super(message);
    }

    public RemoteCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
