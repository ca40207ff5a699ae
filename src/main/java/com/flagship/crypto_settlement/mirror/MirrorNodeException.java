package com.flagship.crypto_settlement.mirror;

/**
 * Failure talking to the mirror node: transport error, non-2xx status or an
 * unparseable body.
 */
public class MirrorNodeException extends RuntimeException {

    public MirrorNodeException(String message) {
        super(message);
    }

    public MirrorNodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
