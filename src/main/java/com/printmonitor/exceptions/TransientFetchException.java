package com.printmonitor.exceptions;

/**
 * A status fetch failed for a reason that may clear on retry: timeout,
 * transport error or no responder on the fetch address.
 */
public class TransientFetchException extends RuntimeException
{

    public TransientFetchException(String message)
    {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
