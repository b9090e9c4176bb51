package com.printmonitor.exceptions;

/**
 * A fragment failed schema or timestamp sanity checks. This is a data-quality
 * problem, not a connectivity one: the fragment is dropped and failure
 * counters are left untouched.
 */
public class InvalidFragmentException extends RuntimeException
{

    public InvalidFragmentException(String message)
    {
        super(message);
    }

    public InvalidFragmentException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
