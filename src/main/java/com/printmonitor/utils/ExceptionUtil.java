package com.printmonitor.utils;

import com.printmonitor.exceptions.InvalidFragmentException;

import io.vertx.core.eventbus.Message;

import io.vertx.core.eventbus.ReplyException;

import io.vertx.core.eventbus.ReplyFailure;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeoutException;

/**
 * ExceptionUtil - Generic Exception Handling Utility

 * Provides consistent error handling across the monitoring core
 * - Event Bus error replies
 * - Message extraction for log lines
 * - Cause-chain classification (invalid data vs connectivity)
 */
public class ExceptionUtil
{

    private static final Logger logger = LoggerFactory.getLogger(ExceptionUtil.class);

    /**
     * Reply to an event bus request with a failure body.
     *
     * @param message request being answered
     * @param cause exception cause
     * @param defaultMessage context for the failure
     */
    public static void handleEventBus(Message<?> message, Throwable cause, String defaultMessage)
    {
        var text = getMessage(cause, defaultMessage);

        var errorResponse = new JsonObject()
            .put("success", false)
            .put("error", text)
            .put("timestamp", System.currentTimeMillis());

        message.reply(errorResponse);

        logger.error("Event Bus Error: {}", text);
    }

    /**
     * Extract meaningful error message from exception
     * Combines default message (context) with exception message (specific error) when both are available
     *
     * @param cause Exception cause
     * @param defaultMessage Default message providing context
     * @return Error message (combined or default only)
     */
    public static String getMessage(Throwable cause, String defaultMessage)
    {
        if (cause == null)
        {
            return defaultMessage;
        }

        var exceptionMessage = cause.getMessage();

        if (exceptionMessage != null && !exceptionMessage.trim().isEmpty())
        {
            return defaultMessage + ": " + exceptionMessage;
        }

        return defaultMessage + ": " + cause.getClass().getSimpleName();
    }

    /**
     * Checks whether an invalid fragment is anywhere in the cause chain.
     *
     * @param cause failure to classify
     * @return true if the failure is a data-quality problem
     */
    public static boolean isInvalidFragment(Throwable cause)
    {
        for (var current = cause; current != null; current = current.getCause())
        {
            if (current instanceof InvalidFragmentException)
            {
                return true;
            }
        }

        return false;
    }

    /**
     * Checks whether the failure is a timeout (local timer or event bus reply timeout).
     *
     * @param cause failure to classify
     * @return true if the failure is a timeout
     */
    public static boolean isTimeout(Throwable cause)
    {
        for (var current = cause; current != null; current = current.getCause())
        {
            if (current instanceof TimeoutException)
            {
                return true;
            }

            if (current instanceof ReplyException
                && ((ReplyException) current).failureType() == ReplyFailure.TIMEOUT)
            {
                return true;
            }
        }

        return false;
    }

}
