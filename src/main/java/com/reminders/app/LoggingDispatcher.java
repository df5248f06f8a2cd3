package com.reminders.app;

import com.reminders.core.DeliveryFailedException;
import com.reminders.core.Dispatcher;

import java.util.logging.Logger;

// Dispatcher for running without a chat backend: each fired reminder becomes a log line
public class LoggingDispatcher implements Dispatcher {
    private static final Logger logger = Logger.getLogger(LoggingDispatcher.class.getName());

    @Override
    public void dispatch(long ownerId, long channelId, String taskName) throws DeliveryFailedException {
        if (channelId <= 0) {
            throw new DeliveryFailedException("No channel " + channelId + " to deliver to");
        }
        logger.info("[channel " + channelId + "] @" + ownerId + " Your " + taskName + " tasks are ready");
    }
}
