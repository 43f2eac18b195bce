package com.taskgraph.api.notification;

import com.taskgraph.core.spi.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notification sink for standalone deployments: writes each notification to the log.
 */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void notify(String userId, String message) {
        log.info("Notify {}: {}", userId, message);
    }
}
