package com.wraft.doc.util;

import com.wraft.doc.model.CallContext;
import com.wraft.doc.model.ServiceType;
import org.slf4j.Logger;

/**
 * Logging helpers for calls that leave the JVM or touch shared storage
 * (renderer process, QR encoder, upload tree).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
