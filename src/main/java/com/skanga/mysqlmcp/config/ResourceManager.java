package com.skanga.mysqlmcp.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Looks up externalized message templates from {@code errors.properties} and formats them
 * with {@link MessageFormat}. Arguments that are numbers should be passed as strings so that
 * ports and counts are not rendered with grouping separators.
 */
public final class ResourceManager {
    private static final Logger logger = LoggerFactory.getLogger(ResourceManager.class);
    private static final String ERROR_BUNDLE = "errors";
    private static final ResourceBundle errorMessages = ResourceBundle.getBundle(ERROR_BUNDLE, Locale.ROOT);

    private ResourceManager() {
    }

    /**
     * Returns the message for {@code messageKey} with its placeholders filled in.
     * An unknown key yields the key itself so that a missing template never hides the error being reported.
     */
    public static String getErrorMessage(String messageKey, Object... messageArgs) {
        String messageTemplate;
        try {
            messageTemplate = errorMessages.getString(messageKey);
        } catch (MissingResourceException e) {
            logger.warn("Missing message template: {}", messageKey);
            return messageKey;
        }
        if (messageArgs == null || messageArgs.length == 0) {
            return messageTemplate;
        }
        return new MessageFormat(messageTemplate, Locale.ROOT).format(messageArgs);
    }
}
