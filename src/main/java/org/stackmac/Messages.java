package org.stackmac;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Access to the localized user-facing messages in the {@code messages} resource bundle.
 */
public final class Messages {

    private static final String BUNDLE_NAME = "messages";
    private static ResourceBundle resourceBundle;

    static {
        setLocale(Locale.ENGLISH);
    }

    private Messages() {
        // Private constructor to prevent instantiation
    }

    public static void setLocale(final Locale locale) {
        try {
            resourceBundle = ResourceBundle.getBundle(BUNDLE_NAME, locale);
        } catch (final MissingResourceException e) {
            resourceBundle = ResourceBundle.getBundle(BUNDLE_NAME, Locale.ROOT);
        }
    }

    /**
     * Formats the message stored under {@code key} with {@link MessageFormat}.
     *
     * @param key The bundle key.
     * @param args The message arguments.
     * @return The formatted message, or the key itself if the bundle has no such entry.
     */
    public static String get(final String key, final Object... args) {
        if (resourceBundle.containsKey(key)) {
            final String pattern = resourceBundle.getString(key);
            return MessageFormat.format(pattern, args);
        }
        return key;
    }
}
