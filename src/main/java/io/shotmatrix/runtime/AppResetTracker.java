package io.shotmatrix.runtime;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last language each device ran in this process, keyed by platform and device folder.
 */
public final class AppResetTracker {
    private final Map<String, String> lastLanguage = new ConcurrentHashMap<>();

    /**
     * Records {@code language} for the device.
     *
     * @return true when the device previously ran a different language
     */
    public boolean languageChanged(String deviceKey, String language) {
        String previous = lastLanguage.put(deviceKey, language);
        return previous != null && !previous.equals(language);
    }

    public String lastLanguage(String deviceKey) {
        return lastLanguage.get(deviceKey);
    }
}
