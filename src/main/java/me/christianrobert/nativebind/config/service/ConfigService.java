package me.christianrobert.nativebind.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime settings of the translation pipeline and the diagnostic report.
 *
 * <p>Degradation warnings emitted by the verifier are fixed policy and have no setting here.</p>
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String FAIL_ON_ERRORS = "pipeline.fail-on-errors";
    public static final String LOG_DIAGNOSTICS = "pipeline.log-diagnostics";
    public static final String DISABLED_PASSES = "pipeline.disabled-passes";
    public static final String EXTRACT_BROKEN = "pipeline.extract-broken";
    public static final String REPORT_INCLUDE_INFO = "report.include-info";

    private final Map<String, Object> settings = new ConcurrentHashMap<>();

    public ConfigService() {
        settings.put(FAIL_ON_ERRORS, false);
        settings.put(LOG_DIAGNOSTICS, true);
        settings.put(DISABLED_PASSES, "");
        settings.put(EXTRACT_BROKEN, false);
        settings.put(REPORT_INCLUDE_INFO, true);

        log.info("Pipeline settings initialized with default values");
    }

    /**
     * Reads a switch. Accepts {@code Boolean} values and their string spelling; anything else, or a
     * missing key, yields {@code defaultValue}.
     */
    public boolean isEnabled(String key, boolean defaultValue) {
        Object value = settings.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return defaultValue;
    }

    /**
     * Reads a comma-separated setting such as {@code "RemoveDebug, BrokenDeclarationExtractor"}.
     * Blank entries are dropped.
     */
    public List<String> getNames(String key) {
        List<String> names = new ArrayList<>();
        Object value = settings.get(key);
        if (value == null) {
            return names;
        }

        for (String part : value.toString().split(",")) {
            String name = part.trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    public void setConfigValue(String key, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Setting " + key + " cannot be null");
        }
        Object oldValue = settings.put(key, value);
        log.debug("Setting changed: {} = {} (was: {})", key, value, oldValue);
    }
}
