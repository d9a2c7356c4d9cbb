package com.nana.iep.util;

import com.nana.iep.service.ExtractFormat;
import com.nana.iep.service.ReconcilePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * AuditConfig - Audit Configuration
 *
 * <p>Layers, later ones overriding earlier ones:
 * <ol>
 *   <li>code defaults ({@link #DEFAULTS});</li>
 *   <li>classpath resource {@code /iep-audit.properties};</li>
 *   <li>an optional user properties file passed to {@link #load(Path)}.</li>
 * </ol>
 * The core components never read configuration themselves; they receive
 * the {@link ExtractFormat} and {@link ReconcilePolicy} built here.
 */
public final class AuditConfig {

    private static final Logger log = LoggerFactory.getLogger(AuditConfig.class);

    private static final String CLASSPATH_RESOURCE = "/iep-audit.properties";

    public static final String KEY_FORMAT_VERSION      = "extract.format.version";
    public static final String KEY_RECORD_DELIMITER    = "extract.record.delimiter";
    public static final String KEY_FIELD_DELIMITER     = "extract.field.delimiter";
    public static final String KEY_FIELD_ORDER         = "extract.field.order";
    public static final String KEY_SESSION_TAG         = "extract.tag.session";
    public static final String KEY_GOAL_TAG            = "extract.tag.goal";
    public static final String KEY_DATE_PATTERN        = "extract.date.pattern";
    public static final String KEY_CODE_COLUMN         = "extract.column.code";
    public static final String KEY_COMPILED_COLUMN     = "extract.column.compiled";
    public static final String KEY_MIN_SESSIONS        = "reconcile.min.sessions.without.goal";
    public static final String KEY_TRACKED_GOALS       = "report.tracked.goals";
    public static final String KEY_DATABASE_PATH       = "store.database.path";

    private static final Properties DEFAULTS = new Properties();

    static {
        DEFAULTS.setProperty(KEY_FORMAT_VERSION,   "1");
        DEFAULTS.setProperty(KEY_RECORD_DELIMITER, ";");
        DEFAULTS.setProperty(KEY_FIELD_DELIMITER,  "|");
        DEFAULTS.setProperty(KEY_FIELD_ORDER,      "type,date,value,status");
        DEFAULTS.setProperty(KEY_SESSION_TAG,      "S");
        DEFAULTS.setProperty(KEY_GOAL_TAG,         "G");
        DEFAULTS.setProperty(KEY_DATE_PATTERN,     "uuuu-MM-dd");
        DEFAULTS.setProperty(KEY_CODE_COLUMN,      "Display Code");
        DEFAULTS.setProperty(KEY_COMPILED_COLUMN,  "Details");
        DEFAULTS.setProperty(KEY_MIN_SESSIONS,     "0");
        DEFAULTS.setProperty(KEY_TRACKED_GOALS,    "numeracy,wellbeing");
        DEFAULTS.setProperty(KEY_DATABASE_PATH,
                Paths.get(System.getProperty("user.home"), "IEP_Audit", "iep_audit.db").toString());
    }

    private final Properties props;

    private AuditConfig(Properties props) {
        this.props = props;
    }

    // -----------------------------------------------------------------------
    // FACTORIES
    // -----------------------------------------------------------------------

    /**
     * Loads defaults, the classpath resource and, if it exists, the user file.
     *
     * @param userFile optional user properties file; may be null
     * @return the layered configuration
     */
    public static AuditConfig load(Path userFile) {
        Properties props = new Properties(DEFAULTS);
        try (InputStream in = AuditConfig.class.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                props.load(in);
                log.debug("Loaded {} from classpath.", CLASSPATH_RESOURCE);
            }
        } catch (IOException ex) {
            log.warn("Failed to load {}: {}", CLASSPATH_RESOURCE, ex.getMessage());
        }
        if (userFile != null) {
            if (Files.isRegularFile(userFile)) {
                try (InputStream in = Files.newInputStream(userFile)) {
                    props.load(in);
                    log.info("AuditConfig loaded user properties from {}.", userFile.toAbsolutePath());
                } catch (IOException ex) {
                    log.warn("Failed to load user properties {}: {}", userFile, ex.getMessage());
                }
            } else {
                log.debug("User properties file {} not found; using defaults.", userFile);
            }
        }
        return new AuditConfig(props);
    }

    /**
     * Builds a configuration from explicit properties layered on the defaults.
     *
     * @param overrides properties overriding the defaults; may be null
     * @return the configuration
     */
    public static AuditConfig fromProperties(Properties overrides) {
        Properties props = new Properties(DEFAULTS);
        if (overrides != null) {
            for (String key : overrides.stringPropertyNames()) {
                props.setProperty(key, overrides.getProperty(key));
            }
        }
        return new AuditConfig(props);
    }

    /** @return {@code ${user.home}/IEP_Audit/iep-audit.properties} */
    public static Path defaultUserFile() {
        return Paths.get(System.getProperty("user.home"), "IEP_Audit", "iep-audit.properties");
    }

    // -----------------------------------------------------------------------
    // RAW ACCESS
    // -----------------------------------------------------------------------

    public String getString(String key) {
        return props.getProperty(key);
    }

    public int getInt(String key, int defaultValue) {
        try {
            return Integer.parseInt(props.getProperty(key).trim());
        } catch (NumberFormatException | NullPointerException ex) {
            log.warn("Property '{}' is not an integer; using {}.", key, defaultValue);
            return defaultValue;
        }
    }

    // -----------------------------------------------------------------------
    // TYPED VIEWS
    // -----------------------------------------------------------------------

    /**
     * @return the packing convention described by the {@code extract.*} keys
     * @throws IllegalArgumentException if the configured convention is invalid
     */
    public ExtractFormat toExtractFormat() {
        return new ExtractFormat(
                getInt(KEY_FORMAT_VERSION, ExtractFormat.SUPPORTED_VERSION),
                getString(KEY_RECORD_DELIMITER),
                getString(KEY_FIELD_DELIMITER),
                ExtractFormat.parseFieldOrder(getString(KEY_FIELD_ORDER)),
                getString(KEY_SESSION_TAG),
                getString(KEY_GOAL_TAG),
                getString(KEY_DATE_PATTERN).trim());
    }

    /** @return the reconcile policy described by the {@code reconcile.*} and report keys */
    public ReconcilePolicy toReconcilePolicy() {
        return new ReconcilePolicy(getInt(KEY_MIN_SESSIONS, 0), getTrackedGoals());
    }

    public List<String> getTrackedGoals() {
        List<String> goals = new ArrayList<>();
        for (String goal : getString(KEY_TRACKED_GOALS).split(",")) {
            if (!goal.isBlank()) {
                goals.add(goal.trim());
            }
        }
        return goals;
    }

    public String getCodeColumn()     { return getString(KEY_CODE_COLUMN).trim(); }

    public String getCompiledColumn() { return getString(KEY_COMPILED_COLUMN).trim(); }

    public Path getDatabasePath()     { return Paths.get(getString(KEY_DATABASE_PATH).trim()); }
}
