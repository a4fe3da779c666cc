package guraa.renderverify.core;

import guraa.renderverify.model.Dimension;
import guraa.renderverify.model.MasterMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.UIManager;
import java.awt.DisplayMode;
import java.awt.GraphicsEnvironment;
import java.awt.Toolkit;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Registry of the environment dimensions a master image can be described by.
 */
public final class DimensionCatalog {

    private static final Logger logger = LoggerFactory.getLogger(DimensionCatalog.class);

    private static final String DEFAULT_DPI = "96";
    private static final String DEFAULT_COLOR_DEPTH = "32";

    public static final Dimension OS_NAME = new Dimension("OsName", true, () -> System.getProperty("os.name"));
    public static final Dimension OS_VERSION = new Dimension("OsVersion", true, () -> System.getProperty("os.version"));
    public static final Dimension ARCHITECTURE = new Dimension("Architecture", true, () -> System.getProperty("os.arch"));
    public static final Dimension DPI = new Dimension("Dpi", true, DimensionCatalog::probeDpi);
    public static final Dimension COLOR_DEPTH = new Dimension("ColorDepth", true, DimensionCatalog::probeColorDepth);
    public static final Dimension THEME = new Dimension("Theme", true, DimensionCatalog::probeTheme);
    public static final Dimension CULTURE = new Dimension("Culture", true, () -> Locale.getDefault().toLanguageTag());
    public static final Dimension JAVA_VERSION = new Dimension("JavaVersion", false, () -> System.getProperty("java.version"));
    public static final Dimension MACHINE_NAME = new Dimension("MachineName", false, DimensionCatalog::probeMachineName);

    private static final Map<String, Dimension> BY_NAME;

    static {
        Map<String, Dimension> table = new LinkedHashMap<>();
        for (Dimension dimension : List.of(OS_NAME, OS_VERSION, ARCHITECTURE, DPI, COLOR_DEPTH,
                THEME, CULTURE, JAVA_VERSION, MACHINE_NAME)) {
            table.put(dimension.getName().toLowerCase(Locale.ROOT), dimension);
        }
        BY_NAME = Collections.unmodifiableMap(table);
    }

    private DimensionCatalog() {
    }

    /**
     * @return Every declared dimension, in declaration order
     */
    public static List<Dimension> all() {
        return List.copyOf(BY_NAME.values());
    }

    /**
     * @return The dimensions that may be used as match criteria
     */
    public static List<Dimension> indexable() {
        return BY_NAME.values().stream()
                .filter(Dimension::isIndexable)
                .collect(Collectors.toList());
    }

    /**
     * Looks up a dimension by name, ignoring case.
     *
     * @param name The dimension name
     * @return The declared dimension, or empty if the name is unknown
     */
    public static Optional<Dimension> byName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Resolves a name to a declared dimension, or to an unregistered placeholder.
     *
     * @param name The dimension name as recorded in stored metadata
     * @return A dimension, never null
     */
    public static Dimension resolve(String name) {
        return byName(name).orElseGet(() -> Dimension.unregistered(name));
    }

    /**
     * Snapshots the current environment.
     *
     * @param overrides Values that replace probed ones, keyed by dimension name
     * @param criteria  The criteria to record in the snapshot
     * @return Metadata describing every declared dimension
     */
    public static MasterMetadata describeCurrentEnvironment(Map<String, String> overrides, List<Dimension> criteria) {
        Map<String, String> normalizedOverrides = new LinkedHashMap<>();
        if (overrides != null) {
            overrides.forEach((key, value) -> {
                if (byName(key).isEmpty()) {
                    logger.warn("Ignoring override for unknown dimension: {}", key);
                } else {
                    normalizedOverrides.put(key.toLowerCase(Locale.ROOT), value);
                }
            });
        }

        Map<Dimension, String> description = new LinkedHashMap<>();
        for (Map.Entry<String, Dimension> entry : BY_NAME.entrySet()) {
            String value = normalizedOverrides.containsKey(entry.getKey())
                    ? normalizedOverrides.get(entry.getKey())
                    : entry.getValue().currentValue();
            description.put(entry.getValue(), value);
        }
        return new MasterMetadata(description, criteria);
    }

    private static String probeDpi() {
        if (GraphicsEnvironment.isHeadless()) {
            return DEFAULT_DPI;
        }
        return String.valueOf(Toolkit.getDefaultToolkit().getScreenResolution());
    }

    private static String probeColorDepth() {
        if (GraphicsEnvironment.isHeadless()) {
            return DEFAULT_COLOR_DEPTH;
        }
        DisplayMode mode = GraphicsEnvironment.getLocalGraphicsEnvironment()
                .getDefaultScreenDevice()
                .getDisplayMode();
        if (mode.getBitDepth() == DisplayMode.BIT_DEPTH_MULTI) {
            return DEFAULT_COLOR_DEPTH;
        }
        return String.valueOf(mode.getBitDepth());
    }

    private static String probeTheme() {
        return UIManager.getLookAndFeel().getName();
    }

    private static String probeMachineName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.debug("Could not determine host name: {}", e.getMessage());
            return null;
        }
    }
}
