package guraa.renderverify.config;

import guraa.renderverify.visual.ChannelCompareMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the application
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Masters masters = new Masters();
    private final Dimensions dimensions = new Dimensions();
    private final Tolerance tolerance = new Tolerance();
    private final Comparison comparison = new Comparison();

    public Masters getMasters() {
        return masters;
    }

    public Dimensions getDimensions() {
        return dimensions;
    }

    public Tolerance getTolerance() {
        return tolerance;
    }

    public Comparison getComparison() {
        return comparison;
    }

    /**
     * Where master images live and how new ones are tagged
     */
    public static class Masters {
        private String directory = "masters";
        private boolean createMissing = true;
        private List<String> defaultCriteria = new ArrayList<>(List.of("OsName", "Dpi", "Theme"));

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public boolean isCreateMissing() {
            return createMissing;
        }

        public void setCreateMissing(boolean createMissing) {
            this.createMissing = createMissing;
        }

        public List<String> getDefaultCriteria() {
            return defaultCriteria;
        }

        public void setDefaultCriteria(List<String> defaultCriteria) {
            this.defaultCriteria = defaultCriteria;
        }
    }

    /**
     * Match weights per dimension, and values that replace probed ones
     */
    public static class Dimensions {
        private Map<String, Integer> weights = new LinkedHashMap<>();
        private Map<String, String> overrides = new LinkedHashMap<>();

        public Map<String, Integer> getWeights() {
            return weights;
        }

        public void setWeights(Map<String, Integer> weights) {
            this.weights = weights;
        }

        public Map<String, String> getOverrides() {
            return overrides;
        }

        public void setOverrides(Map<String, String> overrides) {
            this.overrides = overrides;
        }
    }

    /**
     * Tolerance document location; the bundled default is used when empty
     */
    public static class Tolerance {
        private String file;

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }
    }

    /**
     * Comparison execution settings
     */
    public static class Comparison {
        private int threads = 4;
        private long timeoutSeconds = 60;
        private ChannelCompareMode channelMode = ChannelCompareMode.ARGB;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public ChannelCompareMode getChannelMode() {
            return channelMode;
        }

        public void setChannelMode(ChannelCompareMode channelMode) {
            this.channelMode = channelMode;
        }
    }
}
