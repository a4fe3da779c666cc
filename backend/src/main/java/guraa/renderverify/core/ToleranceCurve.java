package guraa.renderverify.core;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Allowed error per level, kept separately for each DPI ratio between master and capture.
 *
 * Within a ratio the tolerance is a step function: the value in force at a level is the
 * one recorded at the closest configured level at or below it. Instances are not
 * thread-safe; a curve shared with running validations must be copied before it is
 * changed.
 */
public class ToleranceCurve {

    public static final double DEFAULT_DPI_RATIO = 1.0;
    public static final int MIN_LEVEL = 0;
    public static final int MAX_LEVEL = 255;

    private TreeMap<Double, TreeMap<Integer, Double>> tables = new TreeMap<>();
    private double dpiRatio = DEFAULT_DPI_RATIO;

    public ToleranceCurve() {
    }

    private ToleranceCurve(ToleranceCurve other) {
        this.dpiRatio = other.dpiRatio;
        other.tables.forEach((ratio, table) -> this.tables.put(ratio, new TreeMap<>(table)));
    }

    public double getDpiRatio() {
        return dpiRatio;
    }

    /**
     * Selects which ratio's table the other operations act on.
     *
     * @param ratio The DPI ratio, strictly positive
     */
    public void setDpiRatio(double ratio) {
        checkRatio(ratio);
        this.dpiRatio = ratio;
    }

    /**
     * Returns the table of the active ratio, creating an empty one if needed.
     *
     * @return A read-only view, level to allowed fraction
     */
    public SortedMap<Integer, Double> getEntries() {
        return Collections.unmodifiableSortedMap(activeTable());
    }

    public boolean hasEntries() {
        TreeMap<Integer, Double> table = tables.get(dpiRatio);
        return table != null && !table.isEmpty();
    }

    /**
     * @return Every ratio a table exists for, ascending
     */
    public SortedSet<Double> getDpiRatios() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(tables.keySet()));
    }

    /**
     * Sets a landmark in the active ratio's table.
     *
     * @param level    Error level, 0 to 255
     * @param fraction Allowed fraction of pixels at that level, 0.0 to 1.0
     */
    public void addEntry(int level, double fraction) {
        checkLevel(level);
        checkFraction(fraction);
        activeTable().put(level, fraction);
    }

    public void removeEntry(int level) {
        checkLevel(level);
        activeTable().remove(level);
    }

    public void clearEntries() {
        activeTable().clear();
    }

    /**
     * Returns the tolerance in force at a level for the active ratio.
     *
     * @param level Error level, 0 to 255
     * @return The value of the closest landmark at or below the level, or NaN if there is none
     */
    public double interpolatedValue(int level) {
        checkLevel(level);
        TreeMap<Integer, Double> table = tables.get(dpiRatio);
        if (table == null || table.isEmpty()) {
            return Double.NaN;
        }
        Map.Entry<Integer, Double> landmark = table.floorEntry(level);
        return landmark == null ? Double.NaN : landmark.getValue();
    }

    /**
     * @return A deep copy sharing no state with this curve
     */
    public ToleranceCurve copy() {
        return new ToleranceCurve(this);
    }

    /**
     * Replaces every table with the content of a tolerance document. On failure the curve
     * is left as it was. The active ratio is reset to 1.0.
     *
     * @param input The XML document
     * @throws ToleranceParseException if the document is malformed or holds out-of-range values
     */
    public void load(InputStream input) throws ToleranceParseException {
        TreeMap<Double, TreeMap<Integer, Double>> parsed = ToleranceDocumentCodec.read(input);
        this.tables = parsed;
        this.dpiRatio = DEFAULT_DPI_RATIO;
    }

    public void load(Path file) throws ToleranceParseException, IOException {
        try (InputStream input = Files.newInputStream(file)) {
            load(input);
        }
    }

    public void loadXml(String xml) throws ToleranceParseException {
        load(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Writes every ratio and its full table.
     *
     * @param output Destination of the XML document
     * @throws IOException if writing fails
     */
    public void save(OutputStream output) throws IOException {
        ToleranceDocumentCodec.write(tables, output);
    }

    public void save(Path file) throws IOException {
        try (OutputStream output = Files.newOutputStream(file)) {
            save(output);
        }
    }

    public String toXml() {
        return ToleranceDocumentCodec.writeString(tables);
    }

    @Override
    public String toString() {
        return "ToleranceCurve{dpiRatio=" + dpiRatio + ", tables=" + tables + "}";
    }

    private TreeMap<Integer, Double> activeTable() {
        return tables.computeIfAbsent(dpiRatio, r -> new TreeMap<>());
    }

    static void checkRatio(double ratio) {
        if (!(ratio > 0) || Double.isInfinite(ratio)) {
            throw new IllegalArgumentException("DPI ratio must be strictly positive, got " + ratio);
        }
    }

    static void checkLevel(int level) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Level must be between 0 and 255, got " + level);
        }
    }

    static void checkFraction(double fraction) {
        if (!(fraction >= 0.0 && fraction <= 1.0)) {
            throw new IllegalArgumentException("Fraction must be between 0.0 and 1.0, got " + fraction);
        }
    }
}
