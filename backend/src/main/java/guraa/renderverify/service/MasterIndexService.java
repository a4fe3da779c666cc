package guraa.renderverify.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import guraa.renderverify.core.DimensionCatalog;
import guraa.renderverify.model.Dimension;
import guraa.renderverify.model.MasterCandidate;
import guraa.renderverify.model.MasterMetadata;
import guraa.renderverify.model.MasterSidecar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Service for finding stored master images and recording new ones.
 * Each master {@code name.png} has its metadata in {@code name.png.json}.
 */
@Slf4j
@Service
public class MasterIndexService {

    static final String SIDECAR_SUFFIX = ".json";
    private static final String IMAGE_FORMAT = "png";

    private final ObjectMapper objectMapper;

    public MasterIndexService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Lists the masters matching a file pattern, in file name order.
     *
     * @param directory The masters directory
     * @param glob      File name pattern, e.g. {@code button_*.png}
     * @return The candidates; empty if the directory does not exist
     * @throws IOException If the directory or a sidecar cannot be read
     */
    public List<MasterCandidate> scan(Path directory, String glob) throws IOException {
        return scan(directory, glob, name -> true);
    }

    /**
     * Lists the masters of one test, i.e. files named {@code <testName>_<n>.png}, in file
     * name order. Masters of tests whose name merely starts with {@code testName} are left out.
     *
     * @param directory The masters directory
     * @param testName  The logical test name
     * @return The candidates; empty if the directory does not exist
     * @throws IOException If the directory or a sidecar cannot be read
     */
    public List<MasterCandidate> mastersOf(Path directory, String testName) throws IOException {
        Pattern masterName = Pattern.compile(Pattern.quote(testName) + "_\\d+\\." + IMAGE_FORMAT);
        return scan(directory, patternFor(testName), name -> masterName.matcher(name).matches());
    }

    private List<MasterCandidate> scan(Path directory, String glob, Predicate<String> nameFilter) throws IOException {
        if (!Files.isDirectory(directory)) {
            log.debug("Masters directory does not exist: {}", directory);
            return List.of();
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                if (Files.isRegularFile(file) && !name.endsWith(SIDECAR_SUFFIX) && nameFilter.test(name)) {
                    files.add(file);
                }
            }
        }
        files.sort(Comparator.comparing(file -> file.getFileName().toString()));

        List<MasterCandidate> candidates = new ArrayList<>(files.size());
        for (Path file : files) {
            candidates.add(new MasterCandidate(file, readMetadata(file)));
        }
        log.debug("Found {} master candidate(s) for {} in {}", candidates.size(), glob, directory);
        return candidates;
    }

    /**
     * Reads the metadata stored for a master image.
     *
     * @param image The master image file
     * @return Its metadata, or empty metadata if it has no sidecar
     * @throws IOException If the sidecar exists but cannot be parsed
     */
    public MasterMetadata readMetadata(Path image) throws IOException {
        Path sidecar = sidecarOf(image);
        if (!Files.exists(sidecar)) {
            log.debug("No metadata for master {}, it will match any environment", image.getFileName());
            return MasterMetadata.empty();
        }

        MasterSidecar stored = objectMapper.readValue(sidecar.toFile(), MasterSidecar.class);
        Map<Dimension, String> description = new LinkedHashMap<>();
        if (stored.getDescription() != null) {
            stored.getDescription().forEach((name, value) -> description.put(DimensionCatalog.resolve(name), value));
        }
        List<Dimension> criteria = stored.getCriteria() == null
                ? List.of()
                : stored.getCriteria().stream().map(DimensionCatalog::resolve).collect(Collectors.toList());
        return new MasterMetadata(description, criteria);
    }

    /**
     * Writes the metadata of a master image to its sidecar.
     *
     * @param image    The master image file
     * @param metadata The metadata to store
     * @throws IOException If the sidecar cannot be written
     */
    public void writeMetadata(Path image, MasterMetadata metadata) throws IOException {
        MasterSidecar sidecar = new MasterSidecar();
        metadata.getDescription().forEach((dimension, value) -> sidecar.getDescription().put(dimension.getName(), value));
        metadata.getCriteria().forEach(dimension -> sidecar.getCriteria().add(dimension.getName()));
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(sidecarOf(image).toFile(), sidecar);
    }

    /**
     * Stores a capture as a new master for a test.
     *
     * @param directory The masters directory, created if needed
     * @param testName  The logical test name
     * @param image     The image to store
     * @param metadata  Environment description and criteria of the new master
     * @return The path of the new master image
     * @throws IOException If the image or its sidecar cannot be written
     */
    public Path createMaster(Path directory, String testName, BufferedImage image, MasterMetadata metadata)
            throws IOException {
        Files.createDirectories(directory);

        Path file;
        int suffix = 0;
        do {
            file = directory.resolve(testName + "_" + suffix + "." + IMAGE_FORMAT);
            suffix++;
        } while (Files.exists(file));

        if (!ImageIO.write(image, IMAGE_FORMAT, file.toFile())) {
            throw new IOException("No image writer available for format " + IMAGE_FORMAT);
        }
        writeMetadata(file, metadata);

        log.info("Created master {} with criteria {}", file, metadata.getCriteria());
        return file;
    }

    /**
     * @return A file pattern matching every master of a test, and possibly masters of
     *         tests whose name extends it; see {@link #mastersOf(Path, String)}
     */
    public static String patternFor(String testName) {
        return testName + "_*." + IMAGE_FORMAT;
    }

    static Path sidecarOf(Path image) {
        return image.resolveSibling(image.getFileName().toString() + SIDECAR_SUFFIX);
    }
}
