package guraa.renderverify.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlFactory;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads and writes tolerance documents.
 *
 * <pre>
 * &lt;Tolerances&gt;
 *   &lt;Tolerance ratio="1.0"&gt;
 *     &lt;Point level="0" fraction="1.0"/&gt;
 *   &lt;/Tolerance&gt;
 * &lt;/Tolerances&gt;
 * </pre>
 *
 * A lone {@code Tolerance} root is the older single-table form; its ratio defaults to 1.0.
 */
final class ToleranceDocumentCodec {

    private static final Logger logger = LoggerFactory.getLogger(ToleranceDocumentCodec.class);

    static final String CONTAINER_ELEMENT = "Tolerances";
    static final String BLOCK_ELEMENT = "Tolerance";

    private static final XmlMapper MAPPER = createMapper();

    private ToleranceDocumentCodec() {
    }

    private static XmlMapper createMapper() {
        XMLInputFactory inputFactory = XMLInputFactory.newFactory();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        XmlMapper mapper = new XmlMapper(new XmlFactory(inputFactory));
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    static TreeMap<Double, TreeMap<Integer, Double>> read(InputStream input) throws ToleranceParseException {
        if (input == null) {
            throw new ToleranceParseException("Tolerance document cannot be null");
        }

        XMLStreamReader reader = null;
        try {
            reader = MAPPER.getFactory().getXMLInputFactory().createXMLStreamReader(input);
            while (reader.hasNext() && reader.getEventType() != XMLStreamConstants.START_ELEMENT) {
                reader.next();
            }
            if (reader.getEventType() != XMLStreamConstants.START_ELEMENT) {
                throw new ToleranceParseException("Tolerance document has no root element");
            }

            String root = reader.getLocalName();
            if (CONTAINER_ELEMENT.equals(root)) {
                ToleranceDocument document = MAPPER.readValue(reader, ToleranceDocument.class);
                return toTables(document == null ? null : document.getBlocks(), false);
            } else if (BLOCK_ELEMENT.equals(root)) {
                ToleranceBlock block = MAPPER.readValue(reader, ToleranceBlock.class);
                return toTables(block == null ? null : List.of(block), true);
            }
            throw new ToleranceParseException("Unexpected root element '" + root
                    + "', expected '" + CONTAINER_ELEMENT + "' or '" + BLOCK_ELEMENT + "'");
        } catch (XMLStreamException | IOException e) {
            throw new ToleranceParseException("Malformed tolerance document: " + e.getMessage(), e);
        } finally {
            closeQuietly(reader);
        }
    }

    private static TreeMap<Double, TreeMap<Integer, Double>> toTables(List<ToleranceBlock> blocks, boolean legacy)
            throws ToleranceParseException {
        TreeMap<Double, TreeMap<Integer, Double>> tables = new TreeMap<>();
        if (blocks == null) {
            return tables;
        }

        for (ToleranceBlock block : blocks) {
            Double ratio = block.getRatio();
            if (ratio == null) {
                if (!legacy) {
                    throw new ToleranceParseException("Element '" + BLOCK_ELEMENT + "' is missing the 'ratio' attribute");
                }
                ratio = ToleranceCurve.DEFAULT_DPI_RATIO;
            }
            if (!(ratio > 0) || ratio.isInfinite()) {
                throw new ToleranceParseException("Ratio must be strictly positive, got " + ratio);
            }

            TreeMap<Integer, Double> table = tables.computeIfAbsent(ratio, r -> new TreeMap<>());
            if (block.getPoints() == null) {
                continue;
            }
            for (TolerancePoint point : block.getPoints()) {
                table.put(parseLevel(point.getLevel()), parseFraction(point.getFraction()));
            }
        }
        return tables;
    }

    private static int parseLevel(String raw) throws ToleranceParseException {
        if (raw == null) {
            throw new ToleranceParseException("Point is missing the 'level' attribute");
        }
        int level;
        try {
            level = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ToleranceParseException("Level '" + raw + "' is not an integer", e);
        }
        if (level < ToleranceCurve.MIN_LEVEL || level > ToleranceCurve.MAX_LEVEL) {
            throw new ToleranceParseException("Level " + level + " is outside [0, 255]");
        }
        return level;
    }

    private static double parseFraction(String raw) throws ToleranceParseException {
        if (raw == null) {
            throw new ToleranceParseException("Point is missing the 'fraction' attribute");
        }
        double fraction;
        try {
            fraction = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new ToleranceParseException("Fraction '" + raw + "' is not a number", e);
        }
        if (!(fraction >= 0.0 && fraction <= 1.0)) {
            throw new ToleranceParseException("Fraction " + fraction + " is outside [0.0, 1.0]");
        }
        return fraction;
    }

    static void write(Map<Double, TreeMap<Integer, Double>> tables, OutputStream output) throws IOException {
        MAPPER.writeValue(output, toDocument(tables));
    }

    static String writeString(Map<Double, TreeMap<Integer, Double>> tables) {
        try {
            return MAPPER.writeValueAsString(toDocument(tables));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ToleranceDocument toDocument(Map<Double, TreeMap<Integer, Double>> tables) {
        List<ToleranceBlock> blocks = new ArrayList<>();
        tables.forEach((ratio, table) -> {
            List<TolerancePoint> points = new ArrayList<>();
            table.forEach((level, fraction) ->
                    points.add(new TolerancePoint(Integer.toString(level), Double.toString(fraction))));
            blocks.add(new ToleranceBlock(ratio, points));
        });
        return new ToleranceDocument(blocks);
    }

    private static void closeQuietly(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException e) {
            logger.debug("Failed to close tolerance document reader: {}", e.getMessage());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JacksonXmlRootElement(localName = CONTAINER_ELEMENT)
    static class ToleranceDocument {

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = BLOCK_ELEMENT)
        private List<ToleranceBlock> blocks = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JacksonXmlRootElement(localName = BLOCK_ELEMENT)
    static class ToleranceBlock {

        @JacksonXmlProperty(isAttribute = true)
        private Double ratio;

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "Point")
        private List<TolerancePoint> points = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class TolerancePoint {

        @JacksonXmlProperty(isAttribute = true)
        private String level;

        @JacksonXmlProperty(isAttribute = true)
        private String fraction;
    }
}
