package guraa.renderverify.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import guraa.renderverify.core.DimensionCatalog;
import guraa.renderverify.model.Dimension;
import guraa.renderverify.model.MasterCandidate;
import guraa.renderverify.model.MasterMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MasterIndexServiceTest {

    private final MasterIndexService service = new MasterIndexService(new ObjectMapper());

    @TempDir
    Path mastersDir;

    private static BufferedImage image() {
        return new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);
    }

    @Test
    void testCreateMasterPicksNextFreeSuffix() throws Exception {
        MasterMetadata metadata = new MasterMetadata(
                Map.of(DimensionCatalog.THEME, "aero"), List.of(DimensionCatalog.THEME));

        Path first = service.createMaster(mastersDir, "button", image(), metadata);
        Path second = service.createMaster(mastersDir, "button", image(), metadata);

        assertEquals("button_0.png", first.getFileName().toString());
        assertEquals("button_1.png", second.getFileName().toString());
        assertTrue(Files.exists(MasterIndexService.sidecarOf(first)));
    }

    @Test
    void testScanReturnsSortedCandidatesWithMetadata() throws Exception {
        MasterMetadata metadata = new MasterMetadata(
                Map.of(DimensionCatalog.THEME, "aero", DimensionCatalog.DPI, "96"),
                List.of(DimensionCatalog.DPI, DimensionCatalog.THEME));
        service.createMaster(mastersDir, "button", image(), metadata);
        service.createMaster(mastersDir, "button", image(), metadata);
        service.createMaster(mastersDir, "buttonbar", image(), MasterMetadata.empty());

        List<MasterCandidate> candidates = service.scan(mastersDir, MasterIndexService.patternFor("button"));

        assertEquals(List.of("button_0.png", "button_1.png"),
                candidates.stream().map(MasterCandidate::getFileName).collect(Collectors.toList()));
        MasterMetadata stored = candidates.get(0).getMetadata();
        assertEquals(List.of(DimensionCatalog.DPI, DimensionCatalog.THEME), stored.getCriteria());
        assertEquals("aero", stored.valueOf(DimensionCatalog.THEME));
    }

    @Test
    void testMastersOfIgnoresTestsSharingThePrefix() throws Exception {
        service.createMaster(mastersDir, "button", image(), MasterMetadata.empty());
        service.createMaster(mastersDir, "button_large", image(), MasterMetadata.empty());
        service.createMaster(mastersDir, "button_large", image(), MasterMetadata.empty());

        List<MasterCandidate> button = service.mastersOf(mastersDir, "button");
        List<MasterCandidate> large = service.mastersOf(mastersDir, "button_large");

        assertEquals(List.of("button_0.png"),
                button.stream().map(MasterCandidate::getFileName).collect(Collectors.toList()));
        assertEquals(List.of("button_large_0.png", "button_large_1.png"),
                large.stream().map(MasterCandidate::getFileName).collect(Collectors.toList()));
        assertTrue(service.mastersOf(mastersDir, "butto").isEmpty());
    }

    @Test
    void testMasterWithoutSidecarHasEmptyMetadata() throws Exception {
        Path master = service.createMaster(mastersDir, "menu", image(), MasterMetadata.empty());
        Files.delete(MasterIndexService.sidecarOf(master));

        MasterMetadata metadata = service.readMetadata(master);

        assertTrue(metadata.getDescription().isEmpty());
        assertTrue(metadata.getCriteria().isEmpty());
    }

    @Test
    void testUnknownDimensionInSidecarIsKeptAsUnregistered() throws Exception {
        Path master = service.createMaster(mastersDir, "menu", image(), MasterMetadata.empty());
        Files.write(MasterIndexService.sidecarOf(master),
                "{\"description\":{\"GpuVendor\":\"acme\"},\"criteria\":[\"GpuVendor\"]}".getBytes(StandardCharsets.UTF_8));

        MasterMetadata metadata = service.readMetadata(master);

        Dimension criterion = metadata.getCriteria().get(0);
        assertEquals("GpuVendor", criterion.getName());
        assertFalse(criterion.isIndexable());
        assertEquals("acme", metadata.valueOf(criterion));
    }

    @Test
    void testMissingDirectoryYieldsNoCandidates() throws Exception {
        assertTrue(service.scan(mastersDir.resolve("absent"), "x_*.png").isEmpty());
    }
}
