package kds.dal;

import com.google.gson.Gson;
import kds.common.ETransportType;
import kds.domain.model.Assignment;
import kds.domain.model.EAssignmentLevel;
import kds.domain.model.PrinterTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for PrinterCatalog
 * @since 12/10/2026
 */
class PrinterCatalogTest {

    private static final String CATALOG_JSON = "{"
            + "\"printers\": ["
            + "  {\"id\": \"kitchen\", \"name\": \"Kitchen\", \"host\": \"10.0.0.5\", \"port\": 9100, \"active\": true, \"priority\": 2},"
            + "  {\"id\": \"cloud\", \"name\": \"Patio\", \"active\": true, \"priority\": 1, \"transport\": \"CLOUD\"},"
            + "  {\"id\": \"old\", \"name\": \"Old\", \"host\": \"10.0.0.9\", \"port\": 9100, \"active\": false}"
            + "],"
            + "\"assignments\": ["
            + "  {\"id\": \"a1\", \"level\": \"CATEGORY\", \"targetId\": \"mains\", \"printerId\": \"kitchen\", \"priority\": 0, \"active\": true, \"createdAt\": 1},"
            + "  {\"id\": \"a2\", \"level\": \"ITEM\", \"targetId\": \"burger\", \"printerId\": \"cloud\", \"priority\": 3, \"active\": false, \"createdAt\": 2}"
            + "]}";

    @TempDir
    Path tempDir;

    private PrinterCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new PrinterCatalog(new CatalogConfig("config/printers.json"), new Gson());
    }

    @Test
    @DisplayName("Should parse printers and assignments from JSON")
    void shouldParseCatalogJson() throws ConfigurationException {
        // When
        catalog.load(new StringReader(CATALOG_JSON));

        // Then
        assertThat(catalog.isInitialized()).isTrue();
        assertThat(catalog.listAll()).hasSize(3);
        assertThat(catalog.listActive()).extracting(PrinterTarget::id).containsExactly("kitchen", "cloud");
        assertThat(catalog.findById("kitchen")).get()
                .extracting(PrinterTarget::transport).isEqualTo(ETransportType.NETWORK);
        assertThat(catalog.findById("cloud")).get()
                .extracting(PrinterTarget::transport).isEqualTo(ETransportType.CLOUD);
        assertThat(catalog.listActiveAssignments()).extracting(Assignment::id).containsExactly("a1");
        assertThat(catalog.listAllAssignments()).hasSize(2);
    }

    @Test
    @DisplayName("Should normalize non-positive assignment priority to 1")
    void shouldNormalizeAssignmentPriority() throws ConfigurationException {
        // When
        catalog.load(new StringReader(CATALOG_JSON));

        // Then
        assertThat(catalog.findForCategory("mains")).singleElement()
                .extracting(Assignment::priority).isEqualTo(1);
        assertThat(catalog.findForItem("burger")).isEmpty();
    }

    @Test
    @DisplayName("Should reject assignment pointing at unknown printer")
    void shouldRejectUnknownPrinterReference() {
        // Given
        List<PrinterTarget> printers = List.of(PrinterTarget.network("kitchen", "Kitchen", "10.0.0.5", 9100, 1));
        List<Assignment> assignments = List.of(
                Assignment.forCategory("a1", "mains", "grill", 1, 0L));

        // When & Then
        assertThatThrownBy(() -> catalog.replace(printers, assignments))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unknown printer grill");
        assertThat(catalog.isInitialized()).isFalse();
    }

    @Test
    @DisplayName("Should reject duplicate printer ids")
    void shouldRejectDuplicatePrinterIds() {
        // Given
        List<PrinterTarget> printers = List.of(
                PrinterTarget.network("kitchen", "Kitchen", "10.0.0.5", 9100, 1),
                PrinterTarget.simulated("kitchen", "Kitchen copy", 1));

        // When & Then
        assertThatThrownBy(() -> catalog.replace(printers, List.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate printer id");
    }

    @Test
    @DisplayName("Should report malformed JSON as configuration error")
    void shouldReportMalformedJson() {
        assertThatThrownBy(() -> catalog.load(new StringReader("{\"printers\": [ {")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Malformed printer catalog");
    }

    @Test
    @DisplayName("Should load catalog from disk path before classpath")
    void shouldLoadFromDiskPath() throws IOException, ConfigurationException {
        // Given
        Path file = tempDir.resolve("printers.json");
        Files.writeString(file, CATALOG_JSON);
        PrinterCatalog diskCatalog = new PrinterCatalog(new CatalogConfig(file.toString()), new Gson());

        // When
        diskCatalog.load();

        // Then
        assertThat(diskCatalog.listAll()).extracting(PrinterTarget::id).containsExactly("kitchen", "cloud", "old");
    }

    @Test
    @DisplayName("Should load bundled catalog from classpath")
    void shouldLoadBundledCatalog() throws ConfigurationException {
        // When
        catalog.load();

        // Then
        assertThat(catalog.listActive()).extracting(PrinterTarget::id).containsExactly("kitchen", "bar");
        assertThat(catalog.findForCategory("drinks")).extracting(Assignment::printerId).containsExactly("bar");
    }

    @Test
    @DisplayName("Should replace an assignment with the same id on save")
    void shouldReplaceAssignmentOnSave() throws ConfigurationException {
        // Given
        catalog.load(new StringReader(CATALOG_JSON));
        Assignment moved = new Assignment("a1", EAssignmentLevel.CATEGORY, "mains", null, "cloud", 1, true, 1L);

        // When
        catalog.saveAssignment(moved);

        // Then
        assertThat(catalog.listAllAssignments()).hasSize(2);
        assertThat(catalog.findForCategory("mains")).extracting(Assignment::printerId).containsExactly("cloud");
    }
}
