package kds.dal;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import kds.domain.model.Assignment;
import kds.domain.model.PrinterTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Printer targets and routing assignments loaded from a JSON catalog.
 * <p>File shape: {@code {"printers": [...], "assignments": [...]}}. The configured path is tried on disk first,
 * then on the classpath.</p>
 * @since 04/10/2026
 */
@Singleton
public class PrinterCatalog implements IPrinterTargetStore, IAssignmentStore {
    private static final Logger logger = LoggerFactory.getLogger(PrinterCatalog.class);

    private final CatalogConfig config;
    private final Gson gson;

    private volatile List<PrinterTarget> printers = Collections.emptyList();
    private final List<Assignment> assignments = new ArrayList<>();
    private volatile boolean initialized = false;

    @Inject
    public PrinterCatalog(CatalogConfig config, Gson gson) {
        this.config = config;
        this.gson = gson;
    }

    /**
     * Load the catalog from the configured location
     * @throws ConfigurationException if the file is missing, unreadable or inconsistent
     */
    public void load() throws ConfigurationException {
        Path path = Paths.get(config.path());
        if (Files.isRegularFile(path)) {
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                load(reader);
                logger.info("Loaded printer catalog from {}", path.toAbsolutePath());
                return;
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read printer catalog " + path, e);
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(config.path())) {
            if (input == null) {
                throw new ConfigurationException("Printer catalog not found: " + config.path());
            }
            load(new InputStreamReader(input, StandardCharsets.UTF_8));
            logger.info("Loaded printer catalog from classpath '{}'", config.path());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read printer catalog from classpath " + config.path(), e);
        }
    }

    void load(Reader reader) throws ConfigurationException {
        CatalogFile file;
        try {
            file = gson.fromJson(reader, CatalogFile.class);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed printer catalog: " + e.getMessage(), e);
        }
        if (file == null) {
            throw new ConfigurationException("Printer catalog is empty");
        }
        replace(
                file.printers() == null ? List.of() : file.printers(),
                file.assignments() == null ? List.of() : file.assignments());
    }

    /**
     * Swap the whole catalog content
     * @throws ConfigurationException on duplicate printer ids or assignments pointing at unknown printers
     */
    public synchronized void replace(List<PrinterTarget> newPrinters, List<Assignment> newAssignments)
            throws ConfigurationException {
        Set<String> ids = new HashSet<>();
        for (PrinterTarget printer : newPrinters) {
            if (printer.id() == null || printer.id().trim().isEmpty()) {
                throw new ConfigurationException("Printer without id in catalog");
            }
            if (!ids.add(printer.id())) {
                throw new ConfigurationException("Duplicate printer id in catalog: " + printer.id());
            }
        }
        for (Assignment assignment : newAssignments) {
            if (assignment.level() == null || assignment.targetId() == null) {
                throw new ConfigurationException("Assignment " + assignment.id() + " has no level or target");
            }
            if (!ids.contains(assignment.printerId())) {
                throw new ConfigurationException("Assignment " + assignment.id()
                        + " references unknown printer " + assignment.printerId());
            }
        }

        this.printers = List.copyOf(newPrinters);
        this.assignments.clear();
        this.assignments.addAll(newAssignments);
        this.initialized = true;

        logger.info("Printer catalog: {} printers ({} active), {} assignments",
                printers.size(), listActive().size(), assignments.size());
    }

    @Override
    public Optional<PrinterTarget> findById(String printerId) {
        return printers.stream().filter(p -> p.id().equals(printerId)).findFirst();
    }

    @Override
    public List<PrinterTarget> listActive() {
        return printers.stream().filter(PrinterTarget::active).collect(Collectors.toList());
    }

    @Override
    public List<PrinterTarget> listAll() {
        return printers;
    }

    @Override
    public synchronized List<Assignment> listActiveAssignments() {
        return assignments.stream().filter(Assignment::active).collect(Collectors.toList());
    }

    @Override
    public synchronized List<Assignment> listAllAssignments() {
        return List.copyOf(assignments);
    }

    @Override
    public synchronized void saveAssignment(Assignment assignment) {
        assignments.removeIf(a -> a.id().equals(assignment.id()));
        assignments.add(assignment);
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    private record CatalogFile(List<PrinterTarget> printers, List<Assignment> assignments) {
    }
}
