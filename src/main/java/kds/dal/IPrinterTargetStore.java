package kds.dal;

import kds.domain.model.PrinterTarget;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to configured printer targets
 * @since 03/10/2026
 */
public interface IPrinterTargetStore {
    Optional<PrinterTarget> findById(String printerId);

    List<PrinterTarget> listActive();

    List<PrinterTarget> listAll();

    boolean isInitialized();
}
