package kds.domain.queue;

/**
 * Counters of one drain pass
 * @param skipped true when another drain was already running and this one did nothing
 * @since 07/10/2026
 */
public record DrainReport(int attempted, int succeeded, int failed, int deadLettered, boolean skipped) {

    public static DrainReport skippedRun() {
        return new DrainReport(0, 0, 0, 0, true);
    }
}
