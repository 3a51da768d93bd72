package kds.domain.assignment;

import kds.dal.IAssignmentStore;
import kds.dal.IPrinterTargetStore;
import kds.domain.model.Assignment;
import kds.domain.model.EAssignmentLevel;
import kds.domain.model.PrinterTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maps a menu item (or its category, as fallback) to the printers its tickets go to.
 *
 * <p>Item-level assignments always win over category-level ones. Within the winning level every active
 * assignment counts, so one item can fan out to several printers. Matches are ordered by priority (highest
 * first), then creation time, then assignment id, which keeps the order stable regardless of how the store
 * returns them.</p>
 *
 * @since 04/10/2026
 */
@Singleton
public class AssignmentResolver {
    private static final Logger logger = LoggerFactory.getLogger(AssignmentResolver.class);

    static final Comparator<Assignment> RESOLUTION_ORDER = Comparator
            .comparingInt(Assignment::priority).reversed()
            .thenComparingLong(Assignment::createdAt)
            .thenComparing(Assignment::id, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<PrinterTarget> ROUND_ROBIN_ORDER = Comparator
            .comparingInt(PrinterTarget::priority).reversed()
            .thenComparing(PrinterTarget::id);

    private final IAssignmentStore assignmentStore;
    private final IPrinterTargetStore printerStore;

    @Inject
    public AssignmentResolver(IAssignmentStore assignmentStore, IPrinterTargetStore printerStore) {
        this.assignmentStore = assignmentStore;
        this.printerStore = printerStore;
    }

    /**
     * All matching assignments at the winning level, in resolution order
     */
    public List<Assignment> resolveAssignments(String menuItemId, String categoryId) {
        List<Assignment> matches = new ArrayList<>(assignmentStore.findForItem(menuItemId));
        if (matches.isEmpty()) {
            matches = new ArrayList<>(assignmentStore.findForCategory(categoryId));
        }

        matches.sort(RESOLUTION_ORDER);
        return matches;
    }

    /**
     * Ordered, de-duplicated printer ids for one item. Empty when nothing is assigned.
     */
    public List<String> resolveTargets(String menuItemId, String categoryId) {
        Set<String> printerIds = new LinkedHashSet<>();
        for (Assignment assignment : resolveAssignments(menuItemId, categoryId)) {
            printerIds.add(assignment.printerId());
        }
        return new ArrayList<>(printerIds);
    }

    /**
     * The single owning printer where exactly one is needed: highest priority, oldest on ties
     */
    public Optional<String> resolveSingleTarget(String menuItemId, String categoryId) {
        return resolveAssignments(menuItemId, categoryId).stream()
                .map(Assignment::printerId)
                .findFirst();
    }

    public boolean hasAssignment(String menuItemId, String categoryId) {
        return !resolveAssignments(menuItemId, categoryId).isEmpty();
    }

    /**
     * Bootstrap helper: give every category without a category-level assignment one printer, dealing
     * categories round-robin over the active printers. Existing assignments are left untouched.
     *
     * @param categoryIds categories to cover, in the order they should be dealt
     * @return the assignments created (also saved to the store)
     */
    public List<Assignment> autoAssignCategories(List<String> categoryIds) {
        List<PrinterTarget> printers = printerStore.listActive().stream()
                .sorted(ROUND_ROBIN_ORDER)
                .collect(Collectors.toList());
        if (printers.isEmpty()) {
            logger.warn("Auto-assign skipped: no active printers");
            return List.of();
        }

        Set<String> covered = new HashSet<>();
        for (Assignment assignment : assignmentStore.listActiveAssignments()) {
            if (assignment.level() == EAssignmentLevel.CATEGORY) {
                covered.add(assignment.targetId());
            }
        }

        List<Assignment> created = new ArrayList<>();
        int next = 0;
        for (String categoryId : categoryIds) {
            if (categoryId == null || !covered.add(categoryId)) {
                continue;
            }
            PrinterTarget printer = printers.get(next % printers.size());
            next++;

            Assignment assignment = new Assignment(UUID.randomUUID().toString(), EAssignmentLevel.CATEGORY,
                    categoryId, null, printer.id(), 1, true, System.currentTimeMillis());
            assignmentStore.saveAssignment(assignment);
            created.add(assignment);
            logger.info("Auto-assigned category {} -> printer {}", categoryId, printer.name());
        }
        return created;
    }
}
