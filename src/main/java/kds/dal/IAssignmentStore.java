package kds.dal;

import kds.domain.model.Assignment;
import kds.domain.model.EAssignmentLevel;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @since 03/10/2026
 */
public interface IAssignmentStore {
    List<Assignment> listActiveAssignments();

    List<Assignment> listAllAssignments();

    void saveAssignment(Assignment assignment);

    boolean isInitialized();

    default List<Assignment> findForItem(String menuItemId) {
        return findActive(EAssignmentLevel.ITEM, menuItemId);
    }

    default List<Assignment> findForCategory(String categoryId) {
        return findActive(EAssignmentLevel.CATEGORY, categoryId);
    }

    private List<Assignment> findActive(EAssignmentLevel level, String targetId) {
        if (targetId == null) {
            return List.of();
        }
        return listActiveAssignments().stream()
                .filter(a -> a.matches(level, targetId))
                .collect(Collectors.toList());
    }
}
