package kds.domain.model;

/**
 * Routing rule: a menu item or a whole category goes to one printer.
 * Several rules for the same item or category fan the ticket out to several printers.
 *
 * @param targetId menu item id (ITEM level) or category id (CATEGORY level)
 * @param createdAt epoch millis, secondary sort key after priority
 * @since 03/10/2026
 */
public record Assignment(String id, EAssignmentLevel level, String targetId, String targetName, String printerId,
                         int priority, boolean active, long createdAt) {

    public Assignment {
        if (priority <= 0) {
            priority = 1;
        }
    }

    public static Assignment forItem(String id, String menuItemId, String printerId, int priority, long createdAt) {
        return new Assignment(id, EAssignmentLevel.ITEM, menuItemId, null, printerId, priority, true, createdAt);
    }

    public static Assignment forCategory(String id, String categoryId, String printerId, int priority, long createdAt) {
        return new Assignment(id, EAssignmentLevel.CATEGORY, categoryId, null, printerId, priority, true, createdAt);
    }

    public boolean matches(EAssignmentLevel expectedLevel, String expectedTargetId) {
        return level == expectedLevel && targetId != null && targetId.equals(expectedTargetId);
    }
}
