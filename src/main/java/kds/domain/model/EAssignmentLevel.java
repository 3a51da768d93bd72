package kds.domain.model;

/**
 * @since 03/10/2026
 */
public enum EAssignmentLevel {
    ITEM,
    CATEGORY
}
