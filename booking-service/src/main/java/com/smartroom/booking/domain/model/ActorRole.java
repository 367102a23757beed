package com.smartroom.booking.domain.model;

/**
 * Effective role of the caller, resolved upstream by the authorization layer.
 */
public enum ActorRole {
    USER(false, false, false),
    FACILITY_MANAGER(true, true, true),
    ADMIN(true, true, true),
    AUDITOR(false, false, true);

    private final boolean overrideConflicts;
    private final boolean manageOthers;
    private final boolean viewAll;

    ActorRole(boolean overrideConflicts, boolean manageOthers, boolean viewAll) {
        this.overrideConflicts = overrideConflicts;
        this.manageOthers = manageOthers;
        this.viewAll = viewAll;
    }

    public boolean canOverrideConflicts() {
        return overrideConflicts;
    }

    public boolean canManageOthers() {
        return manageOthers;
    }

    public boolean canViewAll() {
        return viewAll;
    }
}
