package com.fleet.moderation.core.model;

/**
 * A participant's role within a scope.
 */
public enum MemberRole {
    CREATOR,
    ADMIN,
    MEMBER,
    RESTRICTED,
    BANNED,
    LEFT;

    public boolean isAdministrator() {
        return this == CREATOR || this == ADMIN;
    }
}
