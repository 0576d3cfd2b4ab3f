package com.friendpick.backend.modules.relation.domain;

public enum RelationType {
    FRIEND,
    ACCOMPANY;

    public boolean isFriend() {
        return this == FRIEND;
    }
}
