package com.friendpick.backend.modules.question.domain;

public enum PublishStatus {
    UPCOMING,
    ACTIVE,
    TERMINATED
}
