package com.friendpick.backend.modules.question.domain;

import java.time.OffsetDateTime;

public record PublishWindow(OffsetDateTime publishedAt, OffsetDateTime endAt) {

    public PublishWindow {
        if (publishedAt == null || endAt == null) {
            throw new IllegalArgumentException("publish window bounds are required");
        }
        if (!endAt.isAfter(publishedAt)) {
            throw new IllegalArgumentException("endAt must be after publishedAt");
        }
    }
}
