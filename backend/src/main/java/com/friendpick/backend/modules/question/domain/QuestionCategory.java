package com.friendpick.backend.modules.question.domain;

public enum QuestionCategory {
    DATING,
    FRIENDSHIP,
    PERSONALITY,
    ENTERTAINMENT,
    FITNESS,
    APPEARANCE,
    WORK,
    HUMOR,
    OTHER
}
