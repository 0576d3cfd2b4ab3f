package com.friendpick.backend.modules.question.domain;

/**
 * FRIEND 질문은 친구 후보에서, ACCOMPANY 질문은 함께하는 멤버 후보에서 답을 고른다.
 */
public enum QuestionType {
    FRIEND,
    ACCOMPANY
}
