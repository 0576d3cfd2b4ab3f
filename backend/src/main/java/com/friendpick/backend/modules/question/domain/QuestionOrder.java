package com.friendpick.backend.modules.question.domain;

import java.util.UUID;

/**
 * Position of a question inside a set, 0-based.
 */
public record QuestionOrder(UUID questionId, int order) {
}
