package com.friendpick.backend.modules.question.config;

import jakarta.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 질문지 후보 수 상한 (app.question-sheet.*).
 */
@Validated
@ConfigurationProperties(prefix = "app.question-sheet")
public record QuestionSheetProperties(
        @Min(0) int friendCandidateLimit,
        @Min(0) int accompanyCandidateLimit
) {
}
