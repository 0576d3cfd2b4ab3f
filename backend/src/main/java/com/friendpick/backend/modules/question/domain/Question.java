package com.friendpick.backend.modules.question.domain;

import java.util.UUID;

import com.friendpick.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "question")
public class Question extends AbstractTimestampedEntity {

    public static final int MAX_CONTENT_LENGTH = 200;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "content", nullable = false, updatable = false, length = MAX_CONTENT_LENGTH)
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 16)
    private QuestionType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, updatable = false, length = 32)
    private QuestionCategory category;

    @Column(name = "emoji_image_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID emojiImageId;

    protected Question() {
    }

    private Question(String content, QuestionType type, QuestionCategory category, UUID emojiImageId) {
        this.content = content;
        this.type = type;
        this.category = category;
        this.emojiImageId = emojiImageId;
    }

    public static Question create(String content, QuestionType type, QuestionCategory category, UUID emojiImageId) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("question content must not be blank");
        }
        String trimmed = content.trim();
        if (trimmed.length() > MAX_CONTENT_LENGTH) {
            throw new IllegalArgumentException("question content exceeds " + MAX_CONTENT_LENGTH + " characters");
        }
        if (type == null || category == null || emojiImageId == null) {
            throw new IllegalArgumentException("type, category and emojiImageId are required");
        }
        return new Question(trimmed, type, category, emojiImageId);
    }

    public UUID getId() {
        return id;
    }

    public String getContent() {
        return content;
    }

    public QuestionType getType() {
        return type;
    }

    public QuestionCategory getCategory() {
        return category;
    }

    public UUID getEmojiImageId() {
        return emojiImageId;
    }
}
