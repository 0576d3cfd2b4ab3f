package com.friendpick.backend.modules.question.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import com.friendpick.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * One question of a set, bound to the member who answers it and the members offered as answers.
 */
@Entity
@Table(
        name = "question_sheet",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_question_sheet_set_question_resolver",
                columnNames = {"question_set_id", "question_id", "resolver_id"}
        )
)
public class QuestionSheet extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "question_set_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID questionSetId;

    @Column(name = "question_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID questionId;

    @Column(name = "resolver_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID resolverId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "question_sheet_candidate", joinColumns = @JoinColumn(name = "question_sheet_id"))
    @OrderColumn(name = "candidate_order")
    @Column(name = "member_id", nullable = false, columnDefinition = "uuid")
    private List<UUID> candidates = new ArrayList<>();

    protected QuestionSheet() {
    }

    private QuestionSheet(UUID questionSetId, UUID questionId, UUID resolverId, List<UUID> candidates) {
        this.questionSetId = questionSetId;
        this.questionId = questionId;
        this.resolverId = resolverId;
        this.candidates = new ArrayList<>(candidates);
    }

    public static QuestionSheet create(UUID questionSetId, UUID questionId, UUID resolverId, List<UUID> candidates) {
        if (questionSetId == null || questionId == null || resolverId == null) {
            throw new IllegalArgumentException("questionSetId, questionId and resolverId are required");
        }
        if (candidates.contains(resolverId)) {
            throw new IllegalArgumentException("resolver " + resolverId + " cannot be a candidate of its own sheet");
        }
        return new QuestionSheet(questionSetId, questionId, resolverId, candidates);
    }

    public UUID getId() {
        return id;
    }

    public UUID getQuestionSetId() {
        return questionSetId;
    }

    public UUID getQuestionId() {
        return questionId;
    }

    public UUID getResolverId() {
        return resolverId;
    }

    public List<UUID> getCandidates() {
        return Collections.unmodifiableList(candidates);
    }
}
