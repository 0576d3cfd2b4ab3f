package com.friendpick.backend.modules.question.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.IntStream;

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
 * 한 발행 구간 [publishedAt, endAt) 동안 노출되는 질문 묶음. 생성 이후 변경되지 않으며,
 * 상태는 저장하지 않고 현재 시각으로부터 계산한다.
 */
@Entity
@Table(
        name = "question_set",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_question_set_published_at",
                columnNames = "published_at"
        )
)
public class QuestionSet extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "question_set_item", joinColumns = @JoinColumn(name = "question_set_id"))
    @OrderColumn(name = "question_order")
    @Column(name = "question_id", nullable = false, columnDefinition = "uuid")
    private List<UUID> questionIds = new ArrayList<>();

    @Column(name = "published_at", nullable = false, updatable = false)
    private OffsetDateTime publishedAt;

    @Column(name = "end_at", nullable = false, updatable = false)
    private OffsetDateTime endAt;

    protected QuestionSet() {
    }

    private QuestionSet(List<UUID> questionIds, OffsetDateTime publishedAt, OffsetDateTime endAt) {
        this.questionIds = new ArrayList<>(questionIds);
        this.publishedAt = publishedAt;
        this.endAt = endAt;
    }

    /**
     * Orders must cover 0..n-1 exactly once and reference distinct questions.
     */
    public static QuestionSet create(List<QuestionOrder> questionOrders, PublishWindow window) {
        if (questionOrders == null || questionOrders.isEmpty()) {
            throw new IllegalArgumentException("question set requires at least one question");
        }
        List<QuestionOrder> sorted = questionOrders.stream()
                .sorted(Comparator.comparingInt(QuestionOrder::order))
                .toList();
        Set<UUID> seen = new HashSet<>();
        List<UUID> ids = new ArrayList<>(sorted.size());
        for (int index = 0; index < sorted.size(); index++) {
            QuestionOrder questionOrder = sorted.get(index);
            if (questionOrder.order() != index) {
                throw new IllegalArgumentException("question orders must be contiguous from 0, got " + questionOrder.order());
            }
            if (questionOrder.questionId() == null || !seen.add(questionOrder.questionId())) {
                throw new IllegalArgumentException("duplicate or missing question id at order " + index);
            }
            ids.add(questionOrder.questionId());
        }
        return new QuestionSet(ids, window.publishedAt(), window.endAt());
    }

    public PublishStatus statusAt(OffsetDateTime now) {
        if (now.isBefore(publishedAt)) {
            return PublishStatus.UPCOMING;
        }
        if (now.isBefore(endAt)) {
            return PublishStatus.ACTIVE;
        }
        return PublishStatus.TERMINATED;
    }

    public List<QuestionOrder> getQuestionOrders() {
        return IntStream.range(0, questionIds.size())
                .mapToObj(index -> new QuestionOrder(questionIds.get(index), index))
                .toList();
    }

    public UUID getId() {
        return id;
    }

    public List<UUID> getQuestionIds() {
        return Collections.unmodifiableList(questionIds);
    }

    public OffsetDateTime getPublishedAt() {
        return publishedAt;
    }

    public OffsetDateTime getEndAt() {
        return endAt;
    }
}
