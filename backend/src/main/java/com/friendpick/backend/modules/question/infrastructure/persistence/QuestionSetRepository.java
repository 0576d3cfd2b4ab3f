package com.friendpick.backend.modules.question.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.friendpick.backend.modules.question.domain.QuestionSet;

import org.springframework.data.jpa.repository.JpaRepository;

public interface QuestionSetRepository extends JpaRepository<QuestionSet, UUID> {

    Optional<QuestionSet> findFirstByPublishedAtLessThanEqualAndEndAtAfterOrderByPublishedAtAsc(
            OffsetDateTime publishedAtBound,
            OffsetDateTime endAtBound
    );

    Optional<QuestionSet> findFirstByPublishedAtAfterOrderByPublishedAtAsc(OffsetDateTime now);

    Optional<QuestionSet> findTopByOrderByPublishedAtDesc();

    boolean existsByPublishedAt(OffsetDateTime publishedAt);

    /**
     * publishedAt <= now < endAt
     */
    default Optional<QuestionSet> findOperating(OffsetDateTime now) {
        return findFirstByPublishedAtLessThanEqualAndEndAtAfterOrderByPublishedAtAsc(now, now);
    }
}
