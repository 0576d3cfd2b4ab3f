package com.friendpick.backend.modules.question.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.friendpick.backend.modules.question.domain.Question;
import com.friendpick.backend.modules.question.domain.QuestionType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface QuestionRepository extends JpaRepository<Question, UUID> {

    long countByType(QuestionType type);

    long countByIdIn(Collection<UUID> ids);

    @Query(value = """
            SELECT q.*
              FROM question q
             WHERE q.type = :type
             ORDER BY random()
             LIMIT :limit
            """, nativeQuery = true)
    List<Question> findRandomByType(@Param("type") String type, @Param("limit") int limit);

    @Query(value = """
            SELECT q.*
              FROM question q
             WHERE q.type = :type
               AND q.id NOT IN (:excludedIds)
             ORDER BY random()
             LIMIT :limit
            """, nativeQuery = true)
    List<Question> findRandomByTypeExcluding(
            @Param("type") String type,
            @Param("excludedIds") Collection<UUID> excludedIds,
            @Param("limit") int limit
    );

    @Query("""
            select q.id
              from Question q
             where q.id in :ids
               and q.type = :type
            """)
    List<UUID> findIdsByIdInAndType(@Param("ids") Collection<UUID> ids, @Param("type") QuestionType type);

    /**
     * Uniform sample of {@code limit} questions of the type, skipping {@code excludedIds}.
     */
    default List<Question> findRandomQuestions(QuestionType type, Collection<UUID> excludedIds, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        if (excludedIds == null || excludedIds.isEmpty()) {
            return findRandomByType(type.name(), limit);
        }
        return findRandomByTypeExcluding(type.name(), excludedIds, limit);
    }

    default List<UUID> findFriendQuestionsByIds(Collection<UUID> ids) {
        return findIdsByIdInAndType(ids, QuestionType.FRIEND);
    }

    default List<UUID> findAccompanyQuestionsByIds(Collection<UUID> ids) {
        return findIdsByIdInAndType(ids, QuestionType.ACCOMPANY);
    }
}
