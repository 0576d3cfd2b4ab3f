package com.friendpick.backend.modules.relation.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.friendpick.backend.modules.relation.domain.MemberRelation;
import com.friendpick.backend.modules.relation.domain.RelationType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MemberRelationRepository extends JpaRepository<MemberRelation, UUID> {

    Optional<MemberRelation> findByFromIdAndToId(UUID fromId, UUID toId);

    boolean existsByFromIdAndToId(UUID fromId, UUID toId);

    boolean existsByFromIdAndToIdAndRelationType(UUID fromId, UUID toId, RelationType relationType);

    @Query("""
            select r.toId
              from MemberRelation r
             where r.fromId = :fromId
             order by r.createdAt asc
            """)
    List<UUID> findByFromId(@Param("fromId") UUID fromId);

    @Query("""
            select r.toId
              from MemberRelation r
             where r.fromId = :fromId
               and r.relationType = :relationType
             order by r.createdAt asc
            """)
    List<UUID> findByFromIdAndRelationType(
            @Param("fromId") UUID fromId,
            @Param("relationType") RelationType relationType
    );

    @Query(value = """
            SELECT r.to_id
              FROM member_relation r
             WHERE r.from_id = :fromId
               AND r.relation_type = :relationType
             ORDER BY random()
             LIMIT :limit
            """, nativeQuery = true)
    List<UUID> findRandomByFromIdAndRelationType(
            @Param("fromId") UUID fromId,
            @Param("relationType") String relationType,
            @Param("limit") int limit
    );

    default List<UUID> findFriendsByFromId(UUID fromId) {
        return findByFromIdAndRelationType(fromId, RelationType.FRIEND);
    }

    default List<UUID> findAccompanyByFromId(UUID fromId) {
        return findByFromIdAndRelationType(fromId, RelationType.ACCOMPANY);
    }

    default boolean isFriend(UUID fromId, UUID toId) {
        return existsByFromIdAndToIdAndRelationType(fromId, toId, RelationType.FRIEND);
    }

    default List<UUID> findRandomOfFriend(UUID memberId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return findRandomByFromIdAndRelationType(memberId, RelationType.FRIEND.name(), limit);
    }

    default List<UUID> findRandomOfAccompany(UUID memberId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return findRandomByFromIdAndRelationType(memberId, RelationType.ACCOMPANY.name(), limit);
    }
}
