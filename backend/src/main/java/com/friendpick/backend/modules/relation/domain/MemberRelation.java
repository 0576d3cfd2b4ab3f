package com.friendpick.backend.modules.relation.domain;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import com.friendpick.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * from 이 to 를 바라보는 단방향 관계. (from, to) 쌍마다 한 행만 존재한다.
 * ACCOMPANY 에서 FRIEND 로의 승격만 허용되고 강등은 없다.
 */
@Entity
@Table(
        name = "member_relation",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_member_relation_from_to",
                columnNames = {"from_id", "to_id"}
        )
)
public class MemberRelation extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "from_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID fromId;

    @Column(name = "to_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID toId;

    @Enumerated(EnumType.STRING)
    @Column(name = "relation_type", nullable = false, length = 16)
    private RelationType relationType;

    protected MemberRelation() {
    }

    private MemberRelation(UUID fromId, UUID toId, RelationType relationType) {
        this.fromId = fromId;
        this.toId = toId;
        this.relationType = relationType;
    }

    /**
     * Default relation created at signup or on first contact.
     */
    public static MemberRelation create(UUID fromId, UUID toId) {
        Objects.requireNonNull(fromId, "fromId");
        Objects.requireNonNull(toId, "toId");
        if (fromId.equals(toId)) {
            throw new IllegalArgumentException("member cannot relate to itself: " + fromId);
        }
        return new MemberRelation(fromId, toId, RelationType.ACCOMPANY);
    }

    public void promoteToFriend() {
        if (relationType.isFriend()) {
            throw new IllegalStateException("relation " + id + " is already FRIEND");
        }
        relationType = RelationType.FRIEND;
    }

    public UUID getId() {
        return id;
    }

    public UUID getFromId() {
        return fromId;
    }

    public UUID getToId() {
        return toId;
    }

    public RelationType getRelationType() {
        return relationType;
    }

    public OffsetDateTime getLastUpdatedAt() {
        return getUpdatedAt();
    }
}
