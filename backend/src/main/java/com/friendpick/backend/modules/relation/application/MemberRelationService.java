package com.friendpick.backend.modules.relation.application;

import java.util.List;
import java.util.UUID;

import com.friendpick.backend.global.error.ProblemException;
import com.friendpick.backend.modules.member.infrastructure.persistence.MemberRepository;
import com.friendpick.backend.modules.relation.domain.MemberRelation;
import com.friendpick.backend.modules.relation.infrastructure.persistence.MemberRelationRepository;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class MemberRelationService {

    private static final String RELATION_UNIQUE_CONSTRAINT = "uq_member_relation_from_to";

    private final MemberRelationRepository memberRelationRepository;
    private final MemberRepository memberRepository;

    public MemberRelationService(
            MemberRelationRepository memberRelationRepository,
            MemberRepository memberRepository
    ) {
        this.memberRelationRepository = memberRelationRepository;
        this.memberRepository = memberRepository;
    }

    @Transactional(readOnly = true)
    public List<UUID> getAllRelationShip(UUID fromId) {
        return memberRelationRepository.findByFromId(fromId);
    }

    @Transactional(readOnly = true)
    public List<UUID> getFriendRelationIds(UUID fromId) {
        return memberRelationRepository.findFriendsByFromId(fromId);
    }

    @Transactional(readOnly = true)
    public List<UUID> getAccompanyRelationIds(UUID fromId) {
        return memberRelationRepository.findAccompanyByFromId(fromId);
    }

    @Transactional(readOnly = true)
    public boolean isFriend(UUID fromId, UUID toId) {
        return memberRelationRepository.isFriend(fromId, toId);
    }

    /**
     * Up to {@code limit} FRIEND targets of the member, in random order.
     */
    @Transactional(readOnly = true)
    public List<UUID> findRandomOfFriend(UUID memberId, int limit) {
        return memberRelationRepository.findRandomOfFriend(memberId, limit);
    }

    /**
     * Up to {@code limit} ACCOMPANY targets of the member, in random order.
     */
    @Transactional(readOnly = true)
    public List<UUID> findRandomOfAccompany(UUID memberId, int limit) {
        return memberRelationRepository.findRandomOfAccompany(memberId, limit);
    }

    /**
     * 기본 관계(ACCOMPANY)를 만든다. 자기 자신, 없는 멤버, 이미 존재하는 쌍은 거절한다.
     */
    public UUID createRelation(UUID fromId, UUID toId) {
        if (fromId == null || toId == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "MEMBER_ID_REQUIRED");
        }
        if (fromId.equals(toId)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "SELF_RELATION_NOT_ALLOWED");
        }
        ensureMemberExists(fromId);
        ensureMemberExists(toId);
        if (memberRelationRepository.existsByFromIdAndToId(fromId, toId)) {
            throw new ProblemException(HttpStatus.CONFLICT, "RELATION_ALREADY_EXISTS");
        }
        return saveRelation(MemberRelation.create(fromId, toId)).getId();
    }

    /**
     * 새 멤버와 기존 멤버 전원 사이에 양방향 ACCOMPANY 관계를 만든다. 이미 있는 쌍은 건너뛴다.
     *
     * @return number of relation rows created
     */
    public int createDefaultRelations(UUID memberId) {
        ensureMemberExists(memberId);
        int created = 0;
        for (UUID otherId : memberRepository.findAllIds()) {
            if (otherId.equals(memberId)) {
                continue;
            }
            if (!memberRelationRepository.existsByFromIdAndToId(memberId, otherId)) {
                saveRelation(MemberRelation.create(memberId, otherId));
                created++;
            }
            if (!memberRelationRepository.existsByFromIdAndToId(otherId, memberId)) {
                saveRelation(MemberRelation.create(otherId, memberId));
                created++;
            }
        }
        return created;
    }

    /**
     * ACCOMPANY -> FRIEND 승격. 이미 FRIEND 인 관계에 대한 재요청은 호출자 버그로 보고 ALREADY_FRIEND 로 실패한다.
     */
    public UUID updateRelationToFriend(UUID fromId, UUID toId) {
        MemberRelation relation = memberRelationRepository.findByFromIdAndToId(fromId, toId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "FRIEND_NOT_FOUND"));
        if (relation.getRelationType().isFriend()) {
            throw new ProblemException(HttpStatus.CONFLICT, "ALREADY_FRIEND");
        }
        relation.promoteToFriend();
        return memberRelationRepository.save(relation).getId();
    }

    private void ensureMemberExists(UUID memberId) {
        if (!memberRepository.existsById(memberId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND", "member " + memberId);
        }
    }

    private MemberRelation saveRelation(MemberRelation relation) {
        try {
            return memberRelationRepository.saveAndFlush(relation);
        } catch (DataIntegrityViolationException ex) {
            throw ProblemException.translateConstraint(ex, RELATION_UNIQUE_CONSTRAINT, "RELATION_ALREADY_EXISTS");
        }
    }
}
