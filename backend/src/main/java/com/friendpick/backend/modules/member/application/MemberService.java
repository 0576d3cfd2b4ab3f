package com.friendpick.backend.modules.member.application;

import java.util.List;
import java.util.UUID;

import com.friendpick.backend.global.error.ProblemException;
import com.friendpick.backend.modules.member.domain.Member;
import com.friendpick.backend.modules.member.infrastructure.persistence.MemberRepository;
import com.friendpick.backend.modules.relation.application.MemberRelationService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class MemberService {

    private static final Logger log = LoggerFactory.getLogger(MemberService.class);
    private static final int MAX_NAME_LENGTH = 50;

    private final MemberRepository memberRepository;
    private final MemberRelationService memberRelationService;

    public MemberService(MemberRepository memberRepository, MemberRelationService memberRelationService) {
        this.memberRepository = memberRepository;
        this.memberRelationService = memberRelationService;
    }

    /**
     * 가입 처리. 가입된 멤버와 기존 멤버 전원 사이에 기본(ACCOMPANY) 관계를 양방향으로 만든다.
     */
    public UUID register(String fullName) {
        String name = fullName == null ? "" : fullName.trim();
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_MEMBER_NAME");
        }
        Member member = new Member();
        member.setFullName(name);
        Member saved = memberRepository.save(member);

        int created = memberRelationService.createDefaultRelations(saved.getId());
        log.info("Registered member {} with {} default relations", saved.getId(), created);
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public Member getMember(UUID memberId) {
        return memberRepository.findById(memberId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public List<UUID> getAllMemberIds() {
        return memberRepository.findAllIds();
    }
}
