package com.friendpick.backend.modules.member.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.friendpick.backend.modules.member.domain.Member;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface MemberRepository extends JpaRepository<Member, UUID> {

    @Query("select m.id from Member m order by m.createdAt asc")
    List<UUID> findAllIds();
}
