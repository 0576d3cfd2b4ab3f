package com.friendpick.backend.modules.member;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;

import com.friendpick.backend.global.error.ProblemException;
import com.friendpick.backend.modules.member.application.MemberService;
import com.friendpick.backend.modules.member.domain.Member;
import com.friendpick.backend.modules.member.infrastructure.persistence.MemberRepository;
import com.friendpick.backend.modules.relation.application.MemberRelationService;
import com.friendpick.backend.support.TestEntities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MemberServiceTest {

    @Mock
    private MemberRepository memberRepository;

    @Mock
    private MemberRelationService memberRelationService;

    @InjectMocks
    private MemberService memberService;

    @Test
    @DisplayName("가입하면 이름을 정리해 저장하고 기본 관계를 만든다")
    void registerCreatesDefaultRelations() {
        UUID memberId = UUID.randomUUID();
        when(memberRepository.save(any(Member.class)))
                .thenAnswer(invocation -> TestEntities.withId(invocation.getArgument(0, Member.class), memberId));
        when(memberRelationService.createDefaultRelations(memberId)).thenReturn(4);

        UUID registered = memberService.register("  김도조  ");

        assertThat(registered).isEqualTo(memberId);
        ArgumentCaptor<Member> captor = ArgumentCaptor.forClass(Member.class);
        verify(memberRepository).save(captor.capture());
        assertThat(captor.getValue().getFullName()).isEqualTo("김도조");
        verify(memberRelationService).createDefaultRelations(memberId);
    }

    @Test
    @DisplayName("빈 이름은 INVALID_MEMBER_NAME")
    void rejectsBlankName() {
        assertThatThrownBy(() -> memberService.register("   "))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_MEMBER_NAME"));
        verifyNoInteractions(memberRepository, memberRelationService);
    }

    @Test
    @DisplayName("없는 멤버 조회는 MEMBER_NOT_FOUND")
    void getMemberFailsWhenMissing() {
        UUID memberId = UUID.randomUUID();
        when(memberRepository.findById(memberId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> memberService.getMember(memberId))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("MEMBER_NOT_FOUND");
                    assertThat(ex.getStatusCode().value()).isEqualTo(404);
                });
    }
}
