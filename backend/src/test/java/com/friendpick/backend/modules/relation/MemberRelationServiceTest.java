package com.friendpick.backend.modules.relation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.friendpick.backend.global.error.ProblemException;
import com.friendpick.backend.modules.member.infrastructure.persistence.MemberRepository;
import com.friendpick.backend.modules.relation.application.MemberRelationService;
import com.friendpick.backend.modules.relation.domain.MemberRelation;
import com.friendpick.backend.modules.relation.domain.RelationType;
import com.friendpick.backend.modules.relation.infrastructure.persistence.MemberRelationRepository;
import com.friendpick.backend.support.TestEntities;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class MemberRelationServiceTest {

    @Mock
    private MemberRelationRepository memberRelationRepository;

    @Mock
    private MemberRepository memberRepository;

    @InjectMocks
    private MemberRelationService memberRelationService;

    private final UUID from = UUID.randomUUID();
    private final UUID to = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        lenient().when(memberRelationRepository.saveAndFlush(any(MemberRelation.class)))
                .thenAnswer(invocation -> TestEntities.withId(
                        invocation.getArgument(0, MemberRelation.class), UUID.randomUUID()));
    }

    @Test
    @DisplayName("새 관계는 ACCOMPANY 로 만들어진다")
    void createsAccompanyByDefault() {
        when(memberRepository.existsById(from)).thenReturn(true);
        when(memberRepository.existsById(to)).thenReturn(true);
        when(memberRelationRepository.existsByFromIdAndToId(from, to)).thenReturn(false);

        UUID relationId = memberRelationService.createRelation(from, to);

        ArgumentCaptor<MemberRelation> captor = ArgumentCaptor.forClass(MemberRelation.class);
        verify(memberRelationRepository).saveAndFlush(captor.capture());
        MemberRelation saved = captor.getValue();
        assertThat(relationId).isEqualTo(saved.getId());
        assertThat(saved.getFromId()).isEqualTo(from);
        assertThat(saved.getToId()).isEqualTo(to);
        assertThat(saved.getRelationType()).isEqualTo(RelationType.ACCOMPANY);
    }

    @Test
    @DisplayName("자기 자신과의 관계는 SELF_RELATION_NOT_ALLOWED")
    void rejectsSelfRelation() {
        assertProblem(() -> memberRelationService.createRelation(from, from), "SELF_RELATION_NOT_ALLOWED", 400);
        verifyNoInteractions(memberRelationRepository, memberRepository);
    }

    @Test
    @DisplayName("존재하지 않는 멤버와의 관계는 MEMBER_NOT_FOUND")
    void rejectsUnknownMember() {
        when(memberRepository.existsById(from)).thenReturn(true);
        when(memberRepository.existsById(to)).thenReturn(false);

        assertProblem(() -> memberRelationService.createRelation(from, to), "MEMBER_NOT_FOUND", 404);
        verify(memberRelationRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("이미 있는 (from, to) 쌍은 RELATION_ALREADY_EXISTS")
    void rejectsExistingPair() {
        when(memberRepository.existsById(from)).thenReturn(true);
        when(memberRepository.existsById(to)).thenReturn(true);
        when(memberRelationRepository.existsByFromIdAndToId(from, to)).thenReturn(true);

        assertProblem(() -> memberRelationService.createRelation(from, to), "RELATION_ALREADY_EXISTS", 409);
    }

    @Test
    @DisplayName("동시 생성으로 유니크 제약에 걸려도 RELATION_ALREADY_EXISTS")
    void translatesUniqueViolation() {
        when(memberRepository.existsById(from)).thenReturn(true);
        when(memberRepository.existsById(to)).thenReturn(true);
        when(memberRelationRepository.existsByFromIdAndToId(from, to)).thenReturn(false);
        doThrow(new DataIntegrityViolationException(
                        "could not execute statement",
                        new RuntimeException("duplicate key value violates unique constraint \"uq_member_relation_from_to\"")))
                .when(memberRelationRepository).saveAndFlush(any(MemberRelation.class));

        assertProblem(() -> memberRelationService.createRelation(from, to), "RELATION_ALREADY_EXISTS", 409);
    }

    @Test
    @DisplayName("관계가 없으면 FRIEND_NOT_FOUND")
    void promoteFailsWithoutRelation() {
        when(memberRelationRepository.findByFromIdAndToId(from, to)).thenReturn(Optional.empty());

        assertProblem(() -> memberRelationService.updateRelationToFriend(from, to), "FRIEND_NOT_FOUND", 404);
    }

    @Test
    @DisplayName("ACCOMPANY 는 FRIEND 로 승격되고 두 번째 승격은 ALREADY_FRIEND")
    void promotesOnlyOnce() {
        MemberRelation relation = TestEntities.withId(MemberRelation.create(from, to), UUID.randomUUID());
        when(memberRelationRepository.findByFromIdAndToId(from, to)).thenReturn(Optional.of(relation));
        when(memberRelationRepository.save(relation)).thenReturn(relation);

        UUID promotedId = memberRelationService.updateRelationToFriend(from, to);

        assertThat(promotedId).isEqualTo(relation.getId());
        assertThat(relation.getRelationType()).isEqualTo(RelationType.FRIEND);
        assertProblem(() -> memberRelationService.updateRelationToFriend(from, to), "ALREADY_FRIEND", 409);
        verify(memberRelationRepository, times(1)).save(relation);
    }

    @Test
    @DisplayName("가입한 멤버와 기존 멤버 사이에 양방향 기본 관계를 만든다")
    void createsDefaultRelationsBothWays() {
        UUID joined = UUID.randomUUID();
        UUID other = UUID.randomUUID();
        UUID related = UUID.randomUUID();
        when(memberRepository.existsById(joined)).thenReturn(true);
        when(memberRepository.findAllIds()).thenReturn(List.of(other, related, joined));
        when(memberRelationRepository.existsByFromIdAndToId(joined, other)).thenReturn(false);
        when(memberRelationRepository.existsByFromIdAndToId(other, joined)).thenReturn(false);
        when(memberRelationRepository.existsByFromIdAndToId(joined, related)).thenReturn(true);
        when(memberRelationRepository.existsByFromIdAndToId(related, joined)).thenReturn(false);

        int created = memberRelationService.createDefaultRelations(joined);

        assertThat(created).isEqualTo(3);
        ArgumentCaptor<MemberRelation> captor = ArgumentCaptor.forClass(MemberRelation.class);
        verify(memberRelationRepository, times(3)).saveAndFlush(captor.capture());
        assertThat(captor.getAllValues())
                .extracting(MemberRelation::getFromId, MemberRelation::getToId)
                .containsExactly(
                        tuple(joined, other),
                        tuple(other, joined),
                        tuple(related, joined));
        assertThat(captor.getAllValues()).allSatisfy(relation ->
                assertThat(relation.getRelationType()).isEqualTo(RelationType.ACCOMPANY));
    }

    @Test
    @DisplayName("후보 표본 추출은 저장소에 상한을 그대로 넘긴다")
    void delegatesRandomSampling() {
        List<UUID> friends = List.of(UUID.randomUUID());
        when(memberRelationRepository.findRandomOfFriend(from, 4)).thenReturn(friends);

        assertThat(memberRelationService.findRandomOfFriend(from, 4)).isEqualTo(friends);
    }

    private static void assertProblem(
            ThrowingCallable call, String code, int status) {
        assertThatThrownBy(call).isInstanceOfSatisfying(ProblemException.class, ex -> {
            assertThat(ex.getCode()).isEqualTo(code);
            assertThat(ex.getStatusCode().value()).isEqualTo(status);
        });
    }
}
