package com.friendpick.backend.modules.question.application;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.friendpick.backend.global.error.ProblemException;
import com.friendpick.backend.modules.question.domain.QuestionSet;
import com.friendpick.backend.modules.question.domain.QuestionSheet;
import com.friendpick.backend.modules.question.infrastructure.persistence.QuestionRepository;
import com.friendpick.backend.modules.question.infrastructure.persistence.QuestionSheetRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class QuestionSheetService {

    private static final Logger log = LoggerFactory.getLogger(QuestionSheetService.class);
    private static final String SHEET_UNIQUE_CONSTRAINT = "uq_question_sheet_set_question_resolver";

    private final QuestionRepository questionRepository;
    private final QuestionSheetRepository questionSheetRepository;

    public QuestionSheetService(
            QuestionRepository questionRepository,
            QuestionSheetRepository questionSheetRepository
    ) {
        this.questionRepository = questionRepository;
        this.questionSheetRepository = questionSheetRepository;
    }

    public List<QuestionSheet> getQuestionSheets(UUID resolverId, UUID questionSetId) {
        return questionSheetRepository.findAllByQuestionSetIdAndResolverId(questionSetId, resolverId);
    }

    /**
     * 세트의 질문마다 resolver 의 질문지를 만든다. FRIEND 질문에는 친구 후보를, ACCOMPANY 질문에는
     * 함께하는 멤버 후보를 붙인다. 결과는 FRIEND 질문지 다음 ACCOMPANY 질문지 순이며 각 그룹은 세트 순서를 따른다.
     *
     * <p>이미 발급된 (set, question, resolver) 조합은 건너뛰므로 같은 멤버에 대해 다시 호출하면 빈 목록을 돌려준다.
     * 타입을 확인할 수 없는 질문에는 질문지를 만들지 않는다. 반환값은 아직 저장되지 않은 상태다.</p>
     */
    public List<QuestionSheet> createQuestionSheetsForMember(
            QuestionSet questionSet,
            List<UUID> candidatesOfFriend,
            List<UUID> candidatesOfAccompany,
            UUID resolver
    ) {
        List<UUID> questionIds = questionSet.getQuestionIds();
        Set<UUID> friendQuestionIds = new HashSet<>(questionRepository.findFriendQuestionsByIds(questionIds));
        Set<UUID> accompanyQuestionIds = new HashSet<>(questionRepository.findAccompanyQuestionsByIds(questionIds));

        Set<UUID> issuedQuestionIds = new HashSet<>();
        for (QuestionSheet existing : questionSheetRepository
                .findAllByQuestionSetIdAndResolverId(questionSet.getId(), resolver)) {
            issuedQuestionIds.add(existing.getQuestionId());
        }
        if (!issuedQuestionIds.isEmpty()) {
            log.debug("Resolver {} already holds {} sheets of question set {}",
                    resolver, issuedQuestionIds.size(), questionSet.getId());
        }

        List<UUID> friendPool = toCandidatePool(candidatesOfFriend, resolver);
        List<UUID> accompanyPool = toCandidatePool(candidatesOfAccompany, resolver);

        List<QuestionSheet> sheets = new ArrayList<>(questionIds.size());
        for (UUID questionId : questionIds) {
            if (friendQuestionIds.contains(questionId) && !issuedQuestionIds.contains(questionId)) {
                sheets.add(QuestionSheet.create(questionSet.getId(), questionId, resolver, friendPool));
            }
        }
        for (UUID questionId : questionIds) {
            if (accompanyQuestionIds.contains(questionId) && !issuedQuestionIds.contains(questionId)) {
                sheets.add(QuestionSheet.create(questionSet.getId(), questionId, resolver, accompanyPool));
            }
        }
        return sheets;
    }

    @Transactional
    public List<QuestionSheet> saveQuestionSheets(List<QuestionSheet> questionSheets) {
        if (questionSheets.isEmpty()) {
            return List.of();
        }
        try {
            return questionSheetRepository.saveAllAndFlush(questionSheets);
        } catch (DataIntegrityViolationException ex) {
            throw ProblemException.translateConstraint(ex, SHEET_UNIQUE_CONSTRAINT, "QUESTION_SHEET_DUPLICATED");
        }
    }

    private List<UUID> toCandidatePool(List<UUID> candidates, UUID resolver) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        Set<UUID> pool = new LinkedHashSet<>();
        for (UUID candidate : candidates) {
            if (candidate != null && !candidate.equals(resolver)) {
                pool.add(candidate);
            }
        }
        return List.copyOf(pool);
    }
}
