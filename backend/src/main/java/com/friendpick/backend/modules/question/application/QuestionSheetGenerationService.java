package com.friendpick.backend.modules.question.application;

import java.util.List;
import java.util.UUID;

import com.friendpick.backend.global.error.ProblemException;
import com.friendpick.backend.modules.question.config.QuestionSheetProperties;
import com.friendpick.backend.modules.question.domain.QuestionSet;
import com.friendpick.backend.modules.question.domain.QuestionSheet;
import com.friendpick.backend.modules.relation.application.MemberRelationService;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 멤버 한 명의 질문지 생성: 관계에서 후보를 표본 추출하고 세트를 질문지로 펼친 뒤 저장한다.
 */
@Service
@Transactional
public class QuestionSheetGenerationService {

    private final QuestionSetService questionSetService;
    private final QuestionSheetService questionSheetService;
    private final MemberRelationService memberRelationService;
    private final QuestionSheetProperties properties;

    public QuestionSheetGenerationService(
            QuestionSetService questionSetService,
            QuestionSheetService questionSheetService,
            MemberRelationService memberRelationService,
            QuestionSheetProperties properties
    ) {
        this.questionSetService = questionSetService;
        this.questionSheetService = questionSheetService;
        this.memberRelationService = memberRelationService;
        this.properties = properties;
    }

    public List<QuestionSheet> generateForMember(QuestionSet questionSet, UUID resolverId) {
        List<UUID> candidatesOfFriend = memberRelationService.findRandomOfFriend(
                resolverId, properties.friendCandidateLimit());
        List<UUID> candidatesOfAccompany = memberRelationService.findRandomOfAccompany(
                resolverId, properties.accompanyCandidateLimit());

        List<QuestionSheet> sheets = questionSheetService.createQuestionSheetsForMember(
                questionSet,
                candidatesOfFriend,
                candidatesOfAccompany,
                resolverId
        );
        return questionSheetService.saveQuestionSheets(sheets);
    }

    /**
     * 현재 운영중인 세트의 질문지를 돌려주고, 아직 발급되지 않았다면 먼저 만든다.
     */
    public List<QuestionSheet> getOrCreateQuestionSheets(UUID resolverId) {
        QuestionSet operating = questionSetService.getOperatingQuestionSet()
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "QUESTION_SET_NOT_FOUND"));
        List<QuestionSheet> existing = questionSheetService.getQuestionSheets(resolverId, operating.getId());
        if (!existing.isEmpty()) {
            return existing;
        }
        return generateForMember(operating, resolverId);
    }
}
