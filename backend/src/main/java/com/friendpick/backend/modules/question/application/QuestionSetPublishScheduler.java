package com.friendpick.backend.modules.question.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.friendpick.backend.global.error.ProblemException;
import com.friendpick.backend.modules.member.application.MemberService;
import com.friendpick.backend.modules.question.domain.QuestionSet;
import com.friendpick.backend.modules.question.domain.QuestionSheet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 다음 발행 세트를 미리 만들어 두고 전체 멤버의 질문지를 발급한다.
 * 세트 생성 실패는 재시도하지 않고 알림 로그로 남긴다.
 */
@Component
public class QuestionSetPublishScheduler {

    private static final Logger log = LoggerFactory.getLogger(QuestionSetPublishScheduler.class);
    private static final String BATCH_KIND = "QUESTION_SHEET";

    private final QuestionSetService questionSetService;
    private final QuestionSheetGenerationService questionSheetGenerationService;
    private final MemberService memberService;
    private final Clock clock;

    public QuestionSetPublishScheduler(
            QuestionSetService questionSetService,
            QuestionSheetGenerationService questionSheetGenerationService,
            MemberService memberService,
            Clock clock
    ) {
        this.questionSetService = questionSetService;
        this.questionSheetGenerationService = questionSheetGenerationService;
        this.memberService = memberService;
        this.clock = clock;
    }

    @Scheduled(cron = "${app.question-set.prepare-cron:0 */10 * * * *}")
    public void prepareNextQuestionSet() {
        Optional<QuestionSet> upcoming = questionSetService.getNextOperatingQuestionSet();
        Optional<QuestionSet> target = upcoming.isPresent() ? upcoming : createNextQuestionSet();
        target.ifPresent(this::distributeQuestionSheets);
    }

    Optional<QuestionSet> createNextQuestionSet() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        // 이미 끝난 세트에 이어 붙이면 과거 구간이 생기므로 그때는 현재 시각 기준으로 다시 잡는다
        QuestionSet latest = questionSetService.getLatestPublishedQuestionSet()
                .filter(set -> set.getEndAt().isAfter(now))
                .orElse(null);
        try {
            UUID questionSetId = questionSetService.createQuestionSet(latest);
            return questionSetService.getQuestionSetById(questionSetId);
        } catch (ProblemException ex) {
            log.error("[ALERT][Batch][QUESTION_SET] previousSetId={} errorCode={} detail={}",
                    latest != null ? latest.getId() : null,
                    ex.getCode(),
                    ex.getDetailMessage(),
                    ex);
            return Optional.empty();
        }
    }

    void distributeQuestionSheets(QuestionSet questionSet) {
        List<UUID> memberIds = memberService.getAllMemberIds();
        int issued = 0;
        int failed = 0;
        for (UUID memberId : memberIds) {
            try {
                List<QuestionSheet> sheets = questionSheetGenerationService.generateForMember(questionSet, memberId);
                issued += sheets.size();
            } catch (Exception ex) {
                failed++;
                String errorCode = ex instanceof ProblemException problem ? problem.getCode() : "SHEET_GENERATION_FAILED";
                log.warn("[ALERT][Batch][{}] attempt={} user={} questionSet={} errorCode={} detail={}",
                        BATCH_KIND,
                        1,
                        memberId,
                        questionSet.getId(),
                        errorCode,
                        ex.getMessage(),
                        ex);
            }
        }
        if (issued > 0 || failed > 0) {
            log.info("Issued {} question sheets of set {} to {} members ({} failed)",
                    issued, questionSet.getId(), memberIds.size() - failed, failed);
        }
    }
}
