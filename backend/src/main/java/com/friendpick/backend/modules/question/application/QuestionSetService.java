package com.friendpick.backend.modules.question.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.stream.IntStream;

import com.friendpick.backend.global.error.ProblemException;
import com.friendpick.backend.modules.question.config.QuestionSetProperties;
import com.friendpick.backend.modules.question.domain.PublishSchedule;
import com.friendpick.backend.modules.question.domain.PublishStatus;
import com.friendpick.backend.modules.question.domain.PublishWindow;
import com.friendpick.backend.modules.question.domain.Question;
import com.friendpick.backend.modules.question.domain.QuestionOrder;
import com.friendpick.backend.modules.question.domain.QuestionSet;
import com.friendpick.backend.modules.question.domain.QuestionType;
import com.friendpick.backend.modules.question.infrastructure.persistence.QuestionRepository;
import com.friendpick.backend.modules.question.infrastructure.persistence.QuestionSetRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds question sets for the next publish window and answers the set lookups.
 */
@Service
@Transactional(readOnly = true)
public class QuestionSetService {

    private static final Logger log = LoggerFactory.getLogger(QuestionSetService.class);
    private static final String PUBLISHED_AT_UNIQUE_CONSTRAINT = "uq_question_set_published_at";

    private final QuestionRepository questionRepository;
    private final QuestionSetRepository questionSetRepository;
    private final QuestionSetProperties properties;
    private final PublishSchedule publishSchedule;
    private final Clock clock;
    private final Random random;

    public QuestionSetService(
            QuestionRepository questionRepository,
            QuestionSetRepository questionSetRepository,
            QuestionSetProperties properties,
            Clock clock,
            Random random
    ) {
        this.questionRepository = questionRepository;
        this.questionSetRepository = questionSetRepository;
        this.properties = properties;
        this.publishSchedule = properties.toSchedule();
        this.clock = clock;
        this.random = random;
    }

    // 현재 운영중인 QuestionSet
    public Optional<QuestionSet> getOperatingQuestionSet() {
        Optional<QuestionSet> operating = questionSetRepository.findOperating(OffsetDateTime.now(clock));
        if (operating.isEmpty()) {
            log.warn("No operating question set at {}", OffsetDateTime.now(clock));
        }
        return operating;
    }

    // 발행 대기중인 가장 가까운 QuestionSet
    public Optional<QuestionSet> getNextOperatingQuestionSet() {
        return questionSetRepository.findFirstByPublishedAtAfterOrderByPublishedAtAsc(OffsetDateTime.now(clock));
    }

    public Optional<QuestionSet> getLatestPublishedQuestionSet() {
        return questionSetRepository.findTopByOrderByPublishedAtDesc();
    }

    public Optional<QuestionSet> getQuestionSetById(UUID questionSetId) {
        return questionSetRepository.findById(questionSetId);
    }

    public PublishStatus currentStatus(QuestionSet questionSet) {
        return questionSet.statusAt(OffsetDateTime.now(clock));
    }

    /**
     * 비율에 맞춰 FRIEND / ACCOMPANY 질문을 무작위로 뽑아 다음 발행 구간의 세트를 만든다.
     * 직전 세트의 질문은 제외하며, 질문이 모자라면 QUESTION_LACK_FOR_CREATE_QUESTION_SET 으로 실패한다.
     */
    @Transactional
    public UUID createQuestionSet(QuestionSet latestQuestionSet) {
        int friendQuestionSize = properties.friendQuestionCount();
        int accompanyQuestionSize = properties.accompanyQuestionCount();
        Set<UUID> excludedQuestionIds = latestQuestionSet != null
                ? new LinkedHashSet<>(latestQuestionSet.getQuestionIds())
                : Set.of();

        List<Question> friendQuestions = questionRepository.findRandomQuestions(
                QuestionType.FRIEND, excludedQuestionIds, friendQuestionSize);
        List<Question> accompanyQuestions = questionRepository.findRandomQuestions(
                QuestionType.ACCOMPANY, excludedQuestionIds, accompanyQuestionSize);

        List<Question> questions = new ArrayList<>(friendQuestions.size() + accompanyQuestions.size());
        questions.addAll(friendQuestions);
        questions.addAll(accompanyQuestions);
        Collections.shuffle(questions, random);

        long distinct = questions.stream().map(Question::getId).distinct().count();
        if (questions.size() != properties.size() || distinct != properties.size()) {
            log.error("Not enough questions left to build a question set. requested={} fetched={} "
                            + "friendExpected={} friendFetched={} friendTotal={} "
                            + "accompanyExpected={} accompanyFetched={} accompanyTotal={} "
                            + "previousSetId={} excludedQuestionIds={}",
                    properties.size(),
                    questions.size(),
                    friendQuestionSize,
                    friendQuestions.size(),
                    questionRepository.countByType(QuestionType.FRIEND),
                    accompanyQuestionSize,
                    accompanyQuestions.size(),
                    questionRepository.countByType(QuestionType.ACCOMPANY),
                    latestQuestionSet != null ? latestQuestionSet.getId() : null,
                    excludedQuestionIds);
            throw new ProblemException(
                    HttpStatus.CONFLICT,
                    "QUESTION_LACK_FOR_CREATE_QUESTION_SET",
                    "requested %d questions but only %d were available".formatted(properties.size(), questions.size())
            );
        }

        List<QuestionOrder> questionOrders = IntStream.range(0, questions.size())
                .mapToObj(index -> new QuestionOrder(questions.get(index).getId(), index))
                .toList();

        // 직전 세트가 있으면 그 종료 시각에 바로 이어서 발행한다
        PublishWindow window = publishSchedule.windowAfter(latestQuestionSet, OffsetDateTime.now(clock));
        ensureWindowAvailable(window.publishedAt());

        QuestionSet saved = saveQuestionSet(QuestionSet.create(questionOrders, window));
        log.info("Created question set {} for [{}, {}) friend={} accompany={}",
                saved.getId(), window.publishedAt(), window.endAt(), friendQuestions.size(), accompanyQuestions.size());
        return saved.getId();
    }

    /**
     * 운영자가 질문과 발행 구간을 직접 지정하는 경우.
     */
    @Transactional
    public QuestionSet createQuestionSet(List<UUID> questionIds, OffsetDateTime publishedAt, OffsetDateTime endAt) {
        if (questionIds == null || questionIds.size() != properties.size()) {
            throw invalidQuestionSet("questions size for QuestionSet must be " + properties.size());
        }
        if (questionIds.stream().anyMatch(Objects::isNull)
                || new HashSet<>(questionIds).size() != questionIds.size()) {
            throw invalidQuestionSet("question ids must be present and unique");
        }
        if (publishedAt == null || !publishedAt.isAfter(OffsetDateTime.now(clock))) {
            throw invalidQuestionSet("publishedAt must be in the future");
        }
        if (endAt == null || !endAt.isAfter(publishedAt)) {
            throw invalidQuestionSet("endAt must be later than publishedAt");
        }
        if (questionRepository.countByIdIn(questionIds) != questionIds.size()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "QUESTION_NOT_FOUND",
                    "some question ids do not exist in the catalog");
        }
        ensureWindowAvailable(publishedAt);

        List<QuestionOrder> questionOrders = IntStream.range(0, questionIds.size())
                .mapToObj(index -> new QuestionOrder(questionIds.get(index), index))
                .toList();
        return saveQuestionSet(QuestionSet.create(questionOrders, new PublishWindow(publishedAt, endAt)));
    }

    private ProblemException invalidQuestionSet(String detail) {
        return new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_QUESTION_SET", detail);
    }

    private void ensureWindowAvailable(OffsetDateTime publishedAt) {
        if (questionSetRepository.existsByPublishedAt(publishedAt)) {
            throw new ProblemException(HttpStatus.CONFLICT, "QUESTION_SET_WINDOW_CONFLICT",
                    "a question set is already published at " + publishedAt);
        }
    }

    private QuestionSet saveQuestionSet(QuestionSet questionSet) {
        try {
            return questionSetRepository.saveAndFlush(questionSet);
        } catch (DataIntegrityViolationException ex) {
            throw ProblemException.translateConstraint(ex, PUBLISHED_AT_UNIQUE_CONSTRAINT, "QUESTION_SET_WINDOW_CONFLICT");
        }
    }
}
