package com.friendpick.backend.support;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

import com.friendpick.backend.modules.question.domain.PublishWindow;
import com.friendpick.backend.modules.question.domain.Question;
import com.friendpick.backend.modules.question.domain.QuestionCategory;
import com.friendpick.backend.modules.question.domain.QuestionOrder;
import com.friendpick.backend.modules.question.domain.QuestionSet;
import com.friendpick.backend.modules.question.domain.QuestionType;

import org.springframework.test.util.ReflectionTestUtils;

/**
 * 영속화 없이 id 가 채워진 엔터티를 만드는 테스트 헬퍼.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static <T> T withId(T entity, UUID id) {
        ReflectionTestUtils.setField(entity, "id", id);
        return entity;
    }

    public static Question question(QuestionType type) {
        Question question = Question.create("question " + type, type, QuestionCategory.FRIENDSHIP, UUID.randomUUID());
        return withId(question, UUID.randomUUID());
    }

    public static List<Question> questions(QuestionType type, int count) {
        List<Question> questions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            questions.add(question(type));
        }
        return questions;
    }

    public static QuestionSet questionSet(List<UUID> questionIds, OffsetDateTime publishedAt, OffsetDateTime endAt) {
        List<QuestionOrder> orders = IntStream.range(0, questionIds.size())
                .mapToObj(index -> new QuestionOrder(questionIds.get(index), index))
                .toList();
        QuestionSet questionSet = QuestionSet.create(orders, new PublishWindow(publishedAt, endAt));
        return withId(questionSet, UUID.randomUUID());
    }

    public static List<UUID> randomIds(int count) {
        return IntStream.range(0, count).mapToObj(i -> UUID.randomUUID()).toList();
    }
}
