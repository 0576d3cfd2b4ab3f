package com.friendpick.backend.modules.question.application;

import java.util.Optional;
import java.util.UUID;

import com.friendpick.backend.global.error.ProblemException;
import com.friendpick.backend.modules.question.domain.Question;
import com.friendpick.backend.modules.question.domain.QuestionCategory;
import com.friendpick.backend.modules.question.domain.QuestionType;
import com.friendpick.backend.modules.question.infrastructure.persistence.QuestionRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 질문 카탈로그. 질문은 한 번 만들어지면 수정되지 않는다.
 */
@Service
@Transactional
public class QuestionService {

    private final QuestionRepository questionRepository;

    public QuestionService(QuestionRepository questionRepository) {
        this.questionRepository = questionRepository;
    }

    public UUID createQuestion(String content, QuestionType type, QuestionCategory category, UUID emojiImageId) {
        Question question;
        try {
            question = Question.create(content, type, category, emojiImageId);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_QUESTION", ex.getMessage(), ex);
        }
        return questionRepository.save(question).getId();
    }

    @Transactional(readOnly = true)
    public Optional<Question> getQuestionById(UUID questionId) {
        return questionRepository.findById(questionId);
    }
}
