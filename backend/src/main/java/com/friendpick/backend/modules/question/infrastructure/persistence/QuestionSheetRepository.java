package com.friendpick.backend.modules.question.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.friendpick.backend.modules.question.domain.QuestionSheet;

import org.springframework.data.jpa.repository.JpaRepository;

public interface QuestionSheetRepository extends JpaRepository<QuestionSheet, UUID> {

    List<QuestionSheet> findAllByQuestionSetIdAndResolverId(UUID questionSetId, UUID resolverId);

    long countByQuestionSetId(UUID questionSetId);
}
