package com.ryvin.matching.service;

import com.ryvin.matching.api.ValidationException;
import com.ryvin.matching.model.QuestionnaireCatalog;
import com.ryvin.matching.model.QuestionnaireField;
import com.ryvin.matching.model.UserResponses;
import com.ryvin.matching.repository.ResponseRepository;
import com.ryvin.matching.scoring.AnswerNormalizer;
import com.ryvin.matching.scoring.ScoreCache;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@Service
@RequiredArgsConstructor
public class QuestionnaireService {

  private final CatalogService catalogService;
  private final ResponseRepository responseRepository;
  private final ScoreCache scoreCache;
  private final Clock clock;

  /**
   * 役割: 利用者の回答をまとめて保存する。
   * 動作: 全回答を先に検証し、1 件でも不正なら何も書き込まない。同じ項目への再回答は上書き。
   * 前提: 引退済み/未登録の項目への回答は ValidationError。
   */
  @Transactional
  public UserResponses submitAnswers(String userId, Map<String, String> answers) {
    requireUserId(userId);
    if (answers == null || answers.isEmpty()) {
      throw new ValidationException("answers must not be empty");
    }
    final QuestionnaireCatalog catalog = catalogService.currentCatalog();
    final Map<String, QuestionnaireField> active = catalog.activeFieldsById();
    final Map<String, String> normalized = new TreeMap<>();
    for (Map.Entry<String, String> answer : answers.entrySet()) {
      final QuestionnaireField field = active.get(answer.getKey());
      if (field == null) {
        final boolean retired = catalog.findField(answer.getKey()).isPresent();
        throw new ValidationException(
            (retired ? "field is retired: " : "unknown field: ") + answer.getKey());
      }
      normalized.put(field.id(), AnswerNormalizer.normalize(field, answer.getValue()));
    }
    final Instant now = Instant.now(clock);
    responseRepository.upsertAll(userId, normalized, now);
    invalidateScores(userId);
    return responseRepository.findByUserId(userId);
  }

  public UserResponses getAnswers(String userId) {
    requireUserId(userId);
    return responseRepository.findByUserId(userId);
  }

  /** 未回答の必須項目 id を id 順で返す。 */
  public List<String> missingRequiredFields(String userId) {
    requireUserId(userId);
    final UserResponses responses = responseRepository.findByUserId(userId);
    return catalogService.currentCatalog().activeFields().stream()
        .filter(QuestionnaireField::required)
        .map(QuestionnaireField::id)
        .filter(fieldId -> responses.answer(fieldId).isEmpty())
        .toList();
  }

  // コミット前に読んだ古い回答で再計算されたエントリも残さないよう、コミット後にもう一度破棄する
  private void invalidateScores(String userId) {
    scoreCache.invalidateUser(userId);
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              scoreCache.invalidateUser(userId);
            }
          });
    }
  }

  private void requireUserId(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new ValidationException("userId is required");
    }
  }
}
