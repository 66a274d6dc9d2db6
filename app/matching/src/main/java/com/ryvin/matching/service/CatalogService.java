/*
 * どこで: Matching サービス層
 * 何を: 質問カタログを catalog_version 単位で読み込み、項目の追加と引退を行う
 * なぜ: 読み取りの多い参照データをプロセス内に保持しつつ、変更をバージョンで確実に検知するため
 */
package com.ryvin.matching.service;

import com.ryvin.matching.api.QuestionnaireFieldAlreadyExistsException;
import com.ryvin.matching.api.QuestionnaireFieldNotFoundException;
import com.ryvin.matching.api.ValidationException;
import com.ryvin.matching.model.QuestionnaireCatalog;
import com.ryvin.matching.model.QuestionnaireField;
import com.ryvin.matching.repository.QuestionnaireRepository;
import com.ryvin.matching.scoring.CatalogValidator;
import com.ryvin.matching.scoring.ScoreCache;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class CatalogService {

  private static final Logger logger = LoggerFactory.getLogger(CatalogService.class);

  private final QuestionnaireRepository questionnaireRepository;
  private final ScoreCache scoreCache;
  private final Clock clock;
  private final AtomicReference<QuestionnaireCatalog> cached = new AtomicReference<>();

  /**
   * 役割: 現在のカタログを返す。
   * 動作: DB の catalog_version が保持中のものと同じなら再利用し、異なれば全項目を読み直す。
   * 前提: 読み込んだ項目はすべて検証に通ること。通らなければ起動時の設定不備として例外にする。
   */
  public QuestionnaireCatalog currentCatalog() {
    final long version = questionnaireRepository.currentVersion();
    final QuestionnaireCatalog snapshot = cached.get();
    if (snapshot != null && snapshot.version() == version) {
      return snapshot;
    }
    final List<QuestionnaireField> fields = questionnaireRepository.findAllFields();
    fields.forEach(CatalogValidator::requireValid);
    final QuestionnaireCatalog loaded = new QuestionnaireCatalog(version, fields);
    cached.set(loaded);
    logger.info(
        "questionnaire catalog loaded version={} fields={} active={}",
        version,
        fields.size(),
        loaded.activeFields().size());
    return loaded;
  }

  @Transactional
  public QuestionnaireField registerField(QuestionnaireField draft) {
    if (draft == null) {
      throw new ValidationException("field is required");
    }
    final Optional<String> problem = CatalogValidator.findProblem(draft);
    if (problem.isPresent()) {
      throw new ValidationException(problem.get());
    }
    final Instant now = Instant.now(clock);
    final QuestionnaireField field =
        new QuestionnaireField(
            draft.id(),
            draft.category(),
            draft.weight(),
            draft.answerKind(),
            draft.comparisonRule(),
            draft.scaleMin(),
            draft.scaleMax(),
            draft.options(),
            draft.compatibilityTable(),
            draft.required(),
            draft.dealBreaker(),
            now,
            null);
    if (!questionnaireRepository.insertField(field)) {
      throw new QuestionnaireFieldAlreadyExistsException(field.id());
    }
    final long version = questionnaireRepository.bumpVersion(now);
    scoreCache.invalidateAll();
    logger.info("questionnaire field registered fieldId={} version={}", field.id(), version);
    return field;
  }

  /** 引退済みの項目に対しては何もせず現在の定義を返す。 */
  @Transactional
  public QuestionnaireField retireField(String fieldId) {
    if (fieldId == null || fieldId.isBlank()) {
      throw new ValidationException("fieldId is required");
    }
    final Instant now = Instant.now(clock);
    final Optional<QuestionnaireField> retired = questionnaireRepository.retireField(fieldId, now);
    if (retired.isEmpty()) {
      return questionnaireRepository
          .findField(fieldId)
          .orElseThrow(() -> new QuestionnaireFieldNotFoundException(fieldId));
    }
    final long version = questionnaireRepository.bumpVersion(now);
    scoreCache.invalidateAll();
    logger.info("questionnaire field retired fieldId={} version={}", fieldId, version);
    return retired.get();
  }
}
