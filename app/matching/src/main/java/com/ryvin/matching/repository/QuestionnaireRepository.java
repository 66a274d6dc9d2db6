package com.ryvin.matching.repository;

import com.ryvin.matching.model.QuestionnaireField;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 質問カタログの永続化。項目は追記のみで、引退フラグ以外は書き換えない。
 */
public interface QuestionnaireRepository {

  long currentVersion();

  List<QuestionnaireField> findAllFields();

  Optional<QuestionnaireField> findField(String fieldId);

  /**
   * 役割: 新しい項目を登録する。
   * 動作: 同じ id が既にあれば何もせず false を返す。
   * 前提: field は検証済みであること。
   */
  boolean insertField(QuestionnaireField field);

  /** 引退済みでない項目に retired_at を設定する。対象が無ければ空。 */
  Optional<QuestionnaireField> retireField(String fieldId, Instant retiredAt);

  /** catalog_version を 1 進め、新しい値を返す。 */
  long bumpVersion(Instant updatedAt);
}
