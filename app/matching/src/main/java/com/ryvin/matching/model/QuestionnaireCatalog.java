/*
 * どこで: Matching ドメインモデル
 * 何を: ある catalog_version 時点の有効な質問項目一覧を保持する
 * なぜ: スコアのキャッシュをバージョン単位で正確に無効化するため
 */
package com.ryvin.matching.model;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record QuestionnaireCatalog(long version, List<QuestionnaireField> fields) {

  public QuestionnaireCatalog {
    // 採点順序を id 順に固定し、入力順に依存しない結果にする
    fields =
        fields == null
            ? List.of()
            : fields.stream().sorted(Comparator.comparing(QuestionnaireField::id)).toList();
  }

  /** 引退していない項目を id 順で返す。 */
  public List<QuestionnaireField> activeFields() {
    return fields.stream().filter(field -> !field.retired()).toList();
  }

  public Optional<QuestionnaireField> findField(String fieldId) {
    return fields.stream().filter(field -> field.id().equals(fieldId)).findFirst();
  }

  public Map<String, QuestionnaireField> activeFieldsById() {
    final Map<String, QuestionnaireField> byId = new LinkedHashMap<>();
    for (QuestionnaireField field : activeFields()) {
      byId.put(field.id(), field);
    }
    return byId;
  }
}
