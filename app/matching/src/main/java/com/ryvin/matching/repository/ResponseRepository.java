package com.ryvin.matching.repository;

import com.ryvin.matching.model.UserResponses;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;

public interface ResponseRepository {

  UserResponses findByUserId(String userId);

  /** 指定ユーザー全員の回答。回答が無いユーザーも空の UserResponses で返す。 */
  Map<String, UserResponses> findByUserIds(Collection<String> userIds);

  /** 正規化済みの回答を (user_id, field_id) 単位で上書き保存する。 */
  void upsertAll(String userId, Map<String, String> answers, Instant updatedAt);
}
