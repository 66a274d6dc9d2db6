package com.ryvin.matching.service;

import com.ryvin.matching.model.UserProfile;
import java.util.List;
import java.util.Optional;

/**
 * 認証状態と相互の希望条件を提供するプロフィールサービスとの境界。
 */
public interface ProfileDirectory {

  /** 存在しないユーザーは空。通信失敗は {@link ProfileIntegrationException}。 */
  Optional<UserProfile> findProfile(String userId);

  /** userId に対する候補プール。件数は limit まで。 */
  List<UserProfile> findCandidatePool(String userId, int limit);
}
