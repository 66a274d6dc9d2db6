package com.ryvin.matching.scoring;

import com.ryvin.matching.model.UserProfile;

/** 年齢/性別/距離の相互条件。どちらか一方の条件を満たさないだけで不一致とする。 */
final class PreferenceMatcher {

  private static final double EARTH_RADIUS_KM = 6371.0088;

  private PreferenceMatcher() {}

  static boolean mutuallyCompatible(UserProfile seeker, UserProfile candidate) {
    return acceptsAge(seeker, candidate)
        && acceptsAge(candidate, seeker)
        && acceptsGender(seeker, candidate)
        && acceptsGender(candidate, seeker)
        && withinDistance(seeker, candidate);
  }

  private static boolean acceptsAge(UserProfile owner, UserProfile other) {
    if (other.age() == null) {
      // 年齢未申告の相手は範囲指定がある場合だけ除外する
      return owner.minAge() == null && owner.maxAge() == null;
    }
    if (owner.minAge() != null && other.age() < owner.minAge()) {
      return false;
    }
    return owner.maxAge() == null || other.age() <= owner.maxAge();
  }

  private static boolean acceptsGender(UserProfile owner, UserProfile other) {
    if (owner.seekingGenders().isEmpty()) {
      return true;
    }
    return other.gender() != null && owner.seekingGenders().contains(other.gender());
  }

  private static boolean withinDistance(UserProfile seeker, UserProfile candidate) {
    final Double limit = tighterLimit(seeker.maxDistanceKm(), candidate.maxDistanceKm());
    if (limit == null || !seeker.hasLocation() || !candidate.hasLocation()) {
      return true;
    }
    return distanceKm(seeker, candidate) <= limit;
  }

  private static Double tighterLimit(Double left, Double right) {
    if (left == null) {
      return right;
    }
    if (right == null) {
      return left;
    }
    return Math.min(left, right);
  }

  static double distanceKm(UserProfile a, UserProfile b) {
    final double lat1 = Math.toRadians(a.latitude());
    final double lat2 = Math.toRadians(b.latitude());
    final double deltaLat = lat2 - lat1;
    final double deltaLon = Math.toRadians(b.longitude() - a.longitude());
    final double h =
        Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
            + Math.cos(lat1) * Math.cos(lat2) * Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);
    return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(h)));
  }
}
