package com.ryvin.matching.service;

import com.ryvin.matching.config.ProfileClientProperties;
import com.ryvin.matching.model.UserProfile;
import com.ryvin.matching.service.dto.ProfileCandidatesResponse;
import com.ryvin.matching.service.dto.ProfileResponse;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@RequiredArgsConstructor
public class HttpProfileDirectory implements ProfileDirectory {

  private static final String STATUS_ACTIVE = "ACTIVE";

  private final RestClient profileRestClient;
  private final ProfileClientProperties properties;
  private final MatchingMetrics metrics;

  @Override
  public Optional<UserProfile> findProfile(String userId) {
    validateUserId(userId);
    try {
      final ProfileResponse response =
          profileRestClient
              .get()
              .uri(properties.getProfilePath(), userId)
              .header(properties.internalApiHeaderName(), properties.internalApiToken())
              .retrieve()
              .body(ProfileResponse.class);
      return Optional.of(toProfile(requireValid(response)));
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        return Optional.empty();
      }
      throw record(mapResponseException(ex));
    } catch (ResourceAccessException ex) {
      throw record(mapResourceException(ex));
    } catch (ProfileIntegrationException ex) {
      throw record(ex);
    } catch (RuntimeException ex) {
      throw record(
          new ProfileIntegrationException(
              ProfileIntegrationException.Reason.INVALID_RESPONSE,
              "profile response parse failed",
              ex));
    }
  }

  @Override
  public List<UserProfile> findCandidatePool(String userId, int limit) {
    validateUserId(userId);
    if (limit <= 0) {
      return List.of();
    }
    try {
      final ProfileCandidatesResponse response =
          profileRestClient
              .get()
              .uri(properties.candidatesPath(), userId, limit)
              .header(properties.internalApiHeaderName(), properties.internalApiToken())
              .retrieve()
              .body(ProfileCandidatesResponse.class);
      if (response == null) {
        throw new ProfileIntegrationException(
            ProfileIntegrationException.Reason.INVALID_RESPONSE, "profile candidates missing");
      }
      final List<UserProfile> pool = new ArrayList<>();
      for (ProfileResponse candidate : response.candidates()) {
        pool.add(toProfile(requireValid(candidate)));
      }
      return pool;
    } catch (RestClientResponseException ex) {
      throw record(mapResponseException(ex));
    } catch (ResourceAccessException ex) {
      throw record(mapResourceException(ex));
    } catch (ProfileIntegrationException ex) {
      throw record(ex);
    } catch (RuntimeException ex) {
      throw record(
          new ProfileIntegrationException(
              ProfileIntegrationException.Reason.INVALID_RESPONSE,
              "profile candidates parse failed",
              ex));
    }
  }

  private void validateUserId(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
  }

  private ProfileResponse requireValid(ProfileResponse response) {
    if (response == null || response.userId() == null || response.userId().isBlank()) {
      throw new ProfileIntegrationException(
          ProfileIntegrationException.Reason.INVALID_RESPONSE, "profile response is invalid");
    }
    return response;
  }

  private UserProfile toProfile(ProfileResponse response) {
    return new UserProfile(
        response.userId(),
        Boolean.TRUE.equals(response.verified()),
        response.status() == null || STATUS_ACTIVE.equalsIgnoreCase(response.status()),
        response.age(),
        response.gender(),
        Set.copyOf(response.seekingGenders()),
        response.minAge(),
        response.maxAge(),
        response.maxDistanceKm(),
        response.latitude(),
        response.longitude());
  }

  private ProfileIntegrationException record(ProfileIntegrationException ex) {
    metrics.recordProfileError(ex.reason().name().toLowerCase(Locale.ROOT));
    return ex;
  }

  private ProfileIntegrationException mapResponseException(RestClientResponseException ex) {
    if (ex.getStatusCode().value() == 401) {
      return new ProfileIntegrationException(
          ProfileIntegrationException.Reason.UNAUTHORIZED, "profile rejected internal auth", ex);
    }
    if (ex.getStatusCode().value() == 403) {
      return new ProfileIntegrationException(
          ProfileIntegrationException.Reason.FORBIDDEN, "profile denied access", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new ProfileIntegrationException(
          ProfileIntegrationException.Reason.BAD_GATEWAY, "profile server error", ex);
    }
    return new ProfileIntegrationException(
        ProfileIntegrationException.Reason.BAD_GATEWAY, "profile request failed", ex);
  }

  private ProfileIntegrationException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      return new ProfileIntegrationException(
          ProfileIntegrationException.Reason.TIMEOUT, "profile request timeout", ex);
    }
    return new ProfileIntegrationException(
        ProfileIntegrationException.Reason.BAD_GATEWAY, "profile connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
