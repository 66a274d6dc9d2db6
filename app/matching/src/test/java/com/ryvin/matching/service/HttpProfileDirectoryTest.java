package com.ryvin.matching.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.ryvin.matching.config.ProfileClientProperties;
import com.ryvin.matching.model.UserProfile;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class HttpProfileDirectoryTest {

  @Test
  void findProfileMapsSnakeCaseResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://profile.test/internal/profiles/user-1"))
        .andExpect(method(GET))
        .andExpect(header("X-Internal-Token", "token-x"))
        .andRespond(
            withSuccess(
                """
                {"user_id":"user-1","verified":true,"status":"ACTIVE","age":31,"gender":"f",
                 "seeking_genders":["m"],"min_age":27,"max_age":38,"max_distance_km":25.0,
                 "latitude":35.68,"longitude":139.76}
                """,
                MediaType.APPLICATION_JSON));

    final Optional<UserProfile> profile = fixture.directory.findProfile("user-1");

    assertThat(profile).isPresent();
    assertThat(profile.get().verified()).isTrue();
    assertThat(profile.get().active()).isTrue();
    assertThat(profile.get().seekingGenders()).containsExactly("m");
    assertThat(profile.get().maxDistanceKm()).isEqualTo(25.0);
    assertThat(profile.get().hasLocation()).isTrue();
    fixture.server.verify();
  }

  @Test
  void findProfileReturnsEmptyWhenNotFound() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://profile.test/internal/profiles/ghost"))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThat(fixture.directory.findProfile("ghost")).isEmpty();
  }

  @Test
  void suspendedProfileIsInactive() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://profile.test/internal/profiles/user-2"))
        .andRespond(
            withSuccess(
                """
                {"user_id":"user-2","verified":true,"status":"SUSPENDED"}
                """,
                MediaType.APPLICATION_JSON));

    final UserProfile profile = fixture.directory.findProfile("user-2").orElseThrow();

    assertThat(profile.active()).isFalse();
    assertThat(profile.seekingGenders()).isEmpty();
  }

  @Test
  void findCandidatePoolPassesLimit() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://profile.test/internal/profiles/user-1/candidates?limit=50"))
        .andRespond(
            withSuccess(
                """
                {"candidates":[{"user_id":"user-2","verified":true},{"user_id":"user-3"}]}
                """,
                MediaType.APPLICATION_JSON));

    final List<UserProfile> pool = fixture.directory.findCandidatePool("user-1", 50);

    assertThat(pool).extracting(UserProfile::userId).containsExactly("user-2", "user-3");
    assertThat(pool.get(1).verified()).isFalse();
    fixture.server.verify();
  }

  @Test
  void serverErrorMapsToBadGatewayAndIsCounted() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://profile.test/internal/profiles/user-1"))
        .andRespond(withServerError());

    assertThatThrownBy(() -> fixture.directory.findProfile("user-1"))
        .isInstanceOf(ProfileIntegrationException.class)
        .extracting(ex -> ((ProfileIntegrationException) ex).reason())
        .isEqualTo(ProfileIntegrationException.Reason.BAD_GATEWAY);
    assertThat(
            fixture
                .registry
                .get("matching.profile.error.total")
                .tag("reason", "bad_gateway")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void unauthorizedMapsToUnauthorized() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://profile.test/internal/profiles/user-1"))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> fixture.directory.findProfile("user-1"))
        .isInstanceOf(ProfileIntegrationException.class)
        .extracting(ex -> ((ProfileIntegrationException) ex).reason())
        .isEqualTo(ProfileIntegrationException.Reason.UNAUTHORIZED);
  }

  @Test
  void timeoutMapsToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://profile.test/internal/profiles/user-1/candidates?limit=10"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.directory.findCandidatePool("user-1", 10))
        .isInstanceOf(ProfileIntegrationException.class)
        .extracting(ex -> ((ProfileIntegrationException) ex).reason())
        .isEqualTo(ProfileIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void responseWithoutUserIdIsInvalid() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://profile.test/internal/profiles/user-1"))
        .andRespond(withSuccess("{\"verified\":true}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.directory.findProfile("user-1"))
        .isInstanceOf(ProfileIntegrationException.class)
        .extracting(ex -> ((ProfileIntegrationException) ex).reason())
        .isEqualTo(ProfileIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void blankUserIdIsRejectedBeforeCalling() {
    final ClientFixture fixture = newFixture();

    assertThatThrownBy(() -> fixture.directory.findProfile(" "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("userId is required");
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://profile.test").build();
    final ProfileClientProperties properties =
        new ProfileClientProperties("http://profile.test", "token-x", null, null, null);
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    return new ClientFixture(
        new HttpProfileDirectory(restClient, properties, new MatchingMetrics(registry)),
        server,
        registry);
  }

  private record ClientFixture(
      HttpProfileDirectory directory, MockRestServiceServer server, SimpleMeterRegistry registry) {}
}
