package com.ryvin.matching.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "profile")
public record ProfileClientProperties(
    String baseUrl,
    String internalApiToken,
    String internalApiHeaderName,
    String getProfilePath,
    String candidatesPath) {

  public ProfileClientProperties {
    baseUrl = baseUrl == null ? "http://profile:80" : baseUrl;
    internalApiToken = internalApiToken == null ? "" : internalApiToken;
    internalApiHeaderName =
        internalApiHeaderName == null || internalApiHeaderName.isBlank()
            ? "X-Internal-Token"
            : internalApiHeaderName;
    getProfilePath =
        getProfilePath == null || getProfilePath.isBlank()
            ? "/internal/profiles/{userId}"
            : getProfilePath;
    candidatesPath =
        candidatesPath == null || candidatesPath.isBlank()
            ? "/internal/profiles/{userId}/candidates?limit={limit}"
            : candidatesPath;
  }
}
