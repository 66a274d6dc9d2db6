package com.ryvin.matching.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class ProfileClientConfig {

  @Bean
  RestClient profileRestClient(RestClient.Builder builder, ProfileClientProperties properties) {
    // profile service 呼び出し専用 RestClient。
    return builder.baseUrl(properties.baseUrl()).build();
  }
}
