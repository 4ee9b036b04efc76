package com.example.password_expiry.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class DirectoryClientConfig {

  @Bean
  RestClient directoryRestClient(
      RestClient.Builder builder, DirectoryClientProperties properties) {
    // token 取得と Graph 呼び出しで共用する。URL は呼び出し側で絶対指定する。
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.requestFactory(requestFactory).build();
  }
}
