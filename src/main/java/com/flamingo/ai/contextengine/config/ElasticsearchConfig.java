package com.flamingo.ai.contextengine.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import co.elastic.clients.transport.rest5_client.low_level.Rest5ClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Elasticsearch client backing the message store.
 *
 * <p>An API key, when set, is sent on every request. A path prefix supports clusters published
 * behind a reverse proxy.
 */
@Configuration
@Slf4j
public class ElasticsearchConfig {

  @Value("${elasticsearch.host:localhost}")
  private String host;

  @Value("${elasticsearch.port:9200}")
  private int port;

  @Value("${elasticsearch.scheme:http}")
  private String scheme;

  @Value("${elasticsearch.api-key:}")
  private String apiKey;

  @Value("${elasticsearch.path-prefix:}")
  private String pathPrefix;

  @Bean
  public Rest5Client rest5Client() {
    if (!"http".equals(scheme) && !"https".equals(scheme)) {
      throw new IllegalStateException("elasticsearch.scheme must be http or https, got " + scheme);
    }
    Rest5ClientBuilder builder =
        Rest5Client.builder(new HttpHost(scheme, host, port))
            .setDefaultHeaders(defaultHeaders(apiKey));
    if (pathPrefix != null && !pathPrefix.isBlank()) {
      builder.setPathPrefix(pathPrefix);
    }
    log.info(
        "Message store at {}://{}:{} (api key {})",
        scheme,
        host,
        port,
        apiKey == null || apiKey.isBlank() ? "not set" : "set");
    return builder.build();
  }

  @Bean
  public ElasticsearchTransport elasticsearchTransport(Rest5Client rest5Client) {
    return new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper());
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport transport) {
    return new ElasticsearchClient(transport);
  }

  static Header[] defaultHeaders(String apiKey) {
    if (apiKey == null || apiKey.isBlank()) {
      return new Header[0];
    }
    return new Header[] {new BasicHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + apiKey.strip())};
  }
}
