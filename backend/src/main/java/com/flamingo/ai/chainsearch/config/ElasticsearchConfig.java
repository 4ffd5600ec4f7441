package com.flamingo.ai.chainsearch.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import co.elastic.clients.transport.rest5_client.low_level.Rest5ClientBuilder;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Elasticsearch client backing the message similarity index.
 *
 * <p>The client is created once at startup and closed with the application context.
 */
@Configuration
public class ElasticsearchConfig {

  @Value("${elasticsearch.host:localhost}")
  private String host;

  @Value("${elasticsearch.port:9200}")
  private int port;

  @Value("${elasticsearch.scheme:http}")
  private String scheme;

  @Value("${elasticsearch.api-key:}")
  private String apiKey;

  @Bean(destroyMethod = "close")
  public Rest5Client rest5Client() {
    Rest5ClientBuilder builder = Rest5Client.builder(new HttpHost(scheme, host, port));
    if (apiKey != null && !apiKey.isBlank()) {
      builder.setDefaultHeaders(
          new Header[] {new BasicHeader("Authorization", "ApiKey " + apiKey)});
    }
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
}
