package com.usagelens.engine.clickhouse;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds requests against the ClickHouse HTTP interface: endpoint, URL-encoded settings and credentials.
 */
public final class ClickHouseRequestFactory {

  private final URI endpoint;
  private final String authorization;

  public ClickHouseRequestFactory(URI endpoint, String username, String password) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.authorization = basic(username, password);
  }

  public static URI endpoint(String protocol, String host, int port) {
    return URI.create(protocol + "://" + host + ":" + port);
  }

  public URI endpoint() {
    return endpoint;
  }

  public HttpRequest.Builder request(Map<String, String> query) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(buildUri(query));
    if (authorization != null) {
      builder.header("Authorization", authorization);
    }
    return builder;
  }

  private URI buildUri(Map<String, String> query) {
    StringBuilder sb = new StringBuilder(endpoint.toString());
    if (sb.charAt(sb.length() - 1) != '/') {
      sb.append('/');
    }
    if (query != null && !query.isEmpty()) {
      sb.append('?');
      sb.append(query.entrySet().stream()
          .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
          .collect(Collectors.joining("&")));
    }
    return URI.create(sb.toString());
  }

  private static String basic(String username, String password) {
    if (username == null || username.isBlank()) {
      return null;
    }
    String credentials = username + ":" + (password == null ? "" : password);
    return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
