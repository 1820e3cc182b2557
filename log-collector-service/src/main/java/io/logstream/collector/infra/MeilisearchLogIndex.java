package io.logstream.collector.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.logstream.collector.config.LogstreamProperties;
import io.logstream.collector.domain.IndexException;
import io.logstream.collector.domain.LogEntry;
import io.logstream.collector.domain.LogIndex;
import io.logstream.collector.domain.LogQuery;
import io.logstream.collector.domain.SearchHits;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link LogIndex} backed by the Meilisearch HTTP API.
 */
public class MeilisearchLogIndex implements LogIndex {

  private static final Logger log = LoggerFactory.getLogger(MeilisearchLogIndex.class);

  static final List<String> SEARCHABLE = List.of("message", "source", "meta");
  static final List<String> FILTERABLE = List.of(
      "project", "level", "traceId", "spanId", "parentSpanId", "environment", "timestampMs");
  static final List<String> SORTABLE = List.of("timestamp", "timestampMs");
  static final List<String> RANKING_RULES = List.of(
      "sort", "words", "typo", "proximity", "attribute", "exactness");
  static final int MAX_TOTAL_HITS = 10_000;

  private final RestTemplate restTemplate;
  private final String indexName;
  private final String apiKey;
  private final ObjectMapper mapper;
  private final Clock clock;

  public MeilisearchLogIndex(RestTemplateBuilder restTemplateBuilder,
                             LogstreamProperties.Index settings,
                             ObjectMapper mapper,
                             Clock clock) {
    this(restTemplateBuilder
            .rootUri(stripTrailingSlash(settings.url()))
            .setConnectTimeout(settings.connectTimeout())
            .setReadTimeout(settings.readTimeout())
            .build(),
        settings.name(), settings.apiKey(), mapper, clock);
  }

  MeilisearchLogIndex(RestTemplate restTemplate, String indexName, String apiKey, ObjectMapper mapper,
                      Clock clock) {
    this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
    this.indexName = Objects.requireNonNull(indexName, "indexName");
    this.apiKey = apiKey;
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void addDocuments(List<LogEntry> batch) {
    if (batch.isEmpty()) {
      return;
    }
    String path = "/indexes/" + indexName + "/documents?primaryKey=id";
    exchange(HttpMethod.POST, path, toJson(batch), "write " + batch.size() + " documents");
  }

  @Override
  public SearchHits search(LogQuery query) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("q", query.text());
    body.put("limit", query.limit());
    body.put("sort", List.of(query.sort() == LogQuery.Sort.OLDEST_FIRST ? "timestampMs:asc" : "timestampMs:desc"));
    if (!query.facets().isEmpty()) {
      body.put("facets", query.facets());
    }
    MeilisearchFilter.build(query, clock).ifPresent(filter -> body.put("filter", filter));
    String response = exchange(HttpMethod.POST, "/indexes/" + indexName + "/search", toJson(body), "search");
    return parseSearch(response);
  }

  @Override
  public void initialize() {
    exchange(HttpMethod.POST, "/indexes", toJson(Map.of("uid", indexName, "primaryKey", "id")),
        "create index");
    Map<String, Object> settings = new LinkedHashMap<>();
    settings.put("searchableAttributes", SEARCHABLE);
    settings.put("filterableAttributes", FILTERABLE);
    settings.put("sortableAttributes", SORTABLE);
    settings.put("rankingRules", RANKING_RULES);
    settings.put("pagination", Map.of("maxTotalHits", MAX_TOTAL_HITS));
    exchange(HttpMethod.PATCH, "/indexes/" + indexName + "/settings", toJson(settings), "update settings");
    log.info("Meilisearch index '{}' configured", indexName);
  }

  private String exchange(HttpMethod method, String path, String json, String operation) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    if (apiKey != null && !apiKey.isBlank()) {
      headers.setBearerAuth(apiKey);
    }
    try {
      ResponseEntity<String> response =
          restTemplate.exchange(path, method, new HttpEntity<>(json, headers), String.class);
      return response.getBody();
    } catch (RestClientException ex) {
      throw new IndexException("Meilisearch " + operation + " failed: " + ex.getMessage(), ex);
    }
  }

  private String toJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IndexException("Unable to serialize request: " + ex.getOriginalMessage(), ex);
    }
  }

  private SearchHits parseSearch(String response) {
    JsonNode root;
    try {
      root = mapper.readTree(response == null ? "{}" : response);
    } catch (JsonProcessingException ex) {
      throw new IndexException("Unreadable Meilisearch response: " + ex.getOriginalMessage(), ex);
    }
    long total = root.has("estimatedTotalHits")
        ? root.path("estimatedTotalHits").asLong()
        : root.path("totalHits").asLong();
    Map<String, Map<String, Long>> facets = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> facetFields = root.path("facetDistribution").fields();
    while (facetFields.hasNext()) {
      Map.Entry<String, JsonNode> facet = facetFields.next();
      Map<String, Long> counts = new LinkedHashMap<>();
      facet.getValue().fields().forEachRemaining(value -> counts.put(value.getKey(), value.getValue().asLong()));
      facets.put(facet.getKey(), counts);
    }
    List<JsonNode> hits = new ArrayList<>();
    root.path("hits").forEach(hits::add);
    return new SearchHits(total, facets, hits);
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
