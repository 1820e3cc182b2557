package io.logstream.collector.infra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logstream.collector.domain.IndexException;
import io.logstream.collector.domain.LogEntry;
import io.logstream.collector.domain.LogLevel;
import io.logstream.collector.domain.LogQuery;
import io.logstream.collector.domain.SearchHits;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class MeilisearchLogIndexTest {

  private static final String ROOT = "http://meili:7700";

  private final ObjectMapper mapper = new ObjectMapper();
  private final Clock clock = Clock.fixed(Instant.ofEpochMilli(5_000_000L), ZoneOffset.UTC);
  private MockRestServiceServer server;
  private MeilisearchLogIndex index;

  @BeforeEach
  void setUp() {
    RestTemplate restTemplate = new RestTemplateBuilder().rootUri(ROOT).build();
    server = MockRestServiceServer.bindTo(restTemplate).build();
    index = new MeilisearchLogIndex(restTemplate, "logs", "master-key", mapper, clock);
  }

  @Test
  void writesBatchAsDocumentArray() {
    server.expect(requestTo(ROOT + "/indexes/logs/documents?primaryKey=id"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("Authorization", "Bearer master-key"))
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].id").value("01A"))
        .andExpect(jsonPath("$[0].level").value("error"))
        .andExpect(jsonPath("$[1].id").value("01B"))
        .andRespond(withSuccess("{\"taskUid\":1}", MediaType.APPLICATION_JSON));

    index.addDocuments(List.of(
        LogEntry.of("api", LogLevel.ERROR, "a").withIdentity("01A", "2024-01-01T00:00:00Z", 1L),
        LogEntry.of("api", LogLevel.INFO, "b").withIdentity("01B", "2024-01-01T00:00:00Z", 2L)));

    server.verify();
  }

  @Test
  void emptyBatchIsNotSent() {
    index.addDocuments(List.of());

    server.verify();
  }

  @Test
  void searchSendsQueryAndParsesHitsAndFacets() {
    server.expect(requestTo(ROOT + "/indexes/logs/search"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.q").value("timeout"))
        .andExpect(jsonPath("$.limit").value(20))
        .andExpect(jsonPath("$.sort[0]").value("timestampMs:desc"))
        .andExpect(jsonPath("$.facets[0]").value("project"))
        .andExpect(jsonPath("$.filter").value("project = \"api\" AND timestampMs > 1400000"))
        .andRespond(withSuccess("""
            {"hits":[{"id":"01A","project":"api","message":"timeout talking to db"}],
             "estimatedTotalHits":17,
             "facetDistribution":{"project":{"api":17},"level":{"error":12,"warn":5}}}
            """, MediaType.APPLICATION_JSON));

    SearchHits result = index.search(new LogQuery("timeout", "api", Set.of(), null, null, "1h", 20,
        LogQuery.Sort.NEWEST_FIRST, List.of("project", "level")));

    assertThat(result.totalHits()).isEqualTo(17);
    assertThat(result.facets().get("level")).containsEntry("error", 12L).containsEntry("warn", 5L);
    assertThat(result.hits()).hasSize(1);
    assertThat(result.hits().get(0).path("message").asText()).isEqualTo("timeout talking to db");
    server.verify();
  }

  @Test
  void oldestFirstSortsAscendingWithoutFilterWhenUnconstrained() {
    server.expect(requestTo(ROOT + "/indexes/logs/search"))
        .andExpect(jsonPath("$.sort[0]").value("timestampMs:asc"))
        .andExpect(jsonPath("$.filter").doesNotExist())
        .andExpect(jsonPath("$.facets").doesNotExist())
        .andRespond(withSuccess("{\"hits\":[],\"totalHits\":0}", MediaType.APPLICATION_JSON));

    SearchHits result = index.search(new LogQuery(null, null, null, null, null, null, 500,
        LogQuery.Sort.OLDEST_FIRST, List.of()));

    assertThat(result.totalHits()).isZero();
    assertThat(result.facets()).isEmpty();
    server.verify();
  }

  @Test
  void serverErrorBecomesIndexException() {
    server.expect(requestTo(ROOT + "/indexes/logs/search"))
        .andRespond(withServerError());

    assertThatThrownBy(() -> index.search(new LogQuery("x", null, null, null, null, null, 1,
        LogQuery.Sort.NEWEST_FIRST, List.of())))
        .isInstanceOf(IndexException.class)
        .hasMessageStartingWith("Meilisearch search failed");
  }

  @Test
  void initializeCreatesIndexAndAppliesSettings() {
    server.expect(requestTo(ROOT + "/indexes"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.uid").value("logs"))
        .andExpect(jsonPath("$.primaryKey").value("id"))
        .andRespond(withSuccess("{\"taskUid\":1}", MediaType.APPLICATION_JSON));
    server.expect(requestTo(ROOT + "/indexes/logs/settings"))
        .andExpect(method(HttpMethod.PATCH))
        .andExpect(jsonPath("$.filterableAttributes[0]").value("project"))
        .andExpect(jsonPath("$.sortableAttributes[1]").value("timestampMs"))
        .andExpect(jsonPath("$.rankingRules[0]").value("sort"))
        .andExpect(jsonPath("$.pagination.maxTotalHits").value(10000))
        .andRespond(withSuccess("{\"taskUid\":2}", MediaType.APPLICATION_JSON));

    index.initialize();

    server.verify();
  }

  @Test
  void omitsAuthorizationWithoutApiKey() {
    RestTemplate restTemplate = new RestTemplateBuilder().rootUri(ROOT).build();
    MockRestServiceServer anonymous = MockRestServiceServer.bindTo(restTemplate).build();
    MeilisearchLogIndex open = new MeilisearchLogIndex(restTemplate, "logs", "", mapper, clock);
    anonymous.expect(requestTo(ROOT + "/indexes/logs/documents?primaryKey=id"))
        .andExpect(request -> assertThat(request.getHeaders().containsKey("Authorization")).isFalse())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andRespond(withSuccess());

    open.addDocuments(List.of(LogEntry.of("api", LogLevel.INFO, "x").withIdentity("01C", "t", 3L)));

    anonymous.verify();
  }
}
