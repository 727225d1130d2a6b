package com.poolhistory.dune;

import com.poolhistory.config.AppProps;
import com.poolhistory.model.HistoricalFact;
import com.poolhistory.model.PoolDimensionVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static com.poolhistory.support.PoolFixtures.d;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DuneClientTest {

    private MockRestServiceServer server;
    private DuneClient client;

    @BeforeEach
    void setup() {
        RestTemplate rt = new RestTemplate();
        server = MockRestServiceServer.bindTo(rt).build();
        AppProps props = new AppProps();
        props.getDune().setBaseUrl("https://dune.test/api/v1");
        props.getDune().setNamespace("ns");
        client = new DuneClient(rt, props);
    }

    @Test
    void createTableSendsSchema() {
        server.expect(requestTo("https://dune.test/api/v1/table/create"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.namespace").value("ns"))
                .andExpect(jsonPath("$.table_name").value("facts"))
                .andExpect(jsonPath("$.is_private").value(true))
                .andExpect(jsonPath("$.schema[0].name").value("timestamp"))
                .andExpect(jsonPath("$.schema[0].type").value("date"))
                .andRespond(withSuccess("{\"full_name\":\"dune.ns.facts\"}", MediaType.APPLICATION_JSON));

        assertThat(client.createTable("facts", "d", DuneFactTableUploader.FACT_COLUMNS, true)).isTrue();
        server.verify();
    }

    @Test
    void createTableToleratesExistingTable() {
        server.expect(requestTo("https://dune.test/api/v1/table/create"))
                .andRespond(withStatus(HttpStatus.CONFLICT).body("{\"error\":\"table already exists\"}"));

        assertThat(client.createTable("facts", "d", List.of(DuneColumn.of("a", "varchar")), true)).isFalse();
    }

    @Test
    void insertSendsNdjsonWithDestinationColumnNames() {
        server.expect(requestTo("https://dune.test/api/v1/table/ns/facts/insert"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(DuneClient.NDJSON))
                .andExpect(content().string(org.hamcrest.Matchers.containsString("\"timestamp\":\"2024-06-01\"")))
                .andExpect(content().string(org.hamcrest.Matchers.containsString("\"is_current\":true")))
                .andExpect(content().string(org.hamcrest.Matchers.containsString("\"valid_to\":\"9999-12-31\"")))
                .andRespond(withSuccess("{\"rows_written\":2,\"bytes_written\":100}", MediaType.APPLICATION_JSON));

        HistoricalFact row = HistoricalFact.builder()
                .date(d("2024-06-01")).poolId("p1").validFrom(d("2024-06-01"))
                .validTo(PoolDimensionVersion.OPEN_END).current(true).active(true).build();

        assertThat(client.insertRows("facts", List.of(row, row))).isEqualTo(2);
        server.verify();
    }

    @Test
    void ndjsonHasOneLinePerRow() {
        HistoricalFact row = HistoricalFact.builder().date(d("2024-06-01")).poolId("p1").build();

        String body = client.toNdjson(List.of(row, row, row));

        assertThat(body.split("\n")).hasSize(3);
        assertThat(body).doesNotContain("\"date\"").contains("\"pool_id\":\"p1\"");
    }

    @Test
    void clearAndDeleteHitTablePaths() {
        server.expect(requestTo("https://dune.test/api/v1/table/ns/facts/clear"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("https://dune.test/api/v1/table/ns/facts"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());

        client.clearTable("facts");
        client.deleteTable("facts");
        server.verify();
    }

    @Test
    void apiErrorsBecomeDuneApiException() {
        server.expect(requestTo("https://dune.test/api/v1/table/ns/facts/insert"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("{\"error\":\"invalid api key\"}"));

        HistoricalFact row = HistoricalFact.builder().date(d("2024-06-01")).poolId("p1").build();
        assertThatThrownBy(() -> client.insertRows("facts", List.of(row)))
                .isInstanceOf(DuneApiException.class)
                .hasMessageContaining("401");
    }

    @Test
    void emptyInsertIsNoCall() {
        assertThat(client.insertRows("facts", List.of())).isZero();
        server.verify();
    }
}
