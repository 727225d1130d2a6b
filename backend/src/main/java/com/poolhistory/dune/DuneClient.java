package com.poolhistory.dune;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.poolhistory.config.AppProps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Blocking client for the Dune uploaded-tables API (create / clear / insert / delete).
 * The API key header is added by the RestTemplate interceptor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DuneClient {

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final RestTemplate duneRestTemplate;
    private final AppProps props;

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * @return true when created, false when the table already existed
     */
    public boolean createTable(String tableName, String description, List<DuneColumn> schema, boolean isPrivate) {
        Assert.hasText(tableName, "tableName required");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("namespace", namespace());
        payload.put("table_name", tableName);
        payload.put("description", description);
        payload.put("is_private", isPrivate);
        payload.put("schema", schema);

        try {
            JsonNode resp = call(HttpMethod.POST, uri("/table/create"), json(payload), MediaType.APPLICATION_JSON);
            log.info("[dune] table created: {}", resp.path("full_name").asText(namespace() + "." + tableName));
            return true;
        } catch (HttpStatusCodeException httpEx) {
            if (httpEx.getStatusCode().value() == HttpStatus.CONFLICT.value()
                    || httpEx.getResponseBodyAsString().toLowerCase().contains("already exist")) {
                log.info("[dune] table {}.{} already exists", namespace(), tableName);
                return false;
            }
            throw new DuneApiException("Dune create " + tableName + " failed: HTTP " + httpEx.getStatusCode()
                    + " " + httpEx.getResponseBodyAsString(), httpEx);
        }
    }

    public void clearTable(String tableName) {
        try {
            call(HttpMethod.POST, tablePath(tableName, "/clear"), null, null);
            log.info("[dune] table {}.{} cleared", namespace(), tableName);
        } catch (HttpStatusCodeException httpEx) {
            throw new DuneApiException("Dune clear " + tableName + " failed: HTTP " + httpEx.getStatusCode()
                    + " " + httpEx.getResponseBodyAsString(), httpEx);
        }
    }

    /**
     * Inserts rows as NDJSON.
     *
     * @return rows written as reported by Dune (falls back to the number of rows sent)
     */
    public long insertRows(String tableName, List<?> rows) {
        if (rows == null || rows.isEmpty()) return 0;
        String body = toNdjson(rows);
        try {
            JsonNode resp = call(HttpMethod.POST, tablePath(tableName, "/insert"), body, NDJSON);
            long written = resp.path("rows_written").asLong(rows.size());
            log.info("[dune] inserted {} rows into {}.{}", written, namespace(), tableName);
            return written;
        } catch (HttpStatusCodeException httpEx) {
            throw new DuneApiException("Dune insert into " + tableName + " failed: HTTP " + httpEx.getStatusCode()
                    + " " + httpEx.getResponseBodyAsString(), httpEx);
        }
    }

    public void deleteTable(String tableName) {
        try {
            call(HttpMethod.DELETE, tablePath(tableName, ""), null, null);
            log.info("[dune] table {}.{} deleted", namespace(), tableName);
        } catch (HttpStatusCodeException httpEx) {
            throw new DuneApiException("Dune delete " + tableName + " failed: HTTP " + httpEx.getStatusCode(), httpEx);
        }
    }

    String toNdjson(List<?> rows) {
        StringBuilder sb = new StringBuilder();
        try {
            for (Object row : rows) {
                sb.append(mapper.writeValueAsString(row)).append('\n');
            }
        } catch (Exception e) {
            throw new DuneApiException("cannot serialize rows for Dune: " + e.getMessage(), e);
        }
        return sb.toString();
    }

    private JsonNode call(HttpMethod method, URI uri, String body, MediaType contentType) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (contentType != null) headers.setContentType(contentType);
        HttpEntity<String> req = new HttpEntity<>(body, headers);
        try {
            ResponseEntity<String> resp = duneRestTemplate.exchange(uri, method, req, String.class);
            String text = resp.getBody();
            return text == null || text.isBlank() ? mapper.createObjectNode() : mapper.readTree(text);
        } catch (HttpStatusCodeException httpEx) {
            throw httpEx;
        } catch (RestClientException e) {
            throw new DuneApiException("Dune call " + method + " " + uri + " failed: " + e.getMessage(), e);
        } catch (Exception e) {
            throw new DuneApiException("Dune response decode error: " + e.getMessage(), e);
        }
    }

    private String json(Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (Exception e) {
            throw new DuneApiException("cannot serialize Dune payload: " + e.getMessage(), e);
        }
    }

    private URI tablePath(String tableName, String suffix) {
        Assert.hasText(tableName, "tableName required");
        return UriComponentsBuilder.fromHttpUrl(props.getDune().getBaseUrl())
                .path("/table/{namespace}/{table}" + suffix)
                .buildAndExpand(namespace(), tableName).toUri();
    }

    private URI uri(String path) {
        return UriComponentsBuilder.fromHttpUrl(props.getDune().getBaseUrl()).path(path).build(true).toUri();
    }

    private String namespace() {
        String ns = props.getDune().getNamespace();
        if (ns == null || ns.isBlank()) throw new IllegalArgumentException("app.dune.namespace is not configured");
        return ns;
    }
}
