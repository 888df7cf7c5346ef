package com.baskettecase.dsbroker.api;

import com.baskettecase.dsbroker.datasource.CredentialUpdate;
import com.baskettecase.dsbroker.datasource.DataSourceRecord;
import com.baskettecase.dsbroker.datasource.DataSourceRegistration;
import com.baskettecase.dsbroker.datasource.DataSourceRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.elasticsearch.client.Request;
import org.elasticsearch.client.Response;
import org.elasticsearch.client.RestClient;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Data Source Controller
 *
 * Manages data sources and exposes a probe that goes through the broker.
 * Responses never include credential material.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/data-sources")
@RequiredArgsConstructor
public class DataSourceController {

    private final DataSourceRegistry registry;
    private final DataSourceRouteContextFactory routeContextFactory;
    private final ObjectMapper objectMapper;

    @GetMapping
    public List<DataSourceRecord> list() {
        return registry.list();
    }

    @GetMapping("/{id}")
    public DataSourceRecord get(@PathVariable String id) {
        return registry.get(id);
    }

    @PostMapping
    public ResponseEntity<DataSourceRecord> register(@Valid @RequestBody DataSourceRegistration registration) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registry.register(registration));
    }

    @PutMapping("/{id}/credential")
    public DataSourceRecord rotateCredential(@PathVariable String id, @Valid @RequestBody CredentialUpdate update) {
        return registry.rotateCredential(id, update);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        registry.delete(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * Fetch the cluster's root document using the pooled client
     */
    @GetMapping("/{id}/cluster-info")
    public ResponseEntity<JsonNode> clusterInfo(@PathVariable String id, HttpServletRequest request) {
        RestClient client = routeContextFactory.forRequest(request).getClient(id);

        try {
            Response response = client.performRequest(new Request("GET", "/"));
            try (InputStream body = response.getEntity().getContent()) {
                return ResponseEntity.ok(objectMapper.readTree(body));
            }
        } catch (IOException e) {
            log.error("Cluster request failed for data source {}: {}", id, e.getMessage());
            throw new DataSourceClientException(id, HttpStatus.BAD_GATEWAY,
                "Data Source Error: " + id + ": " + e.getMessage(), e);
        }
    }
}
