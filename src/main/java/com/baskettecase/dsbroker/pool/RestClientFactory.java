package com.baskettecase.dsbroker.pool;

import com.baskettecase.dsbroker.config.BrokerProperties;
import com.baskettecase.dsbroker.credential.AuthMaterial;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.Header;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.message.BasicHeader;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Builds low-level REST clients for OpenSearch/Elasticsearch-compatible clusters.
 *
 * Building a client does not open a connection; failures surface for malformed endpoints
 * or incomplete credentials.
 */
@Slf4j
@RequiredArgsConstructor
public class RestClientFactory implements ClientFactory<RestClient> {

    private final BrokerProperties.Client settings;
    private final ObjectMapper objectMapper;

    @Override
    public RestClient create(ConnectionParams params) {
        HttpHost host = toHttpHost(params.endpoint());

        RestClientBuilder builder = RestClient.builder(host)
            .setRequestConfigCallback(requestConfigBuilder -> requestConfigBuilder
                .setConnectTimeout(settings.getConnectTimeoutMs())
                .setSocketTimeout(settings.getSocketTimeoutMs()));

        String pathPrefix = URI.create(params.endpoint()).getPath();
        if (pathPrefix != null && !pathPrefix.isEmpty() && !"/".equals(pathPrefix)) {
            builder.setPathPrefix(pathPrefix);
        }

        AuthMaterial auth = params.auth();
        switch (auth.scheme()) {
            case USERNAME_PASSWORD -> {
                CredentialsProvider credentialsProvider = basicCredentials(auth);
                builder.setHttpClientConfigCallback(httpClientBuilder ->
                    httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider));
            }
            case API_KEY -> builder.setDefaultHeaders(new Header[] {apiKeyHeader(auth)});
            case NO_AUTH -> log.debug("No authentication configured for {}", host);
        }

        return builder.build();
    }

    private HttpHost toHttpHost(String endpoint) {
        URI uri;
        try {
            uri = URI.create(endpoint.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid endpoint: " + endpoint, e);
        }
        if (uri.getHost() == null || uri.getScheme() == null) {
            throw new IllegalArgumentException("Invalid endpoint: " + endpoint);
        }
        int port = uri.getPort() != -1 ? uri.getPort() : ("https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80);
        return new HttpHost(uri.getHost(), port, uri.getScheme());
    }

    private CredentialsProvider basicCredentials(AuthMaterial auth) {
        String username = auth.secretField(objectMapper, "username", "user");
        String password = auth.secretField(objectMapper, "password", "pass");
        if (username == null || password == null) {
            throw new IllegalArgumentException("Username and password are required for " + auth.scheme());
        }
        CredentialsProvider credentialsProvider = new BasicCredentialsProvider();
        credentialsProvider.setCredentials(AuthScope.ANY, new UsernamePasswordCredentials(username, password));
        return credentialsProvider;
    }

    // Accepts {"id":"...","api_key":"..."} or an already-encoded key
    private Header apiKeyHeader(AuthMaterial auth) {
        String id = auth.secretField(objectMapper, "id");
        String key = auth.secretField(objectMapper, "api_key", "apiKey");
        String encoded;
        if (id != null && key != null) {
            encoded = Base64.getEncoder().encodeToString((id + ":" + key).getBytes(StandardCharsets.UTF_8));
        } else {
            encoded = auth.secretText().trim();
        }
        if (encoded.isEmpty()) {
            throw new IllegalArgumentException("An API key is required for " + auth.scheme());
        }
        return new BasicHeader("Authorization", "ApiKey " + encoded);
    }
}
