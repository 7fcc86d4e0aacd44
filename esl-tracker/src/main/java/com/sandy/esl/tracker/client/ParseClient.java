package com.sandy.esl.tracker.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.esl.tracker.exception.EslErrorCode;
import com.sandy.esl.tracker.exception.EslStoreException;
import com.sandy.esl.tracker.exception.PlatformException;
import com.sandy.esl.tracker.vo.ParseCreated;
import com.sandy.esl.tracker.vo.ParseErrorResponse;
import com.sandy.esl.tracker.vo.ParseQueryResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * A basic Parse Platform REST API client.
 * <p>
 * Every request carries {@code X-Parse-Application-Id} and, when an API key is configured,
 * {@code X-Parse-REST-API-Key}. Any status other than the one expected by an operation is
 * reported as a {@link PlatformException} built from the {@code {code, error}} body.
 */
@Slf4j
public class ParseClient {

    public static final String APPLICATION_ID_HEADER = "X-Parse-Application-Id";
    public static final String API_KEY_HEADER = "X-Parse-REST-API-Key";

    private final String serverUrl;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public ParseClient(String applicationId, String apiKey, String serverUrl,
                       RestTemplateBuilder restTemplateBuilder, ObjectMapper objectMapper) {
        this.serverUrl = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
        this.objectMapper = objectMapper;
        RestTemplateBuilder builder = restTemplateBuilder
                .defaultHeader(APPLICATION_ID_HEADER, applicationId)
                .errorHandler(new PassThroughErrorHandler());
        if (apiKey != null && !apiKey.isBlank()) {
            builder = builder.defaultHeader(API_KEY_HEADER, apiKey);
        }
        this.restTemplate = builder.build();
        log.debug("Forged request headers: {}={} {}", APPLICATION_ID_HEADER, applicationId,
                apiKey != null && !apiKey.isBlank() ? API_KEY_HEADER + "=****" : "(no api key)");
    }

    /**
     * Merges an object path with the server root url.
     */
    public String getUrl(String path) {
        String formatted = serverUrl + "/" + path;
        log.debug("Formatted url {}", formatted);
        return formatted;
    }

    /**
     * Saves an object by sending a POST request, expects {@code 201 Created}.
     */
    public ParseCreated save(String path, Object data) {
        URI uri = toUri(getUrl(path), null);
        String body = writeJson(data);
        log.debug("Attempting to save ParseObject: {}", body);
        ResponseEntity<String> response = exchange(uri, HttpMethod.POST, body);
        if (response.getStatusCode().value() == HttpStatus.CREATED.value()) {
            ParseCreated created = readJson(response.getBody(), objectMapper.constructType(ParseCreated.class));
            if (created.getObjectId() == null) {
                throw new EslStoreException(EslErrorCode.SERIALIZATION, "objectId missing from creation response");
            }
            return created;
        }
        throw platformError(response);
    }

    /**
     * Finds objects by sending a GET request with a {@code where} predicate, expects {@code 200 OK}.
     * <p>
     * Query format: {@code {"serial":"DEV-42","printed":false,"createdAt":{"$gt":...,"$lt":...}}}
     */
    public <T> List<T> fetch(String path, Object query, Class<T> type) {
        String where = writeJson(query);
        URI uri = toUri(getUrl(path), where);
        log.debug("Fetching {} where={}", path, where);
        ResponseEntity<String> response = exchange(uri, HttpMethod.GET, null);
        if (response.getStatusCode().value() == HttpStatus.OK.value()) {
            JavaType responseType = objectMapper.getTypeFactory().constructParametricType(ParseQueryResponse.class, type);
            ParseQueryResponse<T> results = readJson(response.getBody(), responseType);
            return results.getResults() != null ? results.getResults() : List.of();
        }
        throw platformError(response);
    }

    /**
     * Updates an object by sending a PUT request, expects {@code 200 OK}. The body of the answer is ignored.
     */
    public void update(String path, Object data) {
        URI uri = toUri(getUrl(path), null);
        ResponseEntity<String> response = exchange(uri, HttpMethod.PUT, writeJson(data));
        if (response.getStatusCode().value() != HttpStatus.OK.value()) {
            throw platformError(response);
        }
    }

    private URI toUri(String url, String where) {
        try {
            UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(url);
            if (where != null) {
                builder.queryParam("where", URLEncoder.encode(where, StandardCharsets.UTF_8));
            }
            return builder.build(true).toUri();
        } catch (IllegalArgumentException e) {
            throw EslStoreException.url(url, e);
        }
    }

    private ResponseEntity<String> exchange(URI uri, HttpMethod method, String body) {
        HttpHeaders headers = new HttpHeaders();
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        try {
            return restTemplate.exchange(uri, method, new HttpEntity<>(body, headers), String.class);
        } catch (ResourceAccessException e) {
            log.error("{} {} failed: {}", method, uri, e.getMessage());
            Throwable cause = e.getCause();
            if (cause instanceof IOException && !isNetworkFailure(cause)) {
                throw EslStoreException.io(cause);
            }
            throw EslStoreException.transport(e);
        } catch (RestClientException e) {
            log.error("{} {} failed: {}", method, uri, e.getMessage());
            throw EslStoreException.transport(e);
        }
    }

    private static boolean isNetworkFailure(Throwable cause) {
        return cause instanceof ConnectException
                || cause instanceof SocketTimeoutException
                || cause instanceof UnknownHostException;
    }

    private PlatformException platformError(ResponseEntity<String> response) {
        int status = response.getStatusCode().value();
        ParseErrorResponse error = readJson(response.getBody(), objectMapper.constructType(ParseErrorResponse.class));
        log.warn("Parse server rejected the request: status={} code={} error={}", status, error.getCode(), error.getError());
        return new PlatformException(status, error.getError());
    }

    private String writeJson(Object data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw EslStoreException.serialization(e);
        }
    }

    private <T> T readJson(String body, JavaType type) {
        if (body == null || body.isBlank()) {
            throw new EslStoreException(EslErrorCode.SERIALIZATION,
                    "empty response body, expected " + type.getRawClass().getSimpleName());
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw EslStoreException.serialization(e);
        }
    }

    /**
     * Leaves every status to the client, so that all unexpected ones go through {@link #platformError}.
     */
    private static final class PassThroughErrorHandler extends DefaultResponseErrorHandler {
        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }
    }
}
