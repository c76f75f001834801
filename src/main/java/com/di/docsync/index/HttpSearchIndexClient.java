package com.di.docsync.index;

import com.di.docsync.config.IndexProperties;
import com.di.docsync.exception.IndexException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Document REST API client: {@code POST} puts a whole document, {@code DELETE} removes it.
 * Documents live at {@code /document/v1/<namespace>/<documentType>/docid/<documentId>}.
 */
@Slf4j
public class HttpSearchIndexClient implements SearchIndexClient {

    private static final String DOCUMENT_PATH = "/document/v1/{namespace}/{documentType}/docid/{documentId}";

    private final RestTemplate restTemplate;
    private final String documentUrl;
    private final String namespace;
    private final String documentType;

    public HttpSearchIndexClient(RestTemplate restTemplate, IndexProperties properties) {
        this.restTemplate = restTemplate;
        this.documentUrl = properties.getEndpoint().replaceAll("/+$", "") + DOCUMENT_PATH;
        this.namespace = properties.getNamespace();
        this.documentType = properties.getDocumentType();
    }

    @Override
    public void upsert(String documentId, Map<String, Object> fields) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(Map.of("fields", fields), headers);
        try {
            restTemplate.exchange(documentUrl, HttpMethod.POST, request, String.class,
                    namespace, documentType, documentId);
            log.trace("[INDEX] upsert {}", documentId);
        } catch (RestClientResponseException e) {
            throw new IndexException(documentId, "Index rejected " + documentId + " with HTTP "
                    + e.getStatusCode().value() + ": " + abbreviate(e.getResponseBodyAsString()), e);
        } catch (ResourceAccessException e) {
            throw new IndexException(documentId, "Index unreachable writing " + documentId + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new IndexException(documentId, "Index write failed for " + documentId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String documentId) {
        try {
            restTemplate.exchange(documentUrl, HttpMethod.DELETE, HttpEntity.EMPTY, String.class,
                    namespace, documentType, documentId);
            log.trace("[INDEX] delete {}", documentId);
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return;
            }
            throw new IndexException(documentId, "Index rejected delete of " + documentId + " with HTTP "
                    + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new IndexException(documentId, "Index delete failed for " + documentId + ": " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 297) + "..." : body;
    }
}
