package com.di.docsync.files;

import com.di.docsync.exception.DownloadException;
import com.di.docsync.exception.ObjectAccessDeniedException;
import com.di.docsync.exception.ObjectNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * Fetches an asset through the signed URL carried by the source row. No credentials of our own.
 */
@Slf4j
@RequiredArgsConstructor
public class PreAuthorizedUrlClient implements ObjectStoreClient {

    private final RestTemplate restTemplate;

    @Override
    public byte[] fetch(String url) {
        try {
            // URI.create keeps the signature's percent-encoding intact.
            byte[] body = restTemplate.getForObject(URI.create(url), byte[].class);
            return body != null ? body : new byte[0];
        } catch (HttpClientErrorException.NotFound e) {
            throw new ObjectNotFoundException(redact(url));
        } catch (HttpClientErrorException.Forbidden | HttpClientErrorException.Unauthorized e) {
            throw new ObjectAccessDeniedException(redact(url), e.getStatusText());
        } catch (RestClientResponseException e) {
            throw new DownloadException("HTTP " + e.getStatusCode().value() + " fetching " + redact(url), e);
        } catch (ResourceAccessException e) {
            throw new DownloadException("I/O error fetching " + redact(url) + ": " + e.getMessage(), e);
        }
    }

    /** Drops the query string so signatures never reach the logs. */
    static String redact(String url) {
        int q = url.indexOf('?');
        return q >= 0 ? url.substring(0, q) + "?..." : url;
    }
}
