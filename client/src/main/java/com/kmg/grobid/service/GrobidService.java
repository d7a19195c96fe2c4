package com.kmg.grobid.service;

import com.kmg.grobid.model.OptionSet;
import com.kmg.grobid.model.ProcessingRequest;
import com.kmg.grobid.model.ServiceResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Talks to the GROBID REST API. Status codes are passed through untouched; deciding what a
 * status means is left to {@link RetryPolicy}.
 */
@Service
public class GrobidService {
    private static final Logger log = LoggerFactory.getLogger(GrobidService.class);

    static final String INPUT_FIELD = "input";
    static final String COORDINATES_FIELD = "tei_coordinates";
    static final MediaType PDF = MediaType.APPLICATION_PDF;

    private final RestTemplate restTemplate;

    public GrobidService(RestTemplate grobidRestTemplate) {
        this.restTemplate = grobidRestTemplate;
    }

    /**
     * Posts one document to {@code {apiBase}/api/{operation}}.
     *
     * @throws RestClientException when the server cannot be reached or the exchange times out
     */
    public ServiceResponse submit(String apiBase, ProcessingRequest request) {
        String url = apiBase + "/api/" + request.operation().endpoint();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        headers.setAccept(List.of(MediaType.TEXT_PLAIN));

        HttpEntity<MultiValueMap<String, Object>> entity = new HttpEntity<>(buildPayload(request), headers);
        try {
            ResponseEntity<byte[]> response = restTemplate.exchange(url, HttpMethod.POST, entity, byte[].class);
            return new ServiceResponse(response.getStatusCode().value(), response.getBody());
        } catch (HttpStatusCodeException e) {
            return new ServiceResponse(e.getStatusCode().value(), e.getResponseBodyAsByteArray());
        }
    }

    MultiValueMap<String, Object> buildPayload(ProcessingRequest request) {
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();

        HttpHeaders fileHeaders = new HttpHeaders();
        fileHeaders.setContentType(PDF);
        fileHeaders.set(HttpHeaders.EXPIRES, "0");
        parts.add(INPUT_FIELD, new HttpEntity<>(new FileSystemResource(request.file()), fileHeaders));

        OptionSet options = request.options();
        if (options.generateIds()) {
            parts.add("generate_ids", "1");
        }
        if (options.consolidateHeader()) {
            parts.add("consolidate_header", "1");
        }
        if (options.consolidateCitations()) {
            parts.add("consolidate_citations", "1");
        }
        if (options.includeCoordinates()) {
            for (String element : options.coordinates()) {
                parts.add(COORDINATES_FIELD, element);
            }
        }
        return parts;
    }

    public boolean isAlive(String apiBase) {
        String url = apiBase + "/api/isalive";
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            int status = response.getStatusCode().value();
            if (status != 200) {
                log.warn("GROBID server does not appear up and running, status code: {}", status);
                return false;
            }
            log.info("GROBID server is up and running at {}", apiBase);
            return true;
        } catch (HttpStatusCodeException e) {
            log.warn("GROBID server does not appear up and running, status code: {}", e.getStatusCode().value());
            return false;
        } catch (RestClientException e) {
            log.warn("GROBID server at {} is unreachable: {}", apiBase, e.getMessage());
            return false;
        }
    }

    public void requireAlive(String apiBase) {
        if (!isAlive(apiBase)) {
            throw new GrobidUnavailableException("GROBID server is down: " + apiBase);
        }
    }

    public static class GrobidUnavailableException extends RuntimeException {
        public GrobidUnavailableException(String message) {
            super(message);
        }
    }
}
