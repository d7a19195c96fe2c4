package com.kmg.grobid.model;

/**
 * Raw status and body of one submission attempt.
 */
public record ServiceResponse(int statusCode, byte[] body) {
    public ServiceResponse {
        body = body == null ? new byte[0] : body;
    }
}
