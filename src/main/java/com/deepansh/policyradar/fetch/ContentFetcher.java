package com.deepansh.policyradar.fetch;

/**
 * Fetches a document over HTTP and extracts its text. Never throws for expected
 * failures (blocked URL, HTTP error, oversized body); those come back in {@code error}.
 */
public interface ContentFetcher {

    FetchedContent fetch(String url);

    /** Fetches bytes already known to be a PDF, e.g. a provider's download link. */
    default FetchedContent fetchPdf(String url) {
        return fetch(url);
    }
}
