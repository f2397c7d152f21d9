package com.deepansh.policyradar.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Citation-ready description of one item a provider returned.
 * Accumulated per chat turn in discovery order, never deduplicated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SourceRecord {

    @JsonProperty("source_type")
    private String sourceType;

    private String id;
    private String title;
    private String agency;
    private String date;
    private String url;
    private String excerpt;

    @JsonProperty("pdf_url")
    private String pdfUrl;

    @JsonProperty("content_type")
    private String contentType;

    private Map<String, Object> raw;
}
