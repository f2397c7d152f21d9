package com.deepansh.policyradar.provider;

import com.deepansh.policyradar.model.SourceRecord;
import com.deepansh.policyradar.tool.ToolImage;

import java.util.List;

/**
 * Full text of one provider document.
 *
 * @param contentType pdf, html or text; decides whether the text is indexed into memory
 */
public record ContentRead(
        SourceRecord record,
        String text,
        String contentType,
        String pdfUrl,
        List<ToolImage> images,
        String error
) {

    public static ContentRead failure(SourceRecord record, String error) {
        return new ContentRead(record, null, null, null, List.of(), error);
    }

    public boolean failed() {
        return error != null;
    }
}
