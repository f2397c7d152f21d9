package com.deepansh.policyradar.tool;

import java.util.List;

/**
 * A tool result as it goes back to a model: the call it answers, the capped JSON text
 * and any admitted image attachments.
 */
public record ToolOutput(String callId, String toolName, String content, List<ToolImage> images) {}
