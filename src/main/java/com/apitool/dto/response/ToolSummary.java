package com.apitool.dto.response;

public record ToolSummary(String id, String name, String description) {
}
