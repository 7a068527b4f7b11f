package com.chainflow.chainflow_backend.model.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Built-in node types. The tag is what flow documents carry in a node's {@code type} field.
 * Executors register by tag, so a tag with no constant here can still be served by a custom executor bean.
 */
public enum NodeType {
    INPUT("input"),
    OUTPUT("output"),
    API("api"),
    WEB_CRAWLER("web-crawler"),
    HTML_PARSER("html-parser"),
    MERGER("merger"),
    LLM("llm"),
    JSON_EXTRACTOR("json-extractor"),
    CONDITIONAL("conditional"),
    GROUP("group");      // structural container, members carry groupMember = true

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    public String getTag() { return tag; }

    public static Optional<NodeType> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.tag.equalsIgnoreCase(tag.trim()))
                .findFirst();
    }
}
