package com.deepansh.billbot.tool;

import com.deepansh.billbot.config.ToolProperties;

import java.util.List;
import java.util.function.Function;

/**
 * Valid filter values discovered from the worker and advertised in tool
 * descriptions so callers do not invent sponsor names or statuses.
 */
public enum ContextKind {

    SPONSORS("sponsors", List.of("name", "sponsor"), ToolProperties.Context::getSponsorsTool),
    STATUSES("statuses", List.of("status", "name"), ToolProperties.Context::getStatusesTool),
    TOPICS("topics", List.of("topicName", "topic", "name"), ToolProperties.Context::getTopicsTool),
    ADMINISTRATIONS("administrations", List.of("administration", "name"), ToolProperties.Context::getAdministrationsTool);

    private final String key;
    private final List<String> nameFields;
    private final Function<ToolProperties.Context, String> toolName;

    ContextKind(String key, List<String> nameFields, Function<ToolProperties.Context, String> toolName) {
        this.key = key;
        this.nameFields = nameFields;
        this.toolName = toolName;
    }

    public String key() {
        return key;
    }

    /** Fields tried, in order, to read a display value from one context record. */
    public List<String> nameFields() {
        return nameFields;
    }

    public String toolName(ToolProperties.Context props) {
        return toolName.apply(props);
    }
}
