package com.cloud.topo.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;

/**
 * POJO representation of a synthesized deployment template.
 *
 * Sections without a dedicated field (parameters, rules, conditions) are kept
 * as-is so a template survives a read and write unchanged.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({ "AWSTemplateFormatVersion", "Description", "Metadata", "Resources" })
public final class TemplateDefinition {
    public static final String FORMAT_VERSION = "2010-09-09";

    @JsonProperty("AWSTemplateFormatVersion")
    private String formatVersion = FORMAT_VERSION;

    @JsonProperty("Description")
    private String description;

    @JsonProperty("Metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /** Logical id to resource. */
    @JsonProperty("Resources")
    private Map<String, ResourceDef> resources = new LinkedHashMap<>();

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> otherSections = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getOtherSections() {
        return otherSections;
    }

    @JsonAnySetter
    public void setOtherSection(String name, Object value) {
        otherSections.put(name, value);
    }

    /** Logical ids of every resource of the given type, in template order. */
    public List<String> logicalIdsOf(String type) {
        List<String> ids = new ArrayList<>();
        resources.forEach((id, def) -> {
            if (type.equals(def.getType()))
                ids.add(id);
        });
        return ids;
    }

    /** One entry of the template's resource section. */
    @Data
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonPropertyOrder({ "Type", "Properties", "DependsOn", "DeletionPolicy", "UpdateReplacePolicy" })
    public static final class ResourceDef {
        @JsonProperty("Type")
        private String type;

        @JsonProperty("Properties")
        private Map<String, Object> properties = new LinkedHashMap<>();

        @JsonProperty("DependsOn")
        private List<String> dependsOn = new ArrayList<>();

        @JsonProperty("DeletionPolicy")
        private String deletionPolicy;

        @JsonProperty("UpdateReplacePolicy")
        private String updateReplacePolicy;

        @Getter(AccessLevel.NONE)
        @Setter(AccessLevel.NONE)
        private Map<String, Object> attributes = new LinkedHashMap<>();

        /** Resource attributes without a dedicated field, such as {@code Metadata} or {@code Condition}. */
        @JsonAnyGetter
        public Map<String, Object> getAttributes() {
            return attributes;
        }

        @JsonAnySetter
        public void setAttribute(String name, Object value) {
            attributes.put(name, value);
        }
    }
}
