package com.cloud.topo.io;

import com.cloud.topo.api.TopologyConfigException;
import com.cloud.topo.cdk.TopologyStack;
import com.cloud.topo.engine.ResourceGraph;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import lombok.extern.log4j.Log4j2;
import software.amazon.awscdk.App;
import software.amazon.awscdk.AppProps;
import software.amazon.awscdk.cxapi.CloudAssembly;

/**
 * Compiles a finalized {@link ResourceGraph} into a deployment template.
 *
 * <p>
 * The graph is mapped onto a {@link TopologyStack} inside a fresh CDK app, the
 * app is synthesized, and the stack's template is read back from the cloud
 * assembly into a {@link TemplateDefinition}. Secret values never appear;
 * consumers receive dynamic references that the provisioning engine resolves
 * at deploy time.
 */
@Log4j2
public final class TemplateSynthesizer {

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);

    /**
     * Builds the template for a finalized graph.
     *
     * @throws TopologyConfigException if a resource has no construct mapping.
     */
    public TemplateDefinition synthesize(ResourceGraph graph) {
        App app = new App(AppProps.builder().analyticsReporting(false).build());
        TopologyStack stack = new TopologyStack(app, graph);
        CloudAssembly assembly = app.synth();
        Object template = assembly.getStackArtifact(stack.getArtifactId()).getTemplate();

        TemplateDefinition definition = mapper.convertValue(template, TemplateDefinition.class);
        log.debug("Synthesized {} template resources from {} graph resources",
                definition.getResources().size(), graph.resources().size());
        return definition;
    }

    /** Renders a template as indented JSON. */
    public String toJson(TemplateDefinition template) {
        try {
            return mapper.writeValueAsString(template);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize template " + template.getDescription(), e);
        }
    }

    public String synthesizeJson(ResourceGraph graph) {
        return toJson(synthesize(graph));
    }
}
