package com.cloud.topo;

import com.cloud.topo.cdk.TopologyStack;
import com.cloud.topo.config.StackEnvironment;
import com.cloud.topo.engine.ResourceGraph;
import com.cloud.topo.io.TemplateSynthesizer;
import com.cloud.topo.util.TopologyExplain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awscdk.App;

import java.util.Arrays;

/**
 * CDK app for the reference topology. Account and region come from
 * {@code CDK_DEFAULT_ACCOUNT} / {@code CDK_DEFAULT_REGION}.
 *
 * <p>
 * Run by the CDK toolkit it synthesizes into the toolkit's output directory.
 * With {@code --print} the template is written to stdout instead.
 */
public class TopologyApp {
    private static final Logger log = LogManager.getLogger(TopologyApp.class);

    public static void main(final String[] args) {
        StackEnvironment env = StackEnvironment.fromSystemEnvironment();
        ResourceGraph graph = DocumentDbTopology.build(env);
        log.info("\n{}", new TopologyExplain(graph).dumpTopology());

        if (Arrays.asList(args).contains("--print")) {
            System.out.println(new TemplateSynthesizer().synthesizeJson(graph));
            return;
        }
        App app = new App();
        new TopologyStack(app, graph);
        app.synth();
    }
}
