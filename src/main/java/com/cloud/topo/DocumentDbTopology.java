package com.cloud.topo;

import com.cloud.topo.config.StackEnvironment;
import com.cloud.topo.config.TopologyOptions;
import com.cloud.topo.engine.ResourceGraph;
import com.cloud.topo.resource.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reference topology: a containerized app on ECS Fargate talking to a
 * DocumentDB cluster, fronted by an internet-facing load balancer.
 *
 * <p>
 * The app runs in the public partition; DocumentDB runs in the isolated one
 * and only admits MongoDB traffic from the app's security group. The load
 * balancer's own security group is open to the internet on port 80 and is the
 * only source the app admits. Credentials are generated by the secret store and
 * injected into the container as environment variables.
 */
public final class DocumentDbTopology {
    public static final String STACK_NAME = "AwsCdkDocdbStack";

    public static final String VPC = "VPC for DocumentDB";
    public static final String PUBLIC = "public";
    public static final String PRIVATE = "private";
    public static final String DOCDB_SG = "DocumentDB Security Group";
    public static final String DOCDB_CREDENTIALS = "DocumentDBCredentials";
    public static final String DOCDB = "DocDB";
    public static final String ECS_SG = "ECSSecurityGroup";
    public static final String ECS_CLUSTER = "ECSCluster";
    public static final String PAYLOAD_SECRET = "PayloadSecret";
    public static final String TASK = "TaskDefinition";
    public static final String SERVICE = "ECSService";
    public static final String LB_SG = "LoadBalancerSecurityGroup";
    public static final String LOAD_BALANCER = "LoadBalancer";

    static final int HTTP_PORT = 80;
    static final String IMAGE = "amazon/amazon-ecs-sample";
    static final String ANYWHERE = "0.0.0.0/0";
    static final String GET_SECRET_VALUE = "secretsmanager:GetSecretValue";

    private DocumentDbTopology() {
    }

    public static ResourceGraph build(StackEnvironment environment) {
        return build(environment, TopologyOptions.defaults());
    }

    public static ResourceGraph build(StackEnvironment environment, TopologyOptions options) {
        TopologyBuilder t = Topology.builder(STACK_NAME, environment, options);
        declare(t);
        return t.finalizeGraph();
    }

    /** Declares the full stack into an open builder, without finalizing it. */
    public static void declare(TopologyBuilder t) {
        // Network
        var vpc = t.declareNetwork(VPC, List.of(
                PartitionSpec.externallyReachable(PUBLIC, 24),
                PartitionSpec.isolated(PRIVATE, 24)));

        // DocumentDB
        var docDbSg = t.declareTrafficFilter(DOCDB_SG, vpc);
        var credentials = t.declareSecret(DOCDB_CREDENTIALS,
                Map.of(StatefulServiceCluster.USERNAME_FIELD, "awsdemo"),
                GeneratedSecretSpec.of(StatefulServiceCluster.PASSWORD_FIELD, 16)
                        .withoutPunctuation()
                        .excluding("/¥'%:;{}"));
        var docDb = t.declareStatefulCluster(DOCDB, vpc, vpc.partition(PRIVATE), docDbSg, credentials,
                InstanceType.of("t3", "medium"), 1, RemovalPolicy.DESTROY);

        // ECS
        var ecsSg = t.declareTrafficFilter(ECS_SG, vpc);
        var ecsCluster = t.declareComputeCluster(ECS_CLUSTER, vpc);
        var payloadSecret = t.declareSecret(PAYLOAD_SECRET,
                GeneratedSecretSpec.of("payloadSecret").excluding("\"@/\\ "));

        Map<String, SecretFieldRef> env = new LinkedHashMap<>();
        env.put("DOCDB_USERNAME", credentials.field(StatefulServiceCluster.USERNAME_FIELD));
        env.put("DOCDB_PASSWORD", credentials.field(StatefulServiceCluster.PASSWORD_FIELD));
        env.put("PAYLOAD_SECRET", payloadSecret.field("payloadSecret"));
        var task = t.declareTaskTemplate(TASK, IMAGE, 256, 512, List.of(PortMapping.tcp(HTTP_PORT)), env);

        var service = t.declareServiceInstance(SERVICE, ecsCluster, task, ecsSg, vpc.partition(PUBLIC), true);

        // Load balancer
        var lbSg = t.declareTrafficFilter(LB_SG, vpc);
        var lb = t.declareDistributor(LOAD_BALANCER, vpc, lbSg, true);
        var listener = t.addListener(lb, HTTP_PORT, ListenerProtocol.HTTP);
        t.addTargets(listener, service);
        t.addIngressRule(lbSg, ANYWHERE, Port.tcp(HTTP_PORT), "Allow from anyone on port " + HTTP_PORT);
        t.addIngressRule(ecsSg, lbSg, Port.tcp(HTTP_PORT), "Load balancer to target");

        // ECS <-> DocumentDB
        t.addIngressRule(docDbSg, ecsSg, Port.tcp(docDb.port()), "Allow MongoDB traffic from ECS");
        t.grantPermission(service, Set.of(GET_SECRET_VALUE), List.of(credentials));
        t.addOrderingConstraint(docDb, service);
    }
}
