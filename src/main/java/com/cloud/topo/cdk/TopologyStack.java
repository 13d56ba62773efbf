package com.cloud.topo.cdk;

import com.cloud.topo.api.OrderingConstraint;
import com.cloud.topo.api.Resource;
import com.cloud.topo.api.TopologyConfigException;
import com.cloud.topo.config.StackEnvironment;
import com.cloud.topo.engine.ResourceGraph;
import com.cloud.topo.resource.AddressPartition;
import com.cloud.topo.resource.ComputeCluster;
import com.cloud.topo.resource.IngressRule;
import com.cloud.topo.resource.Listener;
import com.cloud.topo.resource.ListenerProtocol;
import com.cloud.topo.resource.NetworkFabric;
import com.cloud.topo.resource.PermissionGrant;
import com.cloud.topo.resource.Reachability;
import com.cloud.topo.resource.SecretFieldRef;
import com.cloud.topo.resource.SecretMaterial;
import com.cloud.topo.resource.ServiceInstance;
import com.cloud.topo.resource.StatefulServiceCluster;
import com.cloud.topo.resource.TaskTemplate;
import com.cloud.topo.resource.TrafficDistributor;
import com.cloud.topo.resource.TrafficFilter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;
import software.amazon.awscdk.ArnComponents;
import software.amazon.awscdk.ArnFormat;
import software.amazon.awscdk.Environment;
import software.amazon.awscdk.SecretValue;
import software.amazon.awscdk.SecretsManagerSecretOptions;
import software.amazon.awscdk.Stack;
import software.amazon.awscdk.StackProps;
import software.amazon.awscdk.services.docdb.DatabaseCluster;
import software.amazon.awscdk.services.docdb.Login;
import software.amazon.awscdk.services.ec2.IPeer;
import software.amazon.awscdk.services.ec2.ISecurityGroup;
import software.amazon.awscdk.services.ec2.IVpc;
import software.amazon.awscdk.services.ec2.IpAddresses;
import software.amazon.awscdk.services.ec2.Peer;
import software.amazon.awscdk.services.ec2.SecurityGroup;
import software.amazon.awscdk.services.ec2.SubnetConfiguration;
import software.amazon.awscdk.services.ec2.SubnetSelection;
import software.amazon.awscdk.services.ec2.SubnetType;
import software.amazon.awscdk.services.ec2.Vpc;
import software.amazon.awscdk.services.ecs.Cluster;
import software.amazon.awscdk.services.ecs.ContainerDefinitionOptions;
import software.amazon.awscdk.services.ecs.ContainerImage;
import software.amazon.awscdk.services.ecs.FargateService;
import software.amazon.awscdk.services.ecs.FargateTaskDefinition;
import software.amazon.awscdk.services.ecs.ICluster;
import software.amazon.awscdk.services.elasticloadbalancingv2.AddApplicationTargetsProps;
import software.amazon.awscdk.services.elasticloadbalancingv2.ApplicationListener;
import software.amazon.awscdk.services.elasticloadbalancingv2.ApplicationLoadBalancer;
import software.amazon.awscdk.services.elasticloadbalancingv2.ApplicationProtocol;
import software.amazon.awscdk.services.elasticloadbalancingv2.BaseApplicationListenerProps;
import software.amazon.awscdk.services.elasticloadbalancingv2.IApplicationLoadBalancerTarget;
import software.amazon.awscdk.services.iam.PolicyStatement;
import software.amazon.awscdk.services.secretsmanager.ISecret;
import software.amazon.awscdk.services.secretsmanager.Secret;
import software.amazon.awscdk.services.secretsmanager.SecretStringGenerator;
import software.constructs.Construct;
import software.constructs.IConstruct;

import java.util.*;

/**
 * CDK stack for a finalized {@link ResourceGraph}.
 *
 * <p>
 * Constructs are created in the graph's creation order, each under the graph id
 * of the resource it stands for. Partitions become subnet groups of the VPC,
 * ingress rules and grants are applied to the constructs they belong to, and
 * ordering constraints become construct dependencies. What the provider needs
 * beyond that (internet gateway, routes, target groups, roles) comes from the
 * CDK constructs themselves.
 */
@Log4j2
public class TopologyStack extends Stack {
    /** Name of the single container in every task definition. */
    public static final String CONTAINER_NAME = "AppContainer";
    static final String TARGETS_ID = "Targets";

    private static final ObjectMapper JSON = new ObjectMapper();

    private final ResourceGraph graph;
    // graph id -> construct standing for it
    private final Map<String, IConstruct> constructs = new HashMap<>();

    /**
     * @throws TopologyConfigException if a resource cannot be expressed as a
     *                                 construct (an HTTPS listener, a grant on an
     *                                 unsupported kind, a constraint on a partition).
     */
    public TopologyStack(Construct scope, ResourceGraph graph) {
        super(scope, graph.name(), propsFor(graph));
        this.graph = graph;
        getTemplateOptions().setMetadata(Map.<String, Object>of("Topology", graph.name()));

        for (Resource r : graph.creationOrder())
            declare(r);
        for (OrderingConstraint c : graph.constraints())
            constructOf(c.after()).getNode().addDependency(constructOf(c.before()));
        log.debug("Stack {}: {} constructs for {} resources", getStackName(), constructs.size(),
                graph.resources().size());
    }

    public ResourceGraph graph() {
        return graph;
    }

    /** The construct created for {@code resource}, or null for partitions, rules and grants. */
    public IConstruct constructFor(Resource resource) {
        return constructs.get(resource.name());
    }

    static StackProps propsFor(ResourceGraph graph) {
        StackEnvironment env = graph.environment();
        StackProps.Builder props = StackProps.builder().description("Resource topology " + graph.name());
        if (env.account().isPresent() || env.region().isPresent())
            props.env(Environment.builder()
                    .account(env.account().orElse(null))
                    .region(env.region().orElse(null))
                    .build());
        return props.build();
    }

    // ── Per-resource mapping ─────────────────────────────────────

    private void declare(Resource r) {
        if (r instanceof NetworkFabric f) {
            put(f, vpc(f));
        } else if (r instanceof AddressPartition) {
            // subnet group of its VPC
        } else if (r instanceof TrafficFilter f) {
            put(f, SecurityGroup.Builder.create(this, f.name())
                    .vpc(vpcOf(f.fabric()))
                    .description(getStackName() + "/" + f.name())
                    .build());
        } else if (r instanceof IngressRule rule) {
            ingress(rule);
        } else if (r instanceof SecretMaterial s) {
            put(s, secret(s));
        } else if (r instanceof StatefulServiceCluster c) {
            put(c, database(c));
        } else if (r instanceof ComputeCluster c) {
            put(c, Cluster.Builder.create(this, c.name()).vpc(vpcOf(c.fabric())).build());
        } else if (r instanceof TaskTemplate t) {
            put(t, task(t));
        } else if (r instanceof ServiceInstance s) {
            put(s, FargateService.Builder.create(this, s.name())
                    .cluster(constructOf(s.cluster(), ICluster.class))
                    .taskDefinition(constructOf(s.taskTemplate(), FargateTaskDefinition.class))
                    .securityGroups(List.of(constructOf(s.filter(), ISecurityGroup.class)))
                    .assignPublicIp(s.assignPublicAddress())
                    .vpcSubnets(subnetsOf(s.partition()))
                    .build());
        } else if (r instanceof TrafficDistributor d) {
            ApplicationLoadBalancer.Builder lb = ApplicationLoadBalancer.Builder.create(this, d.name())
                    .vpc(vpcOf(d.fabric()))
                    .internetFacing(d.internetFacing());
            d.filter().ifPresent(f -> lb.securityGroup(constructOf(f, ISecurityGroup.class)));
            put(d, lb.build());
        } else if (r instanceof Listener l) {
            put(l, listener(l));
        } else if (r instanceof PermissionGrant g) {
            grant(g);
        } else {
            throw new IllegalArgumentException("No construct mapping for " + r);
        }
    }

    private Vpc vpc(NetworkFabric f) {
        List<SubnetConfiguration> subnets = new ArrayList<>();
        for (AddressPartition p : f.partitions())
            subnets.add(SubnetConfiguration.builder()
                    .name(p.partitionName())
                    .cidrMask(p.cidrMask())
                    .subnetType(p.reachability() == Reachability.EXTERNALLY_REACHABLE
                            ? SubnetType.PUBLIC
                            : SubnetType.PRIVATE_ISOLATED)
                    .build());
        return Vpc.Builder.create(this, f.name())
                .ipAddresses(IpAddresses.cidr(f.cidrBlock()))
                .maxAzs(NetworkFabric.MAX_AVAILABILITY_ZONES)
                .subnetConfiguration(subnets)
                .build();
    }

    private void ingress(IngressRule rule) {
        ISecurityGroup target = constructOf(rule.filter(), ISecurityGroup.class);
        IPeer peer = rule.sourceFilter()
                .<IPeer>map(f -> constructOf(f, ISecurityGroup.class))
                .orElseGet(() -> Peer.ipv4(rule.sourceCidr().orElseThrow().toString()));
        if (rule.description().isEmpty())
            target.addIngressRule(peer, ec2Port(rule.port()));
        else
            target.addIngressRule(peer, ec2Port(rule.port()), rule.description());
    }

    private Secret secret(SecretMaterial s) {
        var generated = s.generated();
        SecretStringGenerator.Builder generator = SecretStringGenerator.builder()
                .secretStringTemplate(json(s))
                .generateStringKey(generated.fieldName())
                .passwordLength(generated.length())
                .excludePunctuation(generated.excludePunctuation());
        if (!generated.excludedCharacters().isEmpty())
            generator.excludeCharacters(generated.excludedCharacters());
        return Secret.Builder.create(this, s.name())
                .generateSecretString(generator.build())
                .build();
    }

    private DatabaseCluster database(StatefulServiceCluster c) {
        ISecret secret = constructOf(c.secret(), ISecret.class);
        // Both credentials stay dynamic references into the secret
        Login login = Login.builder()
                .username(secret.secretValueFromJson(StatefulServiceCluster.USERNAME_FIELD).unsafeUnwrap())
                .password(SecretValue.secretsManager(secret.getSecretArn(), SecretsManagerSecretOptions.builder()
                        .jsonField(StatefulServiceCluster.PASSWORD_FIELD)
                        .build()))
                .build();
        return DatabaseCluster.Builder.create(this, c.name())
                .masterUser(login)
                .instanceType(new software.amazon.awscdk.services.ec2.InstanceType(c.instanceType().toString()))
                .instances(c.instanceCount())
                .port(c.port())
                .vpc(vpcOf(c.fabric()))
                .vpcSubnets(subnetsOf(c.partition()))
                .securityGroup(constructOf(c.filter(), ISecurityGroup.class))
                .removalPolicy(software.amazon.awscdk.RemovalPolicy.valueOf(c.removalPolicy().name()))
                .build();
    }

    private FargateTaskDefinition task(TaskTemplate t) {
        FargateTaskDefinition task = FargateTaskDefinition.Builder.create(this, t.name())
                .cpu(t.cpu())
                .memoryLimitMiB(t.memoryMiB())
                .build();

        Map<String, software.amazon.awscdk.services.ecs.Secret> secrets = new LinkedHashMap<>();
        for (Map.Entry<String, SecretFieldRef> binding : t.secretEnv().entrySet())
            secrets.put(binding.getKey(), software.amazon.awscdk.services.ecs.Secret.fromSecretsManager(
                    constructOf(binding.getValue().secret(), ISecret.class), binding.getValue().field()));
        List<software.amazon.awscdk.services.ecs.PortMapping> ports = new ArrayList<>();
        for (var p : t.ports())
            ports.add(software.amazon.awscdk.services.ecs.PortMapping.builder()
                    .containerPort(p.containerPort())
                    .protocol(software.amazon.awscdk.services.ecs.Protocol.valueOf(p.protocol().name()))
                    .build());

        task.addContainer(CONTAINER_NAME, ContainerDefinitionOptions.builder()
                .image(ContainerImage.fromRegistry(t.image()))
                .cpu(t.cpu())
                .memoryLimitMiB(t.memoryMiB())
                .secrets(secrets)
                .portMappings(ports)
                .build());
        return task;
    }

    private ApplicationListener listener(Listener l) {
        if (l.protocol() != ListenerProtocol.HTTP)
            throw new TopologyConfigException("missing-certificate", l.name(),
                    l.protocol() + " listeners need a certificate, which this topology does not declare");
        ApplicationLoadBalancer lb = constructOf(l.distributor(), ApplicationLoadBalancer.class);
        // Without its own filter the load balancer's generated group is opened to the world
        ApplicationListener listener = lb.addListener(l.name().substring(l.distributor().name().length() + 1),
                BaseApplicationListenerProps.builder()
                        .port(l.port())
                        .protocol(ApplicationProtocol.HTTP)
                        .open(l.distributor().filter().isEmpty())
                        .build());

        List<IApplicationLoadBalancerTarget> targets = new ArrayList<>();
        for (ServiceInstance s : new LinkedHashSet<>(l.targets()))
            targets.add(constructOf(s, FargateService.class));
        ServiceInstance first = l.targets().get(0);
        listener.addTargets(TARGETS_ID, AddApplicationTargetsProps.builder()
                .port(first.taskTemplate().ports().get(0).containerPort())
                .protocol(ApplicationProtocol.HTTP)
                .targets(targets)
                .build());
        return listener;
    }

    private void grant(PermissionGrant g) {
        List<String> arns = new ArrayList<>();
        for (Resource target : g.resources())
            arns.add(arnOf(g, target));
        FargateTaskDefinition task = constructOf(g.identity().taskTemplate(), FargateTaskDefinition.class);
        task.getTaskRole().addToPrincipalPolicy(PolicyStatement.Builder.create()
                .actions(new ArrayList<>(new TreeSet<>(g.actions())))
                .resources(arns)
                .build());
    }

    private String arnOf(PermissionGrant g, Resource target) {
        IConstruct construct = constructs.get(target.name());
        if (construct instanceof ISecret s)
            return s.getSecretArn();
        if (construct instanceof DatabaseCluster c)
            return formatArn(ArnComponents.builder()
                    .service("rds")
                    .resource("cluster")
                    .resourceName(c.getClusterIdentifier())
                    .arnFormat(ArnFormat.COLON_RESOURCE_NAME)
                    .build());
        if (construct instanceof ICluster c)
            return c.getClusterArn();
        if (construct instanceof FargateTaskDefinition t)
            return t.getTaskDefinitionArn();
        if (construct instanceof FargateService s)
            return s.getServiceArn();
        if (construct instanceof ApplicationLoadBalancer lb)
            return lb.getLoadBalancerArn();
        if (construct instanceof ApplicationListener l)
            return l.getListenerArn();
        throw new TopologyConfigException("unsupported-grant-resource", g.name(),
                "Cannot grant access to " + target);
    }

    // ── Helpers ──────────────────────────────────────────────────

    private void put(Resource r, IConstruct construct) {
        constructs.put(r.name(), construct);
    }

    private IConstruct constructOf(Resource r) {
        IConstruct construct = constructs.get(r.name());
        if (construct == null)
            throw new TopologyConfigException("unsupported-constraint", r.name(),
                    r + " has no construct an ordering constraint can attach to");
        return construct;
    }

    private <T> T constructOf(Resource r, Class<T> type) {
        return type.cast(constructs.get(r.name()));
    }

    private IVpc vpcOf(NetworkFabric f) {
        return constructOf(f, IVpc.class);
    }

    private static SubnetSelection subnetsOf(AddressPartition p) {
        return SubnetSelection.builder().subnetGroupName(p.partitionName()).build();
    }

    private static software.amazon.awscdk.services.ec2.Port ec2Port(com.cloud.topo.resource.Port port) {
        boolean single = port.fromPort() == port.toPort();
        return switch (port.protocol()) {
            case TCP -> single
                    ? software.amazon.awscdk.services.ec2.Port.tcp(port.fromPort())
                    : software.amazon.awscdk.services.ec2.Port.tcpRange(port.fromPort(), port.toPort());
            case UDP -> single
                    ? software.amazon.awscdk.services.ec2.Port.udp(port.fromPort())
                    : software.amazon.awscdk.services.ec2.Port.udpRange(port.fromPort(), port.toPort());
        };
    }

    private static String json(SecretMaterial s) {
        try {
            return JSON.writeValueAsString(new TreeMap<>(s.templateFields()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize template fields of " + s.name(), e);
        }
    }
}
