package com.cloud.topo;

import com.cloud.topo.api.*;
import com.cloud.topo.config.StackEnvironment;
import com.cloud.topo.config.TopologyOptions;
import com.cloud.topo.engine.ResourceGraph;
import com.cloud.topo.resource.*;
import org.junit.Before;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class TopologyBuilderTest {

    private TopologyBuilder t;
    private NetworkFabric vpc;
    private TrafficFilter dbSg;
    private SecretMaterial creds;

    @Before
    public void setUp() {
        t = Topology.builder("test");
        vpc = t.declareNetwork("VPC", List.of(
                PartitionSpec.externallyReachable("public", 24),
                PartitionSpec.isolated("private", 24)));
        dbSg = t.declareTrafficFilter("DbSG", vpc);
        creds = t.declareSecret("Creds", Map.of("username", "admin"), GeneratedSecretSpec.of("password", 16));
    }

    private StatefulServiceCluster declareDb() {
        return t.declareStatefulCluster("Db", vpc, vpc.partition("private"), dbSg, creds,
                InstanceType.of("t3", "medium"), 1);
    }

    private TaskTemplate declareTask() {
        return t.declareTaskTemplate("Task", "nginx", 256, 512, List.of(PortMapping.tcp(80)),
                Map.of("DB_PASSWORD", creds.field("password")));
    }

    private ServiceInstance declareService(String name, TrafficFilter sg) {
        var cluster = t.getResource("Compute") != null ? t.<ComputeCluster>getResource("Compute")
                : t.declareComputeCluster("Compute", vpc);
        var task = t.getResource("Task") != null ? t.<TaskTemplate>getResource("Task") : declareTask();
        return t.declareServiceInstance(name, cluster, task, sg, vpc.partition("public"), true);
    }

    private static String singleCode(TopologyConfigException e) {
        assertEquals(1, e.diagnostics().size());
        return e.diagnostics().get(0).code();
    }

    // ── Network ──────────────────────────────────────────────────

    @Test
    public void testDeclareNetworkCreatesPartitions() {
        assertEquals(2, vpc.partitions().size());
        AddressPartition pub = vpc.partition("public");
        assertEquals("VPC.public", pub.name());
        assertEquals(Reachability.EXTERNALLY_REACHABLE, pub.reachability());
        assertEquals(24, pub.cidrMask());
        assertSame(pub, t.getResource("VPC.public"));
        assertEquals(NetworkFabric.DEFAULT_CIDR, vpc.cidrBlock());
    }

    @Test
    public void testSecondNetworkRejected() {
        try {
            t.declareNetwork("Other", List.of(PartitionSpec.externallyReachable("a", 24),
                    PartitionSpec.isolated("b", 24)));
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("duplicate-network", singleCode(e));
        }
        assertNull(t.getResource("Other"));
    }

    @Test
    public void testNetworkNeedsBothReachabilityClasses() {
        TopologyBuilder b = Topology.builder("b");
        try {
            b.declareNetwork("VPC", List.of(PartitionSpec.isolated("private", 24)));
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("missing-reachability-class", singleCode(e));
            assertTrue(e.getMessage().contains("EXTERNALLY_REACHABLE"));
        }
        assertTrue(b.resources().isEmpty());
    }

    @Test
    public void testNetworkRejectsEmptyAndDuplicatePartitions() {
        TopologyBuilder b = Topology.builder("b");
        try {
            b.declareNetwork("VPC", List.of());
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("missing-partitions", singleCode(e));
        }
        try {
            b.declareNetwork("VPC", List.of(PartitionSpec.isolated("a", 24), PartitionSpec.isolated("a", 25)));
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("duplicate-partition", singleCode(e));
        }
    }

    @Test
    public void testPartitionMaskOutsideNetwork() {
        TopologyBuilder b = Topology.builder("b");
        try {
            b.declareNetwork("VPC", "10.0.0.0/24", List.of(
                    PartitionSpec.externallyReachable("public", 23),
                    PartitionSpec.isolated("private", 28)));
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("invalid-partition", singleCode(e));
        }
    }

    @Test
    public void testMalformedNetworkAddressRejected() {
        for (String cidr : List.of("ten.zero.0.0/16", "10.0.0/16", "10.0.0.256/16", "10.0.0.1/16", "10.0.0.0")) {
            TopologyBuilder b = Topology.builder("b");
            try {
                b.declareNetwork("VPC", cidr, List.of(
                        PartitionSpec.externallyReachable("public", 24),
                        PartitionSpec.isolated("private", 24)));
                fail(cidr);
            } catch (TopologyConfigException e) {
                assertEquals(cidr, "invalid-cidr", singleCode(e));
            }
            assertNull(b.getResource("VPC"));
            try {
                b.finalizeGraph();
                fail(cidr);
            } catch (TopologyConfigException e) {
                assertEquals("invalid-cidr", singleCode(e));
            }
        }
    }

    @Test
    public void testPartitionsMustFitNetwork() {
        TopologyBuilder b = Topology.builder("b");
        try {
            b.declareNetwork("VPC", "10.0.0.0/24", List.of(
                    PartitionSpec.externallyReachable("public", 26),
                    PartitionSpec.isolated("private", 26)));
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("address-space-exhausted", singleCode(e));
            assertEquals("VPC.private", e.diagnostics().get(0).resource());
        }
        assertTrue(b.resources().isEmpty());

        var fits = b.declareNetwork("VPC", "10.0.0.0/24", List.of(
                PartitionSpec.externallyReachable("public", 27),
                PartitionSpec.isolated("private", 27)));
        assertEquals("10.0.0.0/24", fits.cidrBlock());
    }

    @Test
    public void testZoneBlocksAllocatedInDeclarationOrder() {
        assertEquals(NetworkFabric.MAX_AVAILABILITY_ZONES, vpc.partition("public").zoneBlocks().size());
        assertEquals("[10.0.0.0/24, 10.0.1.0/24, 10.0.2.0/24]", vpc.partition("public").zoneBlocks().toString());
        assertEquals("10.0.3.0/24", vpc.partition("private").zoneBlocks().get(0).toString());
    }

    @Test(expected = TopologyConfigException.class)
    public void testUnknownPartitionLookup() {
        vpc.partition("nope");
    }

    // ── Filters & secrets ────────────────────────────────────────

    @Test
    public void testDuplicateNameRejected() {
        try {
            t.declareTrafficFilter("DbSG", vpc);
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("duplicate-name", singleCode(e));
        }
    }

    @Test
    public void testSecretFields() {
        assertEquals(List.of("username", "password"), creds.fieldNames());
        assertEquals(new SecretFieldRef(creds, "password"), creds.field("password"));
        try {
            creds.field("token");
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("unknown-secret-field", singleCode(e));
        }
    }

    @Test(expected = TopologyConfigException.class)
    public void testBlankNameRejected() {
        t.declareComputeCluster(" ", vpc);
    }

    // ── Stateful cluster ─────────────────────────────────────────

    @Test
    public void testDeclareStatefulCluster() {
        var db = declareDb();
        assertEquals(StatefulServiceCluster.DEFAULT_PORT, db.port());
        assertEquals(RemovalPolicy.DESTROY, db.removalPolicy());
        assertEquals(List.of(vpc, vpc.partition("private"), dbSg, creds), db.references());
    }

    @Test
    public void testStatefulClusterInPublicPartitionRejected() {
        try {
            t.declareStatefulCluster("Db", vpc, vpc.partition("public"), dbSg, creds,
                    InstanceType.of("t3", "medium"), 1);
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("reachability-mismatch", singleCode(e));
        }
        assertNull(t.getResource("Db"));
    }

    @Test
    public void testStatefulClusterNeedsCredentials() {
        var secret = t.declareSecret("ApiKey", GeneratedSecretSpec.of("key"));
        try {
            t.declareStatefulCluster("Db", vpc, vpc.partition("private"), dbSg, secret,
                    InstanceType.of("t3", "medium"), 1);
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("missing-credential-field", singleCode(e));
        }
    }

    @Test
    public void testStatefulClusterInstanceCount() {
        try {
            t.declareStatefulCluster("Db", vpc, vpc.partition("private"), dbSg, creds,
                    InstanceType.of("t3", "medium"), 0);
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("invalid-instance-count", singleCode(e));
        }
    }

    @Test
    public void testFilterAttachesToOneConsumer() {
        declareDb();
        try {
            declareService("Svc", dbSg);
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("filter-already-attached", singleCode(e));
        }
    }

    @Test
    public void testUndeclaredHandleRejected() {
        var foreign = new TrafficFilter("Foreign", vpc);
        try {
            t.declareStatefulCluster("Db", vpc, vpc.partition("private"), foreign, creds,
                    InstanceType.of("t3", "medium"), 1);
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("dangling-reference", singleCode(e));
            assertEquals("Foreign", e.diagnostics().get(0).resource());
        }
    }

    @Test
    public void testHandleFromOtherBuilderIsDangling() {
        TopologyBuilder other = Topology.builder("other");
        var otherVpc = other.declareNetwork("VPC", List.of(
                PartitionSpec.externallyReachable("public", 24),
                PartitionSpec.isolated("private", 24)));
        try {
            t.declareTrafficFilter("X", otherVpc);
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("dangling-reference", singleCode(e));
        }
    }

    // ── Compute ──────────────────────────────────────────────────

    @Test
    public void testTaskTemplateReferencesBoundSecrets() {
        var task = declareTask();
        assertEquals(List.of(creds), task.references());
        assertEquals(List.of(creds), task.boundSecrets());
    }

    @Test
    public void testTaskTemplateValidation() {
        try {
            t.declareTaskTemplate("Task", "", 256, 512, List.of(), Map.of());
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("invalid-task", singleCode(e));
        }
        try {
            t.declareTaskTemplate("Task", "nginx", 256, 512,
                    List.of(PortMapping.tcp(80), PortMapping.tcp(80)), Map.of());
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("duplicate-port", singleCode(e));
        }
    }

    @Test
    public void testServiceInstanceNeedsReachablePartitionForPublicAddress() {
        var sg = t.declareTrafficFilter("AppSG", vpc);
        var cluster = t.declareComputeCluster("Compute", vpc);
        var task = declareTask();
        try {
            t.declareServiceInstance("Svc", cluster, task, sg, vpc.partition("private"), true);
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("reachability-mismatch", singleCode(e));
        }
        // Without a public address an isolated partition is fine
        var svc = t.declareServiceInstance("Svc", cluster, task, sg, vpc.partition("private"), false);
        assertFalse(svc.assignPublicAddress());
    }

    // ── Load balancing ───────────────────────────────────────────

    @Test
    public void testListenerIdsAndPorts() {
        var lb = t.declareDistributor("LB", vpc, true);
        var l80 = t.addListener(lb, 80, ListenerProtocol.HTTP);
        assertEquals("LB.Listener80", l80.name());
        assertEquals(Optional.of(l80), lb.listenerOn(80));
        try {
            t.addListener(lb, 80, ListenerProtocol.HTTP);
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("duplicate-listener-port", singleCode(e));
        }
        try {
            t.addListener(lb, 0, ListenerProtocol.HTTP);
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("invalid-port", singleCode(e));
        }
    }

    @Test
    public void testAddTargetsKeepsOrder() {
        var a = declareService("A", t.declareTrafficFilter("SgA", vpc));
        var b = declareService("B", t.declareTrafficFilter("SgB", vpc));
        var lb = t.declareDistributor("LB", vpc, true);
        var listener = t.addListener(lb, 80, ListenerProtocol.HTTP);
        assertSame(listener, t.addTargets(listener, b, a));
        assertEquals(List.of(b, a), listener.targets());
        assertEquals(List.of(lb, b, a), listener.references());
    }

    @Test
    public void testTargetNeedsExposedPort() {
        var cluster = t.declareComputeCluster("Compute", vpc);
        var worker = t.declareTaskTemplate("Worker", "busybox", 256, 512, List.of(), Map.of());
        var svc = t.declareServiceInstance("Svc", cluster, worker, t.declareTrafficFilter("AppSG", vpc),
                vpc.partition("public"), true);
        var listener = t.addListener(t.declareDistributor("LB", vpc, true), 80, ListenerProtocol.HTTP);
        try {
            t.addTargets(listener, svc);
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("target-without-port", singleCode(e));
        }
        assertTrue(listener.targets().isEmpty());
    }

    @Test
    public void testDuplicateTargetWarnsByDefault() {
        var svc = declareService("Svc", t.declareTrafficFilter("AppSG", vpc));
        declareDb();
        var lb = t.declareDistributor("LB", vpc, true);
        var listener = t.addListener(lb, 80, ListenerProtocol.HTTP);
        t.addTargets(listener, svc);
        t.addTargets(listener, svc);
        assertEquals(2, listener.targets().size());

        ResourceGraph graph = t.finalizeGraph();
        assertTrue(graph.warnings().stream().anyMatch(w -> w.code().equals("duplicate-target")));
    }

    @Test
    public void testDuplicateTargetRejectedWhenConfigured() {
        t = Topology.builder("strict", StackEnvironment.unresolved(),
                TopologyOptions.defaults().withDuplicateTargets(LintPolicy.REJECT));
        setUpStrict();
        var svc = t.<ServiceInstance>getResource("Svc");
        var listener = t.<Listener>getResource("LB.Listener80");
        try {
            t.addTargets(listener, svc);
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("duplicate-target", singleCode(e));
        }
        assertEquals(List.of(svc), listener.targets());
    }

    private void setUpStrict() {
        vpc = t.declareNetwork("VPC", List.of(
                PartitionSpec.externallyReachable("public", 24),
                PartitionSpec.isolated("private", 24)));
        creds = t.declareSecret("Creds", Map.of("username", "admin"), GeneratedSecretSpec.of("password", 16));
        var svc = declareService("Svc", t.declareTrafficFilter("AppSG", vpc));
        var lb = t.declareDistributor("LB", vpc, true);
        t.addTargets(t.addListener(lb, 80, ListenerProtocol.HTTP), svc);
    }

    @Test
    public void testTargetOrderedAfterListenerIsACycle() {
        var svc = declareService("Svc", t.declareTrafficFilter("AppSG", vpc));
        var lb = t.declareDistributor("LB", vpc, true);
        var listener = t.addListener(lb, 80, ListenerProtocol.HTTP);
        t.addOrderingConstraint(listener, svc);
        try {
            t.addTargets(listener, svc);
            fail();
        } catch (TopologyCycleException e) {
            assertTrue(e.getMessage().contains("Svc"));
        }
        assertTrue(listener.targets().isEmpty());
    }

    // ── Cross-cutting relationships ──────────────────────────────

    @Test
    public void testIngressRulesAreNumbered() {
        var appSg = t.declareTrafficFilter("AppSG", vpc);
        var r0 = t.addIngressRule(dbSg, appSg, IpProtocol.TCP, 27017, "mongo");
        var r1 = t.addIngressRule(dbSg, appSg, Port.tcpRange(8000, 8080), "range");
        assertEquals("DbSG.Ingress0", r0.name());
        assertEquals("DbSG.Ingress1", r1.name());
        assertEquals(List.of(r0, r1), dbSg.rules());
        assertEquals(List.of(dbSg, appSg), r0.references());
    }

    @Test
    public void testMutualIngressIsNotACycle() {
        declareDb();
        var appSg = t.declareTrafficFilter("AppSG", vpc);
        declareService("Svc", appSg);
        t.addIngressRule(dbSg, appSg, IpProtocol.TCP, 27017, "");
        t.addIngressRule(appSg, dbSg, IpProtocol.TCP, 80, "");
        ResourceGraph graph = t.finalizeGraph();
        assertNotNull(graph.resource("AppSG.Ingress0"));
    }

    @Test
    public void testIngressFromAddressRange() {
        var lbSg = t.declareTrafficFilter("LbSG", vpc);
        var rule = t.addIngressRule(lbSg, "0.0.0.0/0", Port.tcp(443), "public https");
        assertEquals("LbSG.Ingress0", rule.name());
        assertEquals(Cidr.ANY_IPV4, rule.sourceCidr().orElseThrow());
        assertFalse(rule.sourceFilter().isPresent());
        assertEquals(List.of(lbSg), rule.references());

        try {
            t.addIngressRule(lbSg, "0.0.0.0/33", Port.tcp(443), "");
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("invalid-cidr", singleCode(e));
        }
        assertEquals(List.of(rule), lbSg.rules());
    }

    @Test
    public void testGrantPermission() {
        declareDb();
        var svc = declareService("Svc", t.declareTrafficFilter("AppSG", vpc));
        var g0 = t.grantPermission(svc, List.of("secretsmanager:GetSecretValue"), List.of(creds));
        var g1 = t.grantPermission(svc, List.of("secretsmanager:DescribeSecret"), List.of(creds));
        assertEquals("Svc.Grant0", g0.name());
        assertEquals("Svc.Grant1", g1.name());
        assertEquals(List.of(svc, creds), g0.references());
    }

    @Test
    public void testGrantNeedsActions() {
        var svc = declareService("Svc", t.declareTrafficFilter("AppSG", vpc));
        try {
            t.grantPermission(svc, List.of(), List.of(creds));
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("empty-grant", singleCode(e));
        }
    }

    @Test
    public void testOrderingConstraintRecorded() {
        var db = declareDb();
        var svc = declareService("Svc", t.declareTrafficFilter("AppSG", vpc));
        var c = t.addOrderingConstraint(db, svc);
        assertEquals(List.of(c), t.constraints());
    }

    @Test(expected = TopologyCycleException.class)
    public void testConstraintAgainstReferenceIsACycle() {
        // The cluster already references the filter
        var db = declareDb();
        t.addOrderingConstraint(db, dbSg);
    }

    // ── Finalize ─────────────────────────────────────────────────

    @Test
    public void testFinalizeNodeSetEqualsDeclarations() {
        declareDb();
        var svc = declareService("Svc", t.declareTrafficFilter("AppSG", vpc));
        var lb = t.declareDistributor("LB", vpc, true);
        t.addTargets(t.addListener(lb, 80, ListenerProtocol.HTTP), svc);
        List<Resource> declared = List.copyOf(t.resources());

        ResourceGraph graph = t.finalizeGraph();
        assertEquals(declared, graph.resources());
        assertEquals(new HashSet<>(declared), new HashSet<>(graph.creationOrder()));
        assertEquals(TopologyBuilder.State.FINALIZED, t.state());
        assertTrue(graph.warnings().isEmpty());
    }

    @Test
    public void testCreationOrderRespectsEdges() {
        var db = declareDb();
        var svc = declareService("Svc", t.declareTrafficFilter("AppSG", vpc));
        t.addOrderingConstraint(db, svc);
        ResourceGraph graph = t.finalizeGraph();

        List<Resource> order = graph.creationOrder();
        for (Resource r : order)
            for (Resource dep : graph.dependenciesOf(r))
                assertTrue(dep + " before " + r, order.indexOf(dep) < order.indexOf(r));
        assertEquals(List.of(db), graph.explicitDependenciesOf(svc));
    }

    @Test
    public void testMutationAfterFinalizeRejected() {
        declareDb();
        t.finalizeGraph();
        try {
            t.declareComputeCluster("Late", vpc);
            fail();
        } catch (TopologyStateException e) {
            assertTrue(e.getMessage().contains("test"));
        }
        try {
            t.finalizeGraph();
            fail();
        } catch (TopologyStateException expected) {
        }
        assertNull(t.getResource("Late"));
    }

    @Test
    public void testFinalizedResourcesCannotBeAppendedTo() {
        declareDb();
        var appSg = t.declareTrafficFilter("AppSG", vpc);
        var svc = declareService("Svc", appSg);
        var lb = t.declareDistributor("LB", vpc, true);
        var listener = t.addListener(lb, 80, ListenerProtocol.HTTP);
        t.addTargets(listener, svc);
        t.addIngressRule(dbSg, appSg, IpProtocol.TCP, 27017, "");
        ResourceGraph graph = t.finalizeGraph();
        List<Resource> listenerDeps = graph.dependenciesOf(listener);

        try {
            listener.appendTarget(svc);
            fail();
        } catch (TopologyStateException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("LB.Listener80"));
        }
        try {
            dbSg.appendRule(new IngressRule("DbSG.Ingress1", dbSg, appSg, Port.tcp(22), "late"));
            fail();
        } catch (TopologyStateException expected) {
        }
        try {
            lb.appendListener(new Listener("LB.Listener443", lb, 443, ListenerProtocol.HTTPS));
            fail();
        } catch (TopologyStateException expected) {
        }

        assertEquals(List.of(svc), listener.targets());
        assertEquals(1, dbSg.rules().size());
        assertEquals(List.of(listener), lb.listeners());
        assertEquals(listenerDeps, graph.dependenciesOf(listener));
        assertTrue(graph.resources().stream().allMatch(r -> ((AbstractResource) r).isFrozen()));
    }

    @Test
    public void testFinalizeAggregatesErrors() {
        declareDb();
        t.declareTrafficFilter("Orphan", vpc);
        var lb = t.declareDistributor("LB", vpc, true);
        t.addListener(lb, 80, ListenerProtocol.HTTP);
        try {
            t.finalizeGraph();
            fail();
        } catch (TopologyConfigException e) {
            List<String> codes = e.diagnostics().stream().map(Diagnostic::code).toList();
            assertEquals(List.of("orphan-filter", "listener-without-targets"), codes);
            assertTrue(e.getMessage().startsWith("2 topology errors"));
        }
        // Failure leaves the builder open
        assertEquals(TopologyBuilder.State.OPEN, t.state());
    }

    @Test
    public void testFinalizeWithoutNetwork() {
        try {
            Topology.builder("empty").finalizeGraph();
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("missing-network", singleCode(e));
        }
    }

    @Test
    public void testRejectedDeclarationBlocksFinalize() {
        try {
            t.declareStatefulCluster("Db", vpc, vpc.partition("public"), dbSg, creds,
                    InstanceType.of("t3", "medium"), 1);
            fail();
        } catch (TopologyConfigException expected) {
        }
        try {
            t.finalizeGraph();
            fail();
        } catch (TopologyConfigException e) {
            assertEquals("reachability-mismatch", singleCode(e));
        }
    }

    @Test
    public void testLintPolicies() {
        t.declareSecret("Unused", GeneratedSecretSpec.of("token"));
        declareDb();
        ResourceGraph graph = t.finalizeGraph();
        List<String> codes = graph.warnings().stream().map(Diagnostic::code).toList();
        // public partition holds nothing
        assertEquals(List.of("unused-partition", "unreferenced-secret"), codes);
        assertEquals("VPC.public", graph.warnings().get(0).resource());
    }

    @Test
    public void testLintRejectAndIgnore() {
        TopologyOptions options = TopologyOptions.defaults()
                .withUnusedPartitions(LintPolicy.IGNORE)
                .withUnreferencedSecrets(LintPolicy.REJECT);
        TopologyBuilder b = Topology.builder("lint", StackEnvironment.unresolved(), options);
        var net = b.declareNetwork("VPC", List.of(
                PartitionSpec.externallyReachable("public", 24),
                PartitionSpec.isolated("private", 24)));
        b.declareSecret("Unused", GeneratedSecretSpec.of("token"));
        try {
            b.finalizeGraph();
            fail();
        } catch (TopologyConfigException e) {
            Diagnostic d = e.diagnostics().get(0);
            assertEquals(1, e.diagnostics().size());
            assertEquals("unreferenced-secret", d.code());
            assertTrue(d.isError());
        }
        assertEquals(2, net.partitions().size());
    }

    @Test
    public void testDistributorWithoutListenersWarns() {
        declareDb();
        t.declareDistributor("LB", vpc, false);
        ResourceGraph graph = t.finalizeGraph();
        assertTrue(graph.warnings().stream()
                .anyMatch(w -> w.code().equals("distributor-without-listeners") && w.resource().equals("LB")));
    }

    @Test
    public void testEnvironmentCarriedIntoGraph() {
        StackEnvironment env = StackEnvironment.of("123456789012", "us-east-1");
        TopologyBuilder b = Topology.builder("env", env);
        b.declareNetwork("VPC", List.of(
                PartitionSpec.externallyReachable("public", 24),
                PartitionSpec.isolated("private", 24)));
        assertEquals(env, b.finalizeGraph().environment());
    }
}
