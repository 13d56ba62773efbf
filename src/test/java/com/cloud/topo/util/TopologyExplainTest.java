package com.cloud.topo.util;

import com.cloud.topo.Topology;
import com.cloud.topo.TopologyBuilder;
import com.cloud.topo.engine.ResourceGraph;
import com.cloud.topo.resource.*;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class TopologyExplainTest {

    private TopologyExplain explain;

    @Before
    public void setUp() {
        TopologyBuilder t = Topology.builder("explain");
        var vpc = t.declareNetwork("VPC", List.of(
                PartitionSpec.externallyReachable("public", 24),
                PartitionSpec.isolated("private", 24)));
        var dbSg = t.declareTrafficFilter("DbSG", vpc);
        var creds = t.declareSecret("Creds", Map.of("username", "admin"), GeneratedSecretSpec.of("password"));
        var db = t.declareStatefulCluster("Db", vpc, vpc.partition("private"), dbSg, creds,
                InstanceType.of("t3", "medium"), 1);
        var compute = t.declareComputeCluster("Compute", vpc);
        t.addOrderingConstraint(db, compute);
        ResourceGraph graph = t.finalizeGraph();
        explain = new TopologyExplain(graph);
    }

    @Test
    public void testDumpTopology() {
        String dump = explain.dumpTopology();
        assertTrue(dump, dump.startsWith("Topology explain (7 resources, 9 edges):\n"));
        assertTrue(dump, dump.contains("  [0] VPC (NETWORK_FABRIC) -> VPC.public, VPC.private, DbSG, Db, Compute\n"));
        assertTrue(dump, dump.contains("  [6] Compute (COMPUTE_CLUSTER)\n"));
        assertTrue(dump, dump.contains("  ! WARNING [unused-partition] VPC.public:"));
    }

    @Test
    public void testExplainResource() {
        String text = explain.explainResource("Db");
        assertTrue(text, text.contains("Kind: Database cluster"));
        assertTrue(text, text.contains("Depends on (4): VPC, VPC.private, DbSG, Creds"));
        assertTrue(text, text.contains("Dependents (1): Compute"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExplainUnknownResource() {
        explain.explainResource("Nope");
    }

    @Test
    public void testMermaid() {
        String mermaid = explain.toMermaid();
        assertTrue(mermaid.startsWith("graph TD;\n"));
        assertTrue(mermaid, mermaid.contains("  VPC_public[\"VPC.public<br/><i>Subnet</i>\"];\n"));
        assertTrue(mermaid, mermaid.contains("  VPC --> VPC_public;\n"));
        assertTrue(mermaid, mermaid.contains("  Db -. \"after\" .-> Compute;\n"));
        assertFalse(mermaid, mermaid.contains("Db --> Compute"));
    }
}
