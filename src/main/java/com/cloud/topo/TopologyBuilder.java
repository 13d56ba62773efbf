package com.cloud.topo;

import com.cloud.topo.api.*;
import com.cloud.topo.config.StackEnvironment;
import com.cloud.topo.config.TopologyOptions;
import com.cloud.topo.engine.DependencyResolver;
import com.cloud.topo.engine.ResourceGraph;
import com.cloud.topo.engine.TopologicalOrder;
import com.cloud.topo.resource.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Topology Builder: primary API for declaring a deployment topology.
 *
 * <p>
 * Resources are declared leaves first: network, filters, secrets, then the
 * database cluster and the container service, then the load balancer, and
 * finally the cross-cutting ingress rules, permission grants and ordering
 * constraints. Every declaration returns a typed handle that later declarations
 * take as input; nothing registers itself implicitly.
 *
 * <h3>Usage Pattern</h3>
 *
 * <pre>{@code
 * TopologyBuilder t = Topology.builder("stack", env);
 * var vpc = t.declareNetwork("VPC", List.of(
 *         PartitionSpec.externallyReachable("public", 24),
 *         PartitionSpec.isolated("private", 24)));
 * var sg = t.declareTrafficFilter("DbSG", vpc);
 * var creds = t.declareSecret("Creds", Map.of("username", "admin"),
 *         GeneratedSecretSpec.of("password", 16));
 * t.declareStatefulCluster("Db", vpc, vpc.partition("private"), sg, creds,
 *         InstanceType.of("t3", "medium"), 1);
 * ResourceGraph graph = t.finalizeGraph();
 * }</pre>
 *
 * <h3>Errors</h3>
 * Each call validates its own inputs and throws synchronously. A declaration
 * that was rejected is also remembered, and {@link #finalizeGraph()} refuses to
 * hand out a graph missing it. Invariants that only make sense for the whole
 * graph (orphan filters, listeners without targets, lints) are checked in
 * {@link #finalizeGraph()} and reported together.
 *
 * <p>
 * The builder is stateful and not thread-safe. Once {@link #finalizeGraph()}
 * succeeds the builder is read-only and every mutation throws
 * {@link TopologyStateException}.
 */
public final class TopologyBuilder {
    private static final Logger log = LogManager.getLogger(TopologyBuilder.class);

    public enum State {
        OPEN, FINALIZED
    }

    private final String topologyName;
    private final StackEnvironment environment;
    private final TopologyOptions options;

    // Declared resources in declaration order, plus name lookup
    private final List<Resource> resources = new ArrayList<>();
    private final Map<String, Resource> resourcesByName = new HashMap<>();
    private final List<OrderingConstraint> constraints = new ArrayList<>();

    // Filter name -> the single consumer it is attached to
    private final Map<String, Resource> filterConsumers = new HashMap<>();
    private final Map<String, Integer> grantCounts = new HashMap<>();

    // Findings from declarations that were refused
    private final List<Diagnostic> rejections = new ArrayList<>();

    private NetworkFabric fabric;
    private State state = State.OPEN;

    private TopologyBuilder(String topologyName, StackEnvironment environment, TopologyOptions options) {
        this.topologyName = topologyName;
        this.environment = environment;
        this.options = options;
    }

    /**
     * Creates a new builder with an unresolved environment and default options.
     *
     * @param topologyName Stack name, also used in logs.
     */
    public static TopologyBuilder create(String topologyName) {
        return create(topologyName, StackEnvironment.unresolved(), TopologyOptions.defaults());
    }

    public static TopologyBuilder create(String topologyName, StackEnvironment environment,
            TopologyOptions options) {
        return new TopologyBuilder(topologyName, Objects.requireNonNull(environment, "environment"),
                Objects.requireNonNull(options, "options"));
    }

    // ── Network ──────────────────────────────────────────────────

    /**
     * Declares the network fabric with {@link NetworkFabric#DEFAULT_CIDR}.
     *
     * @param name  Unique name of the fabric.
     * @param specs Partitions in order. Names must be unique and both reachability
     *              classes must be present.
     * @return The fabric; its partitions are declared along with it.
     */
    public NetworkFabric declareNetwork(String name, List<PartitionSpec> specs) {
        return declareNetwork(name, NetworkFabric.DEFAULT_CIDR, specs);
    }

    public NetworkFabric declareNetwork(String name, String cidrBlock, List<PartitionSpec> specs) {
        return guarded(() -> {
            if (fabric != null)
                throw new TopologyConfigException("duplicate-network", name,
                        "Network " + fabric.name() + " is already declared");
            if (specs == null || specs.isEmpty())
                throw new TopologyConfigException("missing-partitions", name, "Network needs partitions");

            Set<String> seen = new HashSet<>();
            EnumSet<Reachability> classes = EnumSet.noneOf(Reachability.class);
            for (PartitionSpec spec : specs) {
                if (!seen.add(spec.name()))
                    throw new TopologyConfigException("duplicate-partition", name + "." + spec.name(),
                            "Partition name '" + spec.name() + "' is used twice");
                classes.add(spec.reachability());
            }
            List<Diagnostic> missing = new ArrayList<>();
            for (Reachability r : EnumSet.complementOf(classes))
                missing.add(Diagnostic.error("missing-reachability-class", name,
                        "Network has no " + r + " partition"));
            if (!missing.isEmpty())
                throw new TopologyConfigException(missing);

            var node = new NetworkFabric(name, cidrBlock, specs);
            checkNameFree(node);
            for (AddressPartition p : node.partitions())
                checkNameFree(p);
            register(node);
            for (AddressPartition p : node.partitions())
                register(p);
            fabric = node;
            return node;
        });
    }

    // ── Filters & secrets ────────────────────────────────────────

    /**
     * Declares a traffic filter with no ingress rules. It must later be attached to
     * exactly one consumer.
     */
    public TrafficFilter declareTrafficFilter(String name, NetworkFabric fabric) {
        return guarded(() -> {
            requirePresent(fabric, "network");
            var node = new TrafficFilter(name, fabric);
            register(node);
            return node;
        });
    }

    /**
     * Declares a secret whose {@code generated} field is produced at provisioning
     * time.
     *
     * @param templateFields Known non-sensitive fields, e.g. a username.
     * @param generated      Recipe for the generated field.
     * @return A handle usable in environment bindings and permission grants.
     */
    public SecretMaterial declareSecret(String name, Map<String, String> templateFields,
            GeneratedSecretSpec generated) {
        return guarded(() -> {
            var node = new SecretMaterial(name, templateFields == null ? Map.of() : templateFields, generated);
            register(node);
            return node;
        });
    }

    public SecretMaterial declareSecret(String name, GeneratedSecretSpec generated) {
        return declareSecret(name, Map.of(), generated);
    }

    // ── Stateful cluster ─────────────────────────────────────────

    public StatefulServiceCluster declareStatefulCluster(String name, NetworkFabric fabric,
            AddressPartition isolatedPartition, TrafficFilter filter, SecretMaterial secret,
            InstanceType instanceType, int instanceCount) {
        return declareStatefulCluster(name, fabric, isolatedPartition, filter, secret, instanceType,
                instanceCount, RemovalPolicy.DESTROY);
    }

    /**
     * Declares the managed database cluster.
     *
     * @param isolatedPartition Must have {@link Reachability#ISOLATED}.
     * @param secret            Must expose {@code username} and {@code password}.
     */
    public StatefulServiceCluster declareStatefulCluster(String name, NetworkFabric fabric,
            AddressPartition isolatedPartition, TrafficFilter filter, SecretMaterial secret,
            InstanceType instanceType, int instanceCount, RemovalPolicy removalPolicy) {
        return guarded(() -> {
            requirePresent(fabric, "network");
            requirePresent(isolatedPartition, "partition");
            requirePresent(filter, "filter");
            requirePresent(secret, "secret");
            requireSameFabric(name, fabric, isolatedPartition.fabric(), isolatedPartition);
            requireSameFabric(name, fabric, filter.fabric(), filter);
            if (isolatedPartition.reachability() != Reachability.ISOLATED)
                throw new TopologyConfigException("reachability-mismatch", name,
                        "Database cluster must be placed in an ISOLATED partition, "
                                + isolatedPartition.name() + " is " + isolatedPartition.reachability());
            if (instanceCount < 1)
                throw new TopologyConfigException("invalid-instance-count", name,
                        "Instance count must be at least 1, got " + instanceCount);
            for (String field : List.of(StatefulServiceCluster.USERNAME_FIELD,
                    StatefulServiceCluster.PASSWORD_FIELD))
                if (!secret.hasField(field))
                    throw new TopologyConfigException("missing-credential-field", name,
                            "Secret " + secret.name() + " has no '" + field + "' field");
            requireUnattached(filter, name);

            var node = new StatefulServiceCluster(name, fabric, isolatedPartition, filter, secret,
                    Objects.requireNonNull(instanceType, "instanceType"), instanceCount,
                    removalPolicy == null ? RemovalPolicy.DESTROY : removalPolicy);
            register(node);
            attach(filter, node);
            return node;
        });
    }

    // ── Compute ──────────────────────────────────────────────────

    public ComputeCluster declareComputeCluster(String name, NetworkFabric fabric) {
        return guarded(() -> {
            requirePresent(fabric, "network");
            var node = new ComputeCluster(name, fabric);
            register(node);
            return node;
        });
    }

    /**
     * Declares a runnable task.
     *
     * @param ports             Exposed container ports, in order.
     * @param secretEnvBindings Environment variable name to secret field. Every
     *                          secret must already be declared.
     */
    public TaskTemplate declareTaskTemplate(String name, String image, int cpu, int memoryMiB,
            List<PortMapping> ports, Map<String, SecretFieldRef> secretEnvBindings) {
        return guarded(() -> {
            if (image == null || image.isBlank())
                throw new TopologyConfigException("invalid-task", name, "Image is required");
            if (cpu <= 0 || memoryMiB <= 0)
                throw new TopologyConfigException("invalid-task", name,
                        "CPU and memory must be positive, got cpu=" + cpu + " memoryMiB=" + memoryMiB);
            List<PortMapping> portList = ports == null ? List.of() : ports;
            Set<Integer> seenPorts = new HashSet<>();
            for (PortMapping p : portList)
                if (!seenPorts.add(p.containerPort()))
                    throw new TopologyConfigException("duplicate-port", name,
                            "Container port " + p.containerPort() + " is exposed twice");
            Map<String, SecretFieldRef> env = secretEnvBindings == null ? Map.of() : secretEnvBindings;
            for (var binding : env.entrySet()) {
                if (binding.getKey() == null || binding.getKey().isBlank())
                    throw new TopologyConfigException("invalid-task", name, "Environment variable name is blank");
                SecretFieldRef ref = binding.getValue();
                requirePresent(ref == null ? null : ref.secret(), "secret for " + binding.getKey());
                if (!ref.secret().hasField(ref.field()))
                    throw new TopologyConfigException("unknown-secret-field", name,
                            binding.getKey() + " refers to missing field " + ref);
            }
            var node = new TaskTemplate(name, image, cpu, memoryMiB, portList, env);
            register(node);
            return node;
        });
    }

    /**
     * Places a task on a compute cluster.
     *
     * @param publicPartition     Partition the tasks run in. Must be
     *                            {@link Reachability#EXTERNALLY_REACHABLE} when
     *                            {@code assignPublicAddress} is true.
     * @param assignPublicAddress Whether tasks get a public address.
     */
    public ServiceInstance declareServiceInstance(String name, ComputeCluster computeCluster,
            TaskTemplate taskTemplate, TrafficFilter filter, AddressPartition publicPartition,
            boolean assignPublicAddress) {
        return guarded(() -> {
            requirePresent(computeCluster, "compute cluster");
            requirePresent(taskTemplate, "task template");
            requirePresent(filter, "filter");
            requirePresent(publicPartition, "partition");
            requireSameFabric(name, computeCluster.fabric(), publicPartition.fabric(), publicPartition);
            requireSameFabric(name, computeCluster.fabric(), filter.fabric(), filter);
            if (assignPublicAddress && publicPartition.reachability() != Reachability.EXTERNALLY_REACHABLE)
                throw new TopologyConfigException("reachability-mismatch", name,
                        "A public address needs an EXTERNALLY_REACHABLE partition, "
                                + publicPartition.name() + " is " + publicPartition.reachability());
            requireUnattached(filter, name);

            var node = new ServiceInstance(name, computeCluster, taskTemplate, filter, publicPartition,
                    assignPublicAddress);
            register(node);
            attach(filter, node);
            return node;
        });
    }

    // ── Load balancing ───────────────────────────────────────────

    public TrafficDistributor declareDistributor(String name, NetworkFabric fabric, boolean internetFacing) {
        return declareDistributor(name, fabric, null, internetFacing);
    }

    /**
     * Declares a load balancer front end.
     *
     * @param filter Optional filter attached to the load balancer, may be null.
     */
    public TrafficDistributor declareDistributor(String name, NetworkFabric fabric, TrafficFilter filter,
            boolean internetFacing) {
        return guarded(() -> {
            requirePresent(fabric, "network");
            if (filter != null) {
                requirePresent(filter, "filter");
                requireSameFabric(name, fabric, filter.fabric(), filter);
                requireUnattached(filter, name);
            }
            var node = new TrafficDistributor(name, fabric, filter, internetFacing);
            register(node);
            if (filter != null)
                attach(filter, node);
            return node;
        });
    }

    /**
     * Adds a listener; its graph id is {@code <distributor>.Listener<port>}.
     */
    public Listener addListener(TrafficDistributor distributor, int port, ListenerProtocol protocol) {
        return guarded(() -> {
            requirePresent(distributor, "load balancer");
            if (port < 1 || port > 65535)
                throw new TopologyConfigException("invalid-port", distributor.name(),
                        "Listener port must be between 1 and 65535, got " + port);
            if (distributor.listenerOn(port).isPresent())
                throw new TopologyConfigException("duplicate-listener-port", distributor.name(),
                        "Port " + port + " already has a listener");
            var node = new Listener(distributor.name() + ".Listener" + port, distributor, port,
                    protocol == null ? ListenerProtocol.HTTP : protocol);
            register(node);
            distributor.appendListener(node);
            return node;
        });
    }

    public Listener addTargets(Listener listener, ServiceInstance... targets) {
        return addTargets(listener, Arrays.asList(targets));
    }

    /**
     * Appends targets to a listener, in order.
     *
     * <p>
     * A target already on the listener is handled by
     * {@link TopologyOptions#duplicateTargets()}: IGNORE and WARN append it anyway,
     * REJECT refuses the whole call. The load balancer forwards to the first port
     * of the target's task, so a task exposing none is refused. The call is
     * all-or-nothing.
     */
    public Listener addTargets(Listener listener, List<ServiceInstance> targets) {
        return guarded(() -> {
            requirePresent(listener, "listener");
            List<ServiceInstance> current = new ArrayList<>(listener.targets());
            var edges = DependencyResolver.deriveEdges(resources, constraints);
            for (ServiceInstance target : targets) {
                requirePresent(target, "target");
                if (target.taskTemplate().ports().isEmpty())
                    throw new TopologyConfigException("target-without-port", listener.name(),
                            "Task " + target.taskTemplate().name() + " of " + target.name() + " exposes no port");
                if (current.contains(target)) {
                    String msg = "Service " + target.name() + " is already a target";
                    if (options.duplicateTargets() == LintPolicy.REJECT)
                        throw new TopologyConfigException("duplicate-target", listener.name(), msg);
                    log.debug("{}: {}", listener.name(), msg);
                } else if (DependencyResolver.reaches(edges, listener.name(), target.name())) {
                    throw new TopologyCycleException("Targeting " + target.name() + " from " + listener.name()
                            + " would create a cycle: " + target.name() + " is ordered after the listener");
                }
                current.add(target);
            }
            for (ServiceInstance target : targets)
                listener.appendTarget(target);
            log.debug("{}: targets now {}", listener.name(), listener.targets().size());
            return listener;
        });
    }

    // ── Cross-cutting relationships ──────────────────────────────

    public IngressRule addIngressRule(TrafficFilter filter, TrafficFilter sourceFilter, IpProtocol protocol,
            int port, String description) {
        return guarded(() -> ingressRule(filter, sourceFilter, new Port(protocol, port, port), description));
    }

    /**
     * Permits {@code port} traffic from {@code sourceFilter} into {@code filter}.
     * Both filters must already be declared. Rule ids are
     * {@code <filter>.Ingress<n>} with n counting from 0.
     */
    public IngressRule addIngressRule(TrafficFilter filter, TrafficFilter sourceFilter, Port port,
            String description) {
        return guarded(() -> ingressRule(filter, sourceFilter, port, description));
    }

    /**
     * Permits {@code port} traffic from an address range into {@code filter}, for
     * example {@code 0.0.0.0/0} to open a public listener.
     *
     * @throws TopologyConfigException with {@code invalid-cidr} if
     *                                 {@code sourceCidr} is not an IPv4 block.
     */
    public IngressRule addIngressRule(TrafficFilter filter, String sourceCidr, Port port, String description) {
        return guarded(() -> {
            requirePresent(filter, "filter");
            Cidr source = Cidr.parse(filter.name(), sourceCidr);
            return ingressRule(filter, id -> new IngressRule(id, filter, source, port, description(description)),
                    port);
        });
    }

    private IngressRule ingressRule(TrafficFilter filter, TrafficFilter sourceFilter, Port port,
            String description) {
        requirePresent(filter, "filter");
        requirePresent(sourceFilter, "source filter");
        requireSameFabric(filter.name(), filter.fabric(), sourceFilter.fabric(), sourceFilter);
        return ingressRule(filter, id -> new IngressRule(id, filter, sourceFilter, port, description(description)),
                port);
    }

    private IngressRule ingressRule(TrafficFilter filter, Function<String, IngressRule> factory, Port port) {
        Objects.requireNonNull(port, "port");
        var node = factory.apply(filter.name() + ".Ingress" + filter.rules().size());
        register(node);
        filter.appendRule(node);
        return node;
    }

    private static String description(String description) {
        return description == null ? "" : description;
    }

    /**
     * Grants {@code identity}'s execution role the given actions on the given
     * resources.
     *
     * @throws TopologyConfigException if any resource is not part of this graph.
     */
    public PermissionGrant grantPermission(ServiceInstance identity, Collection<String> actions,
            Collection<? extends Resource> resources) {
        return guarded(() -> {
            requirePresent(identity, "identity");
            if (actions == null || actions.isEmpty() || actions.stream().anyMatch(a -> a == null || a.isBlank()))
                throw new TopologyConfigException("empty-grant", identity.name(), "Grant needs named actions");
            if (resources == null || resources.isEmpty())
                throw new TopologyConfigException("empty-grant", identity.name(), "Grant needs resources");
            for (Resource r : resources)
                requirePresent(r, "grant resource");
            int n = grantCounts.getOrDefault(identity.name(), 0);
            var node = new PermissionGrant(identity.name() + ".Grant" + n, identity, actions, resources);
            register(node);
            grantCounts.put(identity.name(), n + 1);
            return node;
        });
    }

    /**
     * Requires {@code after} to be created once {@code before} exists.
     *
     * @throws TopologyCycleException if {@code before} is already reachable from
     *                                {@code after}.
     */
    public OrderingConstraint addOrderingConstraint(Resource before, Resource after) {
        return guarded(() -> {
            requirePresent(before, "constraint source");
            requirePresent(after, "constraint target");
            var edges = DependencyResolver.deriveEdges(resources, constraints);
            if (DependencyResolver.reaches(edges, after.name(), before.name()))
                throw new TopologyCycleException("Ordering " + before.name() + " before " + after.name()
                        + " would create a cycle: " + after.name() + " already precedes " + before.name());
            var constraint = new OrderingConstraint(before, after);
            constraints.add(constraint);
            log.debug("Ordering constraint {}", constraint);
            return constraint;
        });
    }

    // ── Finalize ─────────────────────────────────────────────────

    /**
     * Validates the whole graph and freezes it.
     * <ol>
     * <li>Refuses if any earlier declaration was rejected.</li>
     * <li>Checks graph-wide invariants and lints in declaration order.</li>
     * <li>Topologically sorts resources into creation order.</li>
     * </ol>
     * A failed call leaves the builder open.
     *
     * @return The finalized graph.
     * @throws TopologyConfigException with every error found.
     * @throws TopologyCycleException  if the edge set is cyclic.
     * @throws TopologyStateException  if already finalized.
     */
    public ResourceGraph finalizeGraph() {
        checkOpen();
        if (!rejections.isEmpty()) {
            log.warn("Topology {} has {} rejected declaration(s), refusing to finalize", topologyName,
                    rejections.size());
            throw new TopologyConfigException(rejections);
        }

        List<Diagnostic> errors = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();
        if (fabric == null)
            errors.add(Diagnostic.error("missing-network", topologyName, "No network declared"));

        Set<String> referenced = new HashSet<>();
        for (Resource r : resources)
            for (Resource dep : r.references())
                referenced.add(dep.name());

        for (Resource r : resources) {
            if (r instanceof TrafficFilter f && !filterConsumers.containsKey(f.name())) {
                errors.add(Diagnostic.error("orphan-filter", f.name(), "Filter is not attached to any consumer"));
            } else if (r instanceof AddressPartition p && !placesSomething(p)) {
                lint(options.unusedPartitions(), Diagnostic.warning("unused-partition", p.name(),
                        "No cluster or service is placed in this partition"), errors, warnings);
            } else if (r instanceof SecretMaterial s && !referenced.contains(s.name())) {
                lint(options.unreferencedSecrets(), Diagnostic.warning("unreferenced-secret", s.name(),
                        "Nothing consumes this secret"), errors, warnings);
            } else if (r instanceof TrafficDistributor d && d.listeners().isEmpty()) {
                warnings.add(Diagnostic.warning("distributor-without-listeners", d.name(),
                        "Load balancer has no listeners"));
            } else if (r instanceof Listener l) {
                if (l.targets().isEmpty())
                    errors.add(Diagnostic.error("listener-without-targets", l.name(), "Listener has no targets"));
                else if (new HashSet<>(l.targets()).size() < l.targets().size())
                    lint(options.duplicateTargets(), Diagnostic.warning("duplicate-target", l.name(),
                            "Listener has duplicate targets " + l.targets()), errors, warnings);
            }
        }
        if (!errors.isEmpty()) {
            log.warn("Topology {} failed validation with {} error(s)", topologyName, errors.size());
            throw new TopologyConfigException(errors);
        }

        TopologicalOrder topology = DependencyResolver.resolve(resources, constraints);
        for (Diagnostic w : warnings)
            log.warn("{}", w);

        state = State.FINALIZED;
        for (Resource r : resources)
            if (r instanceof AbstractResource node)
                node.freeze();
        log.info("Topology {} finalized: {} resources, {} edges, {} warning(s), environment {}",
                topologyName, topology.nodeCount(), topology.edgeCount(), warnings.size(), environment);
        return new ResourceGraph(topologyName, environment, resources, constraints, topology, warnings);
    }

    // ── Introspection ────────────────────────────────────────────

    public String name() {
        return topologyName;
    }

    public State state() {
        return state;
    }

    public StackEnvironment environment() {
        return environment;
    }

    public TopologyOptions options() {
        return options;
    }

    /** Declared resources so far, in declaration order. */
    public List<Resource> resources() {
        return Collections.unmodifiableList(resources);
    }

    public List<OrderingConstraint> constraints() {
        return Collections.unmodifiableList(constraints);
    }

    /**
     * Retrieve a resource by name during the build phase.
     */
    @SuppressWarnings("unchecked")
    public <T extends Resource> T getResource(String name) {
        return (T) resourcesByName.get(name);
    }

    /** True if this exact handle was declared in this builder. */
    public boolean contains(Resource resource) {
        return resource != null && resourcesByName.get(resource.name()) == resource;
    }

    // ── Internals ────────────────────────────────────────────────

    // Runs one mutation: state check first, then remembers any refusal
    private <T> T guarded(Supplier<T> step) {
        checkOpen();
        try {
            return step.get();
        } catch (TopologyConfigException e) {
            rejections.addAll(e.diagnostics());
            log.warn("Rejected declaration: {}", e.getMessage());
            throw e;
        } catch (TopologyCycleException e) {
            rejections.add(Diagnostic.error("cycle", topologyName, e.getMessage()));
            log.warn("Rejected declaration: {}", e.getMessage());
            throw e;
        }
    }

    private void register(Resource node) {
        checkNameFree(node);
        resources.add(node);
        resourcesByName.put(node.name(), node);
        log.debug("Declared {}", node);
    }

    private void checkNameFree(Resource node) {
        if (resourcesByName.containsKey(node.name()))
            throw new TopologyConfigException("duplicate-name", node.name(),
                    "Duplicate resource name: " + node.name());
    }

    private void requirePresent(Resource r, String role) {
        if (r == null)
            throw new TopologyConfigException("dangling-reference", topologyName, "Missing " + role);
        if (!contains(r))
            throw new TopologyConfigException("dangling-reference", r.name(),
                    "The " + role + " " + r.name() + " is not declared in topology " + topologyName);
    }

    private static void requireSameFabric(String owner, NetworkFabric expected, NetworkFabric actual,
            Resource what) {
        if (expected != actual)
            throw new TopologyConfigException("fabric-mismatch", owner,
                    what.name() + " belongs to network " + actual.name() + ", not " + expected.name());
    }

    private void requireUnattached(TrafficFilter filter, String consumer) {
        Resource existing = filterConsumers.get(filter.name());
        if (existing != null)
            throw new TopologyConfigException("filter-already-attached", consumer,
                    "Filter " + filter.name() + " is already attached to " + existing.name());
    }

    private void attach(TrafficFilter filter, Resource consumer) {
        filterConsumers.put(filter.name(), consumer);
    }

    private boolean placesSomething(AddressPartition p) {
        for (Resource r : resources) {
            if (r instanceof StatefulServiceCluster c && c.partition() == p)
                return true;
            if (r instanceof ServiceInstance s && s.partition() == p)
                return true;
        }
        return false;
    }

    private static void lint(LintPolicy policy, Diagnostic finding, List<Diagnostic> errors,
            List<Diagnostic> warnings) {
        switch (policy) {
            case REJECT -> errors.add(Diagnostic.error(finding.code(), finding.resource(), finding.message()));
            case WARN -> warnings.add(finding);
            case IGNORE -> {
            }
        }
    }

    private void checkOpen() {
        if (state == State.FINALIZED)
            throw new TopologyStateException("Topology " + topologyName + " is already finalized");
    }
}
