package com.infragraph.core.graph;

import com.infragraph.core.model.Dialect;
import com.infragraph.core.model.Edge;
import com.infragraph.core.model.EdgeHint;
import com.infragraph.core.model.EdgeKind;
import com.infragraph.core.model.ResourceGraph;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.model.UnresolvedReference;
import com.infragraph.core.parser.ParseResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GraphBuilder}.
 */
class GraphBuilderTest {

    private static final String VPC = "terraform:aws_vpc:main";
    private static final String SUBNET = "terraform:aws_subnet:a";
    private static final String INSTANCE = "terraform:aws_instance:web";

    @Test
    void build_assignsProvidersAndSortsNodes() {
        // Given: nodes from two documents
        ParseResult network = result("network.tf", List.of(vpc(), subnet()), List.of());
        ParseResult compute = result("compute.tf", List.of(instance(Map.of())), List.of());

        // When: building
        GraphBuilder.BuildResult built = new GraphBuilder(false).build(List.of(network, compute));

        // Then: nodes are sorted by id and carry the derived provider
        ResourceGraph graph = built.graph();
        assertThat(graph.nodes()).extracting(ResourceNode::id).containsExactly(INSTANCE, SUBNET, VPC);
        assertThat(graph.nodes()).extracting(ResourceNode::provider).containsOnly("aws");
        assertThat(graph.edges()).containsExactly(Edge.of(VPC, SUBNET, EdgeKind.ATTRIBUTE_REFERENCE));
    }

    @Test
    void build_withExplicitAndReferenceOnSamePair_keepsExplicitEdge() {
        // Given: the subnet references the VPC and also declares depends_on on it
        ParseResult network = result("network.tf", List.of(vpc(), subnet()),
            List.of(new EdgeHint(VPC, SUBNET, EdgeKind.EXPLICIT_DEPENDENCY)));

        // When: building
        GraphBuilder.BuildResult built = new GraphBuilder(false).build(List.of(network));

        // Then: one edge of the strongest kind
        assertThat(built.graph().edges()).containsExactly(Edge.of(VPC, SUBNET, EdgeKind.EXPLICIT_DEPENDENCY));
    }

    @Test
    void deduplicate_keepsStrongestKindPerPair() {
        List<Edge> edges = List.of(
            Edge.of("a", "b", EdgeKind.IMPLICIT_ORDERING),
            Edge.of("a", "b", EdgeKind.EXPLICIT_DEPENDENCY),
            Edge.of("a", "b", EdgeKind.ATTRIBUTE_REFERENCE),
            Edge.of("b", "a", EdgeKind.IMPLICIT_ORDERING));

        List<Edge> unique = GraphBuilder.deduplicate(edges);

        assertThat(unique).containsExactly(
            Edge.of("a", "b", EdgeKind.EXPLICIT_DEPENDENCY),
            Edge.of("b", "a", EdgeKind.IMPLICIT_ORDERING));
    }

    @Test
    void build_withRedeclaredNode_laterSourceWins() {
        ResourceNode first = new ResourceNode(VPC, "aws_vpc", null, "first", "main", Dialect.TERRAFORM,
            Map.of("cidr_block", "10.0.0.0/16"), Map.of());
        ResourceNode second = new ResourceNode(VPC, "aws_vpc", null, "second", "main", Dialect.TERRAFORM,
            Map.of("cidr_block", "10.1.0.0/16"), Map.of());

        GraphBuilder.BuildResult built = new GraphBuilder(false).build(List.of(
            result("b.tf", List.of(second), List.of()),
            result("a.tf", List.of(first), List.of())));

        assertThat(built.graph().nodes()).singleElement()
            .satisfies(node -> assertThat(node.displayName()).isEqualTo("second"));
    }

    @Test
    void build_withRedeclaredNode_keepsEdgesOfEveryDeclaration() {
        // Given: two subnets and one instance declared twice, each time on another subnet
        ParseResult network = result("net.tf",
            List.of(node("aws_subnet", "a"), node("aws_subnet", "b")), List.of());
        ParseResult first = result("a.tf",
            List.of(instance(Map.of("subnet_id", new UnresolvedReference("aws_subnet.a.id")))), List.of());
        ParseResult second = result("b.tf",
            List.of(instance(Map.of("subnet_id", new UnresolvedReference("aws_subnet.b.id")))), List.of());

        // When: building
        GraphBuilder.BuildResult built = new GraphBuilder(false).build(List.of(network, first, second));

        // Then: the later declaration wins the attributes, both references stay edges
        assertThat(built.graph().nodes()).filteredOn(node -> node.id().equals(INSTANCE)).singleElement()
            .satisfies(node -> assertThat(node.attributes())
                .containsEntry("subnet_id", new UnresolvedReference("aws_subnet.b.id")));
        assertThat(built.graph().edges()).containsExactlyInAnyOrder(
            Edge.of("terraform:aws_subnet:a", INSTANCE, EdgeKind.ATTRIBUTE_REFERENCE),
            Edge.of("terraform:aws_subnet:b", INSTANCE, EdgeKind.ATTRIBUTE_REFERENCE));
        assertThat(built.diagnostics()).isEmpty();
    }

    @Test
    void build_withoutEdgesAndFallback_chainsEachModuleInstanceSeparately() {
        ResourceNode root = node("aws_s3_bucket", "logs");
        ResourceNode first = moduleNode("aws_sqs_queue", "module_a__jobs", "a");
        ResourceNode second = moduleNode("aws_sqs_queue", "module_b__jobs", "b");
        ResourceNode secondTopic = moduleNode("aws_sns_topic", "module_b__alerts", "b");

        GraphBuilder.BuildResult built = new GraphBuilder(true).build(List.of(
            result("main.tf", List.of(root, first, second, secondTopic), List.of())));

        assertThat(built.graph().edges()).containsExactly(Edge.of(
            "terraform:aws_sns_topic:module_b__alerts", "terraform:aws_sqs_queue:module_b__jobs",
            EdgeKind.IMPLICIT_ORDERING));
    }

    @Test
    void build_isIndependentOfResultOrder() {
        ParseResult network = result("network.tf", List.of(vpc(), subnet()), List.of());
        ParseResult compute = result("compute.tf",
            List.of(instance(Map.of("subnet_id", new UnresolvedReference("aws_subnet.a.id")))), List.of());
        GraphBuilder builder = new GraphBuilder(true);

        GraphBuilder.BuildResult forward = builder.build(List.of(network, compute));
        GraphBuilder.BuildResult backward = builder.build(List.of(compute, network));

        assertThat(forward).isEqualTo(backward);
        assertThat(forward.graph().edges()).hasSize(2);
    }

    @Test
    void build_withoutEdgesAndFallback_chainsNodesInIdOrder() {
        // Given: three unconnected resources
        ParseResult standalone = result("main.tf",
            List.of(node("aws_sqs_queue", "jobs"), node("aws_s3_bucket", "logs"), node("aws_sns_topic", "alerts")),
            List.of());

        // When: building with the implicit ordering fallback
        GraphBuilder.BuildResult built = new GraphBuilder(true).build(List.of(standalone));

        // Then: a chain in id order
        assertThat(built.graph().edges()).containsExactly(
            Edge.of("terraform:aws_s3_bucket:logs", "terraform:aws_sns_topic:alerts", EdgeKind.IMPLICIT_ORDERING),
            Edge.of("terraform:aws_sns_topic:alerts", "terraform:aws_sqs_queue:jobs", EdgeKind.IMPLICIT_ORDERING));
    }

    @Test
    void build_withoutEdgesAndNoFallback_leavesGraphUnconnected() {
        ParseResult standalone = result("main.tf",
            List.of(node("aws_sqs_queue", "jobs"), node("aws_s3_bucket", "logs")), List.of());

        GraphBuilder.BuildResult built = new GraphBuilder(false).build(List.of(standalone));

        assertThat(built.graph().edges()).isEmpty();
    }

    @Test
    void build_withDanglingReference_returnsDiagnostic() {
        ParseResult compute = result("compute.tf",
            List.of(instance(Map.of("subnet_id", new UnresolvedReference("aws_subnet.gone.id")))), List.of());

        GraphBuilder.BuildResult built = new GraphBuilder(false).build(List.of(compute));

        assertThat(built.graph().edges()).isEmpty();
        assertThat(built.diagnostics()).hasSize(1);
    }

    @Test
    void build_withNoResults_returnsEmptyGraph() {
        GraphBuilder.BuildResult built = new GraphBuilder(true).build(List.of());

        assertThat(built.graph()).isEqualTo(ResourceGraph.empty());
        assertThat(built.diagnostics()).isEmpty();
    }

    private static ParseResult result(String source, List<ResourceNode> nodes, List<EdgeHint> hints) {
        return new ParseResult("terraform", source, nodes, hints, Set.of(), List.of(), null);
    }

    private static ResourceNode vpc() {
        return new ResourceNode(VPC, "aws_vpc", null, null, "main", Dialect.TERRAFORM,
            Map.of("cidr_block", "10.0.0.0/16"), Map.of());
    }

    private static ResourceNode subnet() {
        return new ResourceNode(SUBNET, "aws_subnet", null, null, "a", Dialect.TERRAFORM,
            Map.of("vpc_id", new UnresolvedReference("aws_vpc.main.id")), Map.of());
    }

    private static ResourceNode instance(Map<String, Object> attributes) {
        return new ResourceNode(INSTANCE, "aws_instance", null, null, "web", Dialect.TERRAFORM, attributes, Map.of());
    }

    private static ResourceNode moduleNode(String type, String name, String module) {
        return new ResourceNode(ResourceNode.idOf(Dialect.TERRAFORM, type, name), type, null, null, name,
            Dialect.TERRAFORM, Map.of(), Map.of(ResourceNode.TAG_MODULE, module));
    }

    private static ResourceNode node(String type, String name) {
        return new ResourceNode(ResourceNode.idOf(Dialect.TERRAFORM, type, name), type, null, null, name,
            Dialect.TERRAFORM, Map.of(), Map.of());
    }
}
