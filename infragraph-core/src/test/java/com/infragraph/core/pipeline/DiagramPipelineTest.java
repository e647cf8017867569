package com.infragraph.core.pipeline;

import com.infragraph.core.config.LayoutSettings;
import com.infragraph.core.diagnostic.Diagnostic;
import com.infragraph.core.diagnostic.DiagnosticType;
import com.infragraph.core.model.Cluster;
import com.infragraph.core.model.ClusterKind;
import com.infragraph.core.model.Dialect;
import com.infragraph.core.model.Edge;
import com.infragraph.core.model.EdgeKind;
import com.infragraph.core.model.EdgeStyle;
import com.infragraph.core.model.LayoutDirection;
import com.infragraph.core.model.LayoutReadyGraph;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.parser.IacDocument;
import com.infragraph.core.parser.ParserRegistry;
import com.infragraph.core.parser.impl.terraform.TerraformParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Functional tests for {@link DiagramPipeline}.
 */
class DiagramPipelineTest {

    private static final String NETWORK_TF = """
        resource "aws_vpc" "main" {
          cidr_block = "10.0.0.0/16"
        }

        resource "aws_subnet" "app" {
          vpc_id     = aws_vpc.main.id
          cidr_block = "10.0.1.0/24"
        }
        """;

    private static final String COMPUTE_TF = """
        resource "aws_instance" "web" {
          ami       = "ami-123"
          subnet_id = aws_subnet.app.id
        }
        """;

    private DiagramPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new DiagramPipeline(LayoutSettings.defaults());
    }

    @Test
    void run_withReference_producesSingleAttributeEdge() {
        // Given: B interpolates A's identifier
        IacDocument document = IacDocument.of("main.tf", Dialect.TERRAFORM, """
            resource "aws_s3_bucket" "a" {
              bucket = "logs"
            }

            resource "aws_s3_bucket_policy" "b" {
              bucket = "${aws_s3_bucket.a.id}"
            }
            """);

        // When: running the pipeline
        PipelineResult result = pipeline.run(List.of(document));

        // Then: exactly one edge A -> B of kind attribute reference
        assertThat(result.graph().edges()).singleElement()
            .satisfies(edge -> {
                assertThat(edge.from()).isEqualTo("terraform:aws_s3_bucket:a");
                assertThat(edge.to()).isEqualTo("terraform:aws_s3_bucket_policy:b");
                assertThat(edge.kind()).isEqualTo(EdgeKind.ATTRIBUTE_REFERENCE);
                assertThat(edge.styleHint()).isEqualTo(EdgeStyle.DATA);
            });
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void run_withMalformedFile_keepsGoodFilesAndReportsOneParseError() {
        // Given: two well-formed files and one with an unclosed block
        List<IacDocument> documents = List.of(
            IacDocument.of("network.tf", Dialect.TERRAFORM, NETWORK_TF),
            IacDocument.of("broken.tf", Dialect.TERRAFORM, """
                resource "aws_sqs_queue" "jobs" {
                  name = "jobs"
                """),
            IacDocument.of("compute.tf", Dialect.TERRAFORM, COMPUTE_TF));

        // When: running the pipeline
        PipelineResult result = pipeline.run(documents);

        // Then: nodes from the good files survive next to a single parse error
        assertThat(result.graph().nodes()).extracting(ResourceNode::id).containsExactly(
            "terraform:aws_instance:web", "terraform:aws_subnet:app", "terraform:aws_vpc:main");
        assertThat(result.diagnosticsOf(DiagnosticType.PARSE_ERROR)).singleElement()
            .satisfies(d -> assertThat(d.source()).isEqualTo("broken.tf"));
        assertThat(result.hasErrors()).isTrue();
    }

    @Test
    void run_buildsClustersComplexityAndLayout() {
        List<IacDocument> documents = List.of(
            IacDocument.of("network.tf", Dialect.TERRAFORM, NETWORK_TF),
            IacDocument.of("compute.tf", Dialect.TERRAFORM, COMPUTE_TF));

        LayoutReadyGraph graph = pipeline.run(documents).graph();

        assertThat(graph.clustersOf(ClusterKind.PROVIDER)).extracting(Cluster::id).containsExactly("provider:aws");
        assertThat(graph.clustersOf(ClusterKind.NETWORK_CONTAINER)).extracting(Cluster::id).containsExactly(
            "network:terraform:aws_vpc:main", "network:terraform:aws_subnet:app");
        assertThat(graph.complexity().nodeCount()).isEqualTo(3);
        assertThat(graph.complexity().edgeCount()).isEqualTo(2);
        assertThat(graph.layout().direction()).isNotEqualTo(LayoutDirection.AUTO);
        assertThat(graph.layout().edgeStyles().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(2);
        assertThat(graph.edges()).extracting(Edge::styleHint).doesNotContainNull();
    }

    @Test
    void run_withRequestedDirection_usesIt() {
        DiagramPipeline vertical = new DiagramPipeline(LayoutSettings.defaults().withDirection(LayoutDirection.BOTTOM_TOP));

        PipelineResult result = vertical.run(List.of(IacDocument.of("network.tf", Dialect.TERRAFORM, NETWORK_TF)));

        assertThat(result.graph().layout().direction()).isEqualTo(LayoutDirection.BOTTOM_TOP);
    }

    @Test
    void run_isIndependentOfDocumentOrder() {
        List<IacDocument> documents = new ArrayList<>(List.of(
            IacDocument.of("network.tf", Dialect.TERRAFORM, NETWORK_TF),
            IacDocument.of("compute.tf", Dialect.TERRAFORM, COMPUTE_TF),
            IacDocument.of("template.yaml", Dialect.CLOUDFORMATION, """
                Resources:
                  Queue:
                    Type: AWS::SQS::Queue
                """)));

        PipelineResult forward = pipeline.run(documents);
        Collections.reverse(documents);
        PipelineResult backward = pipeline.run(documents);

        assertThat(backward.graph()).isEqualTo(forward.graph());
        assertThat(backward.diagnostics()).containsExactlyInAnyOrderElementsOf(forward.diagnostics());
    }

    @Test
    void run_withSeveralEnvironments_prefixesIdsAndKeepsEnvironmentsApart() {
        // Given: the same stack in dev and prod plus a shared file
        List<IacDocument> documents = List.of(
            IacDocument.of("terraform/dev/network.tf", Dialect.TERRAFORM, NETWORK_TF),
            IacDocument.of("terraform/prod/network.tf", Dialect.TERRAFORM, NETWORK_TF),
            IacDocument.of("global/dns.tf", Dialect.TERRAFORM, """
                resource "aws_route53_zone" "main" {
                  name = "example.com"
                }
                """));

        // When: running the pipeline
        PipelineResult result = pipeline.run(documents);

        // Then: every node is prefixed and each subnet links to its own environment's VPC
        assertThat(result.graph().nodes()).extracting(ResourceNode::id).containsExactly(
            "terraform:aws_route53_zone:shared__main",
            "terraform:aws_subnet:dev__app",
            "terraform:aws_subnet:prod__app",
            "terraform:aws_vpc:dev__main",
            "terraform:aws_vpc:prod__main");
        assertThat(result.graph().edges()).extracting(Edge::from, Edge::to).containsExactly(
            tuple("terraform:aws_vpc:dev__main", "terraform:aws_subnet:dev__app"),
            tuple("terraform:aws_vpc:prod__main", "terraform:aws_subnet:prod__app"));
        assertThat(result.graph().nodes()).extracting(ResourceNode::environment)
            .containsExactly("shared", "dev", "prod", "dev", "prod");
        assertThat(result.diagnosticsOf(DiagnosticType.UNRESOLVED_REFERENCE)).isEmpty();
    }

    @Test
    void run_withDependencyOnSharedResource_linksAcrossEnvironments() {
        // Given: prod depends on a VPC that only shared code declares
        List<IacDocument> documents = List.of(
            IacDocument.of("infra/shared/net.tf", Dialect.TERRAFORM, """
                resource "aws_vpc" "main" {
                  cidr_block = "10.0.0.0/16"
                }
                """),
            IacDocument.of("infra/prod/main.tf", Dialect.TERRAFORM, """
                resource "aws_instance" "web" {
                  ami        = "ami-123"
                  depends_on = [aws_vpc.main]
                }
                """),
            IacDocument.of("infra/dev/main.tf", Dialect.TERRAFORM, """
                resource "aws_instance" "web" {
                  ami = "ami-456"
                }
                """));

        // When: running the pipeline
        PipelineResult result = pipeline.run(documents);

        // Then: the explicit dependency reaches the shared VPC
        assertThat(result.graph().edges()).extracting(Edge::from, Edge::to, Edge::kind).containsExactly(
            tuple("terraform:aws_vpc:shared__main", "terraform:aws_instance:prod__web", EdgeKind.EXPLICIT_DEPENDENCY));
        assertThat(result.diagnosticsOf(DiagnosticType.UNRESOLVED_REFERENCE)).isEmpty();
    }

    @Test
    void run_withLocalModuleCalledTwice_expandsOneInstancePerCall() {
        // Given: a stack instantiating the same network module twice
        List<IacDocument> documents = List.of(
            IacDocument.of("stack/main.tf", Dialect.TERRAFORM, """
                module "net_a" {
                  source = "./modules/network"
                }

                module "net_b" {
                  source = "./modules/network"
                  cidr   = "10.1.0.0/16"
                }

                resource "aws_instance" "web" {
                  ami       = "ami-123"
                  subnet_id = module.net_a.subnet_id
                }
                """),
            IacDocument.of("stack/modules/network/main.tf", Dialect.TERRAFORM, """
                variable "cidr" {
                  default = "10.0.0.0/16"
                }

                resource "aws_vpc" "this" {
                  cidr_block = var.cidr
                }

                resource "aws_subnet" "this" {
                  vpc_id     = aws_vpc.this.id
                  depends_on = [aws_vpc.this]
                }

                output "subnet_id" {
                  value = aws_subnet.this.id
                }
                """));

        // When: running the pipeline
        PipelineResult result = pipeline.run(documents);

        // Then: each instance has its own prefixed resources and the output reference is followed
        assertThat(result.graph().nodes()).extracting(ResourceNode::id).containsExactly(
            "terraform:aws_instance:web",
            "terraform:aws_subnet:module_net_a__this",
            "terraform:aws_subnet:module_net_b__this",
            "terraform:aws_vpc:module_net_a__this",
            "terraform:aws_vpc:module_net_b__this");
        assertThat(result.graph().nodes()).filteredOn(node -> node.logicalName().startsWith("module_net_b__"))
            .extracting(node -> node.tags().get(ResourceNode.TAG_MODULE)).containsOnly("net_b");
        assertThat(result.graph().edges()).extracting(Edge::from, Edge::to).containsExactlyInAnyOrder(
            tuple("terraform:aws_vpc:module_net_a__this", "terraform:aws_subnet:module_net_a__this"),
            tuple("terraform:aws_vpc:module_net_b__this", "terraform:aws_subnet:module_net_b__this"),
            tuple("terraform:aws_subnet:module_net_a__this", "terraform:aws_instance:web"));
        assertThat(result.diagnosticsOf(DiagnosticType.UNRESOLVED_REFERENCE)).isEmpty();
    }

    @Test
    void run_withModuleAcrossEnvironments_prefixesEnvironmentBeforeModule() {
        String caller = """
            module "net" {
              source = "../modules/network"
            }
            """;
        List<IacDocument> documents = List.of(
            IacDocument.of("infra/dev/main.tf", Dialect.TERRAFORM, caller),
            IacDocument.of("infra/prod/main.tf", Dialect.TERRAFORM, caller),
            IacDocument.of("infra/modules/network/main.tf", Dialect.TERRAFORM, """
                resource "aws_vpc" "this" {
                  cidr_block = "10.0.0.0/16"
                }
                """));

        PipelineResult result = pipeline.run(documents);

        assertThat(result.graph().nodes()).extracting(ResourceNode::id).containsExactly(
            "terraform:aws_vpc:dev__module_net__this",
            "terraform:aws_vpc:prod__module_net__this");
        assertThat(result.graph().nodes()).extracting(ResourceNode::environment).containsExactly("dev", "prod");
    }

    @Test
    void run_withSingleEnvironment_tagsWithoutPrefixing() {
        PipelineResult result = pipeline.run(List.of(
            IacDocument.of("envs/staging/network.tf", Dialect.TERRAFORM, NETWORK_TF)));

        assertThat(result.graph().nodes()).extracting(ResourceNode::id)
            .containsExactly("terraform:aws_subnet:app", "terraform:aws_vpc:main");
        assertThat(result.graph().nodes()).extracting(ResourceNode::environment).containsOnly("staging");
    }

    @Test
    void run_withoutParserForDialect_reportsParseError() {
        DiagramPipeline terraformOnly = new DiagramPipeline(LayoutSettings.defaults(),
            ParserRegistry.of(List.of(new TerraformParser())));

        PipelineResult result = terraformOnly.run(List.of(
            IacDocument.of("main.bicep", Dialect.BICEP, "resource x 'a/b@1' = {}")));

        assertThat(result.graph().nodes()).isEmpty();
        assertThat(result.diagnostics()).extracting(Diagnostic::type).containsExactly(DiagnosticType.PARSE_ERROR);
    }

    @Test
    void run_withNoDocuments_returnsEmptyGraph() {
        PipelineResult result = pipeline.run(List.of());

        assertThat(result.graph().nodes()).isEmpty();
        assertThat(result.graph().clusters()).isEmpty();
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void prefixId_prefixesLogicalNameSegment() {
        assertThat(DiagramPipeline.prefixId("cloudformation:AWS::EC2::VPC:Vpc", "dev"))
            .isEqualTo("cloudformation:AWS::EC2::VPC:dev__Vpc");
        assertThat(DiagramPipeline.prefixId("terraform:aws_vpc:main", "prod"))
            .isEqualTo("terraform:aws_vpc:prod__main");
    }
}
