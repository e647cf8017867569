package com.infragraph.core.graph;

import com.infragraph.core.model.Dialect;
import com.infragraph.core.model.EdgeHint;
import com.infragraph.core.model.EdgeKind;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.model.UnresolvedReference;
import com.infragraph.core.parser.IacDocument;
import com.infragraph.core.parser.ParseResult;
import com.infragraph.core.parser.impl.terraform.TerraformParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TerraformModuleExpander}.
 */
class TerraformModuleExpanderTest {

    private final TerraformParser parser = new TerraformParser();
    private final TerraformModuleExpander expander = new TerraformModuleExpander();

    @Test
    void expand_withoutModuleCalls_returnsResultsUnchanged() {
        List<ParseResult> results = List.of(parse("main.tf", """
            resource "aws_vpc" "main" {
              cidr_block = "10.0.0.0/16"
            }
            """));

        assertThat(expander.expand(results)).isSameAs(results);
    }

    @Test
    void expand_localModule_rewritesInternalReferencesAndFoldsMember() {
        // Given: a caller and one module document
        ParseResult caller = parse("main.tf", """
            module "queue" {
              source = "./modules/queue"
            }
            """);
        ParseResult member = parse("modules/queue/main.tf", """
            resource "aws_sqs_queue" "dlq" {
              name = "dead-letters"
            }

            resource "aws_sqs_queue" "jobs" {
              redrive_policy = "${aws_sqs_queue.dlq.arn}"
              tags = {
                Name = "job-queue"
              }
            }
            """);

        // When: expanding
        List<ParseResult> expanded = expander.expand(List.of(caller, member));

        // Then: the caller owns the prefixed copies and the member contributes nothing
        assertThat(expanded.get(0).nodes()).extracting(ResourceNode::id).containsExactly(
            "terraform:aws_sqs_queue:module_queue__dlq",
            "terraform:aws_sqs_queue:module_queue__jobs");
        ResourceNode jobs = expanded.get(0).nodes().get(1);
        assertThat(jobs.attributes()).containsEntry("redrive_policy", "${aws_sqs_queue.module_queue__dlq.arn}");
        assertThat(jobs.displayName()).isEqualTo("job-queue");
        assertThat(jobs.tags())
            .containsEntry(ResourceNode.TAG_MODULE, "queue")
            .containsEntry(ResourceNode.TAG_SOURCE_FILE, "modules/queue/main.tf");
        assertThat(expanded.get(0).nodes().get(0).displayName()).isEqualTo("module_queue__dlq");
        assertThat(expanded.get(1).nodes()).isEmpty();
        assertThat(expanded.get(1).source()).isEqualTo("modules/queue/main.tf");
    }

    @Test
    void expand_nestedModules_composePrefixesAndFollowOutputs() {
        // Given: root -> app -> db, where app re-exports the db endpoint
        ParseResult root = parse("main.tf", """
            module "app" {
              source = "./modules/app"
            }

            resource "aws_route53_record" "db" {
              records = [module.app.db_endpoint]
            }
            """);
        ParseResult app = parse("modules/app/main.tf", """
            module "db" {
              source = "../db"
            }

            resource "aws_instance" "server" {
              user_data = "DB=${module.db.endpoint}"
            }

            output "db_endpoint" {
              value = module.db.endpoint
            }
            """);
        ParseResult db = parse("modules/db/main.tf", """
            resource "aws_db_instance" "main" {
              engine = "postgres"
            }

            output "endpoint" {
              value = aws_db_instance.main.endpoint
            }
            """);

        // When: expanding
        List<ParseResult> expanded = expander.expand(List.of(root, app, db));

        // Then: the database carries both prefixes and both output references become hints
        String database = "terraform:aws_db_instance:module_app__module_db__main";
        assertThat(expanded.get(0).nodes()).extracting(ResourceNode::id).containsExactlyInAnyOrder(
            "terraform:aws_route53_record:db",
            "terraform:aws_instance:module_app__server",
            database);
        assertThat(expanded.get(0).nodes()).filteredOn(node -> node.id().equals(database))
            .extracting(node -> node.tags().get(ResourceNode.TAG_MODULE)).containsExactly("app.db");
        assertThat(expanded.get(0).edgeHints()).containsExactlyInAnyOrder(
            new EdgeHint(database, "terraform:aws_instance:module_app__server", EdgeKind.ATTRIBUTE_REFERENCE),
            new EdgeHint(database, "terraform:aws_route53_record:db", EdgeKind.ATTRIBUTE_REFERENCE));
        assertThat(expanded.get(1).nodes()).isEmpty();
        assertThat(expanded.get(2).nodes()).isEmpty();
    }

    @Test
    void expand_memberDependsOn_isMappedToInstanceIds() {
        ParseResult caller = parse("main.tf", """
            module "net" {
              source = "./net"
            }
            """);
        ParseResult member = parse("net/main.tf", """
            resource "aws_vpc" "this" {
              cidr_block = "10.0.0.0/16"
            }

            resource "aws_internet_gateway" "this" {
              depends_on = [aws_vpc.this]
            }
            """);

        List<ParseResult> expanded = expander.expand(List.of(caller, member));

        assertThat(expanded.get(0).edgeHints()).containsExactly(new EdgeHint(
            "terraform:aws_vpc:module_net__this", "terraform:aws_internet_gateway:module_net__this",
            EdgeKind.EXPLICIT_DEPENDENCY));
        assertThat(expanded.get(0).nodes().get(1).attributes())
            .containsEntry("depends_on", List.of(new UnresolvedReference("aws_vpc.module_net__this")));
    }

    @Test
    void expand_registryOrMissingSource_leavesDocumentsAlone() {
        // Given: a registry module and a local path without documents
        ParseResult caller = parse("main.tf", """
            module "vpc" {
              source = "terraform-aws-modules/vpc/aws"
            }

            module "missing" {
              source = "./modules/missing"
            }

            resource "aws_s3_bucket" "logs" {
              bucket = "logs"
            }
            """);
        ParseResult other = parse("modules/other/main.tf", """
            resource "aws_sqs_queue" "jobs" {
              name = "jobs"
            }
            """);

        // When: expanding
        List<ParseResult> expanded = expander.expand(List.of(caller, other));

        // Then: nothing is copied and the uncalled document keeps its resources
        assertThat(expanded.get(0).nodes()).extracting(ResourceNode::id)
            .containsExactly("terraform:aws_s3_bucket:logs");
        assertThat(expanded.get(1).nodes()).extracting(ResourceNode::id)
            .containsExactly("terraform:aws_sqs_queue:jobs");
    }

    @Test
    void expand_recursiveModule_stopsAtCycle() {
        ParseResult root = parse("main.tf", """
            module "loop" {
              source = "./modules/loop"
            }
            """);
        ParseResult loop = parse("modules/loop/main.tf", """
            module "again" {
              source = "./"
            }

            resource "aws_sqs_queue" "q" {
              name = "q"
            }
            """);

        List<ParseResult> expanded = expander.expand(List.of(root, loop));

        assertThat(expanded.get(0).nodes()).extracting(ResourceNode::id)
            .containsExactly("terraform:aws_sqs_queue:module_loop__q");
    }

    private ParseResult parse(String path, String hcl) {
        return parser.parse(IacDocument.of(path, Dialect.TERRAFORM, hcl));
    }
}
