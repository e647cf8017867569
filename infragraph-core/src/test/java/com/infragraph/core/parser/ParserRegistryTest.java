package com.infragraph.core.parser;

import com.infragraph.core.model.Dialect;
import com.infragraph.core.parser.impl.bicep.BicepParser;
import com.infragraph.core.parser.impl.terraform.TerraformParser;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration test validating SPI registration and dialect detection of {@link ParserRegistry}.
 *
 * <p>Expected parser count: 4 (Terraform, CloudFormation, Bicep, Pulumi YAML).
 */
class ParserRegistryTest {

    private static final int EXPECTED_PARSER_COUNT = 4;

    @Test
    void serviceLoader_discoversAllRegisteredParsers() {
        List<IacParser> parsers = ServiceLoader.load(IacParser.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(parsers)
            .as("ServiceLoader should discover all %d registered parsers", EXPECTED_PARSER_COUNT)
            .hasSize(EXPECTED_PARSER_COUNT);
    }

    @Test
    void serviceLoader_parserIdsAreUnique() {
        Set<String> ids = ServiceLoader.load(IacParser.class).stream()
            .map(provider -> provider.get().getId())
            .collect(Collectors.toSet());

        assertThat(ids).containsExactlyInAnyOrder("terraform", "cloudformation", "bicep", "pulumi-yaml");
    }

    @Test
    void load_coversEveryDialect() {
        ParserRegistry registry = ParserRegistry.load();

        for (Dialect dialect : Dialect.values()) {
            assertThat(registry.forDialect(dialect))
                .as("parser for %s", dialect)
                .isPresent()
                .get()
                .extracting(IacParser::getDialect)
                .isEqualTo(dialect);
        }
    }

    @Test
    void all_returnsParsersInDialectOrder() {
        ParserRegistry registry = ParserRegistry.load();

        assertThat(registry.all())
            .extracting(IacParser::getDialect)
            .containsExactly(Dialect.TERRAFORM, Dialect.CLOUDFORMATION, Dialect.BICEP, Dialect.PULUMI_YAML);
    }

    @Test
    void detectDialect_matchesFileNamePatterns() {
        ParserRegistry registry = ParserRegistry.load();

        assertThat(registry.detectDialect(Path.of("infra/main.tf"))).contains(Dialect.TERRAFORM);
        assertThat(registry.detectDialect(Path.of("infra/terragrunt.hcl"))).contains(Dialect.TERRAFORM);
        assertThat(registry.detectDialect(Path.of("stacks/network.cfn.yaml"))).contains(Dialect.CLOUDFORMATION);
        assertThat(registry.detectDialect(Path.of("template.json"))).contains(Dialect.CLOUDFORMATION);
        assertThat(registry.detectDialect(Path.of("main.bicep"))).contains(Dialect.BICEP);
        assertThat(registry.detectDialect(Path.of("app/Pulumi.yaml"))).contains(Dialect.PULUMI_YAML);
    }

    @Test
    void detectDialect_withUnknownFile_returnsEmpty() {
        ParserRegistry registry = ParserRegistry.load();

        assertThat(registry.detectDialect(Path.of("README.md"))).isEmpty();
        assertThat(registry.detectDialect(Path.of("values.yaml"))).isEmpty();
    }

    @Test
    void of_withTwoParsersForSameDialect_throwsException() {
        assertThatThrownBy(() -> ParserRegistry.of(List.of(new TerraformParser(), new TerraformParser())))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("TERRAFORM");
    }

    @Test
    void of_withSubset_onlyKnowsThoseDialects() {
        ParserRegistry registry = ParserRegistry.of(List.of(new BicepParser()));

        assertThat(registry.forDialect(Dialect.BICEP)).isPresent();
        assertThat(registry.forDialect(Dialect.TERRAFORM)).isEmpty();
        assertThat(registry.detectDialect(Path.of("main.tf"))).isEmpty();
    }
}
