package com.infragraph.core.parser.impl.bicep;

import com.infragraph.core.diagnostic.DiagnosticType;
import com.infragraph.core.model.Dialect;
import com.infragraph.core.model.EdgeHint;
import com.infragraph.core.model.EdgeKind;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.parser.IacDocument;
import com.infragraph.core.parser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Functional tests for {@link BicepParser}.
 */
class BicepParserTest {

    private static final String VNET_ID = "bicep:Microsoft.Network/virtualNetworks:vnet";
    private static final String SUBNET_ID = "bicep:Microsoft.Network/virtualNetworks/subnets:subnet";

    private BicepParser parser;

    @BeforeEach
    void setUp() {
        parser = new BicepParser();
    }

    @Test
    void parse_withResources_extractsNodesAndTags() {
        // Given: a virtual network with tags
        String bicep = """
            resource vnet 'Microsoft.Network/virtualNetworks@2023-04-01' = {
              name: 'core-vnet'
              location: location
              tags: {
                owner: 'platform'
              }
            }
            """;

        // When: parsing
        ParseResult result = parser.parse(IacDocument.of("main.bicep", Dialect.BICEP, bicep));

        // Then: one node with the API version moved into tags
        assertThat(result.diagnostics()).isEmpty();
        ResourceNode vnet = result.nodes().get(0);
        assertThat(vnet.id()).isEqualTo(VNET_ID);
        assertThat(vnet.displayName()).isEqualTo("core-vnet");
        assertThat(vnet.logicalName()).isEqualTo("vnet");
        assertThat(vnet.tags())
            .containsEntry("owner", "platform")
            .containsEntry("apiVersion", "2023-04-01");
    }

    @Test
    void parse_withParentProperty_emitsImplicitOrderingHint() {
        // Given: a subnet declared with parent: vnet
        String bicep = """
            resource vnet 'Microsoft.Network/virtualNetworks@2023-04-01' = {
              name: 'core-vnet'
            }

            resource subnet 'Microsoft.Network/virtualNetworks/subnets@2023-04-01' = {
              parent: vnet
              name: 'app'
            }
            """;

        // When: parsing
        ParseResult result = parser.parse(IacDocument.of("main.bicep", Dialect.BICEP, bicep));

        // Then: parent -> child ordering hint
        assertThat(result.edgeHints()).containsExactly(new EdgeHint(VNET_ID, SUBNET_ID, EdgeKind.IMPLICIT_ORDERING));
    }

    @Test
    void parse_withNestedChild_emitsImplicitOrderingHint() {
        String bicep = """
            resource vnet 'Microsoft.Network/virtualNetworks@2023-04-01' = {
              name: 'core-vnet'
              resource subnet 'subnets' = {
                name: 'app'
              }
            }
            """;

        ParseResult result = parser.parse(IacDocument.of("main.bicep", Dialect.BICEP, bicep));

        assertThat(result.nodes()).extracting(ResourceNode::id).containsExactly(VNET_ID, SUBNET_ID);
        assertThat(result.edgeHints()).containsExactly(new EdgeHint(VNET_ID, SUBNET_ID, EdgeKind.IMPLICIT_ORDERING));
    }

    @Test
    void parse_withDependsOn_emitsExplicitHintsAndReportsUnknownSymbols() {
        String bicep = """
            module shared './shared.bicep' = {
              name: 'shared'
            }

            resource storage 'Microsoft.Storage/storageAccounts@2023-01-01' = {
              name: 'logs${uniqueString(resourceGroup().id)}'
            }

            resource app 'Microsoft.Web/sites@2022-09-01' = {
              name: 'app'
              dependsOn: [
                storage
                shared
                ghost
              ]
            }
            """;

        ParseResult result = parser.parse(IacDocument.of("main.bicep", Dialect.BICEP, bicep));

        assertThat(result.edgeHints()).containsExactly(new EdgeHint(
            "bicep:Microsoft.Storage/storageAccounts:storage", "bicep:Microsoft.Web/sites:app",
            EdgeKind.EXPLICIT_DEPENDENCY));
        assertThat(result.diagnostics()).singleElement()
            .satisfies(d -> {
                assertThat(d.type()).isEqualTo(DiagnosticType.UNRESOLVED_REFERENCE);
                assertThat(d.message()).contains("ghost");
            });
        assertThat(result.symbols()).contains("shared");
        assertThat(result.nodes().get(0).displayName())
            .as("interpolated names fall back to the symbol")
            .isEqualTo("storage");
    }

    @Test
    void parse_withExistingResource_tagsIt() {
        String bicep = """
            resource kv 'Microsoft.KeyVault/vaults@2023-02-01' existing = {
              name: 'shared-kv'
            }
            """;

        ParseResult result = parser.parse(IacDocument.of("main.bicep", Dialect.BICEP, bicep));

        assertThat(result.nodes().get(0).tags()).containsEntry("existing", "true");
    }

    @Test
    void parse_withMalformedResource_reportsErrorAndKeepsOthers() {
        String bicep = """
            resource broken 'Microsoft.Network/virtualNetworks@2023-04-01' = {
              name 'missing-colon'
            }

            resource ok 'Microsoft.Storage/storageAccounts@2023-01-01' = {
              name: 'ok'
            }
            """;

        ParseResult result = parser.parse(IacDocument.of("main.bicep", Dialect.BICEP, bicep));

        assertThat(result.nodes()).extracting(ResourceNode::logicalName).containsExactly("ok");
        assertThat(result.hasErrors()).isTrue();
        assertThat(result.diagnostics()).hasSize(1);
    }
}
