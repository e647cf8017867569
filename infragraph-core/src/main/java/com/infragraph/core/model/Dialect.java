package com.infragraph.core.model;

/**
 * Infrastructure-as-code dialects understood by the parsers.
 */
public enum Dialect {
    /** Terraform / HCL configuration files */
    TERRAFORM("terraform"),

    /** CloudFormation templates in YAML or JSON */
    CLOUDFORMATION("cloudformation"),

    /** Azure Bicep files */
    BICEP("bicep"),

    /** Pulumi YAML programs */
    PULUMI_YAML("pulumi");

    private final String id;

    Dialect(String id) {
        this.id = id;
    }

    /**
     * Returns the lowercase identifier used as the first segment of node ids.
     *
     * @return dialect identifier
     */
    public String id() {
        return id;
    }
}
