package com.infragraph.core.parser;

import java.util.Objects;

/**
 * A call of a reusable module found in a document, e.g. a Terraform
 * {@code module "network" { source = "./modules/network" }} block.
 *
 * @param name instance name of the call
 * @param source module source as written
 */
public record ModuleCall(String name, String source) {

    public ModuleCall {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    /**
     * Returns true when the source is a path on the local file system rather than a
     * registry address or remote URL.
     *
     * @return true for {@code ./} and {@code ../} sources
     */
    public boolean isLocal() {
        return source.startsWith("./") || source.startsWith("../");
    }
}
