package com.infragraph.core.model;

/**
 * Grouping dimension of a cluster.
 */
public enum ClusterKind {
    /** One cluster per cloud provider */
    PROVIDER,

    /** One cluster per resource category (network, compute, ...) */
    CATEGORY,

    /** Inferred network containment (VPC / virtual network, subnet) */
    NETWORK_CONTAINER
}
