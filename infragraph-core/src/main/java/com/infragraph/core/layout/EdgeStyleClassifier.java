package com.infragraph.core.layout;

import com.infragraph.core.model.EdgeStyle;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.util.ResourceTaxonomy;

import java.util.Objects;

/**
 * Assigns a visual class to an edge from its two endpoints.
 *
 * <p>First match wins:
 * <ol>
 *   <li>both endpoint types are security types: {@link EdgeStyle#SECURITY}</li>
 *   <li>either endpoint type is a data or storage type: {@link EdgeStyle#DATA}</li>
 *   <li>the endpoints have different providers: {@link EdgeStyle#CROSS_BOUNDARY}</li>
 *   <li>otherwise {@link EdgeStyle#DEFAULT}</li>
 * </ol>
 */
public final class EdgeStyleClassifier {

    private EdgeStyleClassifier() {
        // Prevent instantiation
    }

    public static EdgeStyle classify(ResourceNode from, ResourceNode to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (ResourceTaxonomy.isSecurityType(from.type()) && ResourceTaxonomy.isSecurityType(to.type())) {
            return EdgeStyle.SECURITY;
        }
        if (ResourceTaxonomy.isDataOrStorageType(from.type()) || ResourceTaxonomy.isDataOrStorageType(to.type())) {
            return EdgeStyle.DATA;
        }
        if (!from.provider().equals(to.provider())) {
            return EdgeStyle.CROSS_BOUNDARY;
        }
        return EdgeStyle.DEFAULT;
    }
}
