package org.adg.classify;

import lombok.Value;

/**
 * Coarse grouping used to sort diagrams into sections.
 */
@Value
public class DiagramFamily {
    /**
     * Largest body-rank among interaction vertices.
     */
    int maxBodyRank;
    Canonicality canonicality;

    public String label() {
        String body;
        switch (maxBodyRank) {
            case 1:
                body = "one-body";
                break;
            case 2:
                body = "two-body";
                break;
            case 3:
                body = "three-body";
                break;
            default:
                body = maxBodyRank + "-body";
        }
        return body + " " + canonicality.name().toLowerCase().replace('_', '-');
    }
}
