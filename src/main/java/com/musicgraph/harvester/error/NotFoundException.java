package com.musicgraph.harvester.error;

/**
 * A seed or referenced entity does not exist in the catalog.
 */
public class NotFoundException extends HarvesterException {
    private final String resourceType;

    public NotFoundException(String message, String resourceType) {
        super(message, false);
        this.resourceType = resourceType;
    }

    public String getResourceType() {
        return resourceType;
    }
}
