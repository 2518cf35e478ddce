package com.musicgraph.harvester.error;

/**
 * The upstream catalog is persistently failing; terminal for the current operation.
 */
public class ServiceException extends HarvesterException {
    private final String serviceName;

    public ServiceException(String message, String serviceName) {
        super(message, false);
        this.serviceName = serviceName;
    }

    public ServiceException(String message, String serviceName, Throwable cause) {
        super(message, false, cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
