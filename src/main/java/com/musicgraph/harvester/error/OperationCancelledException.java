package com.musicgraph.harvester.error;

/**
 * The run was interrupted by the operator. The last saved checkpoint remains the resume point.
 */
public class OperationCancelledException extends HarvesterException {
    public OperationCancelledException(String message) {
        super(message, false);
    }
}
