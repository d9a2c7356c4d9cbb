package com.nana.iep.service;

/**
 * EmptyGroupException - The aggregator was asked to summarise a batch with
 * no normalized records.
 *
 * <p>Per-batch and recoverable: the caller skips aggregation and leaves the
 * master table as it is.
 */
public class EmptyGroupException extends Exception {

    public EmptyGroupException(String message) {
        super(message);
    }
}
