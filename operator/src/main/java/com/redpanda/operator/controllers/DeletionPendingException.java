package com.redpanda.operator.controllers;

/**
 * The HelmRelease of a deleted Redpanda still exists, the finalizer is kept until a later
 * reconciliation finds it gone
 */
public class DeletionPendingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DeletionPendingException(String message) {
        super(message);
    }
}
