package com.redpanda.operator;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RedpandaOperatorTest {

    @Test
    void testWatchingAllNamespaces() {
        assertEquals("Redpanda (cluster.redpanda.com/v1alpha1) with HelmRepository/HelmRelease dependents in all namespaces",
                RedpandaOperator.watching(Optional.empty()));
    }

    @Test
    void testWatchingNamespaces() {
        assertEquals("Redpanda (cluster.redpanda.com/v1alpha1) with HelmRepository/HelmRelease dependents in namespaces redpanda,staging",
                RedpandaOperator.watching(Optional.of(List.of("redpanda", "staging"))));
    }
}
