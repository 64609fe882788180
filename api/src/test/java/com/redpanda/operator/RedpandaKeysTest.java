package com.redpanda.operator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RedpandaKeysTest {

    @Test
    void testAnnotationsUseGroupPrefix() {
        assertEquals("cluster.redpanda.com/managed", RedpandaKeys.Annotations.MANAGED);
        assertEquals("cluster.redpanda.com/revision", RedpandaKeys.Annotations.REVISION);
        assertNotEquals(RedpandaKeys.GROUP, RedpandaKeys.FINALIZER.split("/")[0]);
    }

}
