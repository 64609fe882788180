package com.redpanda.operator.resources.v1alpha1;

import io.fabric8.kubernetes.client.CustomResourceList;

import java.util.Collection;

public class RedpandaList extends CustomResourceList<Redpanda> {
    private static final long serialVersionUID = 4123958731162295843L;

    public RedpandaList() {

    }

    public RedpandaList(Collection<Redpanda> redpandas) {
        this.getItems().addAll(redpandas);
    }
}
