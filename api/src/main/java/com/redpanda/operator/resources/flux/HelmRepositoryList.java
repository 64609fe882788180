package com.redpanda.operator.resources.flux;

import io.fabric8.kubernetes.client.CustomResourceList;

public class HelmRepositoryList extends CustomResourceList<HelmRepository> {

    private static final long serialVersionUID = 1L;

}
