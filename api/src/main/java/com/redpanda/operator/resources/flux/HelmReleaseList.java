package com.redpanda.operator.resources.flux;

import io.fabric8.kubernetes.client.CustomResourceList;

public class HelmReleaseList extends CustomResourceList<HelmRelease> {

    private static final long serialVersionUID = 1L;

}
