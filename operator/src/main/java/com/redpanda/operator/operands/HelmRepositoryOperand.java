package com.redpanda.operator.operands;

import com.redpanda.common.HelmRepositoryResourceClient;
import com.redpanda.common.OperandUtils;
import com.redpanda.operator.events.EventRecorder;
import com.redpanda.operator.resources.flux.FluxKeys;
import com.redpanda.operator.resources.flux.HelmRepository;
import com.redpanda.operator.resources.flux.HelmRepositoryBuilder;
import com.redpanda.operator.resources.v1alpha1.ReadyState;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import com.redpanda.operator.resources.v1alpha1.RedpandaStatus;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Provides the HelmRepository serving the Redpanda chart. Its content never depends on the
 * Redpanda spec, so once created it is left alone.
 */
@ApplicationScoped
public class HelmRepositoryOperand implements Operand<HelmRepository> {

    @Inject
    Logger log;

    @Inject
    HelmRepositoryResourceClient repositoryClient;

    @Inject
    EventRecorder events;

    @ConfigProperty(name = "redpanda.helm.repository-url")
    String repositoryUrl;

    @ConfigProperty(name = "redpanda.helm.repository-interval")
    String repositoryInterval;

    @Override
    public String getKind() {
        return FluxKeys.HELM_REPOSITORY_KIND;
    }

    @Override
    public HelmRepository createOrUpdate(Redpanda redpanda) {
        String namespace = redpanda.getMetadata().getNamespace();
        String name = redpanda.getHelmRepositoryName();

        HelmRepository repository;
        try {
            repository = repositoryClient.getByName(namespace, name);
        } catch (KubernetesClientException e) {
            events.error(redpanda, String.format("error getting HelmRepository: %s", e.getMessage()));
            throw e;
        }

        if (repository == null) {
            try {
                repository = repositoryClient.create(repositoryFrom(redpanda));
            } catch (KubernetesClientException e) {
                events.error(redpanda, String.format("error creating HelmRepository: %s", e.getMessage()));
                throw e;
            }
            log.infof("Created HelmRepository %s/%s", namespace, name);
            events.info(redpanda, String.format("HelmRepository '%s/%s' created", namespace, name));
        }

        redpanda.getStatus().setHelmRepository(name);
        return repository;
    }

    HelmRepository repositoryFrom(Redpanda redpanda) {
        HelmRepository repository = new HelmRepositoryBuilder()
                .withNewMetadata()
                    .withName(redpanda.getHelmRepositoryName())
                    .withNamespace(redpanda.getMetadata().getNamespace())
                .endMetadata()
                .withNewSpec()
                    .withUrl(repositoryUrl)
                    .withInterval(repositoryInterval)
                .endSpec()
                .build();

        OperandUtils.setAsOwner(redpanda, repository);
        return repository;
    }

    @Override
    public ReadyState getReadyState(RedpandaStatus status) {
        return status.getHelmRepositoryReady();
    }

    @Override
    public void setReadyState(RedpandaStatus status, ReadyState state) {
        status.setHelmRepositoryReady(state);
    }
}
