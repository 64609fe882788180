package com.redpanda.operator;

import com.redpanda.operator.resources.flux.HelmRelease;
import com.redpanda.operator.resources.flux.HelmRepository;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.javaoperatorsdk.operator.Operator;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

@QuarkusMain
public class RedpandaOperator implements QuarkusApplication {

    static final String NAMESPACES_PROPERTY = "quarkus.operator-sdk.namespaces";

    @Inject
    Logger log;

    @Inject
    Operator operator;

    @Override
    public int run(String... args) throws Exception {
        log.infof("redpanda operator, watching %s",
                watching(ConfigProvider.getConfig().getOptionalValues(NAMESPACES_PROPERTY, String.class)));

        printConfiguration();

        operator.start();
        Quarkus.waitForExit();
        return 0;
    }

    private void printConfiguration() {
        List<String> config = StreamSupport.stream(ConfigProvider.getConfig().getPropertyNames().spliterator(), false)
            .filter(name -> name.startsWith("redpanda.") || name.startsWith("quarkus.operator-sdk."))
            .sorted()
            .collect(Collectors.toList());
        config.forEach(e -> {
            try {
                String value = ConfigProvider.getConfig().getValue(e, String.class);
                log.infof("%s=%s", e, value);
            } catch (NoSuchElementException ex) {
                log.debugf("%s has no value", e);
            }
        });
    }

    static String watching(Optional<List<String>> namespaces) {
        String scope = namespaces.filter(n -> !n.isEmpty())
                .map(n -> "namespaces " + String.join(",", n))
                .orElse("all namespaces");
        return String.format("%s (%s) with %s/%s dependents in %s",
                HasMetadata.getKind(Redpanda.class), HasMetadata.getApiVersion(Redpanda.class),
                HasMetadata.getKind(HelmRepository.class), HasMetadata.getKind(HelmRelease.class), scope);
    }
}
