package com.upgradedoctor.k8s;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * {@link ResourceReader} backed by the fabric8 {@link KubernetesClient}.
 *
 * Resources are addressed through the generic (unstructured) API so custom resources can be read
 * without generated model classes. Client failures are translated into
 * {@link ResourceAccessException} with a closed {@link ResourceAccessException.ErrorKind}.
 */
@Singleton
public class FabricResourceReader implements ResourceReader {

    private static final Logger log = LoggerFactory.getLogger(FabricResourceReader.class);

    @Inject
    KubernetesClient k8s;

    @Override
    public List<GenericKubernetesResource> list(ResourceType type) {
        try {
            var op = operation(type);
            GenericKubernetesResourceList list = type.namespaced()
                ? op.inAnyNamespace().list()
                : op.list();
            List<GenericKubernetesResource> items = list != null && list.getItems() != null
                ? list.getItems()
                : List.of();
            log.debug("Listed {} {} objects", items.size(), type.kind());
            return items;
        } catch (KubernetesClientException e) {
            throw translate(e, "listing " + type.kind());
        }
    }

    @Override
    public List<GenericKubernetesResource> listMetadata(ResourceType type) {
        return list(type).stream()
            .map(item -> toHeader(type, item))
            .toList();
    }

    @Override
    public GenericKubernetesResource get(ResourceType type, String name, @Nullable String namespace) {
        GenericKubernetesResource obj;
        try {
            var op = operation(type);
            obj = type.namespaced() && namespace != null
                ? op.inNamespace(namespace).withName(name).get()
                : op.withName(name).get();
        } catch (KubernetesClientException e) {
            throw translate(e, "getting " + type.kind() + " " + name);
        }
        if (obj == null) {
            throw ResourceAccessException.notFound(type.kind() + " " + qualified(name, namespace) + " not found");
        }
        return obj;
    }

    // ── Package-private helpers (used in unit tests) ────────────────────────

    static ResourceAccessException translate(KubernetesClientException e, String action) {
        ResourceAccessException.ErrorKind kind = classify(e);
        return new ResourceAccessException(kind, action + ": " + e.getMessage(), e);
    }

    static ResourceAccessException.ErrorKind classify(KubernetesClientException e) {
        switch (e.getCode()) {
            case 401, 403:
                return ResourceAccessException.ErrorKind.FORBIDDEN;
            case 404:
                return ResourceAccessException.ErrorKind.NOT_FOUND;
            case 408, 504:
                return ResourceAccessException.ErrorKind.TIMEOUT;
            case 429, 500, 502, 503:
                return ResourceAccessException.ErrorKind.UNAVAILABLE;
            default:
                break;
        }
        for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof TimeoutException) {
                return ResourceAccessException.ErrorKind.TIMEOUT;
            }
            if (t instanceof ConnectException || t instanceof UnknownHostException) {
                return ResourceAccessException.ErrorKind.UNAVAILABLE;
            }
        }
        return ResourceAccessException.ErrorKind.OTHER;
    }

    /** Copy of the object with apiVersion, kind and metadata only; spec and status are dropped. */
    static GenericKubernetesResource toHeader(ResourceType type, GenericKubernetesResource item) {
        GenericKubernetesResource header = new GenericKubernetesResource();
        header.setApiVersion(type.apiVersion());
        header.setKind(type.kind());
        header.setMetadata(item.getMetadata());
        return header;
    }

    private MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> operation(
        ResourceType type) {
        ResourceDefinitionContext context = new ResourceDefinitionContext.Builder()
            .withGroup(type.group())
            .withVersion(type.version())
            .withKind(type.kind())
            .withPlural(type.plural())
            .withNamespaced(type.namespaced())
            .build();
        return k8s.genericKubernetesResources(context);
    }

    private static String qualified(String name, @Nullable String namespace) {
        return namespace == null || namespace.isEmpty() ? name : namespace + "/" + name;
    }
}
