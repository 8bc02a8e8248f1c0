package net.amphora.application.page;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.amphora.domain.content.BatchOperation;
import net.amphora.domain.content.PageDraft;
import net.amphora.exception.PageCreationException;
import net.amphora.service.ComponentReferences;
import net.amphora.service.ContentStore;
import net.amphora.service.IdentifierGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ObjectNode;

/**
 * Creates a page from a layout reference and named component slots.
 *
 * <p>Each slot names a component; its current defaults are copied into a brand
 * new instance. Slots resolve concurrently, and the instances and the page are
 * written in a single atomic batch once every slot has resolved. A failed slot
 * or a failed commit leaves storage untouched.
 */
@Service
public class PageCreationService {

    private static final Logger log = LoggerFactory.getLogger(PageCreationService.class);

    private static final String PAGES_PREFIX = "/pages/";
    private static final String COMPONENTS_PREFIX = "/components/";
    private static final String INSTANCES_SEGMENT = "/instances/";

    private final ComponentReferences references;
    private final ContentStore contentStore;
    private final IdentifierGenerator identifierGenerator;

    public PageCreationService(ComponentReferences references,
                               ContentStore contentStore,
                               IdentifierGenerator identifierGenerator) {
        this.references = references;
        this.contentStore = contentStore;
        this.identifierGenerator = identifierGenerator;
    }

    /**
     * @param body request body: optional {@code layout} plus slot name to component reference
     * @return the stored page with a {@code _ref} self reference
     */
    public Mono<ObjectNode> createPage(JsonNode body) {
        String pageKey = PAGES_PREFIX + identifierGenerator.next();
        return Mono.defer(() -> {
                String layout = layoutReference(body);
                return Flux.fromIterable(slotReferences(body).entrySet())
                    .flatMapSequential(slot -> resolveSlot(slot.getKey(), slot.getValue()))
                    .collectList()
                    .flatMap(resolved -> commit(pageKey, layout, resolved));
            })
            .doOnSuccess(page -> log.info("Created page {}", pageKey))
            .onErrorMap(error -> {
                log.error("Failed to create new page {}: {}", pageKey, error.getMessage(), error);
                return new PageCreationException(pageKey, error);
            });
    }

    private Mono<ResolvedSlot> resolveSlot(String slotName, JsonNode reference) {
        String componentName = reference != null && reference.isString()
            ? references.getComponentName(reference.asString())
            : null;
        if (componentName == null) {
            return Mono.error(new IllegalArgumentException(
                "Slot '" + slotName + "' does not reference a component: " + reference));
        }
        return references.getComponentData(COMPONENTS_PREFIX + componentName)
            .map(componentData -> {
                String instanceKey = COMPONENTS_PREFIX + componentName + INSTANCES_SEGMENT + identifierGenerator.next();
                return new ResolvedSlot(slotName, instanceKey, BatchOperation.put(instanceKey, componentData.deepCopy()));
            });
    }

    private Mono<ObjectNode> commit(String pageKey, String layout, List<ResolvedSlot> resolved) {
        Map<String, String> slots = new LinkedHashMap<>();
        List<BatchOperation> operations = new ArrayList<>(resolved.size() + 1);
        for (ResolvedSlot slot : resolved) {
            slots.put(slot.name(), slot.instanceKey());
            operations.add(slot.operation());
        }
        PageDraft draft = new PageDraft(layout, slots);
        operations.add(BatchOperation.put(pageKey, draft.toJson()));

        return contentStore.batch(operations)
            .then(Mono.fromSupplier(() -> draft.toJson(pageKey)));
    }

    private static String layoutReference(JsonNode body) {
        if (body == null || !body.isObject()) {
            return null;
        }
        JsonNode layout = body.get(PageDraft.LAYOUT_FIELD);
        if (layout == null || layout.isNull()) {
            return null;
        }
        if (!layout.isString()) {
            throw new IllegalArgumentException("Layout must be a component reference: " + layout);
        }
        return layout.asString();
    }

    private static Map<String, JsonNode> slotReferences(JsonNode body) {
        Map<String, JsonNode> slots = new LinkedHashMap<>();
        if (body == null || !body.isObject()) {
            return slots;
        }
        for (Map.Entry<String, JsonNode> field : body.properties()) {
            if (!PageDraft.LAYOUT_FIELD.equals(field.getKey())) {
                slots.put(field.getKey(), field.getValue());
            }
        }
        return slots;
    }

    private record ResolvedSlot(String name, String instanceKey, BatchOperation operation) {
    }
}
