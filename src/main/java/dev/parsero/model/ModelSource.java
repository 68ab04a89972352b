package dev.parsero.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * The model collaborator handed to every procedure body: a single model, or models by name.
 * Procedures pick what they need; the engine never restricts which entries a body uses.
 *
 * @param <M> model client type
 */
public sealed interface ModelSource<M> {

    String DEFAULT_KEY = "default";

    record Single<M>(M model) implements ModelSource<M> {

        /** A single model answers for every name. */
        @Override
        public M get(String name) {
            return model;
        }

        @Override
        public M primary() {
            return model;
        }
    }

    record Named<M>(Map<String, M> models) implements ModelSource<M> {

        public Named {
            models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        }

        @Override
        public M get(String name) {
            M model = models.get(name);
            if (model == null) {
                throw new NoSuchElementException("No model named '%s'. Available: %s"
                    .formatted(name, models.keySet()));
            }
            return model;
        }

        /** The {@code "default"} entry, or the first one when there is none. */
        @Override
        public M primary() {
            if (models.isEmpty()) {
                throw new NoSuchElementException("No models configured");
            }
            M model = models.get(DEFAULT_KEY);
            return model != null ? model : models.values().iterator().next();
        }
    }

    static <M> ModelSource<M> single(M model) {
        return new Single<>(model);
    }

    static <M> ModelSource<M> named(Map<String, M> models) {
        return new Named<>(models);
    }

    M get(String name);

    M primary();
}
