package dev.parsero.graph;

import dev.parsero.error.GraphCompilationException;
import dev.parsero.model.ModelSource;

import java.util.ArrayList;
import java.util.Optional;

/**
 * The single model a compiled graph hands to its procedures, and why it was chosen.
 * The external engine runs one model, so a named source is narrowed to its
 * {@code "default"} entry, or to the first entry when there is none.
 *
 * @param key     chosen entry name, or null for a single-model source
 * @param model   the chosen model
 * @param warning set when other named models were left out
 */
public record ModelSelection<M>(
    String key, // nullable
    M model,
    String warning // nullable
) {

    public static <M> ModelSelection<M> select(ModelSource<M> source) {
        if (source instanceof ModelSource.Single<M> single) {
            return new ModelSelection<>(null, single.model(), null);
        }

        var named = (ModelSource.Named<M>) source;
        var keys = new ArrayList<>(named.models().keySet());
        if (keys.isEmpty()) {
            throw new GraphCompilationException(
                "No model was supplied. The graph integration needs at least one model.");
        }

        String key = keys.contains(ModelSource.DEFAULT_KEY) ? ModelSource.DEFAULT_KEY : keys.get(0);
        String warning = null;
        if (keys.size() > 1) {
            keys.remove(key);
            warning = "The graph integration only uses model '%s'. Models %s are ignored."
                .formatted(key, keys);
        }
        return new ModelSelection<>(key, named.models().get(key), warning);
    }

    public Optional<String> diagnostic() {
        return Optional.ofNullable(warning);
    }

    /** Source handed to procedures when they run inside the external engine. */
    public ModelSource<M> asSource() {
        return ModelSource.single(model);
    }
}
