package com.chronofill.backend.service.plan;

import java.util.List;

public record TransformModel(String name, ModelLayer layer, Materialization materialization,
                             List<String> dependsOn, List<String> tags) {

    static TransformModel of(String name, ModelLayer layer, Materialization materialization, String... dependsOn) {
        return new TransformModel(name, layer, materialization, List.of(dependsOn), List.of());
    }

    TransformModel tagged(String... newTags) {
        return new TransformModel(name, layer, materialization, dependsOn, List.of(newTags));
    }
}
