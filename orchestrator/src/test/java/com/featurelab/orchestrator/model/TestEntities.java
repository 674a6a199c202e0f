package com.featurelab.orchestrator.model;

import java.util.List;
import java.util.UUID;

/**
 * Builds entities with their generated ids filled in, as if loaded from the
 * database.
 */
public final class TestEntities {

    private TestEntities() {}

    public static Project project(long id, String owner) {
        Project project = new Project("project-" + id, owner);
        setId(project, id);
        return project;
    }

    public static Dataset dataset(long id, Project project, String... fileUris) {
        Dataset dataset = new Dataset("dataset-" + id, project);
        setId(dataset, id);
        for (String uri : fileUris) {
            dataset.addFile(uri);
        }
        return dataset;
    }

    public static Featureset featureset(String name, Project project, List<String> features) {
        Featureset featureset = new Featureset(name, "/data/features/" + name + "_featureset.json",
                project, features);
        setId(featureset, UUID.randomUUID());
        return featureset;
    }

    public static void setId(Object entity, Object id) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
