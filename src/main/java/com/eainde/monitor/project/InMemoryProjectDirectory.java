package com.eainde.monitor.project;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryProjectDirectory implements ProjectDirectory {

    private final Map<String, Project> projects = new ConcurrentHashMap<>();

    public InMemoryProjectDirectory(List<Project> initial) {
        initial.forEach(this::register);
    }

    public void register(Project project) {
        projects.put(key(project.organization().slug(), project.slug()), project);
    }

    @Override
    public Optional<Project> findProject(String organizationSlug, String projectSlug) {
        return Optional.ofNullable(projects.get(key(organizationSlug, projectSlug)));
    }

    private static String key(String organizationSlug, String projectSlug) {
        return organizationSlug + "/" + projectSlug;
    }
}
