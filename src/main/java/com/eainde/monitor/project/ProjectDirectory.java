package com.eainde.monitor.project;

import java.util.Optional;

public interface ProjectDirectory {

    Optional<Project> findProject(String organizationSlug, String projectSlug);
}
