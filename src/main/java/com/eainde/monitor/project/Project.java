package com.eainde.monitor.project;

public record Project(long id, String slug, Organization organization) {
}
