package com.eainde.monitor.project;

public record Organization(long id, String slug) {
}
