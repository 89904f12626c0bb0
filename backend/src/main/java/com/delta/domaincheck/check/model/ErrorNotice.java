package com.delta.domaincheck.check.model;

public record ErrorNotice(String title, String description) {
}
