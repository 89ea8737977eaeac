package com.vidnyan.eaf.domain.model.meta;

public record Property(String name, String value) {}
