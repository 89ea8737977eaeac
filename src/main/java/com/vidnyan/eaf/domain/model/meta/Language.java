package com.vidnyan.eaf.domain.model.meta;

public record Language(String id, String definition, String label) {}
