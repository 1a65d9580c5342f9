package com.example.products.model;

/**
 * The single domain record: an id and a display name.
 */
public record Product(
    int id,
    String name
) {}
