package com.largomodo.shelfcatalog.core;

/**
 * One book on one shelf, flattened for tabular export.
 *
 * @param isbn may be null
 */
public record CatalogRow(String id, String title, String author, String category, String isbn, String shelfName) {
}
