package com.largomodo.shelfcatalog.core;

/**
 * Thrown when a category is found on more than one differently named shelf.
 * <p>
 * RuntimeException: a broken placement means the room was assembled by hand outside
 * the catalog, which callers are not expected to recover from.
 */
public class CategoryPlacementException extends RuntimeException {

    private final String category;

    public CategoryPlacementException(String category, String firstShelf, String secondShelf) {
        super("Category '" + category + "' was found on shelves '" + firstShelf + "' and '" + secondShelf + "'");
        this.category = category;
    }

    public String getCategory() {
        return category;
    }
}
