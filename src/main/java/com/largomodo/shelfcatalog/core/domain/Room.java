package com.largomodo.shelfcatalog.core.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A room owned by one person, holding an ordered sequence of shelves.
 * <p>
 * Shelf names are not required to be unique. Lookups by name always resolve to the
 * first shelf in room order.
 */
public class Room {

    private final String owner;
    private final List<Shelf> shelves = new ArrayList<>();

    public Room(String owner) {
        if (owner == null) {
            throw new IllegalArgumentException("Room owner must not be null");
        }
        this.owner = owner;
    }

    public Room(String owner, List<Shelf> shelves) {
        this(owner);
        if (shelves == null) {
            throw new IllegalArgumentException("Shelves must not be null");
        }
        shelves.forEach(this::addShelf);
    }

    public String getOwner() {
        return owner;
    }

    /**
     * @return read-only view of the shelves in room order
     */
    public List<Shelf> getShelves() {
        return Collections.unmodifiableList(shelves);
    }

    /**
     * Appends a shelf to the room. No uniqueness check on the shelf name.
     *
     * @throws IllegalArgumentException if shelf is null
     */
    public void addShelf(Shelf shelf) {
        if (shelf == null) {
            throw new IllegalArgumentException("Cannot add null shelf to room of " + owner);
        }
        shelves.add(shelf);
    }

    /**
     * Finds the first shelf whose name equals {@code name} exactly (case-sensitive).
     */
    public Optional<Shelf> findShelf(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return shelves.stream()
                .filter(shelf -> shelf.getName().equals(name))
                .findFirst();
    }

    @Override
    public String toString() {
        return "Room{owner='" + owner + "', shelves=" + shelves.size() + "}";
    }
}
