package ru.tigran.nationalityengine.dto;

/**
 * A normalized name and how many times it was counted for a country.
 */
public record PopularName(String name, long count) {
}
