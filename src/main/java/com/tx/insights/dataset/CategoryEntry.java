package com.tx.insights.dataset;

/**
 * A category path with its optional canonical URL.
 *
 * @param path raw category path
 * @param url  category page URL, may be null
 */
public record CategoryEntry(String path, String url) {
}
