package org.netpreserve.hubfinder.config;

/**
 * @param path database file, relative to the job directory
 */
public record StorageConfig(String path) {
}
