package com.chunkr.ingest;

import java.util.LinkedHashMap;
import java.util.Map;

import com.chunkr.runtime.AppConfig;

/**
 * Decides which metadata keys travel with a chunk to the sinks. Keys the policy does not govern pass
 * through untouched.
 */
public class MetadataPolicy {
    private final AppConfig.MetadataConfig config;

    public MetadataPolicy(AppConfig.MetadataConfig config) {
        this.config = config;
    }

    public static MetadataPolicy includeAll() {
        return new MetadataPolicy(new AppConfig.MetadataConfig());
    }

    public Map<String, Object> select(Map<String, Object> metadata) {
        Map<String, Object> selected = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            if (value != null && includes(key)) {
                selected.put(key, value);
            }
        });
        return selected;
    }

    public boolean includes(String key) {
        return switch (key) {
            case "source_path" -> config.isIncludeSourcePath();
            case "calibre_id" -> config.isIncludeCalibreId();
            case "title" -> config.isIncludeTitle();
            case "authors" -> config.isIncludeAuthors();
            case "published" -> config.isIncludePublished();
            case "language" -> config.isIncludeLanguage();
            default -> true;
        };
    }
}
