package com.deepresearch.core.state;

import com.deepresearch.core.model.Resource;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session resources deduplicated by URL, in discovery order. The first title seen
 * for a URL wins; resources without a URL are ignored.
 */
public class ResourceRegistry {

    private final Map<String, Resource> byUrl = new LinkedHashMap<>();

    /**
     * @return true if the resource was new
     */
    public synchronized boolean add(Resource resource) {
        if (resource == null || resource.url() == null || resource.url().isBlank()) {
            return false;
        }
        String url = resource.url().trim();
        if (byUrl.containsKey(url)) {
            return false;
        }
        byUrl.put(url, new Resource(url, resource.title() != null ? resource.title() : url));
        return true;
    }

    public synchronized int addAll(Collection<Resource> resources) {
        int added = 0;
        for (Resource resource : resources) {
            if (add(resource)) {
                added++;
            }
        }
        return added;
    }

    public synchronized int size() {
        return byUrl.size();
    }

    public synchronized List<Resource> snapshot() {
        return List.copyOf(byUrl.values());
    }
}
