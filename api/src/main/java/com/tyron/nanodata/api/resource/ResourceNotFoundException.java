package com.tyron.nanodata.api.resource;

import java.io.IOException;
import java.util.List;

/**
 * Thrown when a resource name could not be resolved against any of the search roots,
 * including the zip fallback candidates.
 */
public class ResourceNotFoundException extends IOException {

    private static final String SEPARATOR = "*".repeat(70);

    private final String resourceName;
    private final List<String> searchedRoots;
    private final String packageName;

    public ResourceNotFoundException(String resourceName, List<String> searchedRoots, String packageName) {
        super("Resource '" + resourceName + "' not found");
        this.resourceName = resourceName;
        this.searchedRoots = List.copyOf(searchedRoots);
        this.packageName = packageName;
    }

    public String getResourceName() {
        return resourceName;
    }

    /**
     * @return The roots that were searched, in search order.
     */
    public List<String> getSearchedRoots() {
        return searchedRoots;
    }

    /**
     * @return The data package that most likely contains the resource (e.g. {@code punkt}
     * for {@code tokenizers/punkt/english.ser}), or an empty string if none can be guessed.
     */
    public String getPackageName() {
        return packageName;
    }

    /**
     * Builds the multi-line message shown to users.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append('\n').append(SEPARATOR).append('\n');
        sb.append("  Resource '").append(packageName.isEmpty() ? resourceName : packageName).append("' not found.\n");
        if (!packageName.isEmpty()) {
            sb.append("  Install the '").append(packageName).append("' data package into one of the search roots.\n");
        }
        sb.append('\n');
        sb.append("  Attempted to load ").append(resourceName).append('\n');
        sb.append('\n');
        sb.append("  Searched in:");
        for (String root : searchedRoots) {
            sb.append("\n    - '").append(root).append('\'');
        }
        sb.append('\n').append(SEPARATOR).append('\n');
        return sb.toString();
    }
}
