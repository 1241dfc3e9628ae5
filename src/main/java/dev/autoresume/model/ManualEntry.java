package dev.autoresume.model;

/**
 * Project typed in by the user during selection. Requires a name and at
 * least one of url or description.
 */
public record ManualEntry(String name, String url, String description) implements ProjectReference {

    public ManualEntry {
        url = url == null ? "" : url.trim();
        description = description == null ? "" : description.trim();
        name = name == null ? "" : name.trim();
    }

    public boolean isComplete() {
        return !name.isBlank() && (!url.isBlank() || !description.isBlank());
    }
}
