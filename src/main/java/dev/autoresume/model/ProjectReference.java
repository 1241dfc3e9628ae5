package dev.autoresume.model;

/**
 * Anything that can be listed as a project on the resume: a collected
 * repository or an entry the user typed in at selection time.
 */
public interface ProjectReference {

    String name();

    String url();

    String description();
}
