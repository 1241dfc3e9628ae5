package dev.autoresume.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The frozen, human-approved project set. This is the only repository input
 * the content generator sees.
 */
public record SelectionResult(List<Repository> chosen, List<ManualEntry> manuallyAdded) {

    public SelectionResult {
        chosen = List.copyOf(chosen);
        manuallyAdded = List.copyOf(manuallyAdded);
    }

    public List<ProjectReference> allProjects() {
        List<ProjectReference> all = new ArrayList<>(chosen);
        all.addAll(manuallyAdded);
        return List.copyOf(all);
    }

    public int size() {
        return chosen.size() + manuallyAdded.size();
    }
}
