package dev.autoresume.model;

import java.util.List;

/**
 * One block of a resume section as the template renders it: a bold title with
 * an optional right-aligned location (linked when {@code link} is set), an
 * italic description with a right-aligned date, and bullet items.
 * Also the shape of the section entries in {@code profile.json}.
 */
public record ResumeItem(String title, String date, String location, String description, String link,
                         List<String> items) {

    public ResumeItem {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
