package dev.autoresume.selection;

import dev.autoresume.exception.SelectionException;
import dev.autoresume.model.ManualEntry;
import dev.autoresume.model.RankedRepository;
import dev.autoresume.model.Repository;
import dev.autoresume.model.SelectionOutcome;
import dev.autoresume.model.SelectionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * One pass through the selection checkpoint. A session runs once; it is
 * not reusable after reaching a terminal state.
 */
@Slf4j
class SelectionSession {

    private static final int MAX_STARS = 5;
    private static final int MAX_SUGGESTIONS = 3;

    private final List<RankedRepository> ranked;
    private final SelectionConsole console;
    private final int defaultCount;

    private final List<Repository> chosen = new ArrayList<>();
    private final List<ManualEntry> manuallyAdded = new ArrayList<>();
    private SelectionState state = SelectionState.PRESENTING;

    SelectionSession(List<RankedRepository> ranked, SelectionConsole console, int defaultCount) {
        this.ranked = List.copyOf(ranked);
        this.console = console;
        this.defaultCount = defaultCount;
    }

    SelectionState getState() {
        return state;
    }

    SelectionOutcome run() {
        if (state != SelectionState.PRESENTING) {
            throw new IllegalStateException("Selection session already ran (state " + state + ")");
        }
        while (!state.isTerminal()) {
            state = switch (state) {
                case PRESENTING -> present();
                case AWAITING_CHOICE -> awaitChoice();
                case RESOLVING_MANUAL_ADDS -> resolveManualAdds();
                default -> throw new IllegalStateException("Unexpected state " + state);
            };
        }
        if (state == SelectionState.ABORTED) {
            log.info("Selection aborted by user");
            return SelectionOutcome.aborted();
        }
        SelectionResult result = new SelectionResult(chosen, manuallyAdded);
        log.info("Final selection: {} repositories, {} manual entries", chosen.size(), manuallyAdded.size());
        return SelectionOutcome.frozen(result);
    }

    private SelectionState present() {
        console.println("");
        console.println("=== Repository Selection ===");
        if (ranked.isEmpty()) {
            console.println("No repositories were collected; you can still add projects manually.");
            return askForManualAdds();
        }
        console.println("Select repositories to include in your resume (top " + defaultCount + " recommended):");
        console.println("");
        for (RankedRepository entry : ranked) {
            Repository repo = entry.repository();
            console.println(String.format("%2d. [%s] %s (%s)", entry.score(), stars(entry.score()), repo.name(),
                    repo.languageSummary()));
            console.println("    " + entry.rationale());
        }
        console.println("");
        return SelectionState.AWAITING_CHOICE;
    }

    private SelectionState awaitChoice() {
        String input = console.readLine("Enter repository numbers (comma-separated, e.g. '1,2,3'), "
                + "Enter for the top " + defaultCount + ", or 'q' to quit: ");
        if (isQuit(input)) {
            return SelectionState.ABORTED;
        }
        if (input.isBlank()) {
            ranked.stream().limit(defaultCount).map(RankedRepository::repository).forEach(chosen::add);
            console.println("No repositories entered. Using the top " + chosen.size() + " by default.");
            return askForManualAdds();
        }
        try {
            for (int index : parseChoice(input)) {
                chosen.add(ranked.get(index - 1).repository());
            }
        } catch (SelectionException e) {
            console.println(e.getMessage());
            return SelectionState.AWAITING_CHOICE;
        }
        log.info("Selected {} repositories", chosen.size());
        return askForManualAdds();
    }

    private SelectionState askForManualAdds() {
        while (true) {
            String answer = console.readLine("Add more projects manually? (y/n): ");
            if (isQuit(answer)) {
                return SelectionState.ABORTED;
            }
            switch (answer.trim().toLowerCase(Locale.ROOT)) {
                case "y", "yes" -> {
                    return SelectionState.RESOLVING_MANUAL_ADDS;
                }
                case "n", "no", "" -> {
                    return SelectionState.FROZEN;
                }
                default -> console.println("Please enter 'y' or 'n'.");
            }
        }
    }

    private SelectionState resolveManualAdds() {
        String input = console.readLine("Project name(s), comma-separated (Enter to finish): ");
        if (input == null) {
            return SelectionState.ABORTED;
        }
        if (input.isBlank()) {
            return SelectionState.FROZEN;
        }
        for (String name : input.split(",")) {
            if (!name.isBlank() && !addByName(name.trim())) {
                return SelectionState.ABORTED;
            }
        }
        return SelectionState.RESOLVING_MANUAL_ADDS;
    }

    /**
     * @return false when input ended while completing the entry
     */
    private boolean addByName(String name) {
        Optional<Repository> existing = findRanked(name);
        if (existing.isPresent()) {
            Repository repo = existing.get();
            if (chosen.contains(repo)) {
                console.println("Already selected: " + repo.name());
            } else {
                chosen.add(repo);
                console.println("Added: " + repo.name());
            }
            return true;
        }
        if (manuallyAdded.stream().anyMatch(entry -> entry.name().equalsIgnoreCase(name))) {
            console.println("Already added: " + name);
            return true;
        }

        console.println("Not found in profile: " + name);
        List<String> suggestions = suggest(name);
        if (!suggestions.isEmpty()) {
            console.println("  Did you mean: " + String.join(", ", suggestions) + "?");
        }

        String url = console.readLine("  URL for '" + name + "' (optional): ");
        if (url == null) {
            return false;
        }
        String description = console.readLine("  Short description (optional): ");
        if (description == null) {
            return false;
        }
        ManualEntry entry = new ManualEntry(name, url, description);
        if (!entry.isComplete()) {
            console.println("'" + name + "' needs a URL or a description; not added.");
            return true;
        }
        manuallyAdded.add(entry);
        console.println("Added manual project: " + name);
        return true;
    }

    /**
     * Parse a comma-separated list of 1-based ranks. Order is kept and
     * repeated numbers count once.
     */
    List<Integer> parseChoice(String input) {
        Set<Integer> indices = new LinkedHashSet<>();
        for (String token : input.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int index;
            try {
                index = Integer.parseInt(trimmed);
            } catch (NumberFormatException e) {
                throw new SelectionException("Invalid input: '" + trimmed + "'. Please enter numbers separated by commas.");
            }
            if (index < 1 || index > ranked.size()) {
                throw new SelectionException("Invalid rank: " + index + ". Choose between 1 and " + ranked.size() + ".");
            }
            indices.add(index);
        }
        if (indices.isEmpty()) {
            throw new SelectionException("No repository numbers found in '" + input.trim() + "'.");
        }
        return new ArrayList<>(indices);
    }

    private Optional<Repository> findRanked(String name) {
        String key = name.substring(name.lastIndexOf('/') + 1);
        return ranked.stream()
                .map(RankedRepository::repository)
                .filter(repo -> repo.name().equalsIgnoreCase(key))
                .findFirst();
    }

    private List<String> suggest(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return ranked.stream()
                .map(entry -> entry.repository().name())
                .filter(candidate -> {
                    String other = candidate.toLowerCase(Locale.ROOT);
                    return other.contains(lower) || lower.contains(other);
                })
                .limit(MAX_SUGGESTIONS)
                .toList();
    }

    /**
     * Relevance indicator: the best rank gets five stars, the last at least one.
     */
    String stars(int score) {
        int size = ranked.size();
        int filled = (int) Math.ceil(MAX_STARS * (double) (size - score + 1) / size);
        filled = Math.max(1, Math.min(MAX_STARS, filled));
        return "★".repeat(filled) + "☆".repeat(MAX_STARS - filled);
    }

    private static boolean isQuit(String input) {
        if (input == null) {
            return true;
        }
        String trimmed = input.trim().toLowerCase(Locale.ROOT);
        return trimmed.equals("q") || trimmed.equals("quit");
    }
}
